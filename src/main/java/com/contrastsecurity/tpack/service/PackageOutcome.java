package com.contrastsecurity.tpack.service;

import com.contrastsecurity.tpack.model.Warning;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What happened to one package of a batch.
 */
public class PackageOutcome {

    public enum Status {
        WRITTEN,
        UNCHANGED,
        DRY_RUN,
        FAILED
    }

    private final Path packageDir;
    private final String packageName;
    private final Status status;
    private final List<Warning> warnings;
    private final String manifestJson;
    private final Exception error;

    private PackageOutcome(Path packageDir, String packageName, Status status, List<Warning> warnings,
                           String manifestJson, Exception error) {
        this.packageDir = packageDir;
        this.packageName = packageName;
        this.status = status;
        this.warnings = warnings != null ? new ArrayList<>(warnings) : new ArrayList<>();
        this.manifestJson = manifestJson;
        this.error = error;
    }

    public static PackageOutcome completed(Path packageDir, String packageName, Status status,
                                           List<Warning> warnings, String manifestJson) {
        return new PackageOutcome(packageDir, packageName, status, warnings, manifestJson, null);
    }

    public static PackageOutcome failed(Path packageDir, Exception error) {
        Path fileName = packageDir.toAbsolutePath().normalize().getFileName();
        return new PackageOutcome(packageDir, fileName != null ? fileName.toString() : packageDir.toString(),
                Status.FAILED, null, null, error);
    }

    public Path getPackageDir() {
        return packageDir;
    }

    public String getPackageName() {
        return packageName;
    }

    public Status getStatus() {
        return status;
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }

    public List<Warning> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    /**
     * Rendered manifest, as written or as it would have been written in a dry run.
     */
    public String getManifestJson() {
        return manifestJson;
    }

    public Exception getError() {
        return error;
    }
}
