package com.contrastsecurity.tpack.service;

import com.contrastsecurity.tpack.manifest.Manifest;
import com.contrastsecurity.tpack.manifest.ManifestStore;
import com.contrastsecurity.tpack.model.CorruptManifestException;
import com.contrastsecurity.tpack.model.PackageIOException;
import com.contrastsecurity.tpack.model.TpackException;
import com.contrastsecurity.tpack.version.SemanticVersion;
import com.contrastsecurity.tpack.version.VersionParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Increments the {@code version} of a package manifest.
 */
public class VersionBumper {
    private static final Logger logger = LoggerFactory.getLogger(VersionBumper.class);

    private final ManifestStore store;

    public VersionBumper(ManifestStore store) {
        this.store = store;
    }

    /**
     * @param packageDir package whose manifest is updated
     * @param bumpType "major", "minor" or "patch"
     * @param dryRun compute the new version without writing it
     * @return the new version
     * @throws TpackException if the manifest is missing, unreadable or holds an invalid version
     */
    public SemanticVersion bump(Path packageDir, String bumpType, boolean dryRun) throws TpackException {
        Manifest manifest = store.load(packageDir);
        if (manifest == null) {
            throw new PackageIOException(packageDir, "No " + Manifest.FILE_NAME + " in " + packageDir);
        }

        SemanticVersion current;
        try {
            current = manifest.isBlank(Manifest.VERSION)
                    ? SemanticVersion.ZERO
                    : VersionParser.parse(manifest.getVersion());
        } catch (IllegalArgumentException e) {
            throw new CorruptManifestException(packageDir, "Invalid version in " + Manifest.FILE_NAME + ": " + e.getMessage(), e);
        }

        SemanticVersion next = current.bump(bumpType);
        logger.info("{}: {} -> {}", packageDir, current, next);
        if (!dryRun) {
            manifest.set(Manifest.VERSION, next.toString());
            store.write(packageDir, manifest);
        }
        return next;
    }
}
