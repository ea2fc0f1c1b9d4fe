package com.contrastsecurity.tpack.runtime;

import com.contrastsecurity.tpack.manifest.Manifest;
import com.contrastsecurity.tpack.manifest.ManifestStore;
import com.contrastsecurity.tpack.model.TpackException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.function.Supplier;

/**
 * The version a package reports about itself, read from its manifest on first access
 * and kept for the lifetime of the process.
 */
public class PackageVersion implements Supplier<String> {
    private static final Logger logger = LoggerFactory.getLogger(PackageVersion.class);

    static final String UNKNOWN = "0.0.0";

    private final Supplier<String> loader;
    private String version;
    private int loads;

    PackageVersion(Supplier<String> loader) {
        this.loader = loader;
    }

    /**
     * Version of the package in the given directory.
     */
    public static PackageVersion forPackage(Path packageDir, ManifestStore store) {
        return new PackageVersion(() -> {
            try {
                Manifest manifest = store.load(packageDir);
                if (manifest != null && !manifest.isBlank(Manifest.VERSION)) {
                    return manifest.getVersion();
                }
                logger.warn("No version in manifest of {}", packageDir);
            } catch (TpackException e) {
                logger.warn("Could not read version of {}: {}", packageDir, e.getMessage());
            }
            return UNKNOWN;
        });
    }

    /**
     * A version that is already known.
     */
    public static PackageVersion of(String version) {
        return new PackageVersion(() -> version != null ? version : UNKNOWN);
    }

    /**
     * The memoised version, loading it on first call.
     */
    @Override
    public synchronized String get() {
        if (version == null) {
            version = loader.get();
            loads++;
        }
        return version;
    }

    synchronized int getLoadCount() {
        return loads;
    }
}
