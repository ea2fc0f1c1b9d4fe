package com.contrastsecurity.tpack.model;

import java.nio.file.Path;

/**
 * Failure that aborts the pipeline of a single package. The batch moves on to the next package.
 */
public class TpackException extends Exception {
    private final Path packageDir;

    public TpackException(Path packageDir, String message) {
        super(message);
        this.packageDir = packageDir;
    }

    public TpackException(Path packageDir, String message, Throwable cause) {
        super(message, cause);
        this.packageDir = packageDir;
    }

    /**
     * Directory of the package whose pipeline failed.
     */
    public Path getPackageDir() {
        return packageDir;
    }
}
