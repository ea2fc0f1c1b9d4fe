package com.contrastsecurity.tpack.model;

import java.nio.file.Path;

/**
 * Package root missing, unreadable, or its manifest could not be written.
 */
public class PackageIOException extends TpackException {

    public PackageIOException(Path packageDir, String message, Throwable cause) {
        super(packageDir, message, cause);
    }

    public PackageIOException(Path packageDir, String message) {
        super(packageDir, message);
    }
}
