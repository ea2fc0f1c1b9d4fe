package com.contrastsecurity.tpack.model;

import java.nio.file.Path;

/**
 * The persisted manifest exists but is not a readable JSON object.
 */
public class CorruptManifestException extends TpackException {

    public CorruptManifestException(Path packageDir, String message, Throwable cause) {
        super(packageDir, message, cause);
    }

    public CorruptManifestException(Path packageDir, String message) {
        super(packageDir, message);
    }
}
