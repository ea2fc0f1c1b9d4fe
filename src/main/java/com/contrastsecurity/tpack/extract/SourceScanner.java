package com.contrastsecurity.tpack.extract;

import java.nio.file.Path;

/**
 * Extracts declared and referenced entities from one source dialect.
 */
public interface SourceScanner {

    /**
     * Short dialect name used in scan statistics, e.g. "python" or "talon".
     */
    String getDialect();

    /**
     * @param file path of a candidate source file
     * @return true if this scanner handles the file, decided by its extension
     */
    boolean supports(Path file);

    /**
     * Scan one file. Implementations never throw for malformed content; a file that cannot
     * be read structurally is returned with {@link FileExtraction#isDegraded()} set.
     *
     * @param relativePath path of the file relative to the package root
     * @param content file content
     * @return entities found in the file
     */
    FileExtraction scan(Path relativePath, String content);
}
