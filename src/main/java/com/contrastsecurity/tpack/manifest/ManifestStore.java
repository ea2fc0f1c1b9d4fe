package com.contrastsecurity.tpack.manifest;

import com.contrastsecurity.tpack.model.CorruptManifestException;
import com.contrastsecurity.tpack.model.PackageIOException;
import com.contrastsecurity.tpack.util.AtomicFileWriter;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes {@code manifest.json} files.
 */
public class ManifestStore {
    private static final Logger logger = LoggerFactory.getLogger(ManifestStore.class);

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .serializeNulls()
            .create();

    public static Path manifestPath(Path packageDir) {
        return packageDir.resolve(Manifest.FILE_NAME);
    }

    public boolean exists(Path packageDir) {
        return Files.isRegularFile(manifestPath(packageDir));
    }

    /**
     * Load the manifest of a package.
     *
     * @param packageDir package directory
     * @return the manifest, or null if the package has none yet
     * @throws CorruptManifestException if the file is not a JSON object
     * @throws PackageIOException if the file exists but cannot be read
     */
    public Manifest load(Path packageDir) throws CorruptManifestException, PackageIOException {
        Path file = manifestPath(packageDir);
        if (!Files.isRegularFile(file)) {
            return null;
        }

        String content;
        try {
            content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new PackageIOException(packageDir, "Failed to read " + file + ": " + e.getMessage(), e);
        }

        JsonElement parsed;
        try {
            parsed = JsonParser.parseString(content);
        } catch (JsonParseException e) {
            throw new CorruptManifestException(packageDir, "Malformed JSON in " + file + ": " + e.getMessage(), e);
        }
        if (!parsed.isJsonObject()) {
            throw new CorruptManifestException(packageDir, "Expected a JSON object in " + file);
        }
        logger.debug("Loaded {}", file);
        return new Manifest(parsed.getAsJsonObject());
    }

    /**
     * Render a manifest the way it is persisted: two-space indent, no HTML escaping,
     * trailing newline.
     */
    public String toJson(Manifest manifest) {
        return GSON.toJson(manifest.getJson()) + "\n";
    }

    /**
     * Replace the package's manifest atomically.
     *
     * @throws PackageIOException if the file cannot be written
     */
    public void write(Path packageDir, Manifest manifest) throws PackageIOException {
        Path file = manifestPath(packageDir);
        try {
            AtomicFileWriter.write(file, toJson(manifest));
        } catch (IOException e) {
            throw new PackageIOException(packageDir, "Failed to write " + file + ": " + e.getMessage(), e);
        }
        logger.info("Wrote {}", file);
    }
}
