package com.contrastsecurity.tpack.service;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Optional {@code tpack.config.json} settings. Command-line flags override them.
 *
 * <pre>
 * {
 *   "defaults": { "manifest": true, "check": false },
 *   "skipDirectories": ["scratch"]
 * }
 * </pre>
 */
public class TpackConfig {
    private static final Logger logger = LoggerFactory.getLogger(TpackConfig.class);

    public static final String FILE_NAME = "tpack.config.json";

    private Defaults defaults = new Defaults();
    private List<String> skipDirectories = new ArrayList<>();

    public static class Defaults {
        private boolean manifest = true;
        private boolean check = false;

        public boolean isManifest() {
            return manifest;
        }

        public boolean isCheck() {
            return check;
        }
    }

    public boolean isManifestEnabled() {
        return defaults == null || defaults.isManifest();
    }

    public boolean isCheckEnabled() {
        return defaults != null && defaults.isCheck();
    }

    public List<String> getSkipDirectories() {
        return skipDirectories != null ? skipDirectories : new ArrayList<>();
    }

    /**
     * Load the first config file found in the given directories.
     *
     * @return the parsed config, or defaults when none exists or it is malformed
     */
    public static TpackConfig load(Path... directories) {
        for (Path dir : directories) {
            if (dir == null) {
                continue;
            }
            Path file = dir.resolve(FILE_NAME);
            if (!Files.isRegularFile(file)) {
                continue;
            }
            try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                TpackConfig config = new Gson().fromJson(reader, TpackConfig.class);
                if (config != null) {
                    logger.info("Loaded configuration from {}", file);
                    return config;
                }
            } catch (IOException | JsonParseException e) {
                logger.warn("Ignoring unreadable configuration {}: {}", file, e.getMessage());
            }
        }
        return new TpackConfig();
    }
}
