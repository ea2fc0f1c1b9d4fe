package com.contrastsecurity.tpack.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class TpackConfigTest {

    @TempDir
    Path dir;

    @Test
    public void testDefaultsWithoutFile() {
        TpackConfig config = TpackConfig.load(dir);

        assertTrue(config.isManifestEnabled());
        assertFalse(config.isCheckEnabled());
        assertTrue(config.getSkipDirectories().isEmpty());
    }

    @Test
    public void testLoadFromFile() throws Exception {
        Files.write(dir.resolve(TpackConfig.FILE_NAME),
                "{\"defaults\": {\"manifest\": false, \"check\": true}, \"skipDirectories\": [\"scratch\"]}"
                        .getBytes(StandardCharsets.UTF_8));

        TpackConfig config = TpackConfig.load(dir.resolve("missing"), dir);

        assertFalse(config.isManifestEnabled());
        assertTrue(config.isCheckEnabled());
        assertEquals(Collections.singletonList("scratch"), config.getSkipDirectories());
    }

    @Test
    public void testMalformedFileFallsBackToDefaults() throws Exception {
        Files.write(dir.resolve(TpackConfig.FILE_NAME), "{\"defaults\": ".getBytes(StandardCharsets.UTF_8));

        TpackConfig config = TpackConfig.load(dir);

        assertTrue(config.isManifestEnabled());
        assertFalse(config.isCheckEnabled());
    }
}
