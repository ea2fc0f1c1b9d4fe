package com.contrastsecurity.tpack.service;

import com.contrastsecurity.tpack.manifest.ManifestStore;
import com.contrastsecurity.tpack.model.CorruptManifestException;
import com.contrastsecurity.tpack.model.PackageIOException;
import com.contrastsecurity.tpack.version.SemanticVersion;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class VersionBumperTest {

    @TempDir
    Path packageDir;

    private final ManifestStore store = new ManifestStore();
    private final VersionBumper bumper = new VersionBumper(store);

    private void manifest(String json) throws IOException {
        Files.write(packageDir.resolve("manifest.json"), json.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void testBumpWritesNewVersion() throws Exception {
        manifest("{\"name\": \"mouse_rig\", \"version\": \"1.4.7\", \"custom\": true}");

        SemanticVersion next = bumper.bump(packageDir, "minor", false);

        assertEquals("1.5.0", next.toString());
        assertEquals("1.5.0", store.load(packageDir).getVersion());
        assertTrue(store.load(packageDir).getBoolean("custom", false));
    }

    @Test
    public void testDryRunLeavesManifestAlone() throws Exception {
        manifest("{\"name\": \"mouse_rig\", \"version\": \"1.4.7\"}");

        assertEquals("2.0.0", bumper.bump(packageDir, "major", true).toString());
        assertEquals("1.4.7", store.load(packageDir).getVersion());
    }

    @Test
    public void testMissingVersionStartsFromZero() throws Exception {
        manifest("{\"name\": \"mouse_rig\"}");

        assertEquals("0.0.1", bumper.bump(packageDir, "patch", false).toString());
    }

    @Test
    public void testInvalidVersion() throws Exception {
        manifest("{\"name\": \"mouse_rig\", \"version\": \"one\"}");

        assertThrows(CorruptManifestException.class, () -> bumper.bump(packageDir, "patch", false));
    }

    @Test
    public void testMissingManifest() {
        assertThrows(PackageIOException.class, () -> bumper.bump(packageDir, "patch", false));
    }

    @Test
    public void testUnknownBumpType() throws Exception {
        manifest("{\"name\": \"mouse_rig\", \"version\": \"1.0.0\"}");

        assertThrows(IllegalArgumentException.class, () -> bumper.bump(packageDir, "huge", false));
    }
}
