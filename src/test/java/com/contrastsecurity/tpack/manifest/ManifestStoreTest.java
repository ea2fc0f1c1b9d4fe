package com.contrastsecurity.tpack.manifest;

import com.contrastsecurity.tpack.model.CorruptManifestException;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class ManifestStoreTest {

    @TempDir
    Path packageDir;

    private final ManifestStore store = new ManifestStore();

    @Test
    public void testMissingManifestLoadsAsNull() throws Exception {
        assertNull(store.load(packageDir));
        assertFalse(store.exists(packageDir));
    }

    @Test
    public void testWriteFormat() throws Exception {
        Manifest manifest = new Manifest(JsonParser.parseString(
                "{\"name\": \"mouse_rig\", \"description\": \"<Moves> & clicks\", \"tags\": [], \"license\": null}")
                .getAsJsonObject());

        store.write(packageDir, manifest);

        String written = new String(Files.readAllBytes(packageDir.resolve("manifest.json")), StandardCharsets.UTF_8);
        String expected = "{\n"
                + "  \"name\": \"mouse_rig\",\n"
                + "  \"description\": \"<Moves> & clicks\",\n"
                + "  \"tags\": [],\n"
                + "  \"license\": null\n"
                + "}\n";
        assertEquals(expected, written);
        assertEquals(expected, store.toJson(manifest));
    }

    @Test
    public void testRoundTripKeepsFieldOrder() throws Exception {
        Files.write(packageDir.resolve("manifest.json"),
                "{\"zeta\": 1, \"alpha\": {\"b\": true, \"a\": false}}".getBytes(StandardCharsets.UTF_8));

        Manifest loaded = store.load(packageDir);
        store.write(packageDir, loaded);

        assertEquals("{\"zeta\":1,\"alpha\":{\"b\":true,\"a\":false}}", store.load(packageDir).toString());
    }

    @Test
    public void testWriteReplacesExistingFile() throws Exception {
        Files.write(packageDir.resolve("manifest.json"), "{\"name\": \"old\"}".getBytes(StandardCharsets.UTF_8));

        store.write(packageDir, new Manifest(JsonParser.parseString("{\"name\": \"new\"}").getAsJsonObject()));

        assertEquals("new", store.load(packageDir).getName());
        try (Stream<Path> files = Files.list(packageDir)) {
            assertEquals(1, files.count());
        }
    }

    @Test
    public void testMalformedManifestIsCorrupt() throws Exception {
        Files.write(packageDir.resolve("manifest.json"), "{\"name\": ".getBytes(StandardCharsets.UTF_8));

        CorruptManifestException e = assertThrows(CorruptManifestException.class, () -> store.load(packageDir));
        assertEquals(packageDir, e.getPackageDir());
    }

    @Test
    public void testNonObjectManifestIsCorrupt() throws Exception {
        Files.write(packageDir.resolve("manifest.json"), "[1, 2]".getBytes(StandardCharsets.UTF_8));

        assertThrows(CorruptManifestException.class, () -> store.load(packageDir));
    }
}
