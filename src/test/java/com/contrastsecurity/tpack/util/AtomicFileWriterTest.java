package com.contrastsecurity.tpack.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class AtomicFileWriterTest {

    @TempDir
    Path dir;

    @Test
    public void testWriteLeavesNoTemporaryFiles() throws Exception {
        Path target = dir.resolve("manifest.json");
        Files.write(target, "old".getBytes(StandardCharsets.UTF_8));

        AtomicFileWriter.write(target, "new ✓");

        assertEquals("new ✓", new String(Files.readAllBytes(target), StandardCharsets.UTF_8));
        try (Stream<Path> files = Files.list(dir)) {
            assertEquals(1, files.count());
        }
    }
}
