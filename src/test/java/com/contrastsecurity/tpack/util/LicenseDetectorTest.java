package com.contrastsecurity.tpack.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class LicenseDetectorTest {

    @TempDir
    Path packageDir;

    @Test
    public void testIdentify() {
        assertEquals("MIT", LicenseDetector.identify("MIT License\n\nCopyright (c) 2024\n\n"
                + "Permission is hereby granted, free of charge, to any person obtaining a copy"));
        assertEquals("Apache-2.0", LicenseDetector.identify("Apache License\nVersion 2.0, January 2004"));
        assertEquals("GPL-3.0", LicenseDetector.identify("GNU GENERAL PUBLIC LICENSE\nVersion 3, 29 June 2007"));
        assertEquals("Unlicense", LicenseDetector.identify("This is free and unencumbered software released"));
        assertEquals(LicenseDetector.CUSTOM, LicenseDetector.identify("All rights reserved."));
    }

    @Test
    public void testIdentifyIgnoresCase() {
        assertEquals("Apache-2.0", LicenseDetector.identify("apache license version 2.0"));
    }

    @Test
    public void testDetectFromFile() throws Exception {
        assertNull(LicenseDetector.detect(packageDir));

        Files.write(packageDir.resolve("LICENSE.md"),
                "Apache License\nVersion 2.0".getBytes(StandardCharsets.UTF_8));

        assertEquals("Apache-2.0", LicenseDetector.detect(packageDir));
    }
}
