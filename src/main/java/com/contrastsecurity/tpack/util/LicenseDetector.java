package com.contrastsecurity.tpack.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Identifies a package's license from the text of its LICENSE file.
 */
public final class LicenseDetector {
    private static final Logger logger = LoggerFactory.getLogger(LicenseDetector.class);

    public static final String CUSTOM = "Custom";

    static final List<String> LICENSE_FILES = Collections.unmodifiableList(Arrays.asList(
            "LICENSE", "LICENSE.txt", "LICENSE.md", "LICENCE", "LICENCE.txt", "LICENCE.md"));

    // Checked in order; every phrase of an entry must appear
    private static final Map<String, List<String>> PATTERNS = new LinkedHashMap<>();
    static {
        PATTERNS.put("MIT", Arrays.asList("Permission is hereby granted, free of charge", "MIT License"));
        PATTERNS.put("Apache-2.0", Arrays.asList("Apache License", "Version 2.0"));
        PATTERNS.put("GPL-3.0", Arrays.asList("GNU GENERAL PUBLIC LICENSE", "Version 3"));
        PATTERNS.put("GPL-2.0", Arrays.asList("GNU GENERAL PUBLIC LICENSE", "Version 2"));
        PATTERNS.put("BSD-3-Clause", Arrays.asList("Redistribution and use", "neither the name"));
        PATTERNS.put("BSD-2-Clause", Arrays.asList("Redistribution and use", "without specific prior written permission"));
        PATTERNS.put("ISC", Arrays.asList("Permission to use, copy, modify", "ISC"));
        PATTERNS.put("Unlicense", Collections.singletonList("This is free and unencumbered software"));
    }

    private LicenseDetector() {
    }

    /**
     * @param packageDir package directory
     * @return SPDX-style identifier, {@value #CUSTOM} for an unrecognised license file,
     *         or null when the package has no readable license file
     */
    public static String detect(Path packageDir) {
        for (String fileName : LICENSE_FILES) {
            Path file = packageDir.resolve(fileName);
            if (!Files.isRegularFile(file)) {
                continue;
            }
            try {
                String text = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
                String license = identify(text);
                logger.info("Detected license {} from {}", license, file);
                return license;
            } catch (IOException e) {
                logger.warn("Could not read {}: {}", file, e.getMessage());
            }
        }
        return null;
    }

    /**
     * Identify license text, case-insensitively.
     */
    public static String identify(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> entry : PATTERNS.entrySet()) {
            boolean all = true;
            for (String phrase : entry.getValue()) {
                if (!lower.contains(phrase.toLowerCase(Locale.ROOT))) {
                    all = false;
                    break;
                }
            }
            if (all) {
                return entry.getKey();
            }
        }
        return CUSTOM;
    }
}
