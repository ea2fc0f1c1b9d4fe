package com.contrastsecurity.tpack.version;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsing and comparison of manifest version strings.
 *
 * Manifests written by hand do not always hold a clean {@code x.y.z}; comparison therefore
 * falls back to a segment-wise ordering that works for most dotted versions.
 */
public class VersionParser {

    private static final Pattern SEMVER_PATTERN = Pattern.compile(
        "^v?([0-9]+)\\.([0-9]+)\\.([0-9]+)$"
    );

    /**
     * Parse a strict {@code major.minor.patch} string (an optional leading "v" is accepted).
     *
     * @param version The version string to parse
     * @return the parsed version
     * @throws IllegalArgumentException if the string is not a three-component version
     */
    public static SemanticVersion parse(String version) {
        if (version == null) {
            throw new IllegalArgumentException("Version is null");
        }
        Matcher matcher = SEMVER_PATTERN.matcher(version.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Not a major.minor.patch version: " + version);
        }
        try {
            return new SemanticVersion(
                Integer.parseInt(matcher.group(1)),
                Integer.parseInt(matcher.group(2)),
                Integer.parseInt(matcher.group(3))
            );
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Version component out of range: " + version, e);
        }
    }

    /**
     * Parse a version, returning {@code fallback} when the string is not a strict version.
     */
    public static SemanticVersion parseOrDefault(String version, SemanticVersion fallback) {
        try {
            return parse(version);
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }

    /**
     * Simple version comparison - returns positive if v1 > v2, negative if v1 < v2, 0 if equal.
     * Null or empty versions sort lowest.
     */
    public static int compare(String v1, String v2) {
        if (v1 == null || v1.isEmpty()) {
            return (v2 == null || v2.isEmpty()) ? 0 : -1;
        }
        if (v2 == null || v2.isEmpty()) {
            return 1;
        }
        String plain1 = stripPrefix(v1);
        String plain2 = stripPrefix(v2);
        if (plain1.equals(plain2)) {
            return 0;
        }

        // Split by dots and dashes
        String[] parts1 = plain1.split("[.\\-]");
        String[] parts2 = plain2.split("[.\\-]");

        int minLength = Math.min(parts1.length, parts2.length);
        for (int i = 0; i < minLength; i++) {
            String part1 = parts1[i];
            String part2 = parts2[i];

            Integer num1 = tryParseInt(part1);
            Integer num2 = tryParseInt(part2);

            if (num1 != null && num2 != null) {
                if (!num1.equals(num2)) {
                    return Integer.compare(num1, num2);
                }
            } else {
                int cmp = part1.compareTo(part2);
                if (cmp != 0) {
                    return cmp;
                }
            }
        }

        // If all compared parts are equal, longer version is considered higher
        return parts1.length - parts2.length;
    }

    /**
     * The higher of two versions; either may be null.
     */
    public static String max(String v1, String v2) {
        return compare(v1, v2) >= 0 ? v1 : v2;
    }

    /**
     * @return true if {@code actual} satisfies the minimum {@code required}
     */
    public static boolean satisfies(String actual, String required) {
        return compare(actual, required) >= 0;
    }

    // "v1.2.0" compares like "1.2.0"
    private static String stripPrefix(String version) {
        String trimmed = version.trim();
        if (trimmed.length() > 1 && (trimmed.charAt(0) == 'v' || trimmed.charAt(0) == 'V')
                && Character.isDigit(trimmed.charAt(1))) {
            return trimmed.substring(1);
        }
        return trimmed;
    }

    private static Integer tryParseInt(String s) {
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
