package com.contrastsecurity.tpack.version;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the VersionParser class
 */
public class VersionParserTest {

    @Test
    public void testParseStandardVersionSimple() {
        SemanticVersion version = VersionParser.parse("1.2.3");

        assertEquals(1, version.getMajor());
        assertEquals(2, version.getMinor());
        assertEquals(3, version.getPatch());
        assertEquals("1.2.3", version.toString());
    }

    @Test
    public void testParseWithLeadingV() {
        assertEquals(new SemanticVersion(0, 4, 12), VersionParser.parse("v0.4.12"));
    }

    @Test
    public void testParseRejectsIncompleteVersion() {
        assertThrows(IllegalArgumentException.class, () -> VersionParser.parse("1.2"));
        assertThrows(IllegalArgumentException.class, () -> VersionParser.parse("1.2.3-beta"));
        assertThrows(IllegalArgumentException.class, () -> VersionParser.parse(""));
        assertThrows(IllegalArgumentException.class, () -> VersionParser.parse(null));
    }

    @Test
    public void testParseOrDefault() {
        assertEquals(SemanticVersion.ZERO, VersionParser.parseOrDefault("latest", SemanticVersion.ZERO));
        assertEquals(new SemanticVersion(2, 0, 1), VersionParser.parseOrDefault("2.0.1", SemanticVersion.ZERO));
    }

    @Test
    public void testCompareNumericSegments() {
        assertTrue(VersionParser.compare("1.10.0", "1.9.0") > 0);
        assertTrue(VersionParser.compare("1.2.0", "1.2.1") < 0);
        assertEquals(0, VersionParser.compare("3.0.0", "3.0.0"));
    }

    @Test
    public void testCompareIgnoresLeadingV() {
        assertTrue(VersionParser.compare("1.4.0", "v1.3.0") > 0);
        assertTrue(VersionParser.compare("v1.10.0", "1.9.0") > 0);
        assertEquals(0, VersionParser.compare("v2.0.0", "2.0.0"));
        assertEquals("1.4.0", VersionParser.max("v1.3.0", "1.4.0"));
    }

    @Test
    public void testCompareLongerVersionIsHigher() {
        assertTrue(VersionParser.compare("1.2.0.1", "1.2.0") > 0);
    }

    @Test
    public void testCompareMissingVersionsSortLowest() {
        assertTrue(VersionParser.compare(null, "0.0.1") < 0);
        assertTrue(VersionParser.compare("0.0.1", "") > 0);
        assertEquals(0, VersionParser.compare(null, ""));
    }

    @Test
    public void testMax() {
        assertEquals("1.2.0", VersionParser.max("1.1.0", "1.2.0"));
        assertEquals("1.2.0", VersionParser.max("1.2.0", null));
    }

    @Test
    public void testSatisfies() {
        assertTrue(VersionParser.satisfies("1.2.0", "1.2.0"));
        assertTrue(VersionParser.satisfies("2.0.0", "1.9.9"));
        assertFalse(VersionParser.satisfies("1.1.0", "1.2.0"));
        assertFalse(VersionParser.satisfies(null, "0.0.1"));
    }
}
