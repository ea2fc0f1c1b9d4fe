package com.contrastsecurity.tpack.version;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

public class SemanticVersionTest {

    @Test
    public void testBumpResetsLowerComponents() {
        SemanticVersion version = new SemanticVersion(1, 4, 7);

        assertEquals("1.4.8", version.bump("patch").toString());
        assertEquals("1.5.0", version.bump("minor").toString());
        assertEquals("2.0.0", version.bump("major").toString());
    }

    @Test
    public void testBumpFromZero() {
        assertEquals("0.0.1", SemanticVersion.ZERO.bump("patch").toString());
    }

    @Test
    public void testUnknownBumpType() {
        assertThrows(IllegalArgumentException.class, () -> SemanticVersion.ZERO.bump("build"));
    }

    @Test
    public void testNegativeComponentRejected() {
        assertThrows(IllegalArgumentException.class, () -> new SemanticVersion(1, -1, 0));
    }

    @Test
    public void testOrdering() {
        assertTrue(new SemanticVersion(1, 10, 0).compareTo(new SemanticVersion(1, 9, 9)) > 0);
        assertTrue(new SemanticVersion(0, 0, 1).compareTo(new SemanticVersion(0, 1, 0)) < 0);
        assertEquals(0, new SemanticVersion(2, 0, 0).compareTo(VersionParser.parse("2.0.0")));
    }
}
