package com.github.alvarosanchez.rpmrepo.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class ReleaseKeyTest {

    @Test
    void parseSplitsAtLastDash() {
        ReleaseKey key = ReleaseKey.parse("1.7.28-0a1b2c3d4e");

        assertEquals("1.7.28", key.version());
        assertEquals("0a1b2c3d4e", key.release());
        assertEquals("1.7.28-0a1b2c3d4e", key.identity());
    }

    @Test
    void parseKeepsDashesInsideVersion() {
        ReleaseKey key = ReleaseKey.parse("2.0.0-beta-abc");

        assertEquals("2.0.0-beta", key.version());
        assertEquals("abc", key.release());
    }

    @Test
    void parseRejectsValuesWithoutRelease() {
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class, () -> ReleaseKey.parse("1.0.0"));

        assertEquals("Expected <version>-<release> but got `1.0.0`.", exception.getMessage());
        assertThrows(IllegalArgumentException.class, () -> ReleaseKey.parse("1.0.0-"));
        assertThrows(IllegalArgumentException.class, () -> ReleaseKey.parse("-abc"));
    }

    @Test
    void constructorRejectsBlankParts() {
        assertThrows(IllegalArgumentException.class, () -> new ReleaseKey(" ", "abc"));
        assertThrows(IllegalArgumentException.class, () -> new ReleaseKey("1.0.0", null));
    }
}
