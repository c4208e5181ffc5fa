package com.github.alvarosanchez.rpmrepo.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class VersionLedgerTest {

    private static final ReleaseDescriptor FIRST = new ReleaseDescriptor("1.0.0", "aaa", "https://example.com/a.rpm", "a.rpm");
    private static final ReleaseDescriptor SECOND = new ReleaseDescriptor("1.1.0", "bbb", "https://example.com/b.rpm", "b.rpm");

    @Test
    void emptyLedgerHasNoLatestRelease() {
        VersionLedger ledger = VersionLedger.empty();

        assertEquals(0, ledger.size());
        assertTrue(ledger.latest().isEmpty());
        assertNull(ledger.updated());
    }

    @Test
    void prependPlacesStampedReleaseFirst() {
        Instant firstSeen = Instant.parse("2025-01-01T00:00:00Z");
        Instant secondSeen = Instant.parse("2025-02-01T00:00:00Z");

        VersionLedger ledger = VersionLedger.empty().prepend(FIRST, firstSeen).prepend(SECOND, secondSeen);

        assertEquals(List.of("1.1.0-bbb", "1.0.0-aaa"), ledger.versions().stream().map(ReleaseDescriptor::identityKey).toList());
        assertEquals("2025-02-01T00:00:00Z", ledger.latest().orElseThrow().added());
        assertEquals("2025-01-01T00:00:00Z", ledger.versions().get(1).added());
        assertEquals("2025-02-01T00:00:00Z", ledger.updated());
    }

    @Test
    void containsMatchesIdentityKey() {
        VersionLedger ledger = VersionLedger.empty().prepend(FIRST, Instant.EPOCH);

        assertTrue(ledger.contains("1.0.0-aaa"));
        assertFalse(ledger.contains("1.0.0-aab"));
    }

    @Test
    void nullVersionsBecomeEmptyList() {
        assertEquals(List.of(), new VersionLedger(null, null).versions());
    }
}
