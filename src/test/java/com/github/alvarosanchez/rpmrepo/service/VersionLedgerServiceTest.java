package com.github.alvarosanchez.rpmrepo.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.github.alvarosanchez.rpmrepo.exception.StorageUnavailableException;
import com.github.alvarosanchez.rpmrepo.model.ReleaseDescriptor;
import com.github.alvarosanchez.rpmrepo.model.ReleaseKey;
import com.github.alvarosanchez.rpmrepo.model.VersionLedger;
import com.github.alvarosanchez.rpmrepo.store.InMemoryKeyValueStore;
import io.micronaut.context.ApplicationContext;
import io.micronaut.serde.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class VersionLedgerServiceTest {

    private static final ReleaseDescriptor RELEASE_A =
        new ReleaseDescriptor("1.0.0", "aaa", "https://example.com/tool-1.0.0.rpm", "tool-1.0.0-aaa.el8.x86_64.rpm");
    private static final ReleaseDescriptor RELEASE_B =
        new ReleaseDescriptor("1.1.0", "bbb", "https://example.com/tool-1.1.0.rpm", "tool-1.1.0-bbb.el8.x86_64.rpm");

    private ApplicationContext context;
    private InMemoryKeyValueStore store;
    private VersionLedgerService service;

    @BeforeEach
    void setUp() {
        context = ApplicationContext.run();
        store = new InMemoryKeyValueStore();
        Clock clock = Clock.fixed(Instant.parse("2025-03-01T12:00:00Z"), ZoneOffset.UTC);
        service = new VersionLedgerService(store, context.getBean(ObjectMapper.class), clock);
    }

    @AfterEach
    void tearDown() {
        context.close();
    }

    @Test
    void missingLedgerReadsAsEmpty() {
        VersionLedger ledger = service.getLedger("tool");

        assertEquals(0, ledger.size());
        assertTrue(service.latest("tool").isEmpty());
    }

    @Test
    void recordingSameReleaseTwiceIsIdempotent() {
        assertTrue(service.recordIfNew("tool", RELEASE_A));
        assertFalse(service.recordIfNew("tool", RELEASE_A));

        assertEquals(1, service.getLedger("tool").size());
    }

    @Test
    void newerReleasesAreListedFirst() {
        service.recordIfNew("tool", RELEASE_A);
        service.recordIfNew("tool", RELEASE_B);

        assertEquals(
            List.of("1.1.0-bbb", "1.0.0-aaa"),
            service.all("tool").stream().map(ReleaseDescriptor::identityKey).toList()
        );
        assertEquals("1.1.0-bbb", service.latest("tool").orElseThrow().identityKey());
    }

    @Test
    void ledgerIsPersistedInVersionIndexFormat() {
        service.recordIfNew("tool", RELEASE_A);

        String json = store.getString("tool:version-index").orElseThrow();

        assertTrue(json.contains("\"versions\""));
        assertTrue(json.contains("\"url\":\"https://example.com/tool-1.0.0.rpm\""));
        assertTrue(json.contains("\"added\":\"2025-03-01T12:00:00Z\""));
        assertTrue(json.contains("\"updated\":\"2025-03-01T12:00:00Z\""));
    }

    @Test
    void readsLedgerWrittenWithUnknownFields() {
        store.putString(
            "tool:version-index",
            "{\"versions\":[{\"version\":\"2.0.0\",\"release\":\"ccc\",\"url\":\"https://example.com/c.rpm\","
                + "\"filename\":\"c.rpm\",\"added\":\"2025-01-01T00:00:00Z\",\"mirror\":\"eu\"}],"
                + "\"updated\":\"2025-01-01T00:00:00Z\",\"owner\":\"ops\"}"
        );

        ReleaseDescriptor latest = service.latest("tool").orElseThrow();

        assertEquals("2.0.0-ccc", latest.identityKey());
        assertEquals("https://example.com/c.rpm", latest.downloadUrl());
    }

    @Test
    void findLooksUpByKeyAndFilename() {
        service.recordIfNew("tool", RELEASE_A);
        service.recordIfNew("tool", RELEASE_B);

        assertEquals("1.0.0-aaa", service.find("tool", new ReleaseKey("1.0.0", "aaa")).orElseThrow().identityKey());
        assertTrue(service.find("tool", new ReleaseKey("1.0.0", "zzz")).isEmpty());
        assertEquals("1.1.0-bbb", service.findByFilename("tool", "tool-1.1.0-bbb.el8.x86_64.rpm").orElseThrow().identityKey());
        assertTrue(service.findByFilename("tool", "other.rpm").isEmpty());
    }

    @Test
    void providersHaveSeparateLedgers() {
        service.recordIfNew("tool", RELEASE_A);

        assertTrue(service.all("other").isEmpty());
        assertTrue(service.recordIfNew("other", RELEASE_A));
    }

    @Test
    void corruptLedgerSurfacesAsStorageUnavailable() {
        store.putString("tool:version-index", "{not json");

        assertThrows(StorageUnavailableException.class, () -> service.getLedger("tool"));
    }

    @Test
    void blankProviderIdIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> service.getLedger(" "));
    }
}
