package com.github.alvarosanchez.rpmrepo.service;

import com.github.alvarosanchez.rpmrepo.exception.StorageUnavailableException;
import com.github.alvarosanchez.rpmrepo.model.ReleaseDescriptor;
import com.github.alvarosanchez.rpmrepo.model.ReleaseKey;
import com.github.alvarosanchez.rpmrepo.model.VersionLedger;
import com.github.alvarosanchez.rpmrepo.store.KeyValueStore;
import io.micronaut.serde.ObjectMapper;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the per-provider ledger of discovered releases and records each release once.
 *
 * <p>Recording is a read-modify-write of the whole ledger without compare-and-swap: two callers racing
 * on one provider may both record, and the last write wins.
 */
@Singleton
public final class VersionLedgerService {

    private static final Logger LOG = LoggerFactory.getLogger(VersionLedgerService.class);

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Inject
    VersionLedgerService(KeyValueStore store, ObjectMapper objectMapper) {
        this(store, objectMapper, Clock.systemUTC());
    }

    VersionLedgerService(KeyValueStore store, ObjectMapper objectMapper, Clock clock) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Loads a provider's ledger.
     *
     * @param providerId provider id
     * @return stored ledger, or an empty one when none was recorded yet
     */
    public VersionLedger getLedger(String providerId) {
        String key = ledgerKey(providerId);
        Optional<byte[]> stored = store.get(key);
        if (stored.isEmpty()) {
            return VersionLedger.empty();
        }
        try {
            VersionLedger ledger = objectMapper.readValue(stored.get(), VersionLedger.class);
            return ledger == null ? VersionLedger.empty() : ledger;
        } catch (IOException e) {
            throw new StorageUnavailableException("Failed to read version ledger `" + key + "`", e);
        }
    }

    /**
     * Records a release unless a release with the same identity key is already present.
     *
     * @param providerId provider id
     * @param candidate discovered release
     * @return {@code true} when the release was recorded, {@code false} when it was already known
     */
    public boolean recordIfNew(String providerId, ReleaseDescriptor candidate) {
        String identityKey = candidate.key().identity();
        VersionLedger ledger = getLedger(providerId);
        if (ledger.contains(identityKey)) {
            LOG.info("Release {} of {} is already recorded", identityKey, providerId);
            return false;
        }

        VersionLedger updated = ledger.prepend(candidate, clock.instant());
        save(providerId, updated);
        LOG.info("Recorded new release {} of {}", identityKey, providerId);
        return true;
    }

    /**
     * Returns the newest recorded release.
     *
     * @param providerId provider id
     * @return newest release, or empty
     */
    public Optional<ReleaseDescriptor> latest(String providerId) {
        return getLedger(providerId).latest();
    }

    /**
     * Returns every recorded release, newest first.
     *
     * @param providerId provider id
     * @return recorded releases
     */
    public List<ReleaseDescriptor> all(String providerId) {
        return getLedger(providerId).versions();
    }

    /**
     * Finds a recorded release by version and release.
     *
     * @param providerId provider id
     * @param key release key
     * @return matching release, or empty
     */
    public Optional<ReleaseDescriptor> find(String providerId, ReleaseKey key) {
        return all(providerId).stream()
            .filter(descriptor -> descriptor.identityKey().equals(key.identity()))
            .findFirst();
    }

    /**
     * Finds a recorded release by its published filename.
     *
     * @param providerId provider id
     * @param filename artifact filename
     * @return matching release, or empty
     */
    public Optional<ReleaseDescriptor> findByFilename(String providerId, String filename) {
        return all(providerId).stream()
            .filter(descriptor -> descriptor.filename().equals(filename))
            .findFirst();
    }

    private void save(String providerId, VersionLedger ledger) {
        String key = ledgerKey(providerId);
        String json;
        try {
            json = objectMapper.writeValueAsString(ledger);
        } catch (IOException e) {
            throw new StorageUnavailableException("Failed to serialize version ledger `" + key + "`", e);
        }
        store.put(key, json.getBytes(StandardCharsets.UTF_8));
    }

    static String ledgerKey(String providerId) {
        return StoreKeys.providerPrefix(providerId) + "version-index";
    }
}
