package com.github.alvarosanchez.rpmrepo.service;

import com.github.alvarosanchez.rpmrepo.exception.StorageUnavailableException;
import com.github.alvarosanchez.rpmrepo.model.ArtifactMetadata;
import com.github.alvarosanchez.rpmrepo.model.ReleaseKey;
import com.github.alvarosanchez.rpmrepo.store.KeyValueStore;
import io.micronaut.serde.ObjectMapper;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keyed persistence of one {@link ArtifactMetadata} record per provider release.
 */
@Singleton
public final class MetadataStore {

    private static final Logger LOG = LoggerFactory.getLogger(MetadataStore.class);

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;

    MetadataStore(KeyValueStore store, ObjectMapper objectMapper) {
        this.store = store;
        this.objectMapper = objectMapper;
    }

    /**
     * Returns whether metadata is stored for a release.
     *
     * @param providerId provider id
     * @param key release key
     * @return {@code true} when a record exists
     */
    public boolean has(String providerId, ReleaseKey key) {
        return store.get(StoreKeys.metadata(providerId, key)).isPresent();
    }

    /**
     * Reads the metadata of a release.
     *
     * <p>A record written with an unsupported schema version is reported as absent.
     *
     * @param providerId provider id
     * @param key release key
     * @return stored metadata, or empty
     */
    public Optional<ArtifactMetadata> get(String providerId, ReleaseKey key) {
        String storeKey = StoreKeys.metadata(providerId, key);
        Optional<byte[]> stored = store.get(storeKey);
        if (stored.isEmpty()) {
            return Optional.empty();
        }

        ArtifactMetadata metadata;
        try {
            metadata = objectMapper.readValue(stored.get(), ArtifactMetadata.class);
        } catch (IOException e) {
            throw new StorageUnavailableException("Failed to read metadata `" + storeKey + "`", e);
        }
        if (metadata == null) {
            throw new StorageUnavailableException("Metadata `" + storeKey + "` is empty");
        }
        if (metadata.schemaVersion() != ArtifactMetadata.CURRENT_SCHEMA_VERSION) {
            LOG.warn(
                "Ignoring metadata `{}` with unsupported schema version {}",
                storeKey,
                metadata.schemaVersion()
            );
            return Optional.empty();
        }
        return Optional.of(metadata);
    }

    /**
     * Stores the metadata of a release, replacing any previous record.
     *
     * @param providerId provider id
     * @param key release key
     * @param metadata metadata to store
     */
    public void put(String providerId, ReleaseKey key, ArtifactMetadata metadata) {
        String storeKey = StoreKeys.metadata(providerId, key);
        String json;
        try {
            json = objectMapper.writeValueAsString(metadata);
        } catch (IOException e) {
            throw new StorageUnavailableException("Failed to serialize metadata `" + storeKey + "`", e);
        }
        store.put(storeKey, json.getBytes(StandardCharsets.UTF_8));
        LOG.info("Stored metadata for {}", storeKey);
    }

    /**
     * Reads the metadata of several releases concurrently, keeping the order of {@code keys}.
     * Releases without metadata are left out.
     *
     * @param providerId provider id
     * @param keys release keys, typically newest first
     * @return metadata of the releases that have it
     */
    public List<ArtifactMetadata> getMany(String providerId, List<ReleaseKey> keys) {
        List<CompletableFuture<Optional<ArtifactMetadata>>> reads = new ArrayList<>(keys.size());
        for (ReleaseKey key : keys) {
            reads.add(CompletableFuture.supplyAsync(() -> get(providerId, key)));
        }

        List<ArtifactMetadata> found = new ArrayList<>(keys.size());
        try {
            for (CompletableFuture<Optional<ArtifactMetadata>> read : reads) {
                read.join().ifPresent(found::add);
            }
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
        return found;
    }

    /**
     * Deletes the metadata of a release.
     *
     * @param providerId provider id
     * @param key release key
     */
    public void delete(String providerId, ReleaseKey key) {
        store.delete(StoreKeys.metadata(providerId, key));
    }
}
