package com.github.alvarosanchez.rpmrepo.service;

import com.github.alvarosanchez.rpmrepo.config.RepositorySettings;
import com.github.alvarosanchez.rpmrepo.model.ArtifactMetadata;
import com.github.alvarosanchez.rpmrepo.model.ReleaseDescriptor;
import com.github.alvarosanchez.rpmrepo.provider.Provider;
import com.github.alvarosanchez.rpmrepo.provider.ProviderRegistry;
import com.github.alvarosanchez.rpmrepo.store.KeyValueStore;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the discovery cycle of a provider: record the upstream's latest release, then make sure
 * recorded releases have metadata, within the per-cycle extraction limit.
 */
@Singleton
public final class DiscoveryService {

    private static final Logger LOG = LoggerFactory.getLogger(DiscoveryService.class);

    private final ProviderRegistry providerRegistry;
    private final VersionLedgerService versionLedgerService;
    private final MetadataStore metadataStore;
    private final ArtifactMetadataExtractor extractor;
    private final KeyValueStore store;
    private final RepositorySettings settings;
    private final Clock clock;

    @Inject
    DiscoveryService(
        ProviderRegistry providerRegistry,
        VersionLedgerService versionLedgerService,
        MetadataStore metadataStore,
        ArtifactMetadataExtractor extractor,
        KeyValueStore store,
        RepositorySettings settings
    ) {
        this(providerRegistry, versionLedgerService, metadataStore, extractor, store, settings, Clock.systemUTC());
    }

    DiscoveryService(
        ProviderRegistry providerRegistry,
        VersionLedgerService versionLedgerService,
        MetadataStore metadataStore,
        ArtifactMetadataExtractor extractor,
        KeyValueStore store,
        RepositorySettings settings,
        Clock clock
    ) {
        this.providerRegistry = providerRegistry;
        this.versionLedgerService = versionLedgerService;
        this.metadataStore = metadataStore;
        this.extractor = extractor;
        this.store = store;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Runs one discovery cycle.
     *
     * <p>A failing provider call aborts the cycle before the ledger is touched. A failing extraction
     * aborts the rest of the cycle; the release stays recorded and the next cycle backfills it.
     *
     * @param providerId provider id
     * @return cycle outcome
     * @throws com.github.alvarosanchez.rpmrepo.exception.NotFoundException when the provider is unknown
     */
    public DiscoveryResult discover(String providerId) {
        Provider provider = providerRegistry.require(providerId);
        LOG.info("Running version check for provider {}", providerId);

        ReleaseDescriptor latest = provider.fetchLatestVersion();
        boolean recorded = versionLedgerService.recordIfNew(providerId, latest);

        List<ReleaseDescriptor> extracted = new ArrayList<>();
        ReleaseDescriptor newRelease = null;
        if (recorded) {
            newRelease = versionLedgerService.latest(providerId).orElse(latest);
            LOG.info("New release {} discovered for {}", newRelease.identityKey(), providerId);
            extractAndStore(providerId, newRelease);
            extracted.add(newRelease);
        } else {
            int limit = settings.extractionsPerRun();
            for (ReleaseDescriptor release : versionLedgerService.all(providerId)) {
                if (extracted.size() >= limit) {
                    break;
                }
                if (!metadataStore.has(providerId, release.key())) {
                    LOG.info("Missing metadata for {}:{}, extracting", providerId, release.identityKey());
                    extractAndStore(providerId, release);
                    extracted.add(release);
                }
            }
        }

        String checkedAt = Long.toString(clock.millis());
        store.put(StoreKeys.lastVersionCheck(providerId), checkedAt.getBytes(StandardCharsets.UTF_8));
        return new DiscoveryResult(providerId, newRelease, extracted);
    }

    /**
     * Extracts the metadata of one release and stores it, replacing any previous record.
     *
     * @param providerId provider id
     * @param release recorded release
     * @return stored metadata
     */
    public ArtifactMetadata extractAndStore(String providerId, ReleaseDescriptor release) {
        ArtifactMetadata metadata = extractor.extract(release.downloadUrl(), release.filename());
        metadataStore.put(providerId, release.key(), metadata);
        return metadata;
    }
}
