package com.github.alvarosanchez.rpmrepo.service;

import com.github.alvarosanchez.rpmrepo.exception.NotFoundException;
import com.github.alvarosanchez.rpmrepo.exception.StorageUnavailableException;
import com.github.alvarosanchez.rpmrepo.model.ArtifactMetadata;
import com.github.alvarosanchez.rpmrepo.model.ReleaseDescriptor;
import com.github.alvarosanchez.rpmrepo.model.ReleaseKey;
import com.github.alvarosanchez.rpmrepo.provider.ProviderRegistry;
import com.github.alvarosanchez.rpmrepo.repodata.IndexDocument;
import com.github.alvarosanchez.rpmrepo.repodata.RepositoryIndexBundle;
import com.github.alvarosanchez.rpmrepo.repodata.RepositoryIndexGenerator;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read path of a provider repository: ledger, stored metadata, freshly generated index documents.
 */
@Singleton
public final class RepodataService {

    private static final Logger LOG = LoggerFactory.getLogger(RepodataService.class);

    private final ProviderRegistry providerRegistry;
    private final VersionLedgerService versionLedgerService;
    private final MetadataStore metadataStore;
    private final RepositoryIndexGenerator generator;

    RepodataService(
        ProviderRegistry providerRegistry,
        VersionLedgerService versionLedgerService,
        MetadataStore metadataStore,
        RepositoryIndexGenerator generator
    ) {
        this.providerRegistry = providerRegistry;
        this.versionLedgerService = versionLedgerService;
        this.metadataStore = metadataStore;
        this.generator = generator;
    }

    /**
     * Generates the index documents of a provider repository.
     *
     * @param providerId provider id
     * @return generated documents
     * @throws NotFoundException when the provider is unknown, has no releases, or no release has metadata yet
     */
    public RepositoryIndexBundle generate(String providerId) {
        providerRegistry.require(providerId);
        List<ReleaseDescriptor> releases = versionLedgerService.all(providerId);
        if (releases.isEmpty()) {
            throw new NotFoundException("No versions available for `" + providerId + "`.");
        }

        List<ReleaseKey> keys = releases.stream().map(ReleaseDescriptor::key).toList();
        List<ArtifactMetadata> metadata = metadataStore.getMany(providerId, keys);
        if (metadata.isEmpty()) {
            throw new NotFoundException(
                "Metadata not yet extracted for `" + providerId + "`. Run `rpmrepo discover " + providerId + "` first."
            );
        }
        if (metadata.size() < releases.size()) {
            LOG.info("{} of {} releases of {} have no metadata yet", releases.size() - metadata.size(), releases.size(), providerId);
        }
        return generator.generate(metadata);
    }

    /**
     * Generates the index documents and writes them under {@code outputDir/repodata}.
     *
     * @param providerId provider id
     * @param outputDir repository root directory
     * @return written bundle
     */
    public RepositoryIndexBundle write(String providerId, Path outputDir) {
        RepositoryIndexBundle bundle = generate(providerId);
        try {
            Files.createDirectories(outputDir.resolve("repodata"));
            for (IndexDocument document : bundle.documents()) {
                Files.write(outputDir.resolve(document.location()), document.gz());
            }
            // repomd.xml last so that readers never see it reference missing documents
            Files.write(outputDir.resolve(RepositoryIndexBundle.REPOMD_LOCATION), bundle.repomd());
        } catch (IOException e) {
            throw new StorageUnavailableException("Failed to write repository metadata to " + outputDir, e);
        }
        LOG.info("Wrote repository metadata of {} (revision {}) to {}", providerId, bundle.revision(), outputDir);
        return bundle;
    }
}
