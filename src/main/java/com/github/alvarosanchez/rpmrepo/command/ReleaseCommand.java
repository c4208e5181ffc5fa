package com.github.alvarosanchez.rpmrepo.command;

import com.github.alvarosanchez.rpmrepo.command.ReleaseTableRenderer.ReleaseRow;
import com.github.alvarosanchez.rpmrepo.exception.NotFoundException;
import com.github.alvarosanchez.rpmrepo.model.ArtifactMetadata;
import com.github.alvarosanchez.rpmrepo.model.Dependency;
import com.github.alvarosanchez.rpmrepo.model.ReleaseDescriptor;
import com.github.alvarosanchez.rpmrepo.model.ReleaseKey;
import com.github.alvarosanchez.rpmrepo.provider.ProviderRegistry;
import com.github.alvarosanchez.rpmrepo.service.DiscoveryService;
import com.github.alvarosanchez.rpmrepo.service.MetadataStore;
import com.github.alvarosanchez.rpmrepo.service.VersionLedgerService;
import jakarta.inject.Inject;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * Command group for recorded releases of a provider.
 */
@Command(
    name = "release",
    description = "Inspect and extract recorded releases.",
    mixinStandardHelpOptions = true,
    subcommands = {
        ReleaseCommand.ListCommand.class,
        ReleaseCommand.ShowCommand.class,
        ReleaseCommand.ExtractCommand.class
    }
)
public class ReleaseCommand implements Runnable {

    /**
     * Prints usage when no subcommand is provided.
     */
    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }

    @Command(name = "list", description = "List recorded releases, newest first.")
    static class ListCommand implements Callable<Integer> {

        private final ProviderRegistry providerRegistry;
        private final VersionLedgerService versionLedgerService;
        private final MetadataStore metadataStore;

        @Inject
        ListCommand(ProviderRegistry providerRegistry, VersionLedgerService versionLedgerService, MetadataStore metadataStore) {
            this.providerRegistry = providerRegistry;
            this.versionLedgerService = versionLedgerService;
            this.metadataStore = metadataStore;
        }

        @Parameters(index = "0", description = "Provider id.")
        private String providerId;

        /**
         * Prints the recorded releases of a provider.
         *
         * @return command exit code
         */
        @Override
        public Integer call() {
            try {
                providerRegistry.require(providerId);
                List<ReleaseDescriptor> releases = versionLedgerService.all(providerId);
                if (releases.isEmpty()) {
                    Cli.warning("No releases recorded for `" + providerId + "` yet. Run `rpmrepo discover " + providerId + "`.");
                    return 0;
                }

                List<ReleaseRow> rows = releases.stream()
                    .map(release -> new ReleaseRow(release, metadataStore.has(providerId, release.key())))
                    .toList();
                ReleaseTableRenderer.print(rows);
                if (rows.stream().anyMatch(row -> !row.hasMetadata())) {
                    Cli.warning("! Some releases have no metadata yet. Run `rpmrepo discover " + providerId + "` to backfill.");
                }
                return 0;
            } catch (RuntimeException e) {
                Cli.error(e.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "show", description = "Show the stored metadata of a release.")
    static class ShowCommand implements Callable<Integer> {

        private static final String ARTIFACT_SUFFIX = ".rpm";

        private final ProviderRegistry providerRegistry;
        private final VersionLedgerService versionLedgerService;
        private final MetadataStore metadataStore;

        @Inject
        ShowCommand(ProviderRegistry providerRegistry, VersionLedgerService versionLedgerService, MetadataStore metadataStore) {
            this.providerRegistry = providerRegistry;
            this.versionLedgerService = versionLedgerService;
            this.metadataStore = metadataStore;
        }

        @Parameters(index = "0", description = "Provider id.")
        private String providerId;

        @Parameters(index = "1", description = "Release as <version>-<release>, or its recorded artifact filename.")
        private String release;

        /**
         * Prints a metadata summary.
         *
         * @return command exit code
         */
        @Override
        public Integer call() {
            try {
                providerRegistry.require(providerId);
                ReleaseKey key = resolveKey();
                ArtifactMetadata metadata = metadataStore.get(providerId, key)
                    .orElseThrow(() -> new NotFoundException("No metadata stored for `" + providerId + "` release `" + key + "`."));
                printMetadata(metadata);
                return 0;
            } catch (RuntimeException e) {
                Cli.error(e.getMessage());
                return 1;
            }
        }

        private ReleaseKey resolveKey() {
            if (!release.endsWith(ARTIFACT_SUFFIX)) {
                return ReleaseKey.parse(release);
            }
            return versionLedgerService.findByFilename(providerId, release)
                .map(ReleaseDescriptor::key)
                .orElseThrow(() -> new NotFoundException("No release of `" + providerId + "` is recorded as `" + release + "`."));
        }

        private static void printMetadata(ArtifactMetadata metadata) {
            field("Name", metadata.name());
            field("Version", metadata.version());
            field("Release", metadata.release());
            field("Architecture", metadata.arch());
            field("Filename", metadata.filename());
            field("Summary", metadata.summary());
            field("License", metadata.license());
            field("Vendor", metadata.vendor());
            field("Build time", Instant.ofEpochSecond(metadata.buildTime()).toString());
            field("Package size", Long.toString(metadata.size().packageBytes()));
            field("Installed size", Long.toString(metadata.size().installedBytes()));
            field("Checksum", metadata.checksum().type() + ":" + metadata.checksum().value());
            field("Source", metadata.sourceUrl());
            field("Requires", Integer.toString(metadata.dependencies().size()));
            for (Dependency dependency : metadata.dependencies()) {
                StringBuilder entry = new StringBuilder("  ").append(dependency.name());
                if (dependency.flag() != null) {
                    entry.append(' ').append(dependency.flag().name());
                }
                if (dependency.version() != null) {
                    entry.append(' ').append(dependency.version());
                }
                Cli.print(entry.toString());
            }
        }

        private static void field(String label, String value) {
            Cli.print(String.format("%-16s%s", label + ":", value == null ? "" : value));
        }
    }

    @Command(name = "extract", description = "Extract and store the metadata of a recorded release.")
    static class ExtractCommand implements Callable<Integer> {

        private final ProviderRegistry providerRegistry;
        private final VersionLedgerService versionLedgerService;
        private final DiscoveryService discoveryService;

        @Inject
        ExtractCommand(
            ProviderRegistry providerRegistry,
            VersionLedgerService versionLedgerService,
            DiscoveryService discoveryService
        ) {
            this.providerRegistry = providerRegistry;
            this.versionLedgerService = versionLedgerService;
            this.discoveryService = discoveryService;
        }

        @Parameters(index = "0", description = "Provider id.")
        private String providerId;

        @Parameters(index = "1", description = "Release as <version>-<release>.")
        private String releaseKey;

        /**
         * Extracts one release, replacing any stored metadata.
         *
         * @return command exit code
         */
        @Override
        public Integer call() {
            try {
                providerRegistry.require(providerId);
                ReleaseKey key = ReleaseKey.parse(releaseKey);
                ReleaseDescriptor release = versionLedgerService.find(providerId, key)
                    .orElseThrow(() -> new NotFoundException("Release `" + key + "` of `" + providerId + "` is not recorded."));
                ArtifactMetadata metadata = discoveryService.extractAndStore(providerId, release);
                Cli.success(
                    "Stored metadata for " + providerId + " " + key + " (" + metadata.checksum().type() + ":"
                        + metadata.checksum().value() + ")."
                );
                return 0;
            } catch (RuntimeException e) {
                Cli.error(e.getMessage());
                return 1;
            }
        }
    }
}
