package com.github.alvarosanchez.rpmrepo.command;

import com.github.alvarosanchez.rpmrepo.config.RepositorySettings;
import com.github.alvarosanchez.rpmrepo.model.RepoConfig;
import com.github.alvarosanchez.rpmrepo.provider.Provider;
import com.github.alvarosanchez.rpmrepo.provider.ProviderRegistry;
import com.github.alvarosanchez.rpmrepo.repodata.RepoFileRenderer;
import jakarta.inject.Inject;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Command group for provider catalogue operations.
 */
@Command(
    name = "provider",
    description = "Inspect the configured release providers.",
    mixinStandardHelpOptions = true,
    subcommands = {
        ProviderCommand.ListCommand.class,
        ProviderCommand.RepoFileCommand.class
    }
)
public class ProviderCommand implements Runnable {

    /**
     * Prints usage when no subcommand is provided.
     */
    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }

    @Command(name = "list", description = "List providers with their install instructions.")
    static class ListCommand implements Callable<Integer> {

        private final ProviderRegistry providerRegistry;
        private final RepositorySettings settings;

        @Inject
        ListCommand(ProviderRegistry providerRegistry, RepositorySettings settings) {
            this.providerRegistry = providerRegistry;
            this.settings = settings;
        }

        /**
         * Prints the provider catalogue.
         *
         * @return command exit code
         */
        @Override
        public Integer call() {
            try {
                List<Provider> providers = providerRegistry.all();
                if (providers.isEmpty()) {
                    Cli.warning("No providers are configured.");
                    return 0;
                }

                String baseUrl = settings.baseUrl();
                for (int i = 0; i < providers.size(); i++) {
                    RepoConfig repoConfig = providers.get(i).repoConfig();
                    if (i > 0) {
                        Cli.print("");
                    }
                    Cli.info(providers.get(i).id() + " - " + repoConfig.displayName());
                    Cli.print("  " + repoConfig.description());
                    for (String hint : RepoFileRenderer.installHint(repoConfig, baseUrl).split("\n")) {
                        Cli.print("  $ " + hint);
                    }
                }
                return 0;
            } catch (RuntimeException e) {
                Cli.error(e.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "repo-file", description = "Print the yum .repo file of a provider repository.")
    static class RepoFileCommand implements Callable<Integer> {

        private final ProviderRegistry providerRegistry;
        private final RepositorySettings settings;

        @Inject
        RepoFileCommand(ProviderRegistry providerRegistry, RepositorySettings settings) {
            this.providerRegistry = providerRegistry;
            this.settings = settings;
        }

        @Parameters(index = "0", description = "Provider id.")
        private String providerId;

        @Option(names = "--base-url", description = "Public base URL of the repositories. Defaults to rpmrepo.base.url.")
        private String baseUrl;

        /**
         * Prints the {@code .repo} file.
         *
         * @return command exit code
         */
        @Override
        public Integer call() {
            try {
                Provider provider = providerRegistry.require(providerId);
                String resolvedBaseUrl = baseUrl == null || baseUrl.isBlank() ? settings.baseUrl() : stripTrailingSlash(baseUrl.trim());
                System.out.print(RepoFileRenderer.render(provider.repoConfig(), resolvedBaseUrl));
                return 0;
            } catch (RuntimeException e) {
                Cli.error(e.getMessage());
                return 1;
            }
        }

        private static String stripTrailingSlash(String value) {
            String stripped = value;
            while (stripped.endsWith("/")) {
                stripped = stripped.substring(0, stripped.length() - 1);
            }
            return stripped;
        }
    }
}
