package com.github.alvarosanchez.rpmrepo.command;

import com.github.alvarosanchez.rpmrepo.model.ReleaseDescriptor;
import com.github.alvarosanchez.rpmrepo.provider.Provider;
import com.github.alvarosanchez.rpmrepo.provider.ProviderRegistry;
import com.github.alvarosanchez.rpmrepo.service.DiscoveryResult;
import com.github.alvarosanchez.rpmrepo.service.DiscoveryService;
import jakarta.inject.Inject;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * Runs the discovery cycle for one or more providers.
 */
@Command(
    name = "discover",
    description = "Check providers for new releases and extract missing metadata.",
    mixinStandardHelpOptions = true
)
public class DiscoverCommand implements Callable<Integer> {

    private final ProviderRegistry providerRegistry;
    private final DiscoveryService discoveryService;

    @Inject
    DiscoverCommand(ProviderRegistry providerRegistry, DiscoveryService discoveryService) {
        this.providerRegistry = providerRegistry;
        this.discoveryService = discoveryService;
    }

    @Parameters(arity = "0..*", description = "Provider ids. All providers when omitted.")
    private List<String> providerIds;

    /**
     * Runs discovery; a failing provider does not stop the remaining ones.
     *
     * @return {@code 0} when every provider succeeded, {@code 1} otherwise
     */
    @Override
    public Integer call() {
        List<String> targets = providerIds == null || providerIds.isEmpty()
            ? providerRegistry.all().stream().map(Provider::id).toList()
            : providerIds;

        boolean failed = false;
        for (String providerId : targets) {
            try {
                report(discoveryService.discover(providerId));
            } catch (RuntimeException e) {
                Cli.error(providerId + ": " + e.getMessage());
                failed = true;
            }
        }
        return failed ? 1 : 0;
    }

    private static void report(DiscoveryResult result) {
        if (result.discoveredNewRelease()) {
            Cli.success(result.providerId() + ": recorded new release " + result.newRelease().identityKey() + ".");
        } else {
            Cli.print(result.providerId() + ": no new release.");
        }
        if (!result.extracted().isEmpty()) {
            Cli.print(
                result.providerId() + ": extracted metadata for "
                    + String.join(", ", result.extracted().stream().map(ReleaseDescriptor::identityKey).toList())
                    + "."
            );
        }
    }
}
