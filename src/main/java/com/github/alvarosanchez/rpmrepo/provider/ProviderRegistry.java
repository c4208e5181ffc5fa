package com.github.alvarosanchez.rpmrepo.provider;

import com.github.alvarosanchez.rpmrepo.exception.NotFoundException;
import jakarta.inject.Singleton;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Lookup of the configured providers by id.
 */
@Singleton
public final class ProviderRegistry {

    private final Map<String, Provider> providersById;

    /**
     * Creates a registry over the given providers.
     *
     * @param providers available providers
     */
    public ProviderRegistry(List<Provider> providers) {
        Map<String, Provider> byId = new TreeMap<>();
        for (Provider provider : providers) {
            Provider previous = byId.putIfAbsent(provider.id(), provider);
            if (previous != null) {
                throw new IllegalStateException("Duplicate provider id `" + provider.id() + "`.");
            }
        }
        this.providersById = Collections.unmodifiableMap(byId);
    }

    /**
     * Finds a provider.
     *
     * @param providerId provider id
     * @return provider, or empty when unknown
     */
    public Optional<Provider> find(String providerId) {
        return Optional.ofNullable(providersById.get(providerId));
    }

    /**
     * Returns a provider or fails.
     *
     * @param providerId provider id
     * @return provider
     * @throws NotFoundException when no provider has this id
     */
    public Provider require(String providerId) {
        return find(providerId).orElseThrow(() -> new NotFoundException("Provider `" + providerId + "` not found."));
    }

    /**
     * Returns all providers ordered by id.
     *
     * @return providers
     */
    public List<Provider> all() {
        return List.copyOf(providersById.values());
    }
}
