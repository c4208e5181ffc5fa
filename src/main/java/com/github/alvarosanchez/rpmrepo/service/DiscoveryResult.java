package com.github.alvarosanchez.rpmrepo.service;

import com.github.alvarosanchez.rpmrepo.model.ReleaseDescriptor;
import io.micronaut.core.annotation.Nullable;
import java.util.List;

/**
 * Outcome of one discovery cycle of a provider.
 *
 * @param providerId provider id
 * @param newRelease release recorded by this cycle, {@code null} when the upstream had nothing new
 * @param extracted releases whose metadata was extracted and stored by this cycle
 */
public record DiscoveryResult(String providerId, @Nullable ReleaseDescriptor newRelease, List<ReleaseDescriptor> extracted) {

    /**
     * Creates a discovery result.
     */
    public DiscoveryResult {
        extracted = List.copyOf(extracted);
    }

    /**
     * Returns whether the cycle recorded a new release.
     *
     * @return {@code true} when a release was recorded
     */
    public boolean discoveredNewRelease() {
        return newRelease != null;
    }
}
