package com.github.alvarosanchez.rpmrepo.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.micronaut.core.annotation.Nullable;
import io.micronaut.serde.annotation.Serdeable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Per-provider ordered list of recorded releases, newest first.
 *
 * @param versions recorded releases in insertion order, newest first
 * @param updated ISO-8601 time of the last recording, {@code null} for an empty ledger
 */
@Serdeable
@JsonIgnoreProperties(ignoreUnknown = true)
public record VersionLedger(@Nullable List<ReleaseDescriptor> versions, @Nullable String updated) {

    /**
     * Creates a ledger.
     *
     * @param versions recorded releases
     * @param updated last update time
     */
    public VersionLedger {
        versions = versions == null ? List.of() : List.copyOf(versions);
    }

    /**
     * Returns an empty ledger.
     *
     * @return ledger with no releases
     */
    public static VersionLedger empty() {
        return new VersionLedger(List.of(), null);
    }

    /**
     * Returns whether a release with the same identity key is recorded.
     *
     * @param identityKey {@code version-release}
     * @return {@code true} when present
     */
    public boolean contains(String identityKey) {
        for (ReleaseDescriptor descriptor : versions) {
            if (descriptor.identityKey().equals(identityKey)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the newest release.
     *
     * @return front of the ledger, or empty
     */
    public Optional<ReleaseDescriptor> latest() {
        return versions.isEmpty() ? Optional.empty() : Optional.of(versions.get(0));
    }

    /**
     * Returns a new ledger with the release stamped and placed in front.
     *
     * @param candidate release to record
     * @param now discovery time
     * @return updated ledger
     */
    public VersionLedger prepend(ReleaseDescriptor candidate, Instant now) {
        List<ReleaseDescriptor> next = new ArrayList<>(versions.size() + 1);
        next.add(candidate.discoveredAt(now));
        next.addAll(versions);
        return new VersionLedger(next, now.toString());
    }

    /**
     * Returns the number of recorded releases.
     *
     * @return ledger length
     */
    public int size() {
        return versions.size();
    }
}
