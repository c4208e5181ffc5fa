package com.github.alvarosanchez.rpmrepo.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.micronaut.core.annotation.Nullable;
import io.micronaut.serde.annotation.Serdeable;
import java.time.Instant;

/**
 * One discovered upstream release.
 *
 * @param version dotted upstream version
 * @param release opaque short release identifier
 * @param downloadUrl artifact origin URL
 * @param filename artifact filename published in the repository
 * @param added ISO-8601 discovery time, {@code null} until the release is recorded
 */
@Serdeable
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReleaseDescriptor(
    String version,
    String release,
    @JsonProperty("url") String downloadUrl,
    String filename,
    @Nullable String added
) {

    /**
     * Creates a release descriptor that has not been recorded yet.
     *
     * @param version dotted upstream version
     * @param release opaque short release identifier
     * @param downloadUrl artifact origin URL
     * @param filename artifact filename
     */
    public ReleaseDescriptor(String version, String release, String downloadUrl, String filename) {
        this(version, release, downloadUrl, filename, null);
    }

    /**
     * Returns the version and release of this descriptor.
     *
     * @return release key
     */
    public ReleaseKey key() {
        return new ReleaseKey(version, release);
    }

    /**
     * Returns the identity key, {@code version-release}.
     *
     * @return identity key
     */
    public String identityKey() {
        return version + "-" + release;
    }

    /**
     * Returns a copy stamped with the given discovery time.
     *
     * @param discoveredAt discovery time
     * @return stamped descriptor
     */
    public ReleaseDescriptor discoveredAt(Instant discoveredAt) {
        return new ReleaseDescriptor(version, release, downloadUrl, filename, discoveredAt.toString());
    }
}
