package com.github.alvarosanchez.rpmrepo.model;

/**
 * Version and release pair identifying one published artifact of a provider.
 *
 * @param version dotted upstream version
 * @param release opaque release identifier
 */
public record ReleaseKey(String version, String release) {

    /**
     * Creates a release key.
     *
     * @param version dotted upstream version
     * @param release opaque release identifier
     */
    public ReleaseKey {
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("Release version is required.");
        }
        if (release == null || release.isBlank()) {
            throw new IllegalArgumentException("Release identifier is required.");
        }
    }

    /**
     * Parses a {@code version-release} string. The release is everything after the last dash.
     *
     * @param value text such as {@code 1.7.28-0a1b2c3d4e}
     * @return parsed key
     */
    public static ReleaseKey parse(String value) {
        String trimmed = value == null ? "" : value.trim();
        int separator = trimmed.lastIndexOf('-');
        if (separator <= 0 || separator == trimmed.length() - 1) {
            throw new IllegalArgumentException("Expected <version>-<release> but got `" + trimmed + "`.");
        }
        return new ReleaseKey(trimmed.substring(0, separator), trimmed.substring(separator + 1));
    }

    /**
     * Returns the identity key used for deduplication and storage keys.
     *
     * @return {@code version-release}
     */
    public String identity() {
        return version + "-" + release;
    }

    @Override
    public String toString() {
        return identity();
    }
}
