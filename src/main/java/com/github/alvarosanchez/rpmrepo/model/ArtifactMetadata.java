package com.github.alvarosanchez.rpmrepo.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.micronaut.core.annotation.Nullable;
import io.micronaut.serde.annotation.Serdeable;
import java.util.List;

/**
 * Verified package metadata of one release, persisted once per {@code provider:version-release}.
 *
 * @param schemaVersion persisted record schema version
 * @param name package name
 * @param version package version
 * @param release package release
 * @param arch package architecture
 * @param summary one-line summary
 * @param description long description
 * @param vendor vendor
 * @param license license
 * @param packager packager
 * @param group package group
 * @param buildHost host the package was built on
 * @param url project home page
 * @param os target operating system
 * @param platform target platform
 * @param filename artifact filename published in the repository
 * @param sourceUrl artifact origin URL the metadata was extracted from
 * @param size package and installed sizes
 * @param checksum checksum over the full artifact content
 * @param buildTime build time in epoch seconds
 * @param headerRange byte range of the main header inside the artifact
 * @param dependencies requirements in header order
 * @param digest integrity fields read from the artifact headers
 */
@Serdeable
@JsonIgnoreProperties(ignoreUnknown = true)
public record ArtifactMetadata(
    int schemaVersion,
    String name,
    String version,
    String release,
    String arch,
    @Nullable String summary,
    @Nullable String description,
    @Nullable String vendor,
    @Nullable String license,
    @Nullable String packager,
    @Nullable String group,
    @Nullable String buildHost,
    @Nullable String url,
    @Nullable String os,
    @Nullable String platform,
    String filename,
    @Nullable String sourceUrl,
    PackageSize size,
    Checksum checksum,
    long buildTime,
    @Nullable HeaderRange headerRange,
    @Nullable List<Dependency> dependencies,
    @Nullable HeaderDigests digest
) {

    /**
     * Schema version written by this build.
     */
    public static final int CURRENT_SCHEMA_VERSION = 1;

    /**
     * Creates artifact metadata.
     */
    public ArtifactMetadata {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    /**
     * Package sizes in bytes.
     *
     * @param packageBytes size of the artifact as transferred
     * @param installedBytes size of the installed payload
     */
    @Serdeable
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PackageSize(@JsonProperty("package") long packageBytes, @JsonProperty("installed") long installedBytes) {
    }

    /**
     * Content checksum.
     *
     * @param type checksum algorithm as named in repository metadata, e.g. {@code sha256}
     * @param value lowercase hex digest
     */
    @Serdeable
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Checksum(String type, String value) {
    }

    /**
     * Byte offsets of the main header section inside the artifact.
     *
     * @param start offset of the first header byte
     * @param end offset just past the last header byte
     */
    @Serdeable
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record HeaderRange(long start, long end) {
    }

    /**
     * Integrity values carried inside the artifact, kept for cross-validation.
     *
     * @param md5 header and payload MD5 from the signature, hex
     * @param sha1 header SHA-1 from the signature
     * @param sha256 header SHA-256 from the signature
     * @param payloadDigest payload digest from the main header
     * @param payloadDigestAlgorithm algorithm of {@code payloadDigest}
     */
    @Serdeable
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record HeaderDigests(
        @Nullable String md5,
        @Nullable String sha1,
        @Nullable String sha256,
        @Nullable String payloadDigest,
        @Nullable String payloadDigestAlgorithm
    ) {
    }
}
