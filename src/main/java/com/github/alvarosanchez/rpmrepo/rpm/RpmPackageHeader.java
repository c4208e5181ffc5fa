package com.github.alvarosanchez.rpmrepo.rpm;

import com.github.alvarosanchez.rpmrepo.model.ArtifactMetadata.HeaderDigests;
import com.github.alvarosanchez.rpmrepo.model.Dependency;
import java.util.List;

/**
 * Structured fields read from the header region of an RPM artifact.
 *
 * @param name package name
 * @param version package version
 * @param release package release
 * @param arch architecture
 * @param summary summary
 * @param description description
 * @param vendor vendor
 * @param license license
 * @param packager packager
 * @param group group
 * @param buildHost build host
 * @param url project home page
 * @param os target operating system
 * @param platform target platform
 * @param buildTime build time in epoch seconds
 * @param installedSize installed payload size in bytes
 * @param requires requirements in header order
 * @param headerStart offset of the main header inside the artifact
 * @param headerEnd offset just past the main header
 * @param digests integrity values from the signature and main header
 */
public record RpmPackageHeader(
    String name,
    String version,
    String release,
    String arch,
    String summary,
    String description,
    String vendor,
    String license,
    String packager,
    String group,
    String buildHost,
    String url,
    String os,
    String platform,
    long buildTime,
    long installedSize,
    List<Dependency> requires,
    long headerStart,
    long headerEnd,
    HeaderDigests digests
) {

    public RpmPackageHeader {
        requires = requires == null ? List.of() : List.copyOf(requires);
    }
}
