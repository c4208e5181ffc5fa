package com.github.alvarosanchez.rpmrepo.repodata;

import com.github.alvarosanchez.rpmrepo.hash.HashUtil;
import com.github.alvarosanchez.rpmrepo.model.ArtifactMetadata;
import com.github.alvarosanchez.rpmrepo.model.Dependency;
import jakarta.inject.Singleton;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.zip.GZIPOutputStream;

/**
 * Renders the YUM/DNF repository index documents from stored package metadata.
 *
 * <p>Output is a pure function of the input list. Every timestamp comes from the build time of the
 * first (newest) package, so an unchanged package set always renders byte-identical documents.
 */
@Singleton
public class RepositoryIndexGenerator {

    static final String COMMON_NAMESPACE = "http://linux.duke.edu/metadata/common";
    static final String RPM_NAMESPACE = "http://linux.duke.edu/metadata/rpm";
    static final String FILELISTS_NAMESPACE = "http://linux.duke.edu/metadata/filelists";
    static final String OTHER_NAMESPACE = "http://linux.duke.edu/metadata/other";
    static final String REPO_NAMESPACE = "http://linux.duke.edu/metadata/repo";

    private static final String XML_DECLARATION = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n";

    /**
     * Generates the index documents.
     *
     * @param packages package metadata, newest first
     * @return generated documents
     */
    public RepositoryIndexBundle generate(List<ArtifactMetadata> packages) {
        long revision = packages.isEmpty() ? 0 : packages.get(0).buildTime();

        IndexDocument primary = compress("primary", primaryXml(packages, revision));
        IndexDocument filelists = compress("filelists", filelistsXml(packages));
        IndexDocument other = compress("other", otherXml(packages));
        byte[] repomd = repomdXml(revision, List.of(primary, filelists, other)).getBytes(StandardCharsets.UTF_8);

        return new RepositoryIndexBundle(revision, repomd, primary, filelists, other);
    }

    static String primaryXml(List<ArtifactMetadata> packages, long revision) {
        StringBuilder xml = new StringBuilder(XML_DECLARATION);
        xml.append("<metadata xmlns=\"").append(COMMON_NAMESPACE)
            .append("\" xmlns:rpm=\"").append(RPM_NAMESPACE)
            .append("\" packages=\"").append(packages.size()).append("\">\n");

        for (ArtifactMetadata pkg : packages) {
            String name = escapeXml(pkg.name());
            String arch = escapeXml(pkg.arch());
            String version = escapeXml(pkg.version());
            String release = escapeXml(pkg.release());

            xml.append("  <package type=\"rpm\">\n");
            xml.append("    <name>").append(name).append("</name>\n");
            xml.append("    <arch>").append(arch).append("</arch>\n");
            xml.append("    <version epoch=\"0\" ver=\"").append(version).append("\" rel=\"").append(release).append("\"/>\n");
            xml.append("    <checksum type=\"").append(escapeXml(pkg.checksum().type())).append("\" pkgid=\"YES\">")
                .append(escapeXml(pkg.checksum().value())).append("</checksum>\n");
            xml.append("    <summary>").append(escapeXml(pkg.summary())).append("</summary>\n");
            xml.append("    <description>").append(escapeXml(pkg.description())).append("</description>\n");
            xml.append("    <packager>").append(escapeXml(pkg.packager())).append("</packager>\n");
            xml.append("    <url>").append(escapeXml(pkg.url())).append("</url>\n");
            xml.append("    <time file=\"").append(revision).append("\" build=\"").append(pkg.buildTime()).append("\"/>\n");
            xml.append("    <size package=\"").append(pkg.size().packageBytes())
                .append("\" installed=\"").append(pkg.size().installedBytes())
                .append("\" archive=\"0\"/>\n");
            xml.append("    <location href=\"").append(escapeXml(pkg.filename())).append("\"/>\n");

            xml.append("    <format>\n");
            xml.append("      <rpm:license>").append(escapeXml(pkg.license())).append("</rpm:license>\n");
            xml.append("      <rpm:vendor>").append(escapeXml(pkg.vendor())).append("</rpm:vendor>\n");
            xml.append("      <rpm:group>").append(escapeXml(pkg.group())).append("</rpm:group>\n");
            xml.append("      <rpm:buildhost>").append(escapeXml(pkg.buildHost())).append("</rpm:buildhost>\n");
            appendHeaderRange(xml, pkg.headerRange());

            xml.append("      <rpm:provides>\n");
            appendProvide(xml, name, version, release);
            appendProvide(xml, name + "(" + arch + ")", version, release);
            xml.append("      </rpm:provides>\n");

            if (!pkg.dependencies().isEmpty()) {
                xml.append("      <rpm:requires>\n");
                for (Dependency dependency : pkg.dependencies()) {
                    xml.append("        <rpm:entry name=\"").append(escapeXml(dependency.name())).append('"');
                    if (dependency.flag() != null) {
                        xml.append(" flags=\"").append(dependency.flag().name()).append('"');
                    }
                    if (dependency.version() != null) {
                        xml.append(" ver=\"").append(escapeXml(dependency.version())).append('"');
                    }
                    xml.append("/>\n");
                }
                xml.append("      </rpm:requires>\n");
            }

            xml.append("    </format>\n");
            xml.append("  </package>\n");
        }

        xml.append("</metadata>\n");
        return xml.toString();
    }

    static String filelistsXml(List<ArtifactMetadata> packages) {
        return packageListXml("filelists", FILELISTS_NAMESPACE, packages);
    }

    static String otherXml(List<ArtifactMetadata> packages) {
        return packageListXml("otherdata", OTHER_NAMESPACE, packages);
    }

    static String repomdXml(long revision, List<IndexDocument> documents) {
        StringBuilder xml = new StringBuilder(XML_DECLARATION);
        xml.append("<repomd xmlns=\"").append(REPO_NAMESPACE).append("\" xmlns:rpm=\"").append(RPM_NAMESPACE).append("\">\n");
        xml.append("  <revision>").append(revision).append("</revision>\n");
        for (IndexDocument document : documents) {
            xml.append("  <data type=\"").append(document.type()).append("\">\n");
            xml.append("    <checksum type=\"").append(HashUtil.SHA256_TYPE).append("\">").append(document.checksum()).append("</checksum>\n");
            xml.append("    <open-checksum type=\"").append(HashUtil.SHA256_TYPE).append("\">").append(document.openChecksum()).append("</open-checksum>\n");
            xml.append("    <location href=\"").append(document.location()).append("\"/>\n");
            xml.append("    <timestamp>").append(revision).append("</timestamp>\n");
            xml.append("    <size>").append(document.size()).append("</size>\n");
            xml.append("    <open-size>").append(document.openSize()).append("</open-size>\n");
            xml.append("  </data>\n");
        }
        xml.append("</repomd>\n");
        return xml.toString();
    }

    /**
     * Escapes text for use in XML element content and attribute values. {@code null} renders as empty.
     *
     * @param value raw text
     * @return escaped text
     */
    static String escapeXml(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        StringBuilder escaped = new StringBuilder(value.length() + 16);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '&') {
                escaped.append("&amp;");
            } else if (c == '<') {
                escaped.append("&lt;");
            } else if (c == '>') {
                escaped.append("&gt;");
            } else if (c == '"') {
                escaped.append("&quot;");
            } else if (c == '\'') {
                escaped.append("&apos;");
            } else {
                escaped.append(c);
            }
        }
        return escaped.toString();
    }

    private static String packageListXml(String rootElement, String namespace, List<ArtifactMetadata> packages) {
        StringBuilder xml = new StringBuilder(XML_DECLARATION);
        xml.append('<').append(rootElement).append(" xmlns=\"").append(namespace)
            .append("\" packages=\"").append(packages.size()).append("\">\n");
        for (ArtifactMetadata pkg : packages) {
            xml.append("  <package pkgid=\"").append(escapeXml(pkg.checksum().value()))
                .append("\" name=\"").append(escapeXml(pkg.name()))
                .append("\" arch=\"").append(escapeXml(pkg.arch())).append("\">\n");
            xml.append("    <version epoch=\"0\" ver=\"").append(escapeXml(pkg.version()))
                .append("\" rel=\"").append(escapeXml(pkg.release())).append("\"/>\n");
            xml.append("  </package>\n");
        }
        xml.append("</").append(rootElement).append(">\n");
        return xml.toString();
    }

    private static void appendHeaderRange(StringBuilder xml, ArtifactMetadata.HeaderRange headerRange) {
        long start = headerRange == null ? 0 : headerRange.start();
        long end = headerRange == null ? 0 : headerRange.end();
        xml.append("      <rpm:header-range start=\"").append(start).append("\" end=\"").append(end).append("\"/>\n");
    }

    private static void appendProvide(StringBuilder xml, String escapedName, String escapedVersion, String escapedRelease) {
        xml.append("        <rpm:entry name=\"").append(escapedName)
            .append("\" flags=\"EQ\" epoch=\"0\" ver=\"").append(escapedVersion)
            .append("\" rel=\"").append(escapedRelease).append("\"/>\n");
    }

    private static IndexDocument compress(String type, String document) {
        byte[] xml = document.getBytes(StandardCharsets.UTF_8);
        byte[] gz = gzip(xml);
        return new IndexDocument(
            type,
            "repodata/" + type + ".xml.gz",
            xml,
            gz,
            HashUtil.sha256(gz),
            HashUtil.sha256(xml),
            gz.length,
            xml.length
        );
    }

    private static byte[] gzip(byte[] data) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(Math.max(64, data.length / 4));
        try (GZIPOutputStream gzip = new GZIPOutputStream(buffer)) {
            gzip.write(data);
        } catch (IOException e) {
            // in-memory streams do not fail
            throw new UncheckedIOException(e);
        }
        return buffer.toByteArray();
    }
}
