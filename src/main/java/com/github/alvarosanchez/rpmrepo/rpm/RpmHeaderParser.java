package com.github.alvarosanchez.rpmrepo.rpm;

import com.github.alvarosanchez.rpmrepo.exception.ParseFailedException;
import com.github.alvarosanchez.rpmrepo.hash.HashUtil;
import com.github.alvarosanchez.rpmrepo.model.ArtifactMetadata.HeaderDigests;
import com.github.alvarosanchez.rpmrepo.model.Dependency;
import jakarta.inject.Singleton;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads the lead, signature and main header of an RPM artifact from the start of a stream.
 *
 * <p>Only the header region is consumed; the payload is never read. When the signature carries
 * SHA-1 or SHA-256 header digests they are checked against the header bytes.
 */
@Singleton
public class RpmHeaderParser {

    static final int LEAD_SIZE = 96;

    private static final int LEAD_MAGIC = 0xEDABEEDB;
    private static final int MAX_INDEX_ENTRIES = 1 << 16;
    private static final long DEFAULT_HEADER_LIMIT = 5L * 1024 * 1024;
    private static final Map<Long, String> PAYLOAD_DIGEST_ALGORITHMS = Map.of(
        1L, "md5",
        2L, "sha1",
        8L, "sha256",
        9L, "sha384",
        10L, "sha512",
        11L, "sha224"
    );

    /**
     * Parses the header region, accepting headers that end within the first 5 MiB.
     *
     * @param input stream positioned at the first byte of the artifact
     * @return structured header fields
     * @throws IOException when the stream fails for reasons other than ending early
     */
    public RpmPackageHeader parse(InputStream input) throws IOException {
        return parse(input, DEFAULT_HEADER_LIMIT);
    }

    /**
     * Parses the header region.
     *
     * <p>Section sizes are checked against {@code limit} before any section buffer is allocated,
     * so a header that declares more bytes than the fetched range fails without reading further.
     *
     * @param input stream positioned at the first byte of the artifact
     * @param limit number of bytes the lead, signature and main header may span together
     * @return structured header fields
     * @throws IOException when the stream fails for reasons other than ending early
     */
    public RpmPackageHeader parse(InputStream input, long limit) throws IOException {
        DataInputStream in = new DataInputStream(input);
        try {
            byte[] lead = new byte[LEAD_SIZE];
            in.readFully(lead);
            if (ByteBuffer.wrap(lead).getInt() != LEAD_MAGIC) {
                throw new ParseFailedException("Not an RPM artifact: bad lead magic");
            }

            byte[] signatureSection = readSection(in, "signature", limit - LEAD_SIZE);
            int padding = (8 - signatureSection.length % 8) % 8;
            in.readFully(new byte[padding]);

            long headerStart = (long) LEAD_SIZE + signatureSection.length + padding;
            byte[] headerSection = readSection(in, "main", limit - headerStart);
            long headerEnd = headerStart + headerSection.length;

            RpmHeader signature = RpmHeader.parse(signatureSection);
            verifyHeaderDigests(signature, headerSection);
            RpmHeader header = RpmHeader.parse(headerSection);
            return toPackageHeader(signature, header, headerStart, headerEnd);
        } catch (EOFException e) {
            throw new ParseFailedException("Artifact header region ended before the headers were complete", e);
        }
    }

    private static byte[] readSection(DataInputStream in, String name, long remaining) throws IOException {
        byte[] intro = new byte[RpmHeader.INTRO_SIZE];
        in.readFully(intro);
        if ((intro[0] & 0xFF) != 0x8E || (intro[1] & 0xFF) != 0xAD || (intro[2] & 0xFF) != 0xE8) {
            throw new ParseFailedException("Bad magic in " + name + " header");
        }

        ByteBuffer buffer = ByteBuffer.wrap(intro);
        int indexCount = buffer.getInt(8);
        int storeLength = buffer.getInt(12);
        if (indexCount < 0 || indexCount > MAX_INDEX_ENTRIES || storeLength < 0) {
            throw new ParseFailedException(
                "Implausible " + name + " header size: " + indexCount + " entries, " + storeLength + " bytes"
            );
        }

        long sectionLength = RpmHeader.INTRO_SIZE + (long) indexCount * RpmHeader.INDEX_ENTRY_SIZE + storeLength;
        if (sectionLength > remaining) {
            throw new ParseFailedException(
                "The " + name + " header declares " + sectionLength + " bytes but only " + Math.max(remaining, 0)
                    + " remain in the header range"
            );
        }

        byte[] section = new byte[(int) sectionLength];
        System.arraycopy(intro, 0, section, 0, intro.length);
        in.readFully(section, intro.length, section.length - intro.length);
        return section;
    }

    private static void verifyHeaderDigests(RpmHeader signature, byte[] headerSection) {
        signature.string(RpmTags.SIG_SHA256).ifPresent(expected -> {
            if (!expected.equalsIgnoreCase(HashUtil.sha256(headerSection))) {
                throw new ParseFailedException("Main header does not match its SHA-256 signature digest");
            }
        });
        signature.string(RpmTags.SIG_SHA1).ifPresent(expected -> {
            if (!expected.equalsIgnoreCase(HashUtil.sha1(headerSection))) {
                throw new ParseFailedException("Main header does not match its SHA-1 signature digest");
            }
        });
    }

    private static RpmPackageHeader toPackageHeader(RpmHeader signature, RpmHeader header, long headerStart, long headerEnd) {
        long installedSize = header.integer(RpmTags.LONG_SIZE).orElse(header.integer(RpmTags.SIZE).orElse(0));
        HeaderDigests digests = new HeaderDigests(
            signature.binary(RpmTags.SIG_MD5).map(HashUtil::hex).orElse(null),
            signature.string(RpmTags.SIG_SHA1).orElse(null),
            signature.string(RpmTags.SIG_SHA256).orElse(null),
            header.string(RpmTags.PAYLOAD_DIGEST).orElse(null),
            payloadDigestAlgorithm(header)
        );

        return new RpmPackageHeader(
            required(header, RpmTags.NAME, "NAME"),
            required(header, RpmTags.VERSION, "VERSION"),
            required(header, RpmTags.RELEASE, "RELEASE"),
            required(header, RpmTags.ARCH, "ARCH"),
            header.string(RpmTags.SUMMARY).orElse(null),
            header.string(RpmTags.DESCRIPTION).orElse(null),
            header.string(RpmTags.VENDOR).orElse(null),
            header.string(RpmTags.LICENSE).orElse(null),
            header.string(RpmTags.PACKAGER).orElse(null),
            header.string(RpmTags.GROUP).orElse(null),
            header.string(RpmTags.BUILD_HOST).orElse(null),
            header.string(RpmTags.URL).orElse(null),
            header.string(RpmTags.OS).orElse(null),
            header.string(RpmTags.PLATFORM).orElse(null),
            header.integer(RpmTags.BUILD_TIME).orElse(0),
            installedSize,
            requires(header),
            headerStart,
            headerEnd,
            digests
        );
    }

    private static List<Dependency> requires(RpmHeader header) {
        List<String> names = header.strings(RpmTags.REQUIRE_NAME);
        List<String> versions = header.strings(RpmTags.REQUIRE_VERSION);
        long[] flags = header.integers(RpmTags.REQUIRE_FLAGS);

        List<Dependency> dependencies = new ArrayList<>(names.size());
        for (int i = 0; i < names.size(); i++) {
            String version = i < versions.size() ? versions.get(i) : "";
            long senseFlags = i < flags.length ? flags[i] : 0;
            dependencies.add(Dependency.fromHeader(names.get(i), version, senseFlags));
        }
        return dependencies;
    }

    private static String payloadDigestAlgorithm(RpmHeader header) {
        if (!header.has(RpmTags.PAYLOAD_DIGEST_ALGO)) {
            return null;
        }
        long algorithm = header.integer(RpmTags.PAYLOAD_DIGEST_ALGO).orElse(0);
        return PAYLOAD_DIGEST_ALGORITHMS.getOrDefault(algorithm, Long.toString(algorithm));
    }

    private static String required(RpmHeader header, int tag, String tagName) {
        return header.string(tag)
            .filter(value -> !value.isBlank())
            .orElseThrow(() -> new ParseFailedException("Main header has no " + tagName + " tag"));
    }
}
