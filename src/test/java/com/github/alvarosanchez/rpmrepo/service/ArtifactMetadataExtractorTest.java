package com.github.alvarosanchez.rpmrepo.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.github.alvarosanchez.rpmrepo.client.ArtifactHttpClient;
import com.github.alvarosanchez.rpmrepo.client.ArtifactOrigin;
import com.github.alvarosanchez.rpmrepo.config.RepositorySettings;
import com.github.alvarosanchez.rpmrepo.exception.ChecksumIncompleteException;
import com.github.alvarosanchez.rpmrepo.exception.FetchFailedException;
import com.github.alvarosanchez.rpmrepo.exception.ParseFailedException;
import com.github.alvarosanchez.rpmrepo.hash.HashUtil;
import com.github.alvarosanchez.rpmrepo.model.ArtifactMetadata;
import com.github.alvarosanchez.rpmrepo.model.ComparisonFlag;
import com.github.alvarosanchez.rpmrepo.model.Dependency;
import com.github.alvarosanchez.rpmrepo.rpm.RpmFixture;
import com.github.alvarosanchez.rpmrepo.rpm.RpmHeaderParser;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ArtifactMetadataExtractorTest {

    private static final String FILENAME = "tool-1.2.3-abc.el8.x86_64.rpm";

    private ArtifactOrigin origin;
    private RpmFixture.Artifact artifact;
    private Duration fetchTimeout = Duration.ofSeconds(10);

    @BeforeEach
    void setUp() throws IOException {
        byte[] payload = new byte[300_000];
        new Random(42).nextBytes(payload);
        artifact = RpmFixture.rpm("tool", "1.2.3", "abc.el8")
            .summary("A tool")
            .license("MIT")
            .buildTime(1_720_000_000L)
            .longSize(900_000L)
            .require("glibc", "2.28", 12)
            .require("libc.so.6()(64bit)", "", 0x4000)
            .payload(payload)
            .build();
        origin = ArtifactOrigin.start().serving(artifact.bytes());
    }

    @AfterEach
    void tearDown() {
        origin.close();
    }

    @Test
    void checksumCoversFullArtifactContent() {
        ArtifactMetadata metadata = extractor().extract(origin.url("/tool.rpm"), FILENAME);

        assertEquals("sha256", metadata.checksum().type());
        assertEquals(HashUtil.sha256(artifact.bytes()), metadata.checksum().value());
        assertEquals(artifact.bytes().length, metadata.size().packageBytes());
        assertEquals(1, origin.rangeRequests());
        assertEquals(1, origin.fullRequests());
    }

    @Test
    void structuralFieldsComeFromHeaderRegion() {
        ArtifactMetadata metadata = extractor().extract(origin.url("/tool.rpm"), FILENAME);

        assertEquals(ArtifactMetadata.CURRENT_SCHEMA_VERSION, metadata.schemaVersion());
        assertEquals("tool", metadata.name());
        assertEquals("1.2.3", metadata.version());
        assertEquals("abc.el8", metadata.release());
        assertEquals("x86_64", metadata.arch());
        assertEquals("A tool", metadata.summary());
        assertEquals("MIT", metadata.license());
        assertEquals(1_720_000_000L, metadata.buildTime());
        assertEquals(900_000L, metadata.size().installedBytes());
        assertEquals(FILENAME, metadata.filename());
        assertEquals(origin.url("/tool.rpm"), metadata.sourceUrl());
        assertEquals(artifact.headerStart(), metadata.headerRange().start());
        assertEquals(artifact.headerEnd(), metadata.headerRange().end());
        assertEquals(
            List.of(new Dependency("glibc", "2.28", ComparisonFlag.GE), new Dependency("libc.so.6()(64bit)", null, null)),
            metadata.dependencies()
        );
    }

    @Test
    void packageSizeFallsBackToHashedBytesWithoutContentLength() {
        origin.withoutContentLength();

        ArtifactMetadata metadata = extractor().extract(origin.url("/tool.rpm"), FILENAME);

        assertEquals(artifact.bytes().length, metadata.size().packageBytes());
        assertEquals(HashUtil.sha256(artifact.bytes()), metadata.checksum().value());
    }

    @Test
    void originWithoutRangeSupportFailsExtraction() {
        origin.ignoringRange();

        assertThrows(FetchFailedException.class, () -> extractor().extract(origin.url("/tool.rpm"), FILENAME));
    }

    @Test
    void failedFullFetchFailsExtraction() {
        origin.answeringFullFetchWith(503);

        FetchFailedException exception = assertThrows(
            FetchFailedException.class,
            () -> extractor().extract(origin.url("/tool.rpm"), FILENAME)
        );

        assertTrue(exception.getMessage().contains("HTTP 503"));
    }

    @Test
    void truncatedFullContentIsReportedAsIncompleteChecksum() {
        origin.truncatingFullBodyAt(artifact.bytes().length / 2);

        assertThrows(ChecksumIncompleteException.class, () -> extractor().extract(origin.url("/tool.rpm"), FILENAME));
    }

    @Test
    void malformedHeaderRegionFailsParsing() {
        byte[] notAnRpm = new byte[8192];
        origin.serving(notAnRpm);

        assertThrows(ParseFailedException.class, () -> extractor().extract(origin.url("/tool.rpm"), FILENAME));
    }

    @Test
    void slowFullFetchTimesOut() {
        fetchTimeout = Duration.ofSeconds(1);
        origin.delayingFullFetch(5_000);

        FetchFailedException exception = assertThrows(
            FetchFailedException.class,
            () -> extractor().extract(origin.url("/tool.rpm"), FILENAME)
        );

        assertTrue(exception.getMessage().contains("tool.rpm"));
    }

    @Test
    void unreachableOriginFailsFetch() {
        String url = origin.url("/tool.rpm");
        origin.close();

        assertThrows(FetchFailedException.class, () -> extractor().extract(url, FILENAME));
    }

    private ArtifactMetadataExtractor extractor() {
        Duration timeout = fetchTimeout;
        RepositorySettings settings = new RepositorySettings() {
            @Override
            public long headerRangeBytes() {
                return 64 * 1024;
            }

            @Override
            public Duration fetchTimeout() {
                return timeout;
            }
        };
        return new ArtifactMetadataExtractor(new ArtifactHttpClient(settings), new RpmHeaderParser(), settings);
    }
}
