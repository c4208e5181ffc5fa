package com.github.alvarosanchez.rpmrepo.service;

import com.github.alvarosanchez.rpmrepo.client.ArtifactHttpClient;
import com.github.alvarosanchez.rpmrepo.config.RepositorySettings;
import com.github.alvarosanchez.rpmrepo.exception.ChecksumIncompleteException;
import com.github.alvarosanchez.rpmrepo.exception.FetchFailedException;
import com.github.alvarosanchez.rpmrepo.exception.RpmRepoException;
import com.github.alvarosanchez.rpmrepo.hash.HashUtil;
import com.github.alvarosanchez.rpmrepo.model.ArtifactMetadata;
import com.github.alvarosanchez.rpmrepo.model.ArtifactMetadata.Checksum;
import com.github.alvarosanchez.rpmrepo.model.ArtifactMetadata.HeaderRange;
import com.github.alvarosanchez.rpmrepo.model.ArtifactMetadata.PackageSize;
import com.github.alvarosanchez.rpmrepo.rpm.RpmHeaderParser;
import com.github.alvarosanchez.rpmrepo.rpm.RpmPackageHeader;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpResponse;
import java.security.MessageDigest;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives {@link ArtifactMetadata} for an RPM artifact at a URL without holding the artifact in memory.
 *
 * <p>The artifact is fetched twice, concurrently: a range fetch of the leading bytes feeds the header
 * parser, and a full fetch feeds a SHA-256 accumulator one chunk at a time. Splitting one download
 * between both consumers would buffer whatever the slower consumer has not read yet, which is unbounded
 * for artifacts of hundreds of megabytes.
 *
 * <p>Extraction is all-or-nothing: the first failure of either fetch aborts the other and is reported.
 */
@Singleton
public final class ArtifactMetadataExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(ArtifactMetadataExtractor.class);
    private static final int CHUNK_SIZE = 64 * 1024;

    private final ArtifactHttpClient httpClient;
    private final RpmHeaderParser headerParser;
    private final RepositorySettings settings;

    /**
     * Creates an extractor.
     *
     * @param httpClient artifact origin client
     * @param headerParser header region parser
     * @param settings runtime settings
     */
    public ArtifactMetadataExtractor(ArtifactHttpClient httpClient, RpmHeaderParser headerParser, RepositorySettings settings) {
        this.httpClient = httpClient;
        this.headerParser = headerParser;
        this.settings = settings;
    }

    /**
     * Extracts metadata of the artifact at {@code downloadUrl}.
     *
     * @param downloadUrl artifact origin URL
     * @param filename filename the artifact is published under
     * @return verified metadata
     * @throws FetchFailedException when a fetch fails, answers a non-success status or exceeds the timeout
     * @throws com.github.alvarosanchez.rpmrepo.exception.ParseFailedException when the header region is malformed
     * @throws ChecksumIncompleteException when the full-content stream ends early
     */
    public ArtifactMetadata extract(String downloadUrl, String filename) {
        LOG.info("Extracting metadata from {}", downloadUrl);
        List<InputStream> openBodies = new CopyOnWriteArrayList<>();
        AtomicReference<Throwable> firstFailure = new AtomicReference<>();

        CompletableFuture<RpmPackageHeader> header = httpClient.fetchRange(downloadUrl, settings.headerRangeBytes())
            .thenApply(response -> parseHeader(downloadUrl, track(response, openBodies, firstFailure)));
        CompletableFuture<ContentDigest> content = httpClient.fetchFull(downloadUrl)
            .thenApply(response -> digestContent(downloadUrl, track(response, openBodies, firstFailure)));

        header.whenComplete((result, failure) -> abortOnFailure(failure, openBodies, firstFailure));
        content.whenComplete((result, failure) -> abortOnFailure(failure, openBodies, firstFailure));

        Duration timeout = settings.fetchTimeout();
        try {
            CompletableFuture.allOf(header, content).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable failure = firstFailure.get();
            throw translate(downloadUrl, failure != null ? failure : e.getCause());
        } catch (TimeoutException e) {
            closeAll(openBodies);
            header.cancel(true);
            content.cancel(true);
            throw new FetchFailedException(
                "Extraction from " + downloadUrl + " exceeded " + timeout.toSeconds() + " seconds",
                e
            );
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            closeAll(openBodies);
            throw new FetchFailedException("Interrupted while extracting " + downloadUrl, e);
        }

        RpmPackageHeader packageHeader = header.join();
        ContentDigest contentDigest = content.join();
        LOG.info(
            "Extracted {}-{}-{}.{} ({} bytes, sha256 {})",
            packageHeader.name(),
            packageHeader.version(),
            packageHeader.release(),
            packageHeader.arch(),
            contentDigest.size(),
            contentDigest.sha256()
        );
        return toMetadata(packageHeader, contentDigest, downloadUrl, filename);
    }

    private RpmPackageHeader parseHeader(String url, HttpResponse<InputStream> response) {
        try (InputStream body = response.body()) {
            return headerParser.parse(body, settings.headerRangeBytes());
        } catch (IOException e) {
            throw new FetchFailedException("Failed to read artifact headers from " + url, e);
        }
    }

    private static ContentDigest digestContent(String url, HttpResponse<InputStream> response) {
        long declaredLength = response.headers().firstValueAsLong("Content-Length").orElse(-1);
        MessageDigest digest = HashUtil.newSha256();
        long bytesRead = 0;
        try (InputStream body = response.body()) {
            byte[] chunk = new byte[CHUNK_SIZE];
            int read;
            while ((read = body.read(chunk)) != -1) {
                digest.update(chunk, 0, read);
                bytesRead += read;
            }
        } catch (IOException e) {
            throw new ChecksumIncompleteException(
                "Artifact stream from " + url + " failed after " + bytesRead + " bytes",
                e
            );
        }
        if (declaredLength >= 0 && bytesRead != declaredLength) {
            throw new ChecksumIncompleteException(
                "Artifact stream from " + url + " ended after " + bytesRead + " of " + declaredLength + " bytes"
            );
        }
        return new ContentDigest(HashUtil.hex(digest.digest()), declaredLength >= 0 ? declaredLength : bytesRead);
    }

    private static HttpResponse<InputStream> track(
        HttpResponse<InputStream> response,
        List<InputStream> openBodies,
        AtomicReference<Throwable> firstFailure
    ) {
        openBodies.add(response.body());
        if (firstFailure.get() != null) {
            closeAll(openBodies);
            throw new CancellationException("Extraction already failed");
        }
        return response;
    }

    private static void abortOnFailure(Throwable failure, List<InputStream> openBodies, AtomicReference<Throwable> firstFailure) {
        if (failure != null && firstFailure.compareAndSet(null, failure)) {
            closeAll(openBodies);
        }
    }

    private static void closeAll(List<InputStream> bodies) {
        for (InputStream body : bodies) {
            try {
                body.close();
            } catch (IOException e) {
                LOG.debug("Failed to close artifact stream", e);
            }
        }
    }

    private static RuntimeException translate(String url, Throwable failure) {
        Throwable cause = failure;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof RpmRepoException) {
            return (RpmRepoException) cause;
        }
        return new FetchFailedException("Failed to fetch " + url + ": " + cause, cause);
    }

    private static ArtifactMetadata toMetadata(
        RpmPackageHeader header,
        ContentDigest contentDigest,
        String downloadUrl,
        String filename
    ) {
        return new ArtifactMetadata(
            ArtifactMetadata.CURRENT_SCHEMA_VERSION,
            header.name(),
            header.version(),
            header.release(),
            header.arch(),
            header.summary(),
            header.description(),
            header.vendor(),
            header.license(),
            header.packager(),
            header.group(),
            header.buildHost(),
            header.url(),
            header.os(),
            header.platform(),
            filename,
            downloadUrl,
            new PackageSize(contentDigest.size(), header.installedSize()),
            new Checksum(HashUtil.SHA256_TYPE, contentDigest.sha256()),
            header.buildTime(),
            new HeaderRange(header.headerStart(), header.headerEnd()),
            header.requires(),
            header.digests()
        );
    }

    private record ContentDigest(String sha256, long size) {
    }
}
