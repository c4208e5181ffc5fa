package com.github.alvarosanchez.rpmrepo.client;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.github.alvarosanchez.rpmrepo.config.RepositorySettings;
import com.github.alvarosanchez.rpmrepo.exception.FetchFailedException;
import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Arrays;
import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ArtifactHttpClientTest {

    private ArtifactOrigin origin;
    private ArtifactHttpClient client;
    private final byte[] artifact = new byte[4096];

    @BeforeEach
    void setUp() throws IOException {
        for (int i = 0; i < artifact.length; i++) {
            artifact[i] = (byte) (i * 31);
        }
        origin = ArtifactOrigin.start().serving(artifact);
        client = new ArtifactHttpClient(new RepositorySettings() {
            @Override
            public Duration fetchTimeout() {
                return Duration.ofSeconds(10);
            }
        });
    }

    @AfterEach
    void tearDown() {
        origin.close();
    }

    @Test
    void rangeFetchReturnsLeadingBytes() throws IOException {
        HttpResponse<InputStream> response = client.fetchRange(origin.url("/tool.rpm"), 100).join();

        assertEquals(206, response.statusCode());
        try (InputStream body = response.body()) {
            assertArrayEquals(Arrays.copyOf(artifact, 100), body.readAllBytes());
        }
    }

    @Test
    void rangeLongerThanArtifactReturnsWholeArtifact() throws IOException {
        HttpResponse<InputStream> response = client.fetchRange(origin.url("/tool.rpm"), 5L * 1024 * 1024).join();

        try (InputStream body = response.body()) {
            assertArrayEquals(artifact, body.readAllBytes());
        }
    }

    @Test
    void rangeFetchFailsWhenOriginIgnoresRange() {
        origin.ignoringRange();

        CompletionException exception = assertThrows(
            CompletionException.class,
            () -> client.fetchRange(origin.url("/tool.rpm"), 100).join()
        );

        FetchFailedException cause = assertInstanceOf(FetchFailedException.class, exception.getCause());
        assertTrue(cause.getMessage().contains("ignored the range request"));
    }

    @Test
    void fullFetchStreamsWholeArtifact() throws IOException {
        HttpResponse<InputStream> response = client.fetchFull(origin.url("/tool.rpm")).join();

        assertEquals(artifact.length, response.headers().firstValueAsLong("Content-Length").orElse(-1));
        try (InputStream body = response.body()) {
            assertArrayEquals(artifact, body.readAllBytes());
        }
    }

    @Test
    void fullFetchFailsOnErrorStatus() {
        origin.answeringFullFetchWith(404);

        CompletionException exception = assertThrows(
            CompletionException.class,
            () -> client.fetchFull(origin.url("/tool.rpm")).join()
        );

        FetchFailedException cause = assertInstanceOf(FetchFailedException.class, exception.getCause());
        assertTrue(cause.getMessage().contains("HTTP 404"));
    }

    @Test
    void invalidUrlFailsImmediately() {
        assertThrows(FetchFailedException.class, () -> client.fetchFull("http://exa mple.com/tool.rpm"));
    }
}
