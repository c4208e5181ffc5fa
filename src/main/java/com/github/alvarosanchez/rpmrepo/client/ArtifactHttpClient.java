package com.github.alvarosanchez.rpmrepo.client;

import com.github.alvarosanchez.rpmrepo.config.RepositorySettings;
import com.github.alvarosanchez.rpmrepo.exception.FetchFailedException;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues the two fetches artifact extraction needs against an origin: a bounded range fetch and a
 * full unconditional fetch. Both return as soon as response headers arrive; bodies are streamed.
 *
 * <p>Redirects are followed, as artifact origins commonly redirect to a CDN.
 */
@Singleton
public class ArtifactHttpClient {

    private static final Logger LOG = LoggerFactory.getLogger(ArtifactHttpClient.class);

    static final int PARTIAL_CONTENT = 206;
    private static final String USER_AGENT = "rpmrepo";

    private final HttpClient httpClient;
    private final RepositorySettings settings;

    /**
     * Creates a client whose connect and request timeouts follow the configured fetch timeout.
     *
     * @param settings runtime settings
     */
    public ArtifactHttpClient(RepositorySettings settings) {
        this.settings = settings;
        this.httpClient = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(settings.fetchTimeout())
            .build();
    }

    /**
     * Starts a fetch of the first {@code length} bytes. The origin must answer with partial content.
     *
     * @param url artifact URL
     * @param length number of leading bytes to request
     * @return future response whose body streams the requested range
     */
    public CompletableFuture<HttpResponse<InputStream>> fetchRange(String url, long length) {
        HttpRequest request = requestBuilder(url)
            .header("Range", "bytes=0-" + (length - 1))
            .GET()
            .build();
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofInputStream())
            .thenApply(response -> {
                if (response.statusCode() == PARTIAL_CONTENT) {
                    return response;
                }
                closeQuietly(response);
                if (isSuccess(response.statusCode())) {
                    throw new FetchFailedException("Origin ignored the range request for " + url + " (HTTP " + response.statusCode() + ")");
                }
                throw new FetchFailedException("Failed to fetch artifact headers from " + url + ": HTTP " + response.statusCode());
            });
    }

    /**
     * Starts a full fetch of the artifact.
     *
     * @param url artifact URL
     * @return future response whose body streams the whole artifact
     */
    public CompletableFuture<HttpResponse<InputStream>> fetchFull(String url) {
        HttpRequest request = requestBuilder(url).GET().build();
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofInputStream())
            .thenApply(response -> {
                if (isSuccess(response.statusCode())) {
                    return response;
                }
                closeQuietly(response);
                throw new FetchFailedException("Failed to fetch artifact from " + url + ": HTTP " + response.statusCode());
            });
    }

    private HttpRequest.Builder requestBuilder(String url) {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new FetchFailedException("Invalid artifact URL: " + url, e);
        }
        return HttpRequest.newBuilder(uri)
            .timeout(settings.fetchTimeout())
            .header("User-Agent", USER_AGENT);
    }

    static boolean isSuccess(int status) {
        return status >= 200 && status < 300;
    }

    private static void closeQuietly(HttpResponse<InputStream> response) {
        try {
            response.body().close();
        } catch (IOException e) {
            LOG.debug("Failed to close discarded response body from {}", response.uri(), e);
        }
    }
}
