package com.github.alvarosanchez.rpmrepo.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.github.alvarosanchez.rpmrepo.config.RepositorySettings;
import com.github.alvarosanchez.rpmrepo.exception.FetchFailedException;
import com.github.alvarosanchez.rpmrepo.model.ReleaseDescriptor;
import com.github.alvarosanchez.rpmrepo.model.RepoConfig;
import io.micronaut.core.annotation.Nullable;
import io.micronaut.serde.ObjectMapper;
import io.micronaut.serde.annotation.Serdeable;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Provider for the Cursor editor Linux x64 RPM builds.
 *
 * <p>The download API reports the version and commit; the RPM location is the redirect target of
 * the per-minor-version download endpoint.
 */
@Singleton
public final class CursorProvider implements Provider {

    static final String ID = "cursor";
    static final URI DEFAULT_API_URI = URI.create("https://www.cursor.com/api/download?platform=linux-x64&releaseTrack=latest");
    static final String DEFAULT_DOWNLOAD_BASE = "https://api2.cursor.sh/updates/download/golden/linux-x64-rpm/cursor/";
    private static final Pattern RPM_LOCATION_PATTERN = Pattern.compile("cursor-(\\d+\\.\\d+\\.\\d+)\\.el8");
    private static final int RELEASE_LENGTH = 10;

    private final ObjectMapper objectMapper;
    private final RepositorySettings settings;
    private final HttpClient httpClient;
    private final URI apiUri;
    private final String downloadBase;

    @Inject
    CursorProvider(ObjectMapper objectMapper, RepositorySettings settings) {
        this(objectMapper, settings, DEFAULT_API_URI, DEFAULT_DOWNLOAD_BASE);
    }

    CursorProvider(ObjectMapper objectMapper, RepositorySettings settings, URI apiUri, String downloadBase) {
        this.objectMapper = objectMapper;
        this.settings = settings;
        this.apiUri = apiUri;
        this.downloadBase = downloadBase;
        this.httpClient = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NEVER)
            .connectTimeout(settings.fetchTimeout())
            .build();
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public RepoConfig repoConfig() {
        return new RepoConfig(ID, "Cursor IDE Repository", "Cursor IDE RPM packages");
    }

    @Override
    public ReleaseDescriptor fetchLatestVersion() {
        DownloadInfo downloadInfo = fetchDownloadInfo();
        String version = downloadInfo.version();
        String[] versionParts = version.split("\\.");
        if (versionParts.length < 2) {
            throw new FetchFailedException("Unexpected Cursor version `" + version + "`.");
        }
        String rpmUrl = resolveRpmLocation(versionParts[0] + "." + versionParts[1]);

        Matcher matcher = RPM_LOCATION_PATTERN.matcher(rpmUrl);
        if (!matcher.find()) {
            throw new FetchFailedException("Failed to extract version from RPM URL " + rpmUrl);
        }

        String commitSha = downloadInfo.commitSha();
        String release = commitSha.substring(0, Math.min(RELEASE_LENGTH, commitSha.length()));
        return new ReleaseDescriptor(version, release, rpmUrl, "cursor-" + version + "-" + release + ".el8.x86_64.rpm");
    }

    private DownloadInfo fetchDownloadInfo() {
        HttpRequest request = HttpRequest.newBuilder(apiUri)
            .timeout(settings.fetchTimeout())
            .header("User-Agent", "RPM-Repo-Proxy")
            .header("Cache-Control", "no-cache")
            .GET()
            .build();
        HttpResponse<String> response = send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new FetchFailedException("Cursor download API answered HTTP " + response.statusCode());
        }

        DownloadInfo downloadInfo;
        try {
            downloadInfo = objectMapper.readValue(response.body(), DownloadInfo.class);
        } catch (IOException e) {
            throw new FetchFailedException("Failed to parse Cursor download API response", e);
        }
        if (downloadInfo == null || isBlank(downloadInfo.version()) || isBlank(downloadInfo.commitSha())) {
            throw new FetchFailedException("Cursor download API response lacks version or commitSha");
        }
        return downloadInfo;
    }

    private String resolveRpmLocation(String majorMinor) {
        HttpRequest request = HttpRequest.newBuilder(URI.create(downloadBase + majorMinor))
            .timeout(settings.fetchTimeout())
            .method("HEAD", HttpRequest.BodyPublishers.noBody())
            .build();
        HttpResponse<Void> response = send(request, HttpResponse.BodyHandlers.discarding());
        return response.headers()
            .firstValue("location")
            .filter(location -> !location.isBlank())
            .orElseThrow(() -> new FetchFailedException("Failed to get RPM URL from redirect (HTTP " + response.statusCode() + ")"));
    }

    private <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> bodyHandler) {
        try {
            return httpClient.send(request, bodyHandler);
        } catch (IOException e) {
            throw new FetchFailedException("Request to " + request.uri() + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchFailedException("Interrupted while requesting " + request.uri(), e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Subset of the Cursor download API response.
     *
     * @param downloadUrl download page URL
     * @param version released version
     * @param commitSha commit the release was built from
     */
    @Serdeable
    @JsonIgnoreProperties(ignoreUnknown = true)
    record DownloadInfo(@Nullable String downloadUrl, @Nullable String version, @Nullable String commitSha) {
    }
}
