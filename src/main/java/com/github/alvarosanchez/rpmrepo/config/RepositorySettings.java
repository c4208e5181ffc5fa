package com.github.alvarosanchez.rpmrepo.config;

import jakarta.inject.Singleton;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Runtime settings resolved from {@code rpmrepo.*} system properties.
 *
 * <p>Values are read on every call so that a running context picks up property changes.
 */
@Singleton
public class RepositorySettings {

    static final String DATA_DIR_PROPERTY = "rpmrepo.data.dir";
    static final String BASE_URL_PROPERTY = "rpmrepo.base.url";
    static final String HEADER_RANGE_BYTES_PROPERTY = "rpmrepo.header.range.bytes";
    static final String FETCH_TIMEOUT_SECONDS_PROPERTY = "rpmrepo.fetch.timeout.seconds";
    static final String EXTRACTIONS_PER_RUN_PROPERTY = "rpmrepo.extractions.per.run";

    static final String DEFAULT_BASE_URL = "http://localhost:8080";
    static final long DEFAULT_HEADER_RANGE_BYTES = 5L * 1024 * 1024;
    static final long DEFAULT_FETCH_TIMEOUT_SECONDS = 300;
    static final int DEFAULT_EXTRACTIONS_PER_RUN = 1;

    /**
     * Returns the directory holding durable state.
     *
     * @return data directory
     */
    public Path dataDirectory() {
        String configuredPath = System.getProperty(DATA_DIR_PROPERTY);
        if (configuredPath != null && !configuredPath.isBlank()) {
            return Path.of(configuredPath);
        }
        return Path.of(System.getProperty("user.home"), ".local", "share", "rpmrepo");
    }

    /**
     * Returns the public base URL under which provider repositories are served.
     *
     * @return base URL without trailing slash
     */
    public String baseUrl() {
        String configured = System.getProperty(BASE_URL_PROPERTY);
        String baseUrl = configured == null || configured.isBlank() ? DEFAULT_BASE_URL : configured.trim();
        while (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        return baseUrl;
    }

    /**
     * Returns how many leading bytes are fetched to parse artifact headers.
     *
     * @return header range size in bytes
     */
    public long headerRangeBytes() {
        return positiveLong(HEADER_RANGE_BYTES_PROPERTY, DEFAULT_HEADER_RANGE_BYTES);
    }

    /**
     * Returns the wall-clock ceiling of one extraction or provider call.
     *
     * @return fetch timeout
     */
    public Duration fetchTimeout() {
        return Duration.ofSeconds(positiveLong(FETCH_TIMEOUT_SECONDS_PROPERTY, DEFAULT_FETCH_TIMEOUT_SECONDS));
    }

    /**
     * Returns how many extractions a single discovery cycle may run.
     *
     * @return extraction limit per cycle
     */
    public int extractionsPerRun() {
        return (int) Math.min(Integer.MAX_VALUE, positiveLong(EXTRACTIONS_PER_RUN_PROPERTY, DEFAULT_EXTRACTIONS_PER_RUN));
    }

    private static long positiveLong(String property, long defaultValue) {
        String value = System.getProperty(property);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            long parsed = Long.parseLong(value.trim());
            return parsed > 0 ? parsed : defaultValue;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }
}
