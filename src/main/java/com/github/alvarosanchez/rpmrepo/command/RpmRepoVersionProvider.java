package com.github.alvarosanchez.rpmrepo.command;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import picocli.CommandLine.IVersionProvider;

/**
 * Provides the CLI version from the packaged version resource.
 */
public final class RpmRepoVersionProvider implements IVersionProvider {

    private static final String VERSION_RESOURCE_PATH = "/META-INF/rpmrepo/version.txt";

    /**
     * Reads and returns the CLI version for Picocli's {@code --version} option.
     *
     * @return a single-item array containing the current project version
     */
    @Override
    public String[] getVersion() {
        try (var inputStream = RpmRepoVersionProvider.class.getResourceAsStream(VERSION_RESOURCE_PATH)) {
            if (inputStream == null) {
                throw new IllegalStateException("Version resource not found: " + VERSION_RESOURCE_PATH);
            }

            String version = new String(inputStream.readAllBytes(), StandardCharsets.UTF_8).trim();
            if (version.isEmpty()) {
                throw new IllegalStateException("Version resource is empty: " + VERSION_RESOURCE_PATH);
            }

            return new String[] {"rpmrepo " + version};
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read version resource: " + VERSION_RESOURCE_PATH, e);
        }
    }
}
