package com.github.alvarosanchez.rpmrepo.command;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.micronaut.configuration.picocli.PicocliRunner;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ProviderCommandTest {

    @TempDir
    Path tempDir;

    private String previousDataDir;
    private String previousBaseUrl;

    @BeforeEach
    void setUp() {
        previousDataDir = System.getProperty("rpmrepo.data.dir");
        previousBaseUrl = System.getProperty("rpmrepo.base.url");
        System.setProperty("rpmrepo.data.dir", tempDir.toString());
        System.setProperty("rpmrepo.base.url", "https://rpm.example.com/");
    }

    @AfterEach
    void tearDown() {
        restore("rpmrepo.data.dir", previousDataDir);
        restore("rpmrepo.base.url", previousBaseUrl);
    }

    @Test
    void listShowsCatalogueWithInstallHints() {
        CommandResult result = execute("provider", "list");

        assertEquals(0, result.exitCode());
        assertTrue(result.stdout().contains("cursor - Cursor IDE Repository"));
        assertTrue(result.stdout().contains("Cursor IDE RPM packages"));
        assertTrue(result.stdout().contains(
            "$ sudo curl -o /etc/yum.repos.d/cursor.repo https://rpm.example.com/cursor/cursor.repo"
        ));
        assertTrue(result.stdout().contains("$ sudo dnf install cursor"));
    }

    @Test
    void repoFileUsesConfiguredBaseUrl() {
        CommandResult result = execute("provider", "repo-file", "cursor");

        assertEquals(0, result.exitCode());
        assertEquals(
            "[cursor]\n"
                + "name=Cursor IDE Repository\n"
                + "baseurl=https://rpm.example.com/cursor\n"
                + "enabled=1\n"
                + "gpgcheck=0\n"
                + "repo_gpgcheck=0\n"
                + "type=rpm\n",
            result.stdout()
        );
    }

    @Test
    void repoFileBaseUrlOptionOverridesSetting() {
        CommandResult result = execute("provider", "repo-file", "cursor", "--base-url", "https://mirror.example.org/rpm/");

        assertEquals(0, result.exitCode());
        assertTrue(result.stdout().contains("baseurl=https://mirror.example.org/rpm/cursor\n"));
    }

    @Test
    void repoFileFailsForUnknownProvider() {
        CommandResult result = execute("provider", "repo-file", "nope");

        assertEquals(1, result.exitCode());
        assertTrue(result.stderr().contains("Provider `nope` not found."));
        assertEquals("", result.stdout());
    }

    private CommandResult execute(String... args) {
        ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        ByteArrayOutputStream stderr = new ByteArrayOutputStream();
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;

        try {
            System.setOut(new PrintStream(stdout));
            System.setErr(new PrintStream(stderr));
            int exitCode = PicocliRunner.execute(RpmRepoCommand.class, args);
            return new CommandResult(exitCode, stdout.toString(), stderr.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private static void restore(String property, String previous) {
        if (previous == null) {
            System.clearProperty(property);
        } else {
            System.setProperty(property, previous);
        }
    }

    private record CommandResult(int exitCode, String stdout, String stderr) {
    }
}
