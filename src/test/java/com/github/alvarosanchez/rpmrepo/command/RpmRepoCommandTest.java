package com.github.alvarosanchez.rpmrepo.command;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.micronaut.configuration.picocli.PicocliRunner;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class RpmRepoCommandTest {

    @Test
    void helpSubcommandPrintsUsage() {
        String output = executeCapturingStdout("help");

        assertTrue(output.contains("Usage: rpmrepo"));
        assertTrue(output.contains("discover"));
        assertTrue(output.contains("repodata"));
    }

    @Test
    void noSubcommandPrintsUsage() {
        String output = executeCapturingStdout();

        assertTrue(output.contains("Usage: rpmrepo"));
    }

    @Test
    void versionOptionPrintsProjectVersion() {
        String output = executeCapturingStdout("--version");

        assertTrue(output.contains("rpmrepo " + readExpectedVersion()));
    }

    private static String executeCapturingStdout(String... args) {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        PrintStream originalOut = System.out;

        try {
            System.setOut(new PrintStream(output));
            int exitCode = PicocliRunner.execute(RpmRepoCommand.class, args);
            assertEquals(0, exitCode);
        } finally {
            System.setOut(originalOut);
        }
        return output.toString();
    }

    private static String readExpectedVersion() {
        try (var inputStream = RpmRepoCommandTest.class.getResourceAsStream("/META-INF/rpmrepo/version.txt")) {
            assertNotNull(inputStream);
            return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read version resource", e);
        }
    }
}
