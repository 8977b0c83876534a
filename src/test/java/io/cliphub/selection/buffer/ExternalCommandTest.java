package io.cliphub.selection.buffer;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs(OS.LINUX)
final class ExternalCommandTest {

    private final ExternalCommand command = new ExternalCommand(Duration.ofMillis(500));

    @TempDir
    Path dir;

    @AfterEach
    void tearDown() {
        command.close();
    }

    @Test
    void capturesStdout() throws Exception {
        final CommandResult r = command.run(List.of("sh", "-c", "printf hello"), null, Duration.ofSeconds(5));

        assertTrue(r.succeeded());
        assertEquals("hello", new String(r.stdout(), StandardCharsets.UTF_8));
    }

    @Test
    void reportsNonZeroExit() throws Exception {
        final CommandResult r = command.run(List.of("sh", "-c", "echo oops >&2; exit 3"), null, Duration.ofSeconds(5));

        assertEquals(3, r.exitCode());
        assertFalse(r.succeeded());
        assertEquals("oops\n", new String(r.stderr(), StandardCharsets.UTF_8));
    }

    @Test
    void feedsStdin() throws Exception {
        final Path out = dir.resolve("out.txt");

        final CommandResult r = command.run(List.of("sh", "-c", "cat > '" + out + "'"),
                "payload".getBytes(StandardCharsets.UTF_8), Duration.ofSeconds(5));

        assertTrue(r.succeeded());
        assertEquals("payload", Files.readString(out));
    }

    @Test
    void killsOnTimeoutWithinGrace() throws Exception {
        final long start = System.nanoTime();
        final CommandResult r = command.run(List.of("sleep", "10"), null, Duration.ofMillis(200));
        final long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertTrue(r.timedOut());
        assertEquals(CommandResult.TIMEOUT_EXIT, r.exitCode());
        assertEquals(0, r.stdout().length);
        assertTrue(elapsedMs < 3_000, "took " + elapsedMs + "ms");
    }

    @Test
    void missingProgramThrows() {
        assertThrows(IOException.class,
                () -> command.run(List.of(dir.resolve("no-such-tool").toString()), null, Duration.ofSeconds(1)));
    }
}
