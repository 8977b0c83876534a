package io.cliphub.selection.buffer;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a short-lived process under a hard deadline.
 * <p>
 * On timeout the process is asked to terminate, given {@code killGrace} to exit, then killed. The
 * caller gets a {@link CommandResult#timeout()} rather than an exception.
 */
@Slf4j
public final class ExternalCommand implements AutoCloseable {

    private final Duration killGrace;
    private final ExecutorService pumps;

    public ExternalCommand(final Duration killGrace) {
        this.killGrace = killGrace;

        final AtomicInteger seq = new AtomicInteger();
        this.pumps = Executors.newCachedThreadPool(r -> {
            final Thread t = new Thread(r, "external-command-io-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * @param argv    program and arguments
     * @param stdin   bytes fed to standard input, or {@code null} to capture output instead
     * @param timeout hard deadline for the whole run
     * @throws IOException if the process cannot be started
     */
    public CommandResult run(final List<String> argv, final byte[] stdin, final Duration timeout) throws IOException {
        final ProcessBuilder pb = new ProcessBuilder(argv);
        if (stdin != null) {
            pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
            pb.redirectError(ProcessBuilder.Redirect.DISCARD);
        }

        final Process process = pb.start();

        final CompletableFuture<byte[]> out;
        final CompletableFuture<byte[]> err;
        if (stdin != null) {
            CompletableFuture.runAsync(() -> feed(process, stdin), pumps);
            out = CompletableFuture.completedFuture(new byte[0]);
            err = CompletableFuture.completedFuture(new byte[0]);
        } else {
            closeQuietly(process.getOutputStream());
            out = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()), pumps);
            err = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()), pumps);
        }

        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.debug("External command timed out after {}: {}", timeout, argv);
                terminate(process);
                return CommandResult.timeout();
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            terminate(process);
            return CommandResult.timeout();
        }

        return new CommandResult(process.exitValue(), collect(out), collect(err), false);
    }

    private void terminate(final Process process) {
        process.destroy();
        try {
            if (!process.waitFor(killGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly().waitFor(killGrace.toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
    }

    private byte[] collect(final CompletableFuture<byte[]> stream) {
        try {
            return stream.get(killGrace.toMillis(), TimeUnit.MILLISECONDS);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            return new byte[0];
        } catch (final ExecutionException | TimeoutException e) {
            log.trace("Could not collect process output: {}", e.toString());
            return new byte[0];
        }
    }

    private static void feed(final Process process, final byte[] data) {
        try (OutputStream in = process.getOutputStream()) {
            in.write(data);
        } catch (final IOException e) {
            // process exited before consuming its input; its exit status tells the story
            log.trace("stdin closed early: {}", e.getMessage());
        }
    }

    private static byte[] drain(final InputStream stream) {
        try (stream) {
            return stream.readAllBytes();
        } catch (final IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void closeQuietly(final OutputStream stream) {
        try {
            stream.close();
        } catch (final IOException e) {
            log.trace("Failed to close stdin: {}", e.getMessage());
        }
    }

    @Override
    public void close() {
        pumps.shutdownNow();
    }
}
