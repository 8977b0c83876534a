package io.cliphub.selection.buffer;

import io.cliphub.core.error.ErrorKind;
import io.cliphub.core.error.Result;
import io.cliphub.selection.Selection;
import io.cliphub.selection.SelectionHealth;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * {@link SelectionBuffer} backed by the {@code xsel} command line tool.
 */
@Slf4j
public final class XselSelectionBuffer implements SelectionBuffer {

    private static final Duration PROBE_TIMEOUT = Duration.ofSeconds(2);

    private final Path xsel;
    private final ExternalCommand command;
    private final Function<String, String> env;

    public XselSelectionBuffer(final Path xsel, final ExternalCommand command) {
        this(xsel, command, System::getenv);
    }

    public XselSelectionBuffer(final Path xsel, final ExternalCommand command, final Function<String, String> env) {
        this.xsel = xsel;
        this.command = command;
        this.env = env;
    }

    @Override
    public Result<byte[]> read(final Selection selection, final Duration timeout) {
        if (!hasDisplay()) {
            log.trace("xsel read skipped: no DISPLAY");
            return Result.ok(new byte[0]);
        }

        final CommandResult r;
        try {
            r = command.run(List.of(xsel.toString(), selection.flag(), "-o"), null, timeout);
        } catch (final IOException e) {
            return Result.err(ErrorKind.EXTERNAL_TOOL_UNAVAILABLE, "cannot run " + xsel + ": " + e.getMessage());
        }

        if (r.timedOut()) {
            return Result.err(ErrorKind.EXTERNAL_TOOL_TIMEOUT, "xsel read of " + selection.label() + " timed out");
        }
        // xsel exits non-zero when the selection has no owner
        return Result.ok(r.exitCode() == 0 ? r.stdout() : new byte[0]);
    }

    @Override
    public Result<Void> write(final Selection selection, final byte[] data, final Duration timeout) {
        if (!hasDisplay()) {
            log.trace("xsel write skipped: no DISPLAY");
            return Result.ok(null);
        }

        try {
            final CommandResult r = command.run(List.of(xsel.toString(), "-n", "-i", selection.flag()), data, timeout);
            if (r.timedOut()) {
                return Result.err(ErrorKind.EXTERNAL_TOOL_TIMEOUT, "xsel write of " + selection.label() + " timed out");
            }
            return Result.ok(null);
        } catch (final IOException e) {
            return Result.err(ErrorKind.EXTERNAL_TOOL_UNAVAILABLE, "cannot run " + xsel + ": " + e.getMessage());
        }
    }

    @Override
    public boolean isAvailable() {
        return Files.exists(xsel) && Files.isExecutable(xsel);
    }

    @Override
    public SelectionHealth checkHealth() {
        final boolean exists = Files.exists(xsel);
        final boolean executable = Files.isExecutable(xsel);
        final Map<Selection, Boolean> readable = new EnumMap<>(Selection.class);

        boolean ok = exists && executable;
        if (ok) {
            for (final Selection sel : Selection.values()) {
                boolean readOk;
                try {
                    readOk = command.run(List.of(xsel.toString(), sel.flag(), "-o"), null, PROBE_TIMEOUT).succeeded();
                } catch (final IOException e) {
                    readOk = false;
                }
                readable.put(sel, readOk);
                ok = ok && readOk;
            }
        }
        return new SelectionHealth(xsel.toString(), exists, executable, onPath(), readable, ok);
    }

    @Override
    public String location() {
        return xsel.toString();
    }

    private boolean hasDisplay() {
        final String display = env.apply("DISPLAY");
        return display != null && !display.isEmpty();
    }

    private boolean onPath() {
        final String path = env.apply("PATH");
        if (path == null || xsel.getFileName() == null) return false;
        final String name = xsel.getFileName().toString();
        for (final String dir : path.split(File.pathSeparator)) {
            if (dir.isEmpty()) continue;
            if (Files.isExecutable(Paths.get(dir, name))) return true;
        }
        return false;
    }
}
