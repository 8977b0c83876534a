package io.cliphub.selection.buffer;

/**
 * Outcome of one external command run.
 */
public record CommandResult(int exitCode, byte[] stdout, byte[] stderr, boolean timedOut) {

    /** Exit status reported for runs killed on timeout, as coreutils {@code timeout} does. */
    public static final int TIMEOUT_EXIT = 124;

    static CommandResult timeout() {
        return new CommandResult(TIMEOUT_EXIT, new byte[0], "timeout".getBytes(), true);
    }

    public boolean succeeded() {
        return !timedOut && exitCode == 0;
    }
}
