package io.cliphub.selection;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * The X selections the engine can mirror, with the {@code xsel} flag selecting each one.
 */
public enum Selection {
    CLIPBOARD("-b"),
    PRIMARY("-p"),
    SECONDARY("-s");

    private final String flag;

    Selection(final String flag) {
        this.flag = flag;
    }

    public String flag() {
        return flag;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Accepts either the name ({@code clipboard}) or the flag ({@code -b}).
     */
    public static Optional<Selection> parse(final String raw) {
        if (raw == null) return Optional.empty();
        final String s = raw.trim();
        return Arrays.stream(values())
                .filter(sel -> sel.name().equalsIgnoreCase(s) || sel.flag.equals(s))
                .findFirst();
    }
}
