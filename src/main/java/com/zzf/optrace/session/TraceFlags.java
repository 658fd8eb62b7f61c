package com.zzf.optrace.session;

import java.util.Locale;

/**
 * Value of the session's {@code optimizer_trace} variable.
 * <p>
 * Parsed from the flag-set syntax used by {@code SET optimizer_trace='enabled=on,one_line=off'}.
 * Flags not mentioned keep their current value; the bare word {@code default} resets all of them.
 * {@code one_line} is accepted and remembered but does not change how traces are rendered.
 */
public final class TraceFlags {
    public static final String VARIABLE = "optimizer_trace";

    public static final int FLAG_DEFAULT = 0;
    public static final int FLAG_ENABLED = 1 << 0;
    public static final int FLAG_ONE_LINE = 1 << 1;

    /** Flag names by bit position. */
    private static final String[] FLAG_NAMES = {"enabled", "one_line"};
    private static final String DEFAULT_NAME = "default";

    public static final TraceFlags DEFAULT = new TraceFlags(FLAG_DEFAULT);

    private final int bits;

    private TraceFlags(int bits) {
        this.bits = bits;
    }

    public static TraceFlags of(int bits) {
        return new TraceFlags(bits & (FLAG_ENABLED | FLAG_ONE_LINE));
    }

    public static TraceFlags parse(String value) {
        return parse(value, DEFAULT);
    }

    public static TraceFlags parse(String value, TraceFlags current) {
        if (value == null) {
            throw new InvalidTraceFlagException(VARIABLE, "NULL");
        }
        int result = current == null ? FLAG_DEFAULT : current.bits;
        if (value.trim().isEmpty()) {
            return of(result);
        }
        for (String rawItem : value.split(",", -1)) {
            String item = rawItem.trim().toLowerCase(Locale.ROOT);
            if (DEFAULT_NAME.equals(item)) {
                result = FLAG_DEFAULT;
                continue;
            }
            int eq = item.indexOf('=');
            if (eq <= 0) {
                throw new InvalidTraceFlagException(VARIABLE, rawItem.trim());
            }
            int flag = flagFor(item.substring(0, eq).trim());
            if (flag == 0) {
                throw new InvalidTraceFlagException(VARIABLE, rawItem.trim());
            }
            String setting = item.substring(eq + 1).trim();
            switch (setting) {
                case "on":
                    result |= flag;
                    break;
                case "off":
                    result &= ~flag;
                    break;
                case DEFAULT_NAME:
                    result = (result & ~flag) | (FLAG_DEFAULT & flag);
                    break;
                default:
                    throw new InvalidTraceFlagException(VARIABLE, rawItem.trim());
            }
        }
        return of(result);
    }

    private static int flagFor(String name) {
        for (int i = 0; i < FLAG_NAMES.length; i++) {
            if (FLAG_NAMES[i].equals(name)) {
                return 1 << i;
            }
        }
        return 0;
    }

    public boolean isEnabled() {
        return (bits & FLAG_ENABLED) != 0;
    }

    public boolean isOneLine() {
        return (bits & FLAG_ONE_LINE) != 0;
    }

    public int bits() {
        return bits;
    }

    public TraceFlags with(int flag, boolean on) {
        return of(on ? bits | flag : bits & ~flag);
    }

    /** Renders the flags the way {@code SELECT @@optimizer_trace} shows them. */
    public String format() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < FLAG_NAMES.length; i++) {
            if (sb.length() > 0) {
                sb.append(',');
            }
            sb.append(FLAG_NAMES[i]).append('=').append((bits & (1 << i)) != 0 ? "on" : "off");
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TraceFlags && ((TraceFlags) o).bits == bits;
    }

    @Override
    public int hashCode() {
        return bits;
    }

    @Override
    public String toString() {
        return format();
    }
}
