package com.zzf.optrace.trace.writer;

/**
 * An open object or array in a {@link StructuredWriter}. Closing emits the matching bracket;
 * closing again does nothing.
 */
public final class Scope implements AutoCloseable {
    private final StructuredWriter writer;
    private final String key;
    private final boolean requiresKey;
    private final boolean discarded;
    private boolean closed;

    Scope(StructuredWriter writer, String key, boolean requiresKey, boolean discarded) {
        this.writer = writer;
        this.key = key;
        this.requiresKey = requiresKey;
        this.discarded = discarded;
    }

    public String key() {
        return key;
    }

    /** True for objects, false for arrays. */
    public boolean requiresKey() {
        return requiresKey;
    }

    /** Content written while this scope is innermost is dropped instead of recorded. */
    public boolean isDiscarded() {
        return discarded;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        writer.close(this);
        closed = true;
    }
}
