package com.zzf.optrace.session;

/**
 * Session-wide formatting switches shared with the engine's own print routines.
 * <p>
 * Only identifier quoting is modelled: the plan printer quotes identifiers while it is on,
 * and trace snapshots turn it off for the duration of a print through {@link #suppressIdentifierQuoting()}.
 */
public final class FormattingOptions {

    private boolean quoteIdentifiers = true;

    public boolean isQuoteIdentifiers() {
        return quoteIdentifiers;
    }

    public void setQuoteIdentifiers(boolean quoteIdentifiers) {
        this.quoteIdentifiers = quoteIdentifiers;
    }

    /**
     * Turns identifier quoting off until the returned override is closed.
     * The previous value is restored on close, whatever it was.
     */
    public FlagOverride suppressIdentifierQuoting() {
        boolean previous = quoteIdentifiers;
        quoteIdentifiers = false;
        return new FlagOverride(this, previous);
    }

    public static final class FlagOverride implements AutoCloseable {
        private final FormattingOptions owner;
        private final boolean previous;
        private boolean restored;

        private FlagOverride(FormattingOptions owner, boolean previous) {
            this.owner = owner;
            this.previous = previous;
        }

        @Override
        public void close() {
            if (restored) {
                return;
            }
            restored = true;
            owner.quoteIdentifiers = previous;
        }
    }
}
