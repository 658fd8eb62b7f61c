package com.zzf.optrace.trace.gate;

/**
 * Outcome of checking one statement for trace eligibility.
 */
public final class GateDecision {

    public enum Reason {
        TRACEABLE,
        DISABLED,
        COMMAND_NOT_TRACEABLE,
        READS_TRACE_VIEW,
        SETS_TRACE_VARIABLE,
        SYSTEM_THREAD,
        NESTED_STATEMENT
    }

    private static final GateDecision TRACE = new GateDecision(Reason.TRACEABLE);

    private final Reason reason;

    private GateDecision(Reason reason) {
        this.reason = reason;
    }

    public static GateDecision trace() {
        return TRACE;
    }

    public static GateDecision skip(Reason reason) {
        if (reason == Reason.TRACEABLE) {
            throw new IllegalArgumentException("skip needs a reason other than TRACEABLE");
        }
        return new GateDecision(reason);
    }

    public boolean isTraceable() {
        return reason == Reason.TRACEABLE;
    }

    public Reason getReason() {
        return reason;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof GateDecision && ((GateDecision) o).reason == reason;
    }

    @Override
    public int hashCode() {
        return reason.hashCode();
    }

    @Override
    public String toString() {
        return "GateDecision{" + reason + "}";
    }
}
