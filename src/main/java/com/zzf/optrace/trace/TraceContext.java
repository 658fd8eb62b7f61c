package com.zzf.optrace.trace;

import com.zzf.optrace.session.FormattingOptions;
import com.zzf.optrace.trace.writer.StructuredWriter;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Per-session owner of the trace being written and of the last finished trace.
 * <p>
 * Holds at most one in-flight document and one completed document; finishing a trace replaces
 * the previously completed one. Confined to the session thread, so there is no locking.
 */
@Slf4j
public final class TraceContext {

    public enum State {
        IDLE,
        RECORDING
    }

    private final FormattingOptions formatting;
    private TraceDocument current;
    private TraceInfo latestCompleted;

    public TraceContext(FormattingOptions formatting) {
        this.formatting = formatting;
    }

    /**
     * Starts a new document. Nested statements must be filtered out by the caller;
     * calling this while a document is open is a programming error.
     */
    public TraceDocument begin() {
        if (current != null) {
            throw new IllegalStateException("trace already in progress");
        }
        current = new TraceDocument(formatting);
        log.debug("trace.begin");
        return current;
    }

    /**
     * Finalizes the in-flight document and makes it the latest completed one.
     * The context is back to {@link State#IDLE} afterwards even if finalizing fails.
     */
    public TraceInfo finish() {
        if (current == null) {
            throw new IllegalStateException("no trace in progress");
        }
        TraceDocument document = current;
        try {
            TraceInfo info = document.finish();
            latestCompleted = info;
            log.debug("trace.finish traceLength={}", info.getTraceLength());
            return info;
        } finally {
            current = null;
        }
    }

    /**
     * Read-only view of the document still being written, for sub-statements that run while
     * the parent statement's trace is open. The document itself never leaves this context.
     */
    public Optional<TraceInfo> getInProgress() {
        return Optional.ofNullable(current).map(TraceDocument::snapshot);
    }

    /** Writer of the in-flight document, for the optimizer code producing the trace. */
    public Optional<StructuredWriter> currentWriter() {
        return Optional.ofNullable(current).map(TraceDocument::getWriter);
    }

    public Optional<TraceInfo> getLatestCompleted() {
        return Optional.ofNullable(latestCompleted);
    }

    public State getState() {
        return current == null ? State.IDLE : State.RECORDING;
    }

    public boolean isRecording() {
        return current != null;
    }

    public int completedCount() {
        return latestCompleted == null ? 0 : 1;
    }

    /** Drops every document; used when the owning session goes away. */
    public void clear() {
        current = null;
        latestCompleted = null;
    }
}
