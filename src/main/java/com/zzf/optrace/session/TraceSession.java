package com.zzf.optrace.session;

import com.zzf.optrace.trace.TraceContext;
import lombok.extern.slf4j.Slf4j;

/**
 * A client session as far as tracing is concerned. Owns exactly one {@link TraceContext};
 * everything that needs the context gets it from here explicitly.
 */
@Slf4j
public final class TraceSession implements AutoCloseable {
    private final String id;
    private final boolean systemThread;
    private final FormattingOptions formatting = new FormattingOptions();
    private final TraceContext traceContext = new TraceContext(formatting);
    private TraceFlags traceFlags;

    public TraceSession(String id, TraceFlags traceFlags, boolean systemThread) {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException("session id is blank");
        }
        this.id = id.trim();
        this.traceFlags = traceFlags == null ? TraceFlags.DEFAULT : traceFlags;
        this.systemThread = systemThread;
    }

    public TraceSession(String id) {
        this(id, TraceFlags.DEFAULT, false);
    }

    public String getId() {
        return id;
    }

    /** Replication appliers, event schedulers and other internal threads are never traced. */
    public boolean isSystemThread() {
        return systemThread;
    }

    public TraceFlags getTraceFlags() {
        return traceFlags;
    }

    public void setTraceFlags(TraceFlags traceFlags) {
        this.traceFlags = traceFlags == null ? TraceFlags.DEFAULT : traceFlags;
    }

    public FormattingOptions getFormatting() {
        return formatting;
    }

    public TraceContext getTraceContext() {
        return traceContext;
    }

    @Override
    public void close() {
        if (traceContext.isRecording()) {
            log.warn("session.close.trace_in_progress session={}", id);
        }
        traceContext.clear();
    }
}
