package com.zzf.optrace.trace.gate;

import com.zzf.optrace.trace.TraceContext;
import com.zzf.optrace.trace.TraceDocument;
import com.zzf.optrace.trace.writer.StructuredWriter;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Handle for the trace of one statement. Closing it finishes the trace, so it must be closed on
 * every exit path of the statement, including errors and kills; use try-with-resources.
 * For statements that are not traced the handle does nothing.
 */
@Slf4j
public final class TraceAcquisition implements AutoCloseable {
    private final GateDecision decision;
    private final TraceContext context;
    private final TraceDocument document;
    private boolean released;

    private TraceAcquisition(GateDecision decision, TraceContext context, TraceDocument document) {
        this.decision = decision;
        this.context = context;
        this.document = document;
    }

    static TraceAcquisition active(GateDecision decision, TraceContext context, TraceDocument document) {
        return new TraceAcquisition(decision, context, document);
    }

    static TraceAcquisition inactive(GateDecision decision) {
        return new TraceAcquisition(decision, null, null);
    }

    public GateDecision getDecision() {
        return decision;
    }

    public boolean isActive() {
        return document != null && !released;
    }

    public Optional<TraceDocument> document() {
        return isActive() ? Optional.of(document) : Optional.empty();
    }

    public Optional<StructuredWriter> writer() {
        return document().map(TraceDocument::getWriter);
    }

    @Override
    public void close() {
        if (context == null || released) {
            return;
        }
        released = true;
        try {
            context.finish();
        } catch (RuntimeException e) {
            // tracing never fails the statement it observes
            log.warn("trace.finish.fail err={}", e.toString());
        }
    }
}
