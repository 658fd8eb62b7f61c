package com.zzf.optrace.trace.gate;

import com.zzf.optrace.session.TraceSession;
import com.zzf.optrace.trace.TraceContext;
import com.zzf.optrace.trace.TraceDocument;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Decides, once per statement, whether it gets a trace, and starts the trace if so.
 */
@Slf4j
public class TraceGate {

    private final CommandClassifier classifier;
    private final String traceViewSchema;
    private final String traceViewName;

    public TraceGate(CommandClassifier classifier, String traceViewSchema, String traceViewName) {
        this.classifier = classifier;
        this.traceViewSchema = traceViewSchema;
        this.traceViewName = traceViewName;
    }

    public GateDecision evaluate(TraceSession session, Command command) {
        if (!session.getTraceFlags().isEnabled()) {
            return GateDecision.skip(GateDecision.Reason.DISABLED);
        }
        if (!classifier.isTraceable(command.getKind())) {
            return GateDecision.skip(GateDecision.Reason.COMMAND_NOT_TRACEABLE);
        }
        // reading the view must not replace the trace being read
        if (readsTraceView(command.getTables())) {
            return GateDecision.skip(GateDecision.Reason.READS_TRACE_VIEW);
        }
        if (classifier.isTraceFlagAssignment(command.getKind(), command.getAssignments())) {
            return GateDecision.skip(GateDecision.Reason.SETS_TRACE_VARIABLE);
        }
        if (session.isSystemThread()) {
            return GateDecision.skip(GateDecision.Reason.SYSTEM_THREAD);
        }
        if (session.getTraceContext().isRecording()) {
            return GateDecision.skip(GateDecision.Reason.NESTED_STATEMENT);
        }
        return GateDecision.trace();
    }

    /**
     * Evaluates the statement and, if it is traceable, begins its trace with the original text recorded.
     * Failing to start a trace only loses the trace; the statement itself is unaffected.
     */
    public TraceAcquisition start(TraceSession session, Command command) {
        GateDecision decision = evaluate(session, command);
        if (!decision.isTraceable()) {
            log.debug("trace.gate.skip session={} kind={} reason={}", session.getId(), command.getKind(), decision.getReason());
            return TraceAcquisition.inactive(decision);
        }
        TraceContext context = session.getTraceContext();
        TraceDocument document;
        try {
            document = context.begin();
        } catch (RuntimeException e) {
            log.warn("trace.begin.fail session={} err={}", session.getId(), e.toString());
            return TraceAcquisition.inactive(decision);
        }
        try {
            byte[] text = command.getText() == null ? new byte[0] : command.getText();
            document.setOriginalText(text, text.length, command.getCharset());
        } catch (RuntimeException e) {
            log.warn("trace.query.set.fail session={} err={}", session.getId(), e.toString());
        }
        log.debug("trace.gate.start session={} kind={}", session.getId(), command.getKind());
        return TraceAcquisition.active(decision, context, document);
    }

    private boolean readsTraceView(List<TableReference> tables) {
        if (tables == null) {
            return false;
        }
        for (TableReference table : tables) {
            if (table != null && table.refersTo(traceViewSchema, traceViewName)) {
                return true;
            }
        }
        return false;
    }
}
