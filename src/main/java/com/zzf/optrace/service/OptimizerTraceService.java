package com.zzf.optrace.service;

import com.zzf.optrace.session.SessionRegistry;
import com.zzf.optrace.session.TraceFlags;
import com.zzf.optrace.session.TraceSession;
import com.zzf.optrace.trace.TraceInfo;
import com.zzf.optrace.trace.gate.Command;
import com.zzf.optrace.trace.gate.TraceAcquisition;
import com.zzf.optrace.trace.gate.TraceGate;
import com.zzf.optrace.trace.view.OptimizerTraceRow;
import com.zzf.optrace.trace.view.OptimizerTraceView;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Entry points the host engine and the API use: run a statement under the trace gate,
 * change the session's {@code optimizer_trace} value and read the view.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OptimizerTraceService {

    private final SessionRegistry sessionRegistry;
    private final TraceGate traceGate;
    private final OptimizerTraceView traceView;
    private final PrivilegeChecker privilegeChecker;

    public <T> T execute(String sessionId, Command command, TracedWork<T> work) throws Exception {
        TraceSession session = sessionRegistry.get(sessionId);
        return execute(session, command, work);
    }

    public <T> T execute(TraceSession session, Command command, TracedWork<T> work) throws Exception {
        try (TraceAcquisition trace = traceGate.start(session, command)) {
            return work.run(session, trace);
        }
    }

    public TraceFlags getTraceVariable(String sessionId) {
        return sessionRegistry.get(sessionId).getTraceFlags();
    }

    public TraceFlags setTraceVariable(String sessionId, String value) {
        TraceSession session = sessionRegistry.get(sessionId);
        TraceFlags updated = TraceFlags.parse(value, session.getTraceFlags());
        session.setTraceFlags(updated);
        log.info("trace.variable.set session={} value={}", session.getId(), updated);
        return updated;
    }

    /**
     * Rows of the view for this session, with the statement and trace blanked when the
     * session may not see them.
     */
    public List<OptimizerTraceRow> readView(String sessionId) {
        TraceSession session = sessionRegistry.get(sessionId);
        Optional<TraceInfo> latest = session.getTraceContext().getLatestCompleted();
        boolean insufficient = latest.map(info -> !privilegeChecker.canView(session, info)).orElse(false);
        List<OptimizerTraceRow> rows = traceView.read(session.getTraceContext(), insufficient);
        if (!insufficient) {
            return rows;
        }
        return rows.stream().map(OptimizerTraceRow::redacted).collect(Collectors.toList());
    }
}
