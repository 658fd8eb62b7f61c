package com.zzf.optrace.api;

import com.zzf.optrace.service.OptimizerTraceService;
import com.zzf.optrace.session.SessionNotFoundException;
import com.zzf.optrace.session.SessionRegistry;
import com.zzf.optrace.session.TraceFlags;
import com.zzf.optrace.session.TraceSession;
import com.zzf.optrace.trace.view.OptimizerTraceRow;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
public class OptimizerTraceController {

    private final SessionRegistry sessionRegistry;
    private final OptimizerTraceService traceService;

    @Data
    public static class OpenSessionRequest {
        private boolean systemThread;
    }

    @Data
    public static class TraceVariableRequest {
        private String value;
    }

    @PostMapping("/{sessionId}")
    public Map<String, Object> openSession(@PathVariable String sessionId,
                                           @RequestBody(required = false) OpenSessionRequest request) {
        boolean systemThread = request != null && request.isSystemThread();
        TraceSession session = sessionRegistry.open(sessionId, systemThread);
        return describe(session);
    }

    @DeleteMapping("/{sessionId}")
    public Map<String, Object> closeSession(@PathVariable String sessionId) {
        if (!sessionRegistry.close(sessionId)) {
            throw new SessionNotFoundException(sessionId);
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("sessionId", sessionId);
        response.put("status", "closed");
        return response;
    }

    @GetMapping("/{sessionId}/optimizer-trace")
    public List<OptimizerTraceRow> readTrace(@PathVariable String sessionId) {
        return traceService.readView(sessionId);
    }

    @GetMapping("/{sessionId}/optimizer-trace/variable")
    public Map<String, Object> readVariable(@PathVariable String sessionId) {
        return variable(traceService.getTraceVariable(sessionId));
    }

    @PutMapping("/{sessionId}/optimizer-trace/variable")
    public Map<String, Object> setVariable(@PathVariable String sessionId, @RequestBody TraceVariableRequest request) {
        return variable(traceService.setTraceVariable(sessionId, request == null ? null : request.getValue()));
    }

    private static Map<String, Object> variable(TraceFlags flags) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put(TraceFlags.VARIABLE, flags.format());
        return response;
    }

    private static Map<String, Object> describe(TraceSession session) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("sessionId", session.getId());
        response.put("systemThread", session.isSystemThread());
        response.put(TraceFlags.VARIABLE, session.getTraceFlags().format());
        response.put("traceState", session.getTraceContext().getState().name());
        return response;
    }
}
