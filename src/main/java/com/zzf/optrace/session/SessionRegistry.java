package com.zzf.optrace.session;

import com.zzf.optrace.config.OptimizerTraceProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Directory of live sessions. Each session's trace state stays confined to that session;
 * only the directory itself is shared.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionRegistry {

    private final OptimizerTraceProperties properties;
    private final Map<String, TraceSession> sessions = new ConcurrentHashMap<>();

    /**
     * Opens a session, or returns the live one with the same id. A live session keeps the
     * {@code systemThread} it was opened with.
     */
    public TraceSession open(String sessionId, boolean systemThread) {
        TraceSession session = new TraceSession(sessionId, initialFlags(), systemThread);
        TraceSession existing = sessions.putIfAbsent(session.getId(), session);
        if (existing != null) {
            if (existing.isSystemThread() != systemThread) {
                log.debug("session.open.existing session={} systemThread={} requested={}",
                        existing.getId(), existing.isSystemThread(), systemThread);
            }
            return existing;
        }
        log.info("session.open session={} systemThread={} flags={}", session.getId(), systemThread, session.getTraceFlags());
        return session;
    }

    public TraceSession get(String sessionId) {
        return find(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    public Optional<TraceSession> find(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.get(sessionId.trim()));
    }

    public boolean close(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return false;
        }
        TraceSession session = sessions.remove(sessionId.trim());
        if (session == null) {
            return false;
        }
        session.close();
        log.info("session.close session={}", session.getId());
        return true;
    }

    public List<String> list() {
        return new ArrayList<>(sessions.keySet());
    }

    private TraceFlags initialFlags() {
        try {
            return TraceFlags.parse(properties.getDefaultFlags());
        } catch (InvalidTraceFlagException e) {
            log.warn("session.flags.default.invalid value={} err={}", properties.getDefaultFlags(), e.getMessage());
            return TraceFlags.DEFAULT;
        }
    }
}
