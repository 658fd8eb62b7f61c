package com.zzf.optrace.service;

import com.zzf.optrace.session.TraceSession;
import com.zzf.optrace.trace.TraceInfo;

/**
 * Host privilege evaluation: may this session see the given trace?
 */
@FunctionalInterface
public interface PrivilegeChecker {
    boolean canView(TraceSession session, TraceInfo trace);
}
