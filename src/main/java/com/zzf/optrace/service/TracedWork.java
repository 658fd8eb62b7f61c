package com.zzf.optrace.service;

import com.zzf.optrace.session.TraceSession;
import com.zzf.optrace.trace.gate.TraceAcquisition;

/**
 * The host's execution of one statement. {@code trace.writer()} is present only when the statement is traced.
 */
@FunctionalInterface
public interface TracedWork<T> {
    T run(TraceSession session, TraceAcquisition trace) throws Exception;
}
