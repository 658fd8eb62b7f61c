package com.zzf.optrace.trace.view;

import com.zzf.optrace.trace.TraceContext;
import com.zzf.optrace.trace.TraceInfo;

import java.nio.charset.Charset;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Projects a session's latest finished trace into view rows. Never modifies the context.
 */
public class OptimizerTraceView {
    public static final String[] COLUMNS = {
            "QUERY", "TRACE", "MISSING_BYTES_BEYOND_MAX_MEM_SIZE", "INSUFFICIENT_PRIVILEGES"
    };

    private final CharsetConverter converter;
    private final Charset systemCharset;

    public OptimizerTraceView(CharsetConverter converter, Charset systemCharset) {
        this.converter = converter;
        this.systemCharset = systemCharset;
    }

    /**
     * @param insufficientPrivileges reported as-is; blanking the text is left to the caller
     * @return no rows if the session never finished a trace, otherwise exactly one
     */
    public List<OptimizerTraceRow> read(TraceContext context, boolean insufficientPrivileges) {
        Optional<TraceInfo> latest = context.getLatestCompleted();
        if (latest.isEmpty()) {
            return Collections.emptyList();
        }
        return Collections.singletonList(toRow(latest.get(), insufficientPrivileges));
    }

    public OptimizerTraceRow toRow(TraceInfo info, boolean insufficientPrivileges) {
        return OptimizerTraceRow.builder()
                .query(converter.convert(info.getQuery(), info.getQueryCharset(), systemCharset))
                .trace(info.getTrace())
                .missingBytesBeyondMaxMemSize(info.getMissingBytes())
                .insufficientPrivileges(insufficientPrivileges)
                .build();
    }
}
