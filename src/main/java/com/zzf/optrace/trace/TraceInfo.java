package com.zzf.optrace.trace;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Read-only view of a trace document: the statement as the client sent it and the trace body.
 */
public final class TraceInfo {
    private final byte[] query;
    private final Charset queryCharset;
    private final String trace;
    private final long missingBytes;
    private final boolean finished;

    public TraceInfo(byte[] query, Charset queryCharset, String trace, long missingBytes, boolean finished) {
        this.query = query == null ? new byte[0] : query.clone();
        this.queryCharset = queryCharset;
        this.trace = trace == null ? "" : trace;
        this.missingBytes = missingBytes;
        this.finished = finished;
    }

    public byte[] getQuery() {
        return query.clone();
    }

    public int getQueryLength() {
        return query.length;
    }

    public Charset getQueryCharset() {
        return queryCharset;
    }

    /** Query decoded with its own charset. */
    public String getQueryText() {
        return queryCharset == null ? new String(query, StandardCharsets.UTF_8) : new String(query, queryCharset);
    }

    public String getTrace() {
        return trace;
    }

    public int getTraceLength() {
        return trace.length();
    }

    public long getMissingBytes() {
        return missingBytes;
    }

    /** False for snapshots of a document that is still being written. */
    public boolean isFinished() {
        return finished;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TraceInfo)) {
            return false;
        }
        TraceInfo other = (TraceInfo) o;
        return missingBytes == other.missingBytes
                && finished == other.finished
                && Arrays.equals(query, other.query)
                && Objects.equals(queryCharset, other.queryCharset)
                && trace.equals(other.trace);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(query) + trace.hashCode();
    }

    @Override
    public String toString() {
        return "TraceInfo{query=" + getQueryText() + ", trace=" + trace + ", finished=" + finished + "}";
    }
}
