package com.zzf.optrace.trace;

import com.zzf.optrace.session.FormattingOptions;
import com.zzf.optrace.trace.writer.StructuredWriter;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.Charset;
import java.util.Arrays;

/**
 * One trace: the original statement text plus the JSON written while it ran.
 * Finished exactly once by its {@link TraceContext}; read-only afterwards.
 */
@Slf4j
public final class TraceDocument {
    private final StructuredWriter writer;
    private byte[] originalText;
    private Charset textCharset;
    private TraceInfo finishedInfo;

    TraceDocument(FormattingOptions formatting) {
        this.writer = new StructuredWriter(formatting);
    }

    /**
     * Records the statement as sent by the client, before any rewrite. The charset is kept as given.
     */
    public void setOriginalText(byte[] text, int length, Charset charset) {
        ensureOpen();
        if (originalText != null) {
            throw new IllegalStateException("original text is already set");
        }
        if (text == null) {
            throw new IllegalArgumentException("text is null");
        }
        if (length < 0 || length > text.length) {
            throw new IllegalArgumentException("length " + length + " out of range for " + text.length + " bytes");
        }
        this.originalText = Arrays.copyOf(text, length);
        this.textCharset = charset;
    }

    public void setOriginalText(String text, Charset charset) {
        byte[] bytes = text == null ? new byte[0] : text.getBytes(charset);
        setOriginalText(bytes, bytes.length, charset);
    }

    public StructuredWriter getWriter() {
        ensureOpen();
        return writer;
    }

    public boolean isFinished() {
        return finishedInfo != null;
    }

    /** What a sub-statement sees while this document is still being written. */
    public TraceInfo snapshot() {
        if (finishedInfo != null) {
            return finishedInfo;
        }
        return new TraceInfo(originalText, textCharset, writer.text(), 0L, false);
    }

    TraceInfo finish() {
        ensureOpen();
        int leaked = writer.seal();
        if (leaked > 0) {
            log.warn("trace.finish.unclosed_scopes count={}", leaked);
        }
        finishedInfo = new TraceInfo(originalText, textCharset, writer.text(), 0L, true);
        return finishedInfo;
    }

    private void ensureOpen() {
        if (finishedInfo != null) {
            throw new IllegalStateException("trace document is already finished");
        }
    }
}
