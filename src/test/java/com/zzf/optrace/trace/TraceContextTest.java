package com.zzf.optrace.trace;

import com.zzf.optrace.session.FormattingOptions;
import com.zzf.optrace.trace.writer.Scope;
import com.zzf.optrace.trace.writer.StructuredWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TraceContextTest {

    private TraceContext context;

    @BeforeEach
    void setUp() {
        context = new TraceContext(new FormattingOptions());
    }

    @Test
    void recordsSingleStatement() {
        TraceDocument document = context.begin();
        assertEquals(TraceContext.State.RECORDING, context.getState());
        document.setOriginalText("SELECT 1", StandardCharsets.UTF_8);
        try (Scope array = document.getWriter().openScope(null, false)) {
            document.getWriter().addValue(3);
        }
        context.finish();

        TraceInfo latest = context.getLatestCompleted().orElseThrow();
        assertEquals("SELECT 1", latest.getQueryText());
        assertEquals("[3]", latest.getTrace());
        assertEquals(0L, latest.getMissingBytes());
        assertTrue(latest.isFinished());
        assertEquals(TraceContext.State.IDLE, context.getState());
    }

    @Test
    void keepsOnlyTheMostRecentTrace() {
        for (int i = 1; i <= 5; i++) {
            TraceDocument document = context.begin();
            document.setOriginalText("SELECT " + i, StandardCharsets.UTF_8);
            try (Scope root = document.getWriter().openObject()) {
                document.getWriter().add("select_id", i);
            }
            TraceInfo finished = context.finish();
            assertSame(finished, context.getLatestCompleted().orElseThrow());
            assertEquals(1, context.completedCount());
        }
        TraceInfo latest = context.getLatestCompleted().orElseThrow();
        assertEquals("SELECT 5", latest.getQueryText());
        assertEquals("{\"select_id\":5}", latest.getTrace());
    }

    @Test
    void nothingCompletedBeforeFirstFinish() {
        assertTrue(context.getLatestCompleted().isEmpty());
        assertEquals(0, context.completedCount());
        context.begin();
        assertTrue(context.getLatestCompleted().isEmpty());
    }

    @Test
    void beginWhileRecordingIsRejected() {
        TraceDocument first = context.begin();
        first.setOriginalText("SELECT 1", StandardCharsets.UTF_8);
        assertThrows(IllegalStateException.class, context::begin);
        assertEquals("SELECT 1", context.getInProgress().orElseThrow().getQueryText());
        assertSame(first.getWriter(), context.currentWriter().orElseThrow());
    }

    @Test
    void finishWhileIdleIsRejected() {
        assertThrows(IllegalStateException.class, context::finish);
    }

    @Test
    void inProgressDocumentIsVisibleToSubStatements() {
        TraceDocument document = context.begin();
        document.setOriginalText("CALL p1()", StandardCharsets.UTF_8);
        StructuredWriter writer = context.currentWriter().orElseThrow();
        writer.openObject();
        writer.add("steps", 1);

        TraceInfo partial = context.getInProgress().orElseThrow();
        assertFalse(partial.isFinished());
        assertEquals("CALL p1()", partial.getQueryText());
        assertEquals("{\"steps\":1", partial.getTrace());

        writer.add("rows", 10);
        assertEquals("{\"steps\":1", partial.getTrace());
        assertEquals("{\"steps\":1,\"rows\":10", context.getInProgress().orElseThrow().getTrace());
    }

    @Test
    void finishClosesScopesLeftOpen() {
        TraceDocument document = context.begin();
        document.setOriginalText("SELECT 2", StandardCharsets.UTF_8);
        document.getWriter().openObject();
        document.getWriter().openArray("steps");

        TraceInfo info = context.finish();

        assertEquals("{\"steps\":[]}", info.getTrace());
        assertEquals(TraceContext.State.IDLE, context.getState());
    }

    @Test
    void finishedDocumentCannotBeChanged() {
        TraceDocument document = context.begin();
        document.setOriginalText("SELECT 1", StandardCharsets.UTF_8);
        StructuredWriter writer = document.getWriter();
        context.finish();

        assertTrue(document.isFinished());
        assertThrows(IllegalStateException.class, document::getWriter);
        assertThrows(IllegalStateException.class, () -> writer.openArray());
        assertThrows(IllegalStateException.class, () -> document.setOriginalText("SELECT 2", StandardCharsets.UTF_8));
    }

    @Test
    void originalTextIsSetOnceAndKeepsCharset() {
        Charset latin1 = StandardCharsets.ISO_8859_1;
        byte[] bytes = "SELECT 'café' -- trailing".getBytes(latin1);
        int length = "SELECT 'café'".length();
        TraceDocument document = context.begin();
        document.setOriginalText(bytes, length, latin1);
        assertThrows(IllegalStateException.class, () -> document.setOriginalText(bytes, length, latin1));

        TraceInfo info = context.finish();
        assertEquals(latin1, info.getQueryCharset());
        assertEquals(length, info.getQueryLength());
        assertArrayEquals("SELECT 'café'".getBytes(latin1), info.getQuery());
        assertEquals("SELECT 'café'", info.getQueryText());
    }

    @Test
    void lengthOutsideBufferIsRejected() {
        TraceDocument document = context.begin();
        assertThrows(IllegalArgumentException.class, () -> document.setOriginalText(new byte[2], 3, StandardCharsets.UTF_8));
    }

    @Test
    void clearDropsEverything() {
        context.begin();
        context.finish();
        context.begin();
        context.clear();
        assertTrue(context.getLatestCompleted().isEmpty());
        assertTrue(context.getInProgress().isEmpty());
        assertEquals(TraceContext.State.IDLE, context.getState());
    }
}
