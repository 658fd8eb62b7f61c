package com.zzf.optrace.trace.view;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.optrace.session.FormattingOptions;
import com.zzf.optrace.trace.TraceContext;
import com.zzf.optrace.trace.TraceDocument;
import com.zzf.optrace.trace.writer.Scope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OptimizerTraceViewTest {

    private TraceContext context;
    private OptimizerTraceView view;

    @BeforeEach
    void setUp() {
        context = new TraceContext(new FormattingOptions());
        view = new OptimizerTraceView(new JdkCharsetConverter(), StandardCharsets.UTF_8);
    }

    @Test
    void noRowsBeforeAnyTraceFinished() {
        assertTrue(view.read(context, false).isEmpty());
        context.begin();
        assertTrue(view.read(context, false).isEmpty());
    }

    @Test
    void oneRowForLatestTrace() {
        record("SELECT 1", 1);
        record("SELECT 2", 2);

        List<OptimizerTraceRow> rows = view.read(context, false);

        assertEquals(1, rows.size());
        OptimizerTraceRow row = rows.get(0);
        assertEquals("SELECT 2", row.getQuery());
        assertEquals("[2]", row.getTrace());
        assertEquals(0L, row.getMissingBytesBeyondMaxMemSize());
        assertFalse(row.isInsufficientPrivileges());
    }

    @Test
    void privilegeFlagIsPassedThroughWithoutRedaction() {
        record("SELECT secret FROM t1", 5);
        OptimizerTraceRow row = view.read(context, true).get(0);
        assertTrue(row.isInsufficientPrivileges());
        assertEquals("SELECT secret FROM t1", row.getQuery());

        OptimizerTraceRow redacted = row.redacted();
        assertEquals("", redacted.getQuery());
        assertEquals("", redacted.getTrace());
        assertTrue(redacted.isInsufficientPrivileges());
    }

    @Test
    void serializesWithColumnNames() throws Exception {
        record("SELECT 1", 3);
        ObjectMapper mapper = new ObjectMapper();
        JsonNode json = mapper.readTree(mapper.writeValueAsString(view.read(context, false).get(0)));

        assertEquals("SELECT 1", json.path("QUERY").asText());
        assertEquals("[3]", json.path("TRACE").asText());
        assertEquals(0, json.path("MISSING_BYTES_BEYOND_MAX_MEM_SIZE").asInt());
        assertFalse(json.path("INSUFFICIENT_PRIVILEGES").asBoolean());
        assertEquals(OptimizerTraceView.COLUMNS.length, json.size());
    }

    @Test
    void queryIsTranscodedToSystemCharset() {
        OptimizerTraceView asciiView = new OptimizerTraceView(new JdkCharsetConverter(), StandardCharsets.US_ASCII);
        TraceDocument document = context.begin();
        byte[] text = "SELECT 'é'".getBytes(StandardCharsets.ISO_8859_1);
        document.setOriginalText(text, text.length, StandardCharsets.ISO_8859_1);
        context.finish();

        assertEquals("SELECT 'é'", view.read(context, false).get(0).getQuery());
        assertEquals("SELECT '?'", asciiView.read(context, false).get(0).getQuery());
    }

    private void record(String sql, int value) {
        TraceDocument document = context.begin();
        document.setOriginalText(sql, StandardCharsets.UTF_8);
        try (Scope array = document.getWriter().openArray()) {
            document.getWriter().addValue(value);
        }
        context.finish();
    }
}
