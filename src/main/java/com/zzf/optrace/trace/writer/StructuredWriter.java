package com.zzf.optrace.trace.writer;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.zzf.optrace.session.FormattingOptions;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Append-only JSON builder for one trace document.
 * <p>
 * Scopes are only opened through {@link #openScope(String, boolean)}, which hands back a {@link Scope}
 * that closes the bracket it opened. Use it with try-with-resources so that every exit path,
 * including exceptions thrown from deep inside the optimizer, leaves the output balanced.
 * A document has a single root. A scope opened after the root has closed is handed back discarded:
 * it balances like any other scope but nothing written inside it is recorded.
 * Not thread-safe; one writer belongs to one command on one session thread.
 */
@Slf4j
public final class StructuredWriter {
    private static final JsonFactory JSON = new JsonFactory();

    private final StringWriter buffer = new StringWriter();
    private final JsonGenerator generator;
    private final FormattingOptions formatting;
    private final Deque<Scope> scopes = new ArrayDeque<>();
    private boolean memberPending;
    private boolean rootWritten;
    private boolean sealed;

    public StructuredWriter(FormattingOptions formatting) {
        this.formatting = formatting;
        try {
            this.generator = JSON.createGenerator(buffer);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public Scope openScope(String key, boolean requiresKey) {
        ensureWritable();
        if (isDiscarding() || (scopes.isEmpty() && rootWritten)) {
            if (scopes.isEmpty()) {
                log.warn("trace.scope.extra_root key={} dropped=true", key);
            }
            Scope dropped = new Scope(this, key, requiresKey, true);
            scopes.push(dropped);
            return dropped;
        }
        if (scopes.isEmpty()) {
            rootWritten = true;
        } else {
            prepareSlot(key);
        }
        try {
            if (requiresKey) {
                generator.writeStartObject();
            } else {
                generator.writeStartArray();
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        Scope scope = new Scope(this, key, requiresKey, false);
        scopes.push(scope);
        return scope;
    }

    public Scope openObject() {
        return openScope(null, true);
    }

    public Scope openObject(String key) {
        return openScope(key, true);
    }

    public Scope openArray() {
        return openScope(null, false);
    }

    public Scope openArray(String key) {
        return openScope(key, false);
    }

    public StructuredWriter addMember(String key) {
        ensureWritable();
        Scope top = requireScope();
        if (top.isDiscarded()) {
            return this;
        }
        if (!top.requiresKey()) {
            throw new IllegalStateException("member '" + key + "' written inside an array");
        }
        if (memberPending) {
            throw new IllegalStateException("member '" + key + "' written while another member awaits its value");
        }
        if (key == null) {
            throw new IllegalStateException("member key is required inside an object");
        }
        try {
            generator.writeFieldName(key);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        memberPending = true;
        return this;
    }

    public StructuredWriter addValue(String value) {
        if (!prepareScalar()) {
            return this;
        }
        try {
            if (value == null) {
                generator.writeNull();
            } else {
                generator.writeString(value);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return this;
    }

    public StructuredWriter addValue(long value) {
        if (!prepareScalar()) {
            return this;
        }
        try {
            generator.writeNumber(value);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return this;
    }

    public StructuredWriter addValue(double value) {
        if (!prepareScalar()) {
            return this;
        }
        try {
            generator.writeNumber(value);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return this;
    }

    public StructuredWriter addValue(boolean value) {
        if (!prepareScalar()) {
            return this;
        }
        try {
            generator.writeBoolean(value);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return this;
    }

    public StructuredWriter addNull() {
        if (!prepareScalar()) {
            return this;
        }
        try {
            generator.writeNull();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return this;
    }

    public StructuredWriter add(String key, String value) {
        return addMember(key).addValue(value);
    }

    public StructuredWriter add(String key, long value) {
        return addMember(key).addValue(value);
    }

    public StructuredWriter add(String key, double value) {
        return addMember(key).addValue(value);
    }

    public StructuredWriter add(String key, boolean value) {
        return addMember(key).addValue(value);
    }

    /**
     * Embeds the printed form of a plan or expression as a string.
     * Identifier quoting is switched off while the printer runs and restored afterwards.
     * If the printer fails the member is left out and the failure is only logged.
     *
     * @param key member name; ignored inside an array, and when a member added through
     *            {@link #addMember(String)} is still waiting for its value
     */
    public <P> StructuredWriter addQueryPlanSnapshot(String key, PlanPrinter<P> printer, P plan) {
        ensureWritable();
        Scope top = requireScope();
        if (top.isDiscarded()) {
            return this;
        }
        boolean keyed = top.requiresKey() && !memberPending;
        String text;
        try (FormattingOptions.FlagOverride ignored = formatting.suppressIdentifierQuoting()) {
            text = printer.print(plan);
        } catch (Exception e) {
            log.warn("trace.plan.print.fail key={} err={}", key, e.toString());
            // the member key is already out, so it gets null
            return memberPending ? addNull() : this;
        }
        if (keyed) {
            return text == null ? this : add(key, text);
        }
        if (text == null && !memberPending) {
            return this;
        }
        return addValue(text);
    }

    public int depth() {
        return scopes.size();
    }

    public boolean isInsideScope() {
        return !scopes.isEmpty();
    }

    public boolean isSealed() {
        return sealed;
    }

    /**
     * Current text of the document. While scopes are still open the text is a prefix of the final
     * document and is not balanced yet.
     */
    public String text() {
        if (sealed) {
            return buffer.toString();
        }
        try {
            generator.flush();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return buffer.toString();
    }

    /**
     * Closes any scope still open, then forbids further writes. Called by the owning document when it finishes.
     *
     * @return number of scopes that had to be closed here
     */
    public int seal() {
        if (sealed) {
            return 0;
        }
        int leaked = 0;
        while (!scopes.isEmpty()) {
            scopes.peek().close();
            leaked++;
        }
        sealed = true;
        try {
            generator.close();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return leaked;
    }

    void close(Scope scope) {
        if (scopes.peek() != scope) {
            throw new IllegalStateException("scope '" + scope.key() + "' closed out of order");
        }
        if (scope.isDiscarded()) {
            scopes.pop();
            return;
        }
        try {
            if (memberPending) {
                generator.writeNull();
                memberPending = false;
            }
            if (scope.requiresKey()) {
                generator.writeEndObject();
            } else {
                generator.writeEndArray();
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        scopes.pop();
    }

    private void prepareSlot(String key) {
        Scope top = scopes.peek();
        if (top.requiresKey()) {
            if (!memberPending) {
                addMember(key);
            } else if (key != null) {
                throw new IllegalStateException("scope '" + key + "' opened while another member awaits its value");
            }
        }
        memberPending = false;
    }

    /** Returns false when the value belongs to a discarded scope and must be dropped. */
    private boolean prepareScalar() {
        ensureWritable();
        Scope top = requireScope();
        if (top.isDiscarded()) {
            return false;
        }
        if (top.requiresKey() && !memberPending) {
            throw new IllegalStateException("value written inside an object without a member key");
        }
        memberPending = false;
        return true;
    }

    private boolean isDiscarding() {
        Scope top = scopes.peek();
        return top != null && top.isDiscarded();
    }

    private Scope requireScope() {
        Scope top = scopes.peek();
        if (top == null) {
            throw new IllegalStateException("trace content written outside of any scope");
        }
        return top;
    }

    private void ensureWritable() {
        if (sealed) {
            throw new IllegalStateException("trace document is already finished");
        }
    }

    @Override
    public String toString() {
        return text();
    }
}
