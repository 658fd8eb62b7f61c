package com.zzf.optrace.trace.gate;

import java.util.Locale;
import java.util.Objects;

/**
 * A table or view the statement reads or writes.
 */
public final class TableReference {
    private final String schema;
    private final String name;

    public TableReference(String schema, String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("table name is blank");
        }
        this.schema = schema == null ? "" : schema.trim();
        this.name = name.trim();
    }

    public static TableReference of(String schema, String name) {
        return new TableReference(schema, name);
    }

    public String getSchema() {
        return schema;
    }

    public String getName() {
        return name;
    }

    /** Case-insensitive, like information_schema names. */
    public boolean refersTo(String otherSchema, String otherName) {
        return schema.toLowerCase(Locale.ROOT).equals(otherSchema == null ? "" : otherSchema.trim().toLowerCase(Locale.ROOT))
                && name.toLowerCase(Locale.ROOT).equals(otherName == null ? "" : otherName.trim().toLowerCase(Locale.ROOT));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TableReference)) {
            return false;
        }
        TableReference that = (TableReference) o;
        return schema.equals(that.schema) && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schema, name);
    }

    @Override
    public String toString() {
        return schema.isEmpty() ? name : schema + "." + name;
    }
}
