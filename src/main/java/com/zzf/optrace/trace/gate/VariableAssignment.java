package com.zzf.optrace.trace.gate;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * One {@code name = value} item of a SET statement.
 */
@Data
@AllArgsConstructor
public class VariableAssignment {
    private String name;
    private String value;
    /** False for user variables ({@code @x}), which never affect server behaviour. */
    private boolean systemVariable;

    public static VariableAssignment system(String name, String value) {
        return new VariableAssignment(name, value, true);
    }

    public static VariableAssignment user(String name, String value) {
        return new VariableAssignment(name, value, false);
    }
}
