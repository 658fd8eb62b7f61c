package com.zzf.optrace.trace.gate;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Traces data-manipulation statements, SET, DO and CALL; everything else is ignored.
 */
public class DefaultCommandClassifier implements CommandClassifier {

    private static final Set<CommandKind> TRACEABLE = Collections.unmodifiableSet(EnumSet.of(
            CommandKind.SELECT,
            CommandKind.INSERT,
            CommandKind.INSERT_SELECT,
            CommandKind.UPDATE,
            CommandKind.UPDATE_MULTI,
            CommandKind.DELETE,
            CommandKind.DELETE_MULTI,
            CommandKind.REPLACE,
            CommandKind.REPLACE_SELECT,
            CommandKind.SET_OPTION,
            CommandKind.DO,
            CommandKind.CALL
    ));

    private final String traceVariable;

    public DefaultCommandClassifier(String traceVariable) {
        if (traceVariable == null || traceVariable.isBlank()) {
            throw new IllegalArgumentException("traceVariable is blank");
        }
        this.traceVariable = traceVariable.trim();
    }

    public static Set<CommandKind> traceableKinds() {
        return TRACEABLE;
    }

    @Override
    public boolean isTraceable(CommandKind kind) {
        return kind != null && TRACEABLE.contains(kind);
    }

    @Override
    public boolean isTraceFlagAssignment(CommandKind kind, List<VariableAssignment> assignments) {
        if (kind != CommandKind.SET_OPTION || assignments == null) {
            return false;
        }
        for (VariableAssignment assignment : assignments) {
            if (assignment != null
                    && assignment.isSystemVariable()
                    && traceVariable.equalsIgnoreCase(stripScope(assignment.getName()))) {
                return true;
            }
        }
        return false;
    }

    // SET SESSION x / SET @@session.x / SET GLOBAL x all name the same variable
    private static String stripScope(String name) {
        if (name == null) {
            return "";
        }
        String n = name.trim();
        if (n.startsWith("@@")) {
            n = n.substring(2);
        }
        int dot = n.indexOf('.');
        if (dot >= 0) {
            n = n.substring(dot + 1);
        }
        return n;
    }
}
