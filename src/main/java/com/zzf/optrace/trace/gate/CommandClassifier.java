package com.zzf.optrace.trace.gate;

import java.util.List;

/**
 * Knowledge about statement kinds that the gate needs but does not own.
 */
public interface CommandClassifier {

    boolean isTraceable(CommandKind kind);

    /** True if the statement assigns the variable that switches tracing on or off. */
    boolean isTraceFlagAssignment(CommandKind kind, List<VariableAssignment> assignments);
}
