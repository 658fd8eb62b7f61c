package com.zzf.optrace.trace.gate;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultCommandClassifierTest {

    private final DefaultCommandClassifier classifier = new DefaultCommandClassifier("optimizer_trace");

    @Test
    void dmlSetDoAndCallAreTraceable() {
        assertEquals(12, DefaultCommandClassifier.traceableKinds().size());
        assertTrue(classifier.isTraceable(CommandKind.SELECT));
        assertTrue(classifier.isTraceable(CommandKind.UPDATE_MULTI));
        assertTrue(classifier.isTraceable(CommandKind.REPLACE_SELECT));
        assertTrue(classifier.isTraceable(CommandKind.SET_OPTION));
        assertTrue(classifier.isTraceable(CommandKind.CALL));
    }

    @Test
    void ddlAndShowAreNotTraceable() {
        assertFalse(classifier.isTraceable(CommandKind.SHOW));
        assertFalse(classifier.isTraceable(CommandKind.CREATE_TABLE));
        assertFalse(classifier.isTraceable(CommandKind.COMMIT));
        assertFalse(classifier.isTraceable(null));
    }

    @Test
    void recognisesTraceVariableInAnyScopeSpelling() {
        assertTrue(classifier.isTraceFlagAssignment(CommandKind.SET_OPTION,
                List.of(VariableAssignment.system("optimizer_trace", "enabled=on"))));
        assertTrue(classifier.isTraceFlagAssignment(CommandKind.SET_OPTION,
                List.of(VariableAssignment.system("@@session.OPTIMIZER_TRACE", "enabled=off"))));
        assertTrue(classifier.isTraceFlagAssignment(CommandKind.SET_OPTION,
                List.of(VariableAssignment.system("sql_mode", "''"), VariableAssignment.system("optimizer_trace", "default"))));
    }

    @Test
    void otherAssignmentsDoNotCount() {
        assertFalse(classifier.isTraceFlagAssignment(CommandKind.SET_OPTION,
                List.of(VariableAssignment.user("optimizer_trace", "1"))));
        assertFalse(classifier.isTraceFlagAssignment(CommandKind.SET_OPTION,
                List.of(VariableAssignment.system("optimizer_switch", "index_merge=off"))));
        assertFalse(classifier.isTraceFlagAssignment(CommandKind.SELECT,
                List.of(VariableAssignment.system("optimizer_trace", "enabled=on"))));
        assertFalse(classifier.isTraceFlagAssignment(CommandKind.SET_OPTION, null));
    }

    @Test
    void rejectsBlankVariableName() {
        assertThrows(IllegalArgumentException.class, () -> new DefaultCommandClassifier(" "));
    }
}
