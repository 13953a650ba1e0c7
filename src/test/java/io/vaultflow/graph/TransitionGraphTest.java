package io.vaultflow.graph;

import io.vaultflow.model.TaskState;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

final class TransitionGraphTest {

    // Hand-written copy of the documented lifecycle table. Any drift in the graph fails here.
    private static final Map<TaskState, Set<TaskState>> EXPECTED = expected();

    @Test
    void edgesMatchDocumentedTableExactly() {
        for (TaskState from : TaskState.values()) {
            for (TaskState to : TaskState.values()) {
                boolean expected = EXPECTED.get(from).contains(to);
                Assertions.assertEquals(expected, TransitionGraph.isAllowed(from, to), from + " -> " + to);
            }
            Assertions.assertEquals(EXPECTED.get(from), TransitionGraph.allowedTargets(from), "targets of " + from);
        }
    }

    @Test
    void selfTransitionsAreNeverAllowed() {
        for (TaskState state : TaskState.values()) {
            Assertions.assertFalse(TransitionGraph.isAllowed(state, state), state.wireName());
        }
    }

    @Test
    void terminalStatesHaveNoOutgoingEdges() {
        for (TaskState state : EnumSet.of(TaskState.DONE, TaskState.REJECTED, TaskState.FAILED)) {
            Assertions.assertTrue(TransitionGraph.isTerminal(state));
            Assertions.assertTrue(TransitionGraph.allowedTargets(state).isEmpty());
        }
        Assertions.assertFalse(TransitionGraph.isTerminal(TaskState.APPROVED));
        Assertions.assertTrue(TransitionGraph.allowedTargets(TaskState.APPROVED).isEmpty());
    }

    @Test
    void unknownAndNullValuesFailClosed() {
        Assertions.assertFalse(TransitionGraph.isAllowed((TaskState) null, TaskState.DONE));
        Assertions.assertFalse(TransitionGraph.isAllowed(TaskState.IN_PROGRESS, null));
        Assertions.assertFalse(TransitionGraph.isAllowed("in_progress", "finished"));
        Assertions.assertFalse(TransitionGraph.isAllowed("IN_PROGRESS", "done"));
        Assertions.assertFalse(TransitionGraph.isAllowed((String) null, "done"));
        Assertions.assertTrue(TransitionGraph.isAllowed("in_progress", "done"));
        Assertions.assertTrue(TransitionGraph.foldersFor(null).isEmpty());
        Assertions.assertTrue(TransitionGraph.allowedTargets(null).isEmpty());
    }

    @Test
    void folderLicensingFollowsDirectoryTable() {
        Assertions.assertEquals(Set.of(VaultFolder.INBOX), TransitionGraph.foldersFor(TaskState.ENTRY));
        Assertions.assertEquals(Set.of(VaultFolder.NEEDS_ACTION, VaultFolder.ERRORS), TransitionGraph.foldersFor(TaskState.ERROR_QUEUE));
        Assertions.assertEquals(Set.of(VaultFolder.APPROVALS), TransitionGraph.foldersFor(TaskState.APPROVED));
        Assertions.assertEquals(VaultFolder.ERRORS, TransitionGraph.primaryFolder(TaskState.ERROR_QUEUE));
        Assertions.assertEquals(
                EnumSet.of(TaskState.DONE, TaskState.REJECTED, TaskState.FAILED),
                TransitionGraph.statesLicensedIn(VaultFolder.DONE)
        );
        Assertions.assertFalse(TransitionGraph.isLicensed(TaskState.IN_PROGRESS, VaultFolder.DONE));
        for (TaskState state : TaskState.values()) {
            Assertions.assertTrue(TransitionGraph.isLicensed(state, TransitionGraph.primaryFolder(state)), state.wireName());
        }
    }

    @Test
    void onlyEdgesLeavingPendingApprovalNeedADecision() {
        Assertions.assertTrue(TransitionGraph.requiresApproval(TaskState.PENDING_APPROVAL, TaskState.IN_PROGRESS));
        Assertions.assertTrue(TransitionGraph.requiresApproval(TaskState.PENDING_APPROVAL, TaskState.REJECTED));
        Assertions.assertFalse(TransitionGraph.requiresApproval(TaskState.PENDING_APPROVAL, TaskState.DONE));
        Assertions.assertFalse(TransitionGraph.requiresApproval(TaskState.NEEDS_ACTION, TaskState.IN_PROGRESS));
    }

    @Test
    void tablesCannotBeMutated() {
        Set<TaskState> targets = TransitionGraph.allowedTargets(TaskState.ENTRY);
        Assertions.assertThrows(UnsupportedOperationException.class, () -> targets.add(TaskState.DONE));
        Set<VaultFolder> folders = TransitionGraph.foldersFor(TaskState.DONE);
        Assertions.assertThrows(UnsupportedOperationException.class, () -> folders.add(VaultFolder.INBOX));
    }

    private static Map<TaskState, Set<TaskState>> expected() {
        Map<TaskState, Set<TaskState>> table = new EnumMap<>(TaskState.class);
        for (TaskState state : TaskState.values()) {
            table.put(state, EnumSet.noneOf(TaskState.class));
        }
        table.put(TaskState.ENTRY, EnumSet.of(TaskState.NEEDS_ACTION, TaskState.PENDING_APPROVAL));
        table.put(TaskState.NEEDS_ACTION, EnumSet.of(TaskState.IN_PROGRESS, TaskState.PENDING_APPROVAL, TaskState.ERROR_QUEUE));
        table.put(TaskState.IN_PROGRESS, EnumSet.of(TaskState.DONE, TaskState.PENDING_APPROVAL, TaskState.ERROR_QUEUE));
        table.put(TaskState.PENDING_APPROVAL, EnumSet.of(TaskState.IN_PROGRESS, TaskState.REJECTED));
        table.put(TaskState.ERROR_QUEUE, EnumSet.of(TaskState.NEEDS_ACTION, TaskState.FAILED));
        return table;
    }
}
