package io.vaultflow.graph;

import io.vaultflow.model.TaskState;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Canonical transition and directory tables shared by the engine and the consistency auditor.
 *
 * <p>Both tables are built once and never mutated, so every method is safe to call from
 * any thread without locking. Every lookup fails closed: {@code null}, unknown values and
 * self-transitions are never allowed.
 */
public final class TransitionGraph {
    private static final Map<TaskState, Set<TaskState>> EDGES = buildEdges();
    private static final Map<TaskState, Set<VaultFolder>> FOLDERS = buildFolders();
    private static final Map<TaskState, VaultFolder> PRIMARY_FOLDER = buildPrimaryFolders();

    private TransitionGraph() {
    }

    public static boolean isAllowed(TaskState from, TaskState to) {
        if (from == null || to == null || from == to) {
            return false;
        }
        return EDGES.get(from).contains(to);
    }

    public static boolean isAllowed(String from, String to) {
        Optional<TaskState> fromState = TaskState.lookup(from);
        Optional<TaskState> toState = TaskState.lookup(to);
        return fromState.isPresent() && toState.isPresent() && isAllowed(fromState.get(), toState.get());
    }

    public static Set<TaskState> allowedTargets(TaskState from) {
        if (from == null) {
            return Set.of();
        }
        return EDGES.get(from);
    }

    public static Set<VaultFolder> foldersFor(TaskState state) {
        if (state == null) {
            return Set.of();
        }
        return FOLDERS.get(state);
    }

    public static VaultFolder primaryFolder(TaskState state) {
        if (state == null) {
            throw new IllegalArgumentException("state must not be null");
        }
        return PRIMARY_FOLDER.get(state);
    }

    public static boolean isLicensed(TaskState state, VaultFolder folder) {
        return folder != null && foldersFor(state).contains(folder);
    }

    public static Set<TaskState> statesLicensedIn(VaultFolder folder) {
        EnumSet<TaskState> out = EnumSet.noneOf(TaskState.class);
        for (Map.Entry<TaskState, Set<VaultFolder>> entry : FOLDERS.entrySet()) {
            if (entry.getValue().contains(folder)) {
                out.add(entry.getKey());
            }
        }
        return Collections.unmodifiableSet(out);
    }

    public static boolean isTerminal(TaskState state) {
        return state != null && state.isTerminal();
    }

    /**
     * Edges leaving {@code pending_approval} need a decision recorded on the approval stamp.
     */
    public static boolean requiresApproval(TaskState from, TaskState to) {
        return from == TaskState.PENDING_APPROVAL && isAllowed(from, to);
    }

    private static Map<TaskState, Set<TaskState>> buildEdges() {
        EnumMap<TaskState, Set<TaskState>> edges = new EnumMap<>(TaskState.class);
        for (TaskState state : TaskState.values()) {
            edges.put(state, Set.of());
        }
        edges.put(TaskState.ENTRY, immutable(TaskState.NEEDS_ACTION, TaskState.PENDING_APPROVAL));
        edges.put(TaskState.NEEDS_ACTION, immutable(TaskState.IN_PROGRESS, TaskState.PENDING_APPROVAL, TaskState.ERROR_QUEUE));
        edges.put(TaskState.IN_PROGRESS, immutable(TaskState.DONE, TaskState.PENDING_APPROVAL, TaskState.ERROR_QUEUE));
        edges.put(TaskState.PENDING_APPROVAL, immutable(TaskState.IN_PROGRESS, TaskState.REJECTED));
        edges.put(TaskState.ERROR_QUEUE, immutable(TaskState.NEEDS_ACTION, TaskState.FAILED));
        return Collections.unmodifiableMap(edges);
    }

    private static Map<TaskState, Set<VaultFolder>> buildFolders() {
        EnumMap<TaskState, Set<VaultFolder>> folders = new EnumMap<>(TaskState.class);
        folders.put(TaskState.ENTRY, Set.of(VaultFolder.INBOX));
        folders.put(TaskState.NEEDS_ACTION, Set.of(VaultFolder.NEEDS_ACTION));
        folders.put(TaskState.ERROR_QUEUE, Set.of(VaultFolder.NEEDS_ACTION, VaultFolder.ERRORS));
        folders.put(TaskState.IN_PROGRESS, Set.of(VaultFolder.IN_PROGRESS));
        folders.put(TaskState.PENDING_APPROVAL, Set.of(VaultFolder.APPROVALS));
        folders.put(TaskState.APPROVED, Set.of(VaultFolder.APPROVALS));
        folders.put(TaskState.DONE, Set.of(VaultFolder.DONE));
        folders.put(TaskState.REJECTED, Set.of(VaultFolder.DONE));
        folders.put(TaskState.FAILED, Set.of(VaultFolder.DONE));
        return Collections.unmodifiableMap(folders);
    }

    private static Map<TaskState, VaultFolder> buildPrimaryFolders() {
        EnumMap<TaskState, VaultFolder> primary = new EnumMap<>(TaskState.class);
        primary.put(TaskState.ENTRY, VaultFolder.INBOX);
        primary.put(TaskState.NEEDS_ACTION, VaultFolder.NEEDS_ACTION);
        primary.put(TaskState.ERROR_QUEUE, VaultFolder.ERRORS);
        primary.put(TaskState.IN_PROGRESS, VaultFolder.IN_PROGRESS);
        primary.put(TaskState.PENDING_APPROVAL, VaultFolder.APPROVALS);
        primary.put(TaskState.APPROVED, VaultFolder.APPROVALS);
        primary.put(TaskState.DONE, VaultFolder.DONE);
        primary.put(TaskState.REJECTED, VaultFolder.DONE);
        primary.put(TaskState.FAILED, VaultFolder.DONE);
        return Collections.unmodifiableMap(primary);
    }

    private static Set<TaskState> immutable(TaskState first, TaskState... rest) {
        return Collections.unmodifiableSet(EnumSet.of(first, rest));
    }
}
