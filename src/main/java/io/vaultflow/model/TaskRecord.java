package io.vaultflow.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * In-memory form of one task file. Instances are immutable; every mutation returns a copy.
 */
public record TaskRecord(
        String id,
        TaskState state,
        Priority priority,
        Instant createdAt,
        Instant modifiedAt,
        int retryCount,
        List<StateHistoryEntry> stateHistory,
        ApprovalStamp approval,
        String body
) {
    public TaskRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(createdAt, "createdAt");
        priority = priority == null ? Priority.MEDIUM : priority;
        modifiedAt = modifiedAt == null ? createdAt : modifiedAt;
        if (retryCount < 0) {
            throw new IllegalArgumentException("retry_count must not be negative: " + retryCount);
        }
        stateHistory = stateHistory == null ? List.of() : List.copyOf(stateHistory);
        body = body == null ? "" : body;
    }

    public static TaskRecord create(String id, Priority priority, String body, String actor, Instant now) {
        return new TaskRecord(
                id,
                TaskState.ENTRY,
                priority,
                now,
                now,
                0,
                List.of(new StateHistoryEntry(TaskState.ENTRY, now, actor)),
                null,
                body
        );
    }

    public boolean isApproval() {
        return approval != null;
    }

    public StateHistoryEntry lastHistoryEntry() {
        return stateHistory.isEmpty() ? null : stateHistory.get(stateHistory.size() - 1);
    }

    /**
     * Returns a copy in {@code target} with exactly one history entry appended. The entry
     * timestamp is clamped so history stays non-decreasing even if the clock steps back.
     */
    public TaskRecord transitionedTo(TaskState target, String actor, Instant at) {
        Instant stamp = at;
        StateHistoryEntry last = lastHistoryEntry();
        if (last != null && last.timestamp().isAfter(stamp)) {
            stamp = last.timestamp();
        }
        List<StateHistoryEntry> history = new ArrayList<>(stateHistory);
        history.add(new StateHistoryEntry(target, stamp, actor));
        return new TaskRecord(id, target, priority, createdAt, stamp, retryCount, history, approval, body);
    }

    public TaskRecord withRetryCount(int value) {
        return new TaskRecord(id, state, priority, createdAt, modifiedAt, value, stateHistory, approval, body);
    }

    public TaskRecord withApproval(ApprovalStamp stamp, Instant at) {
        Instant modified = at.isBefore(modifiedAt) ? modifiedAt : at;
        return new TaskRecord(id, state, priority, createdAt, modified, retryCount, stateHistory, stamp, body);
    }
}
