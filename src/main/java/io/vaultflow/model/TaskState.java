package io.vaultflow.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum TaskState {
    ENTRY("inbox"),
    NEEDS_ACTION("needs_action"),
    IN_PROGRESS("in_progress"),
    PENDING_APPROVAL("pending_approval"),
    APPROVED("approved"),
    REJECTED("rejected"),
    DONE("done"),
    ERROR_QUEUE("error_queue"),
    FAILED("failed");

    private final String wireName;

    TaskState(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == DONE || this == REJECTED || this == FAILED;
    }

    /**
     * Strict lookup by the persisted name. Unknown values never map to a state.
     */
    @JsonCreator
    public static TaskState fromWire(String raw) {
        return lookup(raw).orElseThrow(() -> new IllegalArgumentException("Unknown task state: " + raw));
    }

    public static Optional<TaskState> lookup(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String value = raw.trim();
        for (TaskState state : values()) {
            if (state.wireName.equals(value)) {
                return Optional.of(state);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
