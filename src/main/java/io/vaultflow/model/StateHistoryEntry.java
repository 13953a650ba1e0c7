package io.vaultflow.model;

import java.time.Instant;
import java.util.Objects;

public record StateHistoryEntry(
        TaskState state,
        Instant timestamp,
        String actor
) {
    public StateHistoryEntry {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(timestamp, "timestamp");
        actor = actor == null || actor.isBlank() ? Actors.SYSTEM : actor.trim();
    }
}
