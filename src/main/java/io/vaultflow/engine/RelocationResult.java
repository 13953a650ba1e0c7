package io.vaultflow.engine;

import io.vaultflow.model.TaskFile;

/**
 * Outcome of a relocation or in-place rewrite. For {@link Outcome#ALREADY_HANDLED} the
 * task is the stale copy the caller passed in: another process got to the file first.
 */
public record RelocationResult(
        Outcome outcome,
        TaskFile task
) {
    public enum Outcome {
        MOVED,
        REWRITTEN,
        ALREADY_HANDLED
    }

    public boolean applied() {
        return outcome != Outcome.ALREADY_HANDLED;
    }
}
