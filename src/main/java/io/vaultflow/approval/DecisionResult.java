package io.vaultflow.approval;

import io.vaultflow.engine.RelocationResult;
import io.vaultflow.model.TaskFile;

/**
 * Result of {@link ApprovalGate#decide}. {@code followUp} is only set by
 * {@link ApprovalGate#resolve}, which also performs the move that the decision licenses.
 */
public record DecisionResult(
        DecisionOutcome outcome,
        TaskFile task,
        RelocationResult followUp
) {
    public enum DecisionOutcome {
        APPROVED,
        REJECTED,
        ALREADY_DECIDED
    }

    static DecisionResult of(DecisionOutcome outcome, TaskFile task) {
        return new DecisionResult(outcome, task, null);
    }

    DecisionResult withFollowUp(RelocationResult relocation) {
        return new DecisionResult(outcome, relocation.applied() ? relocation.task() : task, relocation);
    }
}
