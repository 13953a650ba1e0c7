package io.vaultflow.orchestrator;

import io.vaultflow.graph.VaultFolder;
import io.vaultflow.model.TaskState;

/**
 * Counters for one sweep. {@code handledElsewhere} counts files that vanished between the
 * listing and the move; they are not failures. {@code awaitingDecision} counts approvals
 * that were skipped because nobody has decided them yet.
 */
public record SweepReport(
        VaultFolder folder,
        TaskState target,
        int scanned,
        int moved,
        int routedToApproval,
        int handledElsewhere,
        int awaitingDecision,
        int failed,
        boolean halted
) {
}
