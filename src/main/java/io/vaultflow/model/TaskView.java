package io.vaultflow.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Flat, printable projection of a task file for the CLI.
 */
public record TaskView(
        String taskId,
        String state,
        String priority,
        String file,
        int retryCount,
        String createdAt,
        String modifiedAt,
        List<String> history,
        String approvalId,
        String approvalStatus,
        String approvalExpiresAt
) {
    public static TaskView of(TaskFile task, Path vaultRoot) {
        TaskRecord r = task.record();
        Path path = task.path();
        String file = vaultRoot == null ? path.toString() : vaultRoot.relativize(path).toString().replace('\\', '/');
        List<String> history = r.stateHistory().stream()
                .map(e -> e.timestamp() + " " + e.state() + " by " + e.actor())
                .toList();
        ApprovalStamp a = r.approval();
        return new TaskView(
                r.id(),
                r.state().wireName(),
                r.priority().wireName(),
                file,
                r.retryCount(),
                r.createdAt().toString(),
                r.modifiedAt().toString(),
                history,
                a == null ? null : a.approvalId(),
                a == null ? null : a.status().wireName(),
                a == null ? null : a.expiresAt().toString()
        );
    }
}
