package io.vaultflow.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Approval metadata carried by a task waiting in {@link TaskState#PENDING_APPROVAL}.
 *
 * <p>{@code taskId} is a back-reference to the gated task, not ownership.
 * {@code integrityHash} is the SHA-256 of the body at issuance and may be {@code null}
 * for hand-written approvals, in which case no content check is possible.
 */
public record ApprovalStamp(
        String approvalId,
        String taskId,
        String nonce,
        String integrityHash,
        ApprovalStatus status,
        Instant createdAt,
        Instant expiresAt,
        String rejectionReason,
        Instant reviewedAt,
        String reviewedBy
) {
    public ApprovalStamp {
        Objects.requireNonNull(approvalId, "approvalId");
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(expiresAt, "expiresAt");
    }

    public static ApprovalStamp issue(
            String approvalId,
            String taskId,
            String nonce,
            String integrityHash,
            Instant createdAt,
            Instant expiresAt
    ) {
        return new ApprovalStamp(approvalId, taskId, nonce, integrityHash, ApprovalStatus.PENDING,
                createdAt, expiresAt, null, null, null);
    }

    public boolean isPending() {
        return status == ApprovalStatus.PENDING;
    }

    public boolean isExpiredAt(Instant now) {
        return !expiresAt.isAfter(now);
    }

    public ApprovalStamp decided(ApprovalStatus decision, String actor, String reason, Instant at) {
        String rejection = decision == ApprovalStatus.REJECTED ? reason : rejectionReason;
        return new ApprovalStamp(approvalId, taskId, nonce, integrityHash, decision,
                createdAt, expiresAt, rejection, at, actor);
    }

    public ApprovalStamp expired() {
        return new ApprovalStamp(approvalId, taskId, nonce, integrityHash, ApprovalStatus.EXPIRED,
                createdAt, expiresAt, rejectionReason, reviewedAt, Actors.SYSTEM);
    }
}
