package io.vaultflow.approval;

import io.vaultflow.model.ApprovalStatus;

public enum Decision {
    APPROVE(ApprovalStatus.APPROVED),
    REJECT(ApprovalStatus.REJECTED);

    private final ApprovalStatus status;

    Decision(ApprovalStatus status) {
        this.status = status;
    }

    public ApprovalStatus status() {
        return status;
    }
}
