package io.vaultflow.observability;

public final class AuditActions {
    public static final String TASK_CREATED = "task_created";
    public static final String STATE_TRANSITION = "state_transition";
    public static final String APPROVAL_REQUESTED = "approval_requested";
    public static final String APPROVAL_APPROVED = "approval_approved";
    public static final String APPROVAL_REJECTED = "approval_rejected";
    public static final String APPROVAL_EXPIRED = "approval_expired";
    public static final String APPROVAL_REFUSED = "approval_refused";

    private AuditActions() {
    }
}
