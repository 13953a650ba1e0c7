package io.vaultflow.error;

/**
 * Refusal raised by the approval gate when a decision could indicate tampering or replay.
 */
public final class ApprovalSecurityException extends VaultException {
    private final String approvalId;

    public ApprovalSecurityException(ErrorKind kind, String approvalId, String message) {
        super(kind, message);
        if (!kind.securityRelevant()) {
            throw new IllegalArgumentException("Not an approval security kind: " + kind);
        }
        this.approvalId = approvalId;
    }

    public String approvalId() {
        return approvalId;
    }
}
