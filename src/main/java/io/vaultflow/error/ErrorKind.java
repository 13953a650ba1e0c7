package io.vaultflow.error;

public enum ErrorKind {
    INVALID_TRANSITION(Category.RULE, 2),
    FOLDER_MISMATCH(Category.RULE, 2),
    APPROVAL_REQUIRED(Category.RULE, 2),
    RETRIES_NOT_EXHAUSTED(Category.RULE, 2),
    MALFORMED_TASK_FILE(Category.RULE, 2),
    TASK_NOT_FOUND(Category.RULE, 2),
    TASK_EXISTS(Category.RULE, 2),
    FILE_OPERATION(Category.INFRASTRUCTURE, 3),
    STALE_READ(Category.INFRASTRUCTURE, 3),
    APPROVAL_EXPIRED(Category.SECURITY, 4),
    MALFORMED_NONCE(Category.SECURITY, 4),
    NONCE_REPLAYED(Category.SECURITY, 4),
    INTEGRITY_MISMATCH(Category.SECURITY, 4);

    public enum Category {
        RULE,
        INFRASTRUCTURE,
        SECURITY
    }

    private final Category category;
    private final int exitCode;

    ErrorKind(Category category, int exitCode) {
        this.category = category;
        this.exitCode = exitCode;
    }

    public Category category() {
        return category;
    }

    public int exitCode() {
        return exitCode;
    }

    /**
     * Only infrastructure failures leave the source untouched and may be retried verbatim.
     */
    public boolean retryable() {
        return category == Category.INFRASTRUCTURE;
    }

    public boolean securityRelevant() {
        return category == Category.SECURITY;
    }
}
