package io.vaultflow.config;

/**
 * What the relocator does with {@code error_queue -> failed} while retries remain.
 */
public enum FailedTransitionPolicy {
    /** Refuse the move. */
    ENFORCE,
    /** Allow the move but log and audit a warning. */
    WARN;

    public static FailedTransitionPolicy fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return ENFORCE;
        }
        for (FailedTransitionPolicy value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown failed transition policy: " + raw);
    }
}
