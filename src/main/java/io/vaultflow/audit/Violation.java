package io.vaultflow.audit;

import java.nio.file.Path;

public record Violation(
        Path file,
        Rule rule,
        String message
) {
    public enum Rule {
        UNPARSEABLE,
        FOLDER_STATE_MISMATCH,
        HISTORY_OUT_OF_ORDER,
        ILLEGAL_HISTORY_EDGE,
        HISTORY_STATE_MISMATCH,
        RETRIES_NOT_EXHAUSTED,
        INTEGRITY_MISMATCH,
        STALE_MARKER
    }
}
