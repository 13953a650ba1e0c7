package io.vaultflow.model;

import java.nio.file.Path;

/**
 * A decoded task together with where it was read from and the exact text that was read.
 * The raw text lets the relocator detect a concurrent edit between read and claim.
 */
public record TaskFile(
        Path path,
        TaskRecord record,
        String rawContent
) {
    public String fileName() {
        return path.getFileName().toString();
    }
}
