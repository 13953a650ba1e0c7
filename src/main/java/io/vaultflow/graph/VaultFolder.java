package io.vaultflow.graph;

import java.nio.file.Path;
import java.util.Optional;

public enum VaultFolder {
    INBOX("Inbox"),
    NEEDS_ACTION("Needs_Action"),
    ERRORS("Needs_Action/Errors"),
    IN_PROGRESS("In_Progress"),
    APPROVALS("Approvals"),
    DONE("Done");

    private final String relativePath;

    VaultFolder(String relativePath) {
        this.relativePath = relativePath;
    }

    public String relativePath() {
        return relativePath;
    }

    public Path resolve(Path vaultRoot) {
        return vaultRoot.resolve(relativePath);
    }

    public static Optional<VaultFolder> lookup(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String value = raw.trim();
        for (VaultFolder folder : values()) {
            if (folder.name().equalsIgnoreCase(value) || folder.relativePath.equalsIgnoreCase(value)) {
                return Optional.of(folder);
            }
        }
        return Optional.empty();
    }

    /**
     * Maps a directory back to its folder, or empty when the path is not a state directory.
     */
    public static Optional<VaultFolder> of(Path vaultRoot, Path directory) {
        Path normalized = directory.toAbsolutePath().normalize();
        for (VaultFolder folder : values()) {
            if (folder.resolve(vaultRoot).toAbsolutePath().normalize().equals(normalized)) {
                return Optional.of(folder);
            }
        }
        return Optional.empty();
    }
}
