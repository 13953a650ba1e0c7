package io.vaultflow.config;

import io.vaultflow.graph.VaultFolder;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class VaultConfig {
    public static final String DEFAULT_ROOT = "vault";
    public static final String SETTINGS_FILE = "vaultflow-settings.json";
    public static final String STOP_FILE = ".stop";

    private final Path rootDir;

    public VaultConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static VaultConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new VaultConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path folder(VaultFolder folder) {
        return folder.resolve(rootDir);
    }

    public Path inboxDir() {
        return folder(VaultFolder.INBOX);
    }

    public Path needsActionDir() {
        return folder(VaultFolder.NEEDS_ACTION);
    }

    public Path errorsDir() {
        return folder(VaultFolder.ERRORS);
    }

    public Path inProgressDir() {
        return folder(VaultFolder.IN_PROGRESS);
    }

    public Path approvalsDir() {
        return folder(VaultFolder.APPROVALS);
    }

    public Path doneDir() {
        return folder(VaultFolder.DONE);
    }

    public Path logsDir() {
        return rootDir.resolve("Logs");
    }

    public Path internalDir() {
        return rootDir.resolve(".vault");
    }

    public Path consumedNoncesFile() {
        return internalDir().resolve("consumed-nonces.txt");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path stopFile() {
        return rootDir.resolve(STOP_FILE);
    }
}
