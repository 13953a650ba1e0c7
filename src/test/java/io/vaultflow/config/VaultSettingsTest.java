package io.vaultflow.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.stream.Stream;

final class VaultSettingsTest {

    @Test
    void missingFileMeansDefaults() throws Exception {
        Path root = Files.createTempDirectory("vaultflow-test-settings-default-");
        try {
            VaultSettings settings = VaultSettings.load(VaultConfig.fromRoot(root.toString()));

            Assertions.assertEquals(VaultSettings.defaults(), settings);
            Assertions.assertEquals(3, settings.maxRetries());
            Assertions.assertEquals(FailedTransitionPolicy.ENFORCE, settings.failedTransitionPolicy());
            Assertions.assertEquals(Duration.ofHours(12), settings.approvalTimeout());
            Assertions.assertEquals(Duration.ofMinutes(10), settings.staleMarkerAge());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void partialFileOverridesOnlyWhatItNames() throws Exception {
        Path root = Files.createTempDirectory("vaultflow-test-settings-partial-");
        try {
            VaultConfig config = VaultConfig.fromRoot(root.toString());
            Files.writeString(config.settingsFile(), """
                    {
                      "maxRetries": 5,
                      "failedTransitionPolicy": "warn",
                      "approvalKeywords": ["invoice"]
                    }
                    """, StandardCharsets.UTF_8);

            VaultSettings settings = VaultSettings.load(config);

            Assertions.assertEquals(5, settings.maxRetries());
            Assertions.assertEquals(FailedTransitionPolicy.WARN, settings.failedTransitionPolicy());
            Assertions.assertEquals(List.of("invoice"), settings.approvalKeywords());
            Assertions.assertEquals(VaultSettings.DEFAULT_APPROVAL_TIMEOUT_HOURS, settings.approvalTimeoutHours());
            Assertions.assertEquals(VaultSettings.DEFAULT_STALE_MARKER_MINUTES, settings.staleMarkerMinutes());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void invalidFilesAreErrorsNotSilentDefaults() throws Exception {
        Path root = Files.createTempDirectory("vaultflow-test-settings-invalid-");
        try {
            VaultConfig config = VaultConfig.fromRoot(root.toString());

            Files.writeString(config.settingsFile(), "{\"maxRetrys\": 2}", StandardCharsets.UTF_8);
            Assertions.assertThrows(RuntimeException.class, () -> VaultSettings.load(config));

            Files.writeString(config.settingsFile(), "{\"failedTransitionPolicy\": \"sometimes\"}", StandardCharsets.UTF_8);
            Assertions.assertThrows(IllegalArgumentException.class, () -> VaultSettings.load(config));

            Files.writeString(config.settingsFile(), "{\"approvalTimeoutHours\": 0}", StandardCharsets.UTF_8);
            Assertions.assertThrows(IllegalArgumentException.class, () -> VaultSettings.load(config));

            Files.writeString(config.settingsFile(), "{ not json", StandardCharsets.UTF_8);
            Assertions.assertThrows(RuntimeException.class, () -> VaultSettings.load(config));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void policyCanBeSwappedWithoutTouchingTheRest() {
        VaultSettings warn = VaultSettings.defaults().withFailedTransitionPolicy(FailedTransitionPolicy.WARN);

        Assertions.assertEquals(FailedTransitionPolicy.WARN, warn.failedTransitionPolicy());
        Assertions.assertEquals(VaultSettings.DEFAULT_APPROVAL_KEYWORDS, warn.approvalKeywords());
        Assertions.assertThrows(IllegalArgumentException.class, () -> new VaultSettings(-1, null, 1, null, 1));
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
