package io.vaultflow.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.vaultflow.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

public record VaultSettings(
        int maxRetries,
        FailedTransitionPolicy failedTransitionPolicy,
        long approvalTimeoutHours,
        List<String> approvalKeywords,
        long staleMarkerMinutes
) {
    private static final Logger log = LoggerFactory.getLogger(VaultSettings.class);

    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final long DEFAULT_APPROVAL_TIMEOUT_HOURS = 12L;
    public static final long DEFAULT_STALE_MARKER_MINUTES = 10L;
    public static final List<String> DEFAULT_APPROVAL_KEYWORDS = List.of("payment", "wire", "deploy", "delete", "email");

    public VaultSettings {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
        if (approvalTimeoutHours <= 0L) {
            throw new IllegalArgumentException("approvalTimeoutHours must be positive: " + approvalTimeoutHours);
        }
        if (staleMarkerMinutes <= 0L) {
            throw new IllegalArgumentException("staleMarkerMinutes must be positive: " + staleMarkerMinutes);
        }
        failedTransitionPolicy = failedTransitionPolicy == null ? FailedTransitionPolicy.ENFORCE : failedTransitionPolicy;
        approvalKeywords = approvalKeywords == null ? List.of() : List.copyOf(approvalKeywords);
    }

    public static VaultSettings defaults() {
        return new VaultSettings(
                DEFAULT_MAX_RETRIES,
                FailedTransitionPolicy.ENFORCE,
                DEFAULT_APPROVAL_TIMEOUT_HOURS,
                DEFAULT_APPROVAL_KEYWORDS,
                DEFAULT_STALE_MARKER_MINUTES
        );
    }

    /**
     * Reads {@code vaultflow-settings.json} from the vault root. Missing file means defaults;
     * an unreadable or invalid file is an error rather than a silent fallback.
     */
    public static VaultSettings load(VaultConfig config) {
        Path file = config.settingsFile();
        if (!Files.exists(file)) {
            return defaults();
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            VaultSettings resolved = fromFile(raw, defaults());
            log.debug("Loaded vault settings from {}: {}", file, resolved);
            return resolved;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read vault settings: " + file, e);
        }
    }

    public Duration approvalTimeout() {
        return Duration.ofHours(approvalTimeoutHours);
    }

    public Duration staleMarkerAge() {
        return Duration.ofMinutes(staleMarkerMinutes);
    }

    public VaultSettings withFailedTransitionPolicy(FailedTransitionPolicy policy) {
        return new VaultSettings(maxRetries, policy, approvalTimeoutHours, approvalKeywords, staleMarkerMinutes);
    }

    static VaultSettings fromFile(SettingsFile file, VaultSettings defaults) {
        if (file == null) {
            return defaults;
        }
        return new VaultSettings(
                file.maxRetries() == null ? defaults.maxRetries() : file.maxRetries(),
                file.failedTransitionPolicy() == null
                        ? defaults.failedTransitionPolicy()
                        : FailedTransitionPolicy.fromString(file.failedTransitionPolicy()),
                file.approvalTimeoutHours() == null ? defaults.approvalTimeoutHours() : file.approvalTimeoutHours(),
                file.approvalKeywords() == null ? defaults.approvalKeywords() : file.approvalKeywords(),
                file.staleMarkerMinutes() == null ? defaults.staleMarkerMinutes() : file.staleMarkerMinutes()
        );
    }

    @JsonIgnoreProperties(ignoreUnknown = false)
    record SettingsFile(
            Integer maxRetries,
            String failedTransitionPolicy,
            Long approvalTimeoutHours,
            List<String> approvalKeywords,
            Long staleMarkerMinutes
    ) {
    }
}
