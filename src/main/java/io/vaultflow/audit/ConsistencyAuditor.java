package io.vaultflow.audit;

import io.vaultflow.codec.TaskFileCodec;
import io.vaultflow.config.VaultConfig;
import io.vaultflow.config.VaultSettings;
import io.vaultflow.engine.TaskStore;
import io.vaultflow.error.VaultException;
import io.vaultflow.graph.TransitionGraph;
import io.vaultflow.graph.VaultFolder;
import io.vaultflow.model.ApprovalStamp;
import io.vaultflow.model.StateHistoryEntry;
import io.vaultflow.model.TaskRecord;
import io.vaultflow.model.TaskState;
import io.vaultflow.util.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Read-only sweep that reports every task file whose directory, metadata and history
 * disagree. It uses the same {@link TransitionGraph} as the engine and never writes.
 */
public final class ConsistencyAuditor {
    private static final Logger log = LoggerFactory.getLogger(ConsistencyAuditor.class);

    private final VaultConfig config;
    private final VaultSettings settings;
    private final Clock clock;

    public ConsistencyAuditor(VaultConfig config, VaultSettings settings, Clock clock) {
        this.config = config;
        this.settings = settings;
        this.clock = clock;
    }

    public AuditReport run() {
        List<Violation> violations = new ArrayList<>();
        int checked = 0;
        for (VaultFolder folder : VaultFolder.values()) {
            Path dir = config.folder(folder);
            for (Path file : TaskStore.listTaskFiles(dir)) {
                String content;
                try {
                    content = Files.readString(file, StandardCharsets.UTF_8);
                } catch (NoSuchFileException e) {
                    // Moved by another process since the listing.
                    continue;
                } catch (IOException e) {
                    violations.add(new Violation(file, Violation.Rule.UNPARSEABLE, "unreadable: " + e.getMessage()));
                    checked++;
                    continue;
                }
                checked++;
                checkFile(file, folder, content, violations);
            }
            checkMarkers(dir, violations);
        }
        violations.sort(Comparator.comparing((Violation v) -> v.file().toString()).thenComparing(Violation::rule));
        log.info("Consistency check of {} finished: files={} violations={}", config.rootDir(), checked, violations.size());
        return new AuditReport(config.rootDir(), checked, violations);
    }

    private void checkFile(Path file, VaultFolder folder, String content, List<Violation> out) {
        TaskRecord record;
        try {
            record = TaskFileCodec.decode(content, file.toString());
        } catch (VaultException e) {
            out.add(new Violation(file, Violation.Rule.UNPARSEABLE, e.getMessage()));
            return;
        }
        TaskState state = record.state();
        if (!TransitionGraph.isLicensed(state, folder)) {
            out.add(new Violation(file, Violation.Rule.FOLDER_STATE_MISMATCH,
                    "declares state " + state + " but lives in " + folder.relativePath()
                            + "; licensed folders: " + TransitionGraph.foldersFor(state)));
        }
        checkHistory(file, record, out);
        if (state == TaskState.FAILED && record.retryCount() < settings.maxRetries()) {
            out.add(new Violation(file, Violation.Rule.RETRIES_NOT_EXHAUSTED,
                    "failed with retry_count=" + record.retryCount() + " below max_retries=" + settings.maxRetries()));
        }
        ApprovalStamp stamp = record.approval();
        if (stamp != null && folder == VaultFolder.APPROVALS && stamp.integrityHash() != null
                && !Hashing.matches(record.body(), stamp.integrityHash())) {
            out.add(new Violation(file, Violation.Rule.INTEGRITY_MISMATCH,
                    "approval " + stamp.approvalId() + " integrity_hash no longer matches the body"));
        }
    }

    private static void checkHistory(Path file, TaskRecord record, List<Violation> out) {
        List<StateHistoryEntry> history = record.stateHistory();
        if (history.isEmpty()) {
            out.add(new Violation(file, Violation.Rule.HISTORY_STATE_MISMATCH,
                    "state_history is empty but state is " + record.state()));
            return;
        }
        for (int i = 1; i < history.size(); i++) {
            StateHistoryEntry prev = history.get(i - 1);
            StateHistoryEntry next = history.get(i);
            if (next.timestamp().isBefore(prev.timestamp())) {
                out.add(new Violation(file, Violation.Rule.HISTORY_OUT_OF_ORDER,
                        "state_history[" + i + "] at " + next.timestamp() + " precedes " + prev.timestamp()));
            }
            if (!TransitionGraph.isAllowed(prev.state(), next.state())) {
                out.add(new Violation(file, Violation.Rule.ILLEGAL_HISTORY_EDGE,
                        "state_history[" + i + "] records " + prev.state() + " -> " + next.state()));
            }
        }
        StateHistoryEntry last = history.get(history.size() - 1);
        if (last.state() != record.state()) {
            out.add(new Violation(file, Violation.Rule.HISTORY_STATE_MISMATCH,
                    "last history entry is " + last.state() + " but state is " + record.state()));
        }
    }

    private void checkMarkers(Path dir, List<Violation> out) {
        if (!Files.isDirectory(dir)) {
            return;
        }
        Duration maxAge = settings.staleMarkerAge();
        Instant now = clock.instant();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, ".*")) {
            for (Path path : stream) {
                if (!TaskStore.isInFlightMarker(path)) {
                    continue;
                }
                Instant modified;
                try {
                    modified = Files.getLastModifiedTime(path).toInstant();
                } catch (NoSuchFileException e) {
                    // Relocation completed while listing.
                    continue;
                }
                if (modified.plus(maxAge).isBefore(now)) {
                    out.add(new Violation(path, Violation.Rule.STALE_MARKER,
                            "in-flight marker last modified " + modified + ", older than " + maxAge));
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to list directory: " + dir, e);
        }
    }
}
