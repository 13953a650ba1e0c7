package io.vaultflow.engine;

import io.vaultflow.codec.TaskFileCodec;
import io.vaultflow.config.FailedTransitionPolicy;
import io.vaultflow.config.VaultConfig;
import io.vaultflow.config.VaultSettings;
import io.vaultflow.error.ApprovalSecurityException;
import io.vaultflow.error.ErrorKind;
import io.vaultflow.error.FileOperationException;
import io.vaultflow.error.VaultException;
import io.vaultflow.graph.TransitionGraph;
import io.vaultflow.graph.VaultFolder;
import io.vaultflow.model.ApprovalStamp;
import io.vaultflow.model.ApprovalStatus;
import io.vaultflow.model.TaskFile;
import io.vaultflow.model.TaskRecord;
import io.vaultflow.model.TaskState;
import io.vaultflow.observability.AuditActions;
import io.vaultflow.observability.AuditEvent;
import io.vaultflow.observability.AuditLogger;
import io.vaultflow.util.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * The only writer of existing task files.
 *
 * <p>A relocation writes the updated record to a hidden temp file in the destination
 * directory, claims the source by renaming it to a hidden in-flight marker, publishes
 * the temp file under its final name and finally drops the marker. The claim rename is
 * the arbitration point between processes: whoever renames the source first owns the
 * transition, and a loser sees the source gone and gets
 * {@link RelocationResult.Outcome#ALREADY_HANDLED}. Any failure after the claim renames
 * the marker back, so the source is left byte-for-byte as it was and no destination file
 * remains.
 */
public final class TaskRelocator {
    private static final Logger log = LoggerFactory.getLogger(TaskRelocator.class);

    private final VaultConfig config;
    private final VaultSettings settings;
    private final FileOperations files;
    private final AuditLogger auditLogger;
    private final Clock clock;

    public TaskRelocator(VaultConfig config, VaultSettings settings, FileOperations files,
                         AuditLogger auditLogger, Clock clock) {
        this.config = config;
        this.settings = settings;
        this.files = files;
        this.auditLogger = auditLogger;
        this.clock = clock;
    }

    public RelocationResult move(TaskFile task, TaskState toState, String reason, String actor) {
        return move(task, toState, TransitionGraph.primaryFolder(toState), reason, actor, UnaryOperator.identity());
    }

    public RelocationResult move(TaskFile task, TaskState toState, VaultFolder destination, String reason, String actor) {
        return move(task, toState, destination, reason, actor, UnaryOperator.identity());
    }

    /**
     * Moves {@code task} to {@code toState} in {@code destination}.
     *
     * @param amendment applied to the transitioned record before it is written; it may attach
     *                  metadata such as an approval stamp but must keep id, state and history
     */
    public RelocationResult move(
            TaskFile task,
            TaskState toState,
            VaultFolder destination,
            String reason,
            String actor,
            UnaryOperator<TaskRecord> amendment
    ) {
        Objects.requireNonNull(task, "task");
        TaskRecord current = task.record();
        TaskState fromState = current.state();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("file", task.fileName());
        details.put("destination", destination == null ? null : destination.relativePath());
        try {
            validate(task, toState, destination);
            String warning = checkRetryBudget(current, toState);
            if (warning != null) {
                details.put("warning", warning);
            }

            TaskRecord updated = current.transitionedTo(toState, actor, clock.instant());
            if (fromState == TaskState.ERROR_QUEUE && toState == TaskState.NEEDS_ACTION) {
                updated = updated.withRetryCount(current.retryCount() + 1);
            }
            if (toState == TaskState.PENDING_APPROVAL && updated.isApproval() && !updated.approval().isPending()) {
                // A decision from an earlier approval round never carries over.
                updated = updated.withApproval(null, updated.modifiedAt());
            }
            TaskRecord amended = amendment.apply(updated);
            requireSameTransition(updated, amended);

            RelocationResult result = commit(task, amended, config.folder(destination), RelocationResult.Outcome.MOVED);
            if (!result.applied()) {
                log.info("Task {} vanished from {} before {} -> {}; already handled elsewhere",
                        current.id(), task.path().getParent(), fromState, toState);
                return result;
            }
            details.put("retry_count", amended.retryCount());
            AuditEvent event = warning == null
                    ? AuditEvent.success(AuditActions.STATE_TRANSITION, current.id(), fromState, toState, actor, reason, details)
                    : AuditEvent.warning(AuditActions.STATE_TRANSITION, current.id(), fromState, toState, actor, reason, warning, details);
            auditLogger.record(event);
            log.debug("Moved task {} {} -> {} into {}", current.id(), fromState, toState, destination);
            return result;
        } catch (VaultException e) {
            auditFailure(e, current.id(), fromState, toState, actor, reason, details);
            throw e;
        }
    }

    /**
     * Rewrites a task in its current directory without changing its state. Used for approval
     * stamping and expiry. Auditing is the caller's concern.
     */
    public RelocationResult rewrite(TaskFile task, UnaryOperator<TaskRecord> change) {
        Objects.requireNonNull(task, "task");
        TaskRecord updated = change.apply(task.record());
        requireSameTransition(task.record(), updated);
        return commit(task, updated, task.path().getParent(), RelocationResult.Outcome.REWRITTEN);
    }

    private void validate(TaskFile task, TaskState toState, VaultFolder destination) {
        TaskRecord record = task.record();
        TaskState fromState = record.state();
        if (!TransitionGraph.isAllowed(fromState, toState)) {
            throw new VaultException(ErrorKind.INVALID_TRANSITION,
                    "Illegal transition " + fromState + " -> " + toState + " for task " + record.id()
                            + "; allowed from " + fromState + ": " + TransitionGraph.allowedTargets(fromState));
        }
        Optional<VaultFolder> sourceFolder = VaultFolder.of(config.rootDir(), task.path().getParent());
        if (sourceFolder.isEmpty() || !TransitionGraph.isLicensed(fromState, sourceFolder.get())) {
            throw new VaultException(ErrorKind.FOLDER_MISMATCH,
                    "Task " + record.id() + " declares state " + fromState + " but lives in "
                            + sourceFolder.map(VaultFolder::relativePath).orElse(String.valueOf(task.path().getParent()))
                            + "; licensed folders: " + TransitionGraph.foldersFor(fromState));
        }
        if (destination == null || !TransitionGraph.isLicensed(toState, destination)) {
            throw new VaultException(ErrorKind.FOLDER_MISMATCH,
                    "Folder " + (destination == null ? "<none>" : destination.relativePath())
                            + " is not licensed for state " + toState
                            + "; licensed folders: " + TransitionGraph.foldersFor(toState));
        }
        if (TransitionGraph.requiresApproval(fromState, toState)) {
            checkApproval(record, toState);
        }
    }

    private void checkApproval(TaskRecord record, TaskState toState) {
        ApprovalStamp stamp = record.approval();
        if (stamp == null) {
            throw new VaultException(ErrorKind.APPROVAL_REQUIRED,
                    "Task " + record.id() + " has no approval stamp; " + TaskState.PENDING_APPROVAL + " -> " + toState
                            + " needs a recorded decision");
        }
        if (toState == TaskState.IN_PROGRESS) {
            if (stamp.status() != ApprovalStatus.APPROVED) {
                throw new VaultException(ErrorKind.APPROVAL_REQUIRED,
                        "Approval " + stamp.approvalId() + " is " + stamp.status() + ", not approved; "
                                + TaskState.PENDING_APPROVAL + " -> " + toState + " refused");
            }
            if (stamp.integrityHash() != null && !Hashing.matches(record.body(), stamp.integrityHash())) {
                throw new ApprovalSecurityException(ErrorKind.INTEGRITY_MISMATCH, stamp.approvalId(),
                        "Approval " + stamp.approvalId() + " body hash " + Hashing.sha256Hex(record.body())
                                + " does not match integrity_hash " + stamp.integrityHash());
            }
        } else if (toState == TaskState.REJECTED
                && stamp.status() != ApprovalStatus.REJECTED
                && stamp.status() != ApprovalStatus.EXPIRED) {
            throw new VaultException(ErrorKind.APPROVAL_REQUIRED,
                    "Approval " + stamp.approvalId() + " is " + stamp.status() + "; "
                            + TaskState.PENDING_APPROVAL + " -> " + toState + " needs a rejected or expired decision");
        }
    }

    private String checkRetryBudget(TaskRecord record, TaskState toState) {
        if (toState != TaskState.FAILED || record.retryCount() >= settings.maxRetries()) {
            return null;
        }
        String message = "Task " + record.id() + " has retry_count=" + record.retryCount()
                + " below max_retries=" + settings.maxRetries() + "; -> " + TaskState.FAILED + " before retries are exhausted";
        if (settings.failedTransitionPolicy() == FailedTransitionPolicy.ENFORCE) {
            throw new VaultException(ErrorKind.RETRIES_NOT_EXHAUSTED, message);
        }
        log.warn("{} (allowed by policy {})", message, FailedTransitionPolicy.WARN);
        return message;
    }

    private static void requireSameTransition(TaskRecord expected, TaskRecord actual) {
        if (actual == null
                || !expected.id().equals(actual.id())
                || expected.state() != actual.state()
                || !expected.stateHistory().equals(actual.stateHistory())) {
            throw new IllegalArgumentException("Amendment must not change task id, state or history: " + expected.id());
        }
    }

    private RelocationResult commit(TaskFile task, TaskRecord updated, Path destinationDir, RelocationResult.Outcome outcome) {
        Path source = task.path();
        Path target = destinationDir.resolve(task.fileName());
        String token = UUID.randomUUID().toString();
        Path temp = TaskStore.hiddenSibling(target, token + TaskStore.TEMP_SUFFIX);
        Path claim = TaskStore.hiddenSibling(source, token + TaskStore.CLAIM_SUFFIX);
        String content = TaskFileCodec.encode(updated);

        try {
            files.create(temp, content);
        } catch (IOException e) {
            cleanup(temp, e);
            throw new FileOperationException("Failed to stage " + temp.getFileName() + " in " + destinationDir, temp, e);
        }

        try {
            files.rename(source, claim);
        } catch (NoSuchFileException e) {
            cleanup(temp, null);
            return new RelocationResult(RelocationResult.Outcome.ALREADY_HANDLED, task);
        } catch (IOException e) {
            cleanup(temp, e);
            throw new FileOperationException("Failed to claim " + source, source, e);
        }

        String claimed;
        try {
            claimed = files.read(claim);
        } catch (IOException e) {
            rollback(claim, source, temp, null, e);
            throw new FileOperationException("Failed to verify claimed " + source, source, e);
        }
        if (!claimed.equals(task.rawContent())) {
            rollback(claim, source, temp, null, null);
            throw new VaultException(ErrorKind.STALE_READ,
                    "Task file " + source + " changed after it was read; reload and retry");
        }

        try {
            files.publish(temp, target);
        } catch (IOException e) {
            rollback(claim, source, temp, null, e);
            throw new FileOperationException("Failed to publish " + target, target, e);
        }

        try {
            files.delete(claim);
        } catch (IOException e) {
            rollback(claim, source, null, target, e);
            throw new FileOperationException("Failed to release in-flight marker for " + source, claim, e);
        }
        return new RelocationResult(outcome, new TaskFile(target, updated, content));
    }

    private void rollback(Path claim, Path source, Path temp, Path published, IOException cause) {
        if (temp != null) {
            cleanup(temp, cause);
        }
        if (published != null) {
            try {
                files.delete(published);
            } catch (IOException e) {
                log.error("Rollback could not remove published file {}", published, e);
                suppress(cause, e);
            }
        }
        try {
            files.publish(claim, source);
        } catch (IOException e) {
            log.error("Rollback could not restore {} from in-flight marker {}", source, claim, e);
            suppress(cause, e);
        }
    }

    private void cleanup(Path temp, IOException cause) {
        try {
            files.delete(temp);
        } catch (NoSuchFileException ignored) {
            // Never created.
        } catch (IOException e) {
            log.warn("Could not remove staged file {}: {}", temp, e.getMessage());
            suppress(cause, e);
        }
    }

    private void auditFailure(VaultException e, String taskId, TaskState from, TaskState to,
                              String actor, String reason, Map<String, Object> details) {
        Map<String, Object> row = new LinkedHashMap<>(details);
        row.put("kind", e.kind().name());
        AuditEvent event = e.retryable()
                ? AuditEvent.failure(AuditActions.STATE_TRANSITION, taskId, from, to, actor, reason, e.getMessage(), row)
                : AuditEvent.refused(AuditActions.STATE_TRANSITION, taskId, from, to, actor, reason, e.getMessage(), row);
        auditLogger.record(event);
        if (e.kind().securityRelevant()) {
            log.error("Refused {} -> {} for task {}: {}", from, to, taskId, e.getMessage());
        } else {
            log.warn("Refused {} -> {} for task {} ({}): {}", from, to, taskId, e.kind(), e.getMessage());
        }
    }

    private static void suppress(Throwable primary, Throwable secondary) {
        if (primary != null && primary != secondary) {
            primary.addSuppressed(secondary);
        }
    }
}
