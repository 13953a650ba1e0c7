package io.vaultflow.approval;

import io.vaultflow.engine.RelocationResult;
import io.vaultflow.engine.TaskRelocator;
import io.vaultflow.engine.TaskStore;
import io.vaultflow.error.ApprovalSecurityException;
import io.vaultflow.error.ErrorKind;
import io.vaultflow.error.VaultException;
import io.vaultflow.graph.VaultFolder;
import io.vaultflow.model.ApprovalStamp;
import io.vaultflow.model.TaskFile;
import io.vaultflow.model.TaskRecord;
import io.vaultflow.model.TaskState;
import io.vaultflow.observability.AuditActions;
import io.vaultflow.observability.AuditEvent;
import io.vaultflow.observability.AuditLogger;
import io.vaultflow.util.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Human sign-off for tasks in {@code pending_approval}.
 *
 * <p>A decision is only recorded after four checks pass, in this order: the stamp is still
 * pending, it has not expired, its nonce is well formed and unused, and the body still
 * hashes to the {@code integrity_hash} taken at issuance. The last three are security
 * failures: they are audited, logged at ERROR and never retried.
 */
public final class ApprovalGate {
    private static final Logger log = LoggerFactory.getLogger(ApprovalGate.class);
    private static final DateTimeFormatter APPROVAL_ID_TIME = DateTimeFormatter.ofPattern("yyyyMMddHHmmss")
            .withZone(ZoneOffset.UTC);

    private final TaskStore store;
    private final TaskRelocator relocator;
    private final NonceLedger nonceLedger;
    private final AuditLogger auditLogger;
    private final Clock clock;
    private final Duration timeout;

    public ApprovalGate(
            TaskStore store,
            TaskRelocator relocator,
            NonceLedger nonceLedger,
            AuditLogger auditLogger,
            Clock clock,
            Duration timeout
    ) {
        this.store = store;
        this.relocator = relocator;
        this.nonceLedger = nonceLedger;
        this.auditLogger = auditLogger;
        this.clock = clock;
        this.timeout = timeout;
    }

    /**
     * Issues a fresh approval for {@code task} and parks it in {@code pending_approval}.
     * A task already waiting there without any stamp is stamped in place. One that already
     * carries a stamp, pending or decided, is left untouched so a recorded decision is
     * never overwritten.
     */
    public RelocationResult request(TaskFile task, String actor, String reason) {
        TaskRecord record = task.record();
        if (record.state() == TaskState.PENDING_APPROVAL && record.isApproval()) {
            ApprovalStamp existing = record.approval();
            if (!existing.isPending()) {
                log.warn("Task {} already carries {} approval {}; not issuing a new one",
                        record.id(), existing.status(), existing.approvalId());
            }
            return new RelocationResult(RelocationResult.Outcome.ALREADY_HANDLED, task);
        }
        Instant now = clock.instant();
        ApprovalStamp stamp = ApprovalStamp.issue(
                "APR-" + record.id() + "-" + APPROVAL_ID_TIME.format(now),
                record.id(),
                NonceLedger.generate(),
                Hashing.sha256Hex(record.body()),
                now,
                now.plus(timeout)
        );
        RelocationResult result;
        if (record.state() == TaskState.PENDING_APPROVAL) {
            result = relocator.rewrite(task, r -> r.withApproval(stamp, now));
        } else {
            result = relocator.move(task, TaskState.PENDING_APPROVAL, VaultFolder.APPROVALS, reason, actor,
                    r -> r.withApproval(stamp, now));
        }
        if (result.applied()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("approval_id", stamp.approvalId());
            details.put("expires_at", stamp.expiresAt().toString());
            auditLogger.record(AuditEvent.success(AuditActions.APPROVAL_REQUESTED, record.id(),
                    record.state(), TaskState.PENDING_APPROVAL, actor, reason, details));
        }
        return result;
    }

    public DecisionResult decide(TaskFile task, Decision decision, String actor, String reason) {
        TaskRecord record = task.record();
        ApprovalStamp stamp = record.approval();
        if (stamp == null) {
            throw new VaultException(ErrorKind.APPROVAL_REQUIRED,
                    "Task " + record.id() + " carries no approval stamp to decide");
        }
        if (!stamp.isPending()) {
            log.warn("Approval {} for task {} is already {}; ignoring {} by {}",
                    stamp.approvalId(), record.id(), stamp.status(), decision, actor);
            return DecisionResult.of(DecisionResult.DecisionOutcome.ALREADY_DECIDED, task);
        }

        Instant now = clock.instant();
        if (stamp.isExpiredAt(now)) {
            throw refuse(task, decision, actor, reason, ErrorKind.APPROVAL_EXPIRED,
                    "Approval " + stamp.approvalId() + " expired at " + stamp.expiresAt() + " (now " + now + ")");
        }
        if (!NonceLedger.isWellFormed(stamp.nonce())) {
            throw refuse(task, decision, actor, reason, ErrorKind.MALFORMED_NONCE,
                    "Approval " + stamp.approvalId() + " nonce is not a well-formed UUID");
        }
        if (nonceLedger.isConsumed(stamp.nonce())) {
            Optional<TaskFile> decidedCopy = decidedOnDisk(record.id(), stamp.approvalId());
            if (decidedCopy.isPresent()) {
                ApprovalStamp current = decidedCopy.get().record().approval();
                log.warn("Approval {} for task {} is already {} on disk; ignoring {} by {}",
                        stamp.approvalId(), record.id(), current.status(), decision, actor);
                return DecisionResult.of(DecisionResult.DecisionOutcome.ALREADY_DECIDED, decidedCopy.get());
            }
            throw refuse(task, decision, actor, reason, ErrorKind.NONCE_REPLAYED,
                    "Approval " + stamp.approvalId() + " nonce was already consumed; replay blocked");
        }
        if (stamp.integrityHash() != null && !Hashing.matches(record.body(), stamp.integrityHash())) {
            throw refuse(task, decision, actor, reason, ErrorKind.INTEGRITY_MISMATCH,
                    "Approval " + stamp.approvalId() + " body hash " + Hashing.sha256Hex(record.body())
                            + " does not match integrity_hash " + stamp.integrityHash()
                            + "; content changed after issuance");
        }

        ApprovalStamp decided = stamp.decided(decision.status(), actor, reason, now);
        RelocationResult written = relocator.rewrite(task, r -> r.withApproval(decided, now));
        if (!written.applied()) {
            log.warn("Approval {} vanished while deciding; another process acted on it", stamp.approvalId());
            return DecisionResult.of(DecisionResult.DecisionOutcome.ALREADY_DECIDED, task);
        }
        nonceLedger.consume(stamp.nonce());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("approval_id", stamp.approvalId());
        details.put("decision", decided.status().wireName());
        auditLogger.record(AuditEvent.success(
                decision == Decision.APPROVE ? AuditActions.APPROVAL_APPROVED : AuditActions.APPROVAL_REJECTED,
                record.id(), record.state(), record.state(), actor, reason, details));
        log.info("Approval {} for task {} {} by {}", stamp.approvalId(), record.id(), decided.status(), actor);
        return DecisionResult.of(
                decision == Decision.APPROVE
                        ? DecisionResult.DecisionOutcome.APPROVED
                        : DecisionResult.DecisionOutcome.REJECTED,
                written.task());
    }

    /**
     * Decides and then performs the move the decision licenses: approved tasks resume in
     * {@code in_progress}, rejected ones are filed as {@code rejected}.
     */
    public DecisionResult resolve(TaskFile task, Decision decision, String actor, String reason) {
        DecisionResult result = decide(task, decision, actor, reason);
        if (result.outcome() == DecisionResult.DecisionOutcome.ALREADY_DECIDED) {
            return result;
        }
        TaskState target = decision == Decision.APPROVE ? TaskState.IN_PROGRESS : TaskState.REJECTED;
        String moveReason = reason == null || reason.isBlank() ? "approval " + decision.status() : reason;
        return result.withFollowUp(relocator.move(result.task(), target, moveReason, actor));
    }

    /**
     * Marks every overdue pending approval as expired. Returns the rewritten files.
     */
    public List<TaskFile> expireOverdue() {
        Instant now = clock.instant();
        List<TaskFile> expired = new ArrayList<>();
        for (Path path : store.list(VaultFolder.APPROVALS)) {
            Optional<TaskFile> loaded;
            try {
                loaded = store.tryLoad(path);
            } catch (VaultException e) {
                log.warn("Skipping unreadable approval {}: {}", path, e.getMessage());
                continue;
            }
            if (loaded.isEmpty()) {
                continue;
            }
            TaskFile task = loaded.get();
            ApprovalStamp stamp = task.record().approval();
            if (stamp == null || !stamp.isPending() || !stamp.isExpiredAt(now)) {
                continue;
            }
            RelocationResult result = relocator.rewrite(task, r -> r.withApproval(stamp.expired(), now));
            if (!result.applied()) {
                continue;
            }
            auditLogger.record(AuditEvent.success(AuditActions.APPROVAL_EXPIRED, task.record().id(),
                    task.record().state(), task.record().state(), null, "expired at " + stamp.expiresAt(),
                    Map.of("approval_id", stamp.approvalId())));
            log.info("Approval {} for task {} expired", stamp.approvalId(), task.record().id());
            expired.add(result.task());
        }
        return expired;
    }

    /**
     * The current copy of the task if it still carries approval {@code approvalId} and that
     * approval is no longer pending. A copy that claims {@code pending} for a consumed nonce
     * has been edited back and stays a replay.
     */
    private Optional<TaskFile> decidedOnDisk(String taskId, String approvalId) {
        Optional<TaskFile> current = store.find(taskId);
        if (current.isEmpty()) {
            return Optional.empty();
        }
        ApprovalStamp stamp = current.get().record().approval();
        if (stamp == null || !approvalId.equals(stamp.approvalId()) || stamp.isPending()) {
            return Optional.empty();
        }
        return current;
    }

    private ApprovalSecurityException refuse(TaskFile task, Decision decision, String actor, String reason,
                                             ErrorKind kind, String message) {
        TaskRecord record = task.record();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("approval_id", record.approval().approvalId());
        details.put("decision", decision.status().wireName());
        details.put("kind", kind.name());
        auditLogger.record(AuditEvent.refused(AuditActions.APPROVAL_REFUSED, record.id(),
                record.state(), record.state(), actor, reason, message, details));
        log.error("Approval security failure {} for task {}: {}", kind, record.id(), message);
        return new ApprovalSecurityException(kind, record.approval().approvalId(), message);
    }
}
