package io.vaultflow.orchestrator;

import io.vaultflow.approval.ApprovalGate;
import io.vaultflow.approval.ApprovalKeywordMatcher;
import io.vaultflow.config.VaultConfig;
import io.vaultflow.engine.RelocationResult;
import io.vaultflow.engine.TaskRelocator;
import io.vaultflow.engine.TaskStore;
import io.vaultflow.error.VaultException;
import io.vaultflow.graph.VaultFolder;
import io.vaultflow.model.TaskFile;
import io.vaultflow.model.TaskRecord;
import io.vaultflow.model.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * One orchestrator pass over a folder: every visible task is moved toward {@code target}.
 *
 * <p>The listing is a snapshot, loaded up front and worked through highest priority first,
 * then oldest {@code created_at}, then by name. Files that disappear before they are moved
 * were taken by another process and are counted, not raised. Tasks headed for
 * {@code in_progress} whose body names a sensitive action are parked for approval instead,
 * unless they already wait in {@code pending_approval}: those move once their approval is
 * decided and are left alone while it is still pending. Creating the stop file at the vault
 * root halts the pass before the next file.
 */
public final class VaultSweeper {
    private static final Logger log = LoggerFactory.getLogger(VaultSweeper.class);
    private static final String SWEEP_REASON = "sweep";
    private static final Comparator<TaskFile> SWEEP_ORDER = Comparator
            .comparing((TaskFile t) -> t.record().priority())
            .thenComparing(t -> t.record().createdAt())
            .thenComparing(TaskFile::fileName);

    private final VaultConfig config;
    private final TaskStore store;
    private final TaskRelocator relocator;
    private final ApprovalGate gate;
    private final ApprovalKeywordMatcher keywords;

    public VaultSweeper(
            VaultConfig config,
            TaskStore store,
            TaskRelocator relocator,
            ApprovalGate gate,
            ApprovalKeywordMatcher keywords
    ) {
        this.config = config;
        this.store = store;
        this.relocator = relocator;
        this.gate = gate;
        this.keywords = keywords;
    }

    public boolean stopRequested() {
        return Files.exists(config.stopFile());
    }

    public SweepReport sweep(VaultFolder folder, TaskState target, String actor) {
        if (stopRequested()) {
            log.warn("Stop file {} present; not sweeping {}", config.stopFile(), folder.relativePath());
            return new SweepReport(folder, target, 0, 0, 0, 0, 0, 0, true);
        }
        int moved = 0;
        int routed = 0;
        int elsewhere = 0;
        int awaiting = 0;
        int failed = 0;
        boolean halted = false;

        List<Path> snapshot = store.list(folder);
        List<TaskFile> queue = new ArrayList<>();
        for (Path path : snapshot) {
            try {
                Optional<TaskFile> loaded = store.tryLoad(path);
                if (loaded.isEmpty()) {
                    log.info("{} vanished before it could be loaded; handled elsewhere", path.getFileName());
                    elsewhere++;
                    continue;
                }
                queue.add(loaded.get());
            } catch (VaultException e) {
                log.warn("Sweep could not load {} ({}): {}", path.getFileName(), e.kind(), e.getMessage());
                failed++;
            }
        }
        queue.sort(SWEEP_ORDER);

        int done = 0;
        for (TaskFile task : queue) {
            if (stopRequested()) {
                log.warn("Stop file {} present; halting sweep of {} after {} task(s)",
                        config.stopFile(), folder.relativePath(), done);
                halted = true;
                break;
            }
            done++;
            try {
                if (awaitsDecision(task)) {
                    log.debug("Task {} still awaits a decision; skipped", task.record().id());
                    awaiting++;
                    continue;
                }
                List<String> matched = target == TaskState.IN_PROGRESS && task.record().state() != TaskState.PENDING_APPROVAL
                        ? keywords.matched(task.record().body())
                        : List.of();
                RelocationResult result;
                if (!matched.isEmpty()) {
                    result = gate.request(task, actor, "approval keywords " + matched);
                    if (result.applied()) {
                        routed++;
                        continue;
                    }
                } else {
                    result = relocator.move(task, target, SWEEP_REASON, actor);
                    if (result.applied()) {
                        moved++;
                        continue;
                    }
                }
                elsewhere++;
            } catch (VaultException e) {
                // Refusals are already audited by the relocator; the sweep carries on.
                log.warn("Sweep could not advance {} ({}): {}", task.fileName(), e.kind(), e.getMessage());
                failed++;
            }
        }

        SweepReport report = new SweepReport(folder, target, snapshot.size(), moved, routed, elsewhere, awaiting,
                failed, halted);
        log.info("Sweep {} -> {}: scanned={} moved={} routedToApproval={} handledElsewhere={} awaitingDecision={} failed={} halted={}",
                folder.relativePath(), target, report.scanned(), moved, routed, elsewhere, awaiting, failed, halted);
        return report;
    }

    private static boolean awaitsDecision(TaskFile task) {
        TaskRecord record = task.record();
        return record.state() == TaskState.PENDING_APPROVAL && (!record.isApproval() || record.approval().isPending());
    }
}
