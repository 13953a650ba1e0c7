package io.vaultflow.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.vaultflow.approval.ApprovalGate;
import io.vaultflow.approval.ApprovalKeywordMatcher;
import io.vaultflow.approval.Decision;
import io.vaultflow.approval.DecisionResult;
import io.vaultflow.approval.NonceLedger;
import io.vaultflow.audit.AuditReport;
import io.vaultflow.audit.ConsistencyAuditor;
import io.vaultflow.config.VaultConfig;
import io.vaultflow.config.VaultSettings;
import io.vaultflow.engine.FileOperations;
import io.vaultflow.engine.RelocationResult;
import io.vaultflow.engine.TaskRelocator;
import io.vaultflow.engine.TaskStore;
import io.vaultflow.error.ErrorKind;
import io.vaultflow.error.VaultException;
import io.vaultflow.graph.TransitionGraph;
import io.vaultflow.graph.VaultFolder;
import io.vaultflow.model.Priority;
import io.vaultflow.model.TaskFile;
import io.vaultflow.model.TaskState;
import io.vaultflow.model.TaskView;
import io.vaultflow.observability.AuditLogger;
import io.vaultflow.orchestrator.SweepReport;
import io.vaultflow.orchestrator.VaultSweeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Wires one vault's components together and exposes the operations the CLI maps onto.
 * Every component shares the same clock, audit logger and file operations.
 */
public final class VaultRuntime {
    private static final Logger log = LoggerFactory.getLogger(VaultRuntime.class);

    private final VaultConfig config;
    private final VaultSettings settings;
    private final Clock clock;
    private final AuditLogger auditLogger;
    private final TaskStore store;
    private final TaskRelocator relocator;
    private final ApprovalGate gate;
    private final VaultSweeper sweeper;

    public VaultRuntime(VaultConfig config) {
        this(config, VaultSettings.load(config), Clock.systemUTC(), FileOperations.nio());
    }

    public VaultRuntime(VaultConfig config, VaultSettings settings, Clock clock, FileOperations files) {
        this.config = config;
        this.settings = settings;
        this.clock = clock;
        this.auditLogger = new AuditLogger(config.logsDir(), clock);
        this.store = new TaskStore(config, files, auditLogger, clock);
        this.relocator = new TaskRelocator(config, settings, files, auditLogger, clock);
        this.gate = new ApprovalGate(store, relocator, new NonceLedger(config.consumedNoncesFile()),
                auditLogger, clock, settings.approvalTimeout());
        this.sweeper = new VaultSweeper(config, store, relocator, gate,
                new ApprovalKeywordMatcher(settings.approvalKeywords()));
    }

    /**
     * Creates the state directories, the log directory and the internal directory. Safe to
     * repeat; existing content is left alone.
     */
    public void init() {
        try {
            for (VaultFolder folder : VaultFolder.values()) {
                Files.createDirectories(config.folder(folder));
            }
            Files.createDirectories(config.logsDir());
            Files.createDirectories(config.internalDir());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize vault at " + config.rootDir(), e);
        }
        log.debug("Vault directories ready at {}", config.rootDir());
    }

    public TaskView create(String taskId, String priority, String body, String actor) {
        TaskFile created = store.create(taskId, Priority.fromString(priority), body, actor);
        return view(created);
    }

    public TaskFile load(String taskId) {
        return store.find(taskId).orElseThrow(() ->
                new VaultException(ErrorKind.TASK_NOT_FOUND, "No task " + taskId + " in any state directory of " + config.rootDir()));
    }

    public TaskView show(String taskId) {
        return view(load(taskId));
    }

    public MoveOutcome move(String taskId, TaskState toState, VaultFolder destination, String reason, String actor) {
        TaskFile task = load(taskId);
        VaultFolder folder = destination == null ? TransitionGraph.primaryFolder(toState) : destination;
        RelocationResult result = relocator.move(task, toState, folder, reason, actor);
        return MoveOutcome.of(result, this);
    }

    public MoveOutcome requestApproval(String taskId, String actor, String reason) {
        return MoveOutcome.of(gate.request(load(taskId), actor, reason), this);
    }

    /**
     * Records a decision. With {@code resume} the licensed follow-up move is made as well.
     */
    public DecisionOutcome decide(String taskId, Decision decision, String actor, String reason, boolean resume) {
        TaskFile task = load(taskId);
        DecisionResult result = resume
                ? gate.resolve(task, decision, actor, reason)
                : gate.decide(task, decision, actor, reason);
        return new DecisionOutcome(
                taskId,
                result.outcome().name(),
                result.followUp() == null ? null : result.followUp().outcome().name(),
                view(result.task())
        );
    }

    public List<TaskView> expireApprovals() {
        return gate.expireOverdue().stream().map(this::view).toList();
    }

    public SweepReport sweep(VaultFolder folder, TaskState target, String actor) {
        return sweeper.sweep(folder, target, actor);
    }

    public AuditReport check() {
        return new ConsistencyAuditor(config, settings, clock).run();
    }

    public List<JsonNode> auditTail(LocalDate date, int lines) {
        return auditLogger.tail(date == null ? LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC) : date, lines);
    }

    public VaultConfig config() {
        return config;
    }

    public VaultSettings settings() {
        return settings;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    public TaskStore store() {
        return store;
    }

    public TaskRelocator relocator() {
        return relocator;
    }

    public ApprovalGate gate() {
        return gate;
    }

    private TaskView view(TaskFile task) {
        return TaskView.of(task, config.rootDir());
    }

    public record MoveOutcome(String outcome, TaskView task) {
        static MoveOutcome of(RelocationResult result, VaultRuntime runtime) {
            return new MoveOutcome(result.outcome().name(), runtime.view(result.task()));
        }

        public boolean applied() {
            return !RelocationResult.Outcome.ALREADY_HANDLED.name().equals(outcome);
        }
    }

    public record DecisionOutcome(String taskId, String outcome, String followUp, TaskView task) {
    }
}
