package io.vaultflow.engine;

import io.vaultflow.config.FailedTransitionPolicy;
import io.vaultflow.config.VaultConfig;
import io.vaultflow.config.VaultSettings;
import io.vaultflow.error.ErrorKind;
import io.vaultflow.error.FileOperationException;
import io.vaultflow.error.VaultException;
import io.vaultflow.graph.VaultFolder;
import io.vaultflow.model.Priority;
import io.vaultflow.model.TaskFile;
import io.vaultflow.model.TaskRecord;
import io.vaultflow.model.TaskState;
import io.vaultflow.observability.AuditLogger;
import io.vaultflow.runtime.VaultRuntime;
import io.vaultflow.testing.MutableClock;
import io.vaultflow.testing.ScriptedFileOperations;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.stream.Stream;

final class TaskRelocatorTest {

    @Test
    void moveRewritesMetadataAndRelocatesAtomically() throws Exception {
        Path root = Files.createTempDirectory("vaultflow-test-move-");
        try {
            Vault vault = Vault.open(root, VaultSettings.defaults(), FileOperations.nio());
            TaskFile created = vault.store.create("T-1", Priority.HIGH, "triage the report\n", "watcher");
            vault.clock.advance(Duration.ofMinutes(5));

            RelocationResult result = vault.relocator.move(created, TaskState.NEEDS_ACTION, "triaged", "orchestrator");

            Assertions.assertEquals(RelocationResult.Outcome.MOVED, result.outcome());
            Path target = vault.config.needsActionDir().resolve("T-1.md");
            Assertions.assertEquals(target, result.task().path());
            Assertions.assertFalse(Files.exists(created.path()));
            Assertions.assertEquals(List.of("T-1.md"), fileNames(vault.config.needsActionDir()));
            Assertions.assertEquals(List.of(), fileNames(vault.config.inboxDir()));

            TaskRecord onDisk = vault.store.load(target).record();
            Assertions.assertEquals(TaskState.NEEDS_ACTION, onDisk.state());
            Assertions.assertEquals(2, onDisk.stateHistory().size());
            Assertions.assertEquals("orchestrator", onDisk.lastHistoryEntry().actor());
            Assertions.assertEquals(vault.clock.instant(), onDisk.modifiedAt());
            Assertions.assertEquals(created.record().createdAt(), onDisk.createdAt());
            Assertions.assertEquals("triage the report\n", onDisk.body());

            List<String> audit = auditLines(vault.audit);
            Assertions.assertEquals(2, audit.size());
            Assertions.assertTrue(audit.get(1).contains("\"action\":\"state_transition\""));
            Assertions.assertTrue(audit.get(1).contains("\"from_state\":\"inbox\""));
            Assertions.assertTrue(audit.get(1).contains("\"to_state\":\"needs_action\""));
            Assertions.assertTrue(audit.get(1).contains("\"result\":\"success\""));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void entryMayGoToPendingApprovalButNotStraightToDone() throws Exception {
        Path root = Files.createTempDirectory("vaultflow-test-invalid-");
        try {
            Vault vault = Vault.open(root, VaultSettings.defaults(), FileOperations.nio());
            TaskFile created = vault.store.create("T-1", Priority.MEDIUM, "body", "watcher");
            String before = Files.readString(created.path(), StandardCharsets.UTF_8);

            VaultException e = Assertions.assertThrows(VaultException.class,
                    () -> vault.relocator.move(created, TaskState.DONE, "skip", "alice"));
            Assertions.assertEquals(ErrorKind.INVALID_TRANSITION, e.kind());
            Assertions.assertTrue(e.getMessage().contains("inbox -> done"));
            Assertions.assertEquals(before, Files.readString(created.path(), StandardCharsets.UTF_8));
            Assertions.assertTrue(auditLines(vault.audit).get(1).contains("\"result\":\"refused\""));

            RelocationResult parked = vault.relocator.move(created, TaskState.PENDING_APPROVAL, "sensitive", "alice");
            Assertions.assertEquals(RelocationResult.Outcome.MOVED, parked.outcome());
            Assertions.assertEquals(vault.config.approvalsDir().resolve("T-1.md"), parked.task().path());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void folderMismatchIsRefusedForSourceAndDestination() throws Exception {
        Path root = Files.createTempDirectory("vaultflow-test-folder-");
        try {
            Vault vault = Vault.open(root, VaultSettings.defaults(), FileOperations.nio());
            TaskFile created = vault.store.create("T-1", Priority.MEDIUM, "body", "watcher");

            VaultException destination = Assertions.assertThrows(VaultException.class,
                    () -> vault.relocator.move(created, TaskState.NEEDS_ACTION, VaultFolder.DONE, "wrong", "alice"));
            Assertions.assertEquals(ErrorKind.FOLDER_MISMATCH, destination.kind());
            Assertions.assertTrue(Files.exists(created.path()));

            Path misplaced = vault.config.inProgressDir().resolve("T-2.md");
            Files.writeString(misplaced,
                    Files.readString(created.path(), StandardCharsets.UTF_8).replace("T-1", "T-2"),
                    StandardCharsets.UTF_8);
            TaskFile stray = vault.store.load(misplaced);
            VaultException source = Assertions.assertThrows(VaultException.class,
                    () -> vault.relocator.move(stray, TaskState.NEEDS_ACTION, "wrong", "alice"));
            Assertions.assertEquals(ErrorKind.FOLDER_MISMATCH, source.kind());
            Assertions.assertTrue(source.getMessage().contains("In_Progress"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void publishFailureRestoresSourceAndLeavesNoDestinationFile() throws Exception {
        Path root = Files.createTempDirectory("vaultflow-test-publish-fail-");
        try {
            ScriptedFileOperations ops = ScriptedFileOperations.overNio().failOn(ScriptedFileOperations.Op.PUBLISH, 1);
            Vault vault = Vault.open(root, VaultSettings.defaults(), ops);
            TaskFile created = vault.seed("T-1", "body\n");
            String before = Files.readString(created.path(), StandardCharsets.UTF_8);

            FileOperationException e = Assertions.assertThrows(FileOperationException.class,
                    () -> vault.relocator.move(created, TaskState.NEEDS_ACTION, "triaged", "alice"));

            Assertions.assertEquals(ErrorKind.FILE_OPERATION, e.kind());
            Assertions.assertTrue(e.retryable());
            Assertions.assertEquals(before, Files.readString(created.path(), StandardCharsets.UTF_8));
            Assertions.assertEquals(List.of("T-1.md"), fileNames(vault.config.inboxDir()));
            Assertions.assertEquals(List.of(), fileNames(vault.config.needsActionDir()));
            Assertions.assertTrue(auditLines(vault.audit).get(1).contains("\"result\":\"failure\""));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void stagingAndMarkerReleaseFailuresAlsoLeaveSourceIntact() throws Exception {
        Path root = Files.createTempDirectory("vaultflow-test-stage-fail-");
        try {
            ScriptedFileOperations staging = ScriptedFileOperations.overNio().failOn(ScriptedFileOperations.Op.CREATE, 1);
            Vault vault = Vault.open(root, VaultSettings.defaults(), staging);
            TaskFile first = vault.seed("T-1", "one");
            String before = Files.readString(first.path(), StandardCharsets.UTF_8);

            Assertions.assertThrows(FileOperationException.class,
                    () -> vault.relocator.move(first, TaskState.NEEDS_ACTION, "x", "alice"));
            Assertions.assertEquals(before, Files.readString(first.path(), StandardCharsets.UTF_8));
            Assertions.assertEquals(List.of(), fileNames(vault.config.needsActionDir()));

            ScriptedFileOperations release = ScriptedFileOperations.overNio().failOn(ScriptedFileOperations.Op.DELETE, 1);
            TaskRelocator relocator = new TaskRelocator(vault.config, VaultSettings.defaults(), release, vault.audit, vault.clock);
            Assertions.assertThrows(FileOperationException.class,
                    () -> relocator.move(first, TaskState.NEEDS_ACTION, "x", "alice"));
            Assertions.assertEquals(before, Files.readString(first.path(), StandardCharsets.UTF_8));
            Assertions.assertEquals(List.of("T-1.md"), fileNames(vault.config.inboxDir()));
            Assertions.assertEquals(List.of(), fileNames(vault.config.needsActionDir()));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void staleCopyOfAlreadyMovedTaskIsAlreadyHandled() throws Exception {
        Path root = Files.createTempDirectory("vaultflow-test-vanished-");
        try {
            Vault vault = Vault.open(root, VaultSettings.defaults(), FileOperations.nio());
            TaskFile created = vault.seed("T-1", "body");

            RelocationResult winner = vault.relocator.move(created, TaskState.NEEDS_ACTION, "first", "proc-a");
            RelocationResult loser = vault.relocator.move(created, TaskState.NEEDS_ACTION, "second", "proc-b");

            Assertions.assertTrue(winner.applied());
            Assertions.assertEquals(RelocationResult.Outcome.ALREADY_HANDLED, loser.outcome());
            Assertions.assertFalse(loser.applied());
            Assertions.assertEquals(List.of("T-1.md"), fileNames(vault.config.needsActionDir()));
            Assertions.assertEquals("proc-a", vault.store.load(winner.task().path()).record().lastHistoryEntry().actor());
            Assertions.assertEquals(2, auditLines(vault.audit).size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void concurrentEditAfterReadIsStaleRead() throws Exception {
        Path root = Files.createTempDirectory("vaultflow-test-stale-");
        try {
            Vault vault = Vault.open(root, VaultSettings.defaults(), FileOperations.nio());
            TaskFile created = vault.seed("T-1", "original");
            String edited = Files.readString(created.path(), StandardCharsets.UTF_8) + " plus an edit";
            Files.writeString(created.path(), edited, StandardCharsets.UTF_8);

            VaultException e = Assertions.assertThrows(VaultException.class,
                    () -> vault.relocator.move(created, TaskState.NEEDS_ACTION, "x", "alice"));

            Assertions.assertEquals(ErrorKind.STALE_READ, e.kind());
            Assertions.assertTrue(e.retryable());
            Assertions.assertEquals(edited, Files.readString(created.path(), StandardCharsets.UTF_8));
            Assertions.assertEquals(List.of(), fileNames(vault.config.needsActionDir()));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failedNeedsExhaustedRetriesUnderEnforcePolicy() throws Exception {
        Path root = Files.createTempDirectory("vaultflow-test-retry-enforce-");
        try {
            Vault vault = Vault.open(root, VaultSettings.defaults(), FileOperations.nio());
            TaskFile task = vault.relocator.move(vault.seed("T-1", "flaky"), TaskState.NEEDS_ACTION, "", "o").task();
            task = vault.relocator.move(task, TaskState.ERROR_QUEUE, "boom", "o").task();
            Assertions.assertEquals(vault.config.errorsDir().resolve("T-1.md"), task.path());

            TaskFile early = task;
            VaultException e = Assertions.assertThrows(VaultException.class,
                    () -> vault.relocator.move(early, TaskState.FAILED, "give up", "o"));
            Assertions.assertEquals(ErrorKind.RETRIES_NOT_EXHAUSTED, e.kind());

            for (int attempt = 1; attempt <= 3; attempt++) {
                task = vault.relocator.move(task, TaskState.NEEDS_ACTION, "retry", "o").task();
                Assertions.assertEquals(attempt, task.record().retryCount());
                task = vault.relocator.move(task, TaskState.ERROR_QUEUE, "boom", "o").task();
            }
            RelocationResult failed = vault.relocator.move(task, TaskState.FAILED, "give up", "o");

            Assertions.assertEquals(vault.config.doneDir().resolve("T-1.md"), failed.task().path());
            Assertions.assertEquals(TaskState.FAILED, failed.task().record().state());
            Assertions.assertEquals(3, failed.task().record().retryCount());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void warnPolicyAllowsEarlyFailureButAuditsWarning() throws Exception {
        Path root = Files.createTempDirectory("vaultflow-test-retry-warn-");
        try {
            VaultSettings settings = VaultSettings.defaults().withFailedTransitionPolicy(FailedTransitionPolicy.WARN);
            Vault vault = Vault.open(root, settings, FileOperations.nio());
            TaskFile task = vault.relocator.move(vault.seed("T-1", "flaky"), TaskState.NEEDS_ACTION, "", "o").task();
            task = vault.relocator.move(task, TaskState.ERROR_QUEUE, "boom", "o").task();

            RelocationResult failed = vault.relocator.move(task, TaskState.FAILED, "give up", "o");

            Assertions.assertEquals(RelocationResult.Outcome.MOVED, failed.outcome());
            List<String> audit = auditLines(vault.audit);
            String last = audit.get(audit.size() - 1);
            Assertions.assertTrue(last.contains("\"result\":\"warning\""));
            Assertions.assertTrue(last.contains("retry_count=0"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void leavingPendingApprovalWithoutDecisionIsRefused() throws Exception {
        Path root = Files.createTempDirectory("vaultflow-test-approval-required-");
        try {
            Vault vault = Vault.open(root, VaultSettings.defaults(), FileOperations.nio());
            TaskFile pending = vault.relocator.move(vault.seed("T-1", "deploy"), TaskState.PENDING_APPROVAL, "", "o").task();

            VaultException resume = Assertions.assertThrows(VaultException.class,
                    () -> vault.relocator.move(pending, TaskState.IN_PROGRESS, "go", "mallory"));
            VaultException reject = Assertions.assertThrows(VaultException.class,
                    () -> vault.relocator.move(pending, TaskState.REJECTED, "no", "mallory"));

            Assertions.assertEquals(ErrorKind.APPROVAL_REQUIRED, resume.kind());
            Assertions.assertEquals(ErrorKind.APPROVAL_REQUIRED, reject.kind());
            Assertions.assertTrue(Files.exists(pending.path()));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void amendmentMayNotRewriteStateOrHistory() throws Exception {
        Path root = Files.createTempDirectory("vaultflow-test-amend-");
        try {
            Vault vault = Vault.open(root, VaultSettings.defaults(), FileOperations.nio());
            TaskFile created = vault.seed("T-1", "body");

            Assertions.assertThrows(IllegalArgumentException.class, () -> vault.relocator.move(
                    created, TaskState.NEEDS_ACTION, VaultFolder.NEEDS_ACTION, "", "o",
                    r -> r.transitionedTo(TaskState.IN_PROGRESS, "o", r.modifiedAt())));
            Assertions.assertTrue(Files.exists(created.path()));
        } finally {
            deleteRecursively(root);
        }
    }

    private record Vault(VaultConfig config, MutableClock clock, AuditLogger audit, TaskStore store, TaskRelocator relocator) {
        static Vault open(Path root, VaultSettings settings, FileOperations ops) {
            VaultConfig config = VaultConfig.fromRoot(root.toString());
            MutableClock clock = MutableClock.at("2026-01-01T10:00:00Z");
            new VaultRuntime(config, settings, clock, FileOperations.nio()).init();
            AuditLogger audit = new AuditLogger(config.logsDir(), clock);
            TaskStore store = new TaskStore(config, FileOperations.nio(), audit, clock);
            return new Vault(config, clock, audit, store, new TaskRelocator(config, settings, ops, audit, clock));
        }

        TaskFile seed(String id, String body) {
            return store.create(id, Priority.MEDIUM, body, "watcher");
        }
    }

    private static List<String> auditLines(AuditLogger audit) throws IOException {
        return Files.readAllLines(audit.currentFile(), StandardCharsets.UTF_8);
    }

    private static List<String> fileNames(Path dir) throws IOException {
        try (Stream<Path> list = Files.list(dir)) {
            return list.filter(Files::isRegularFile).map(p -> p.getFileName().toString()).sorted().toList();
        }
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
