package io.vaultflow.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.vaultflow.approval.Decision;
import io.vaultflow.audit.AuditReport;
import io.vaultflow.audit.Violation;
import io.vaultflow.config.VaultConfig;
import io.vaultflow.error.VaultException;
import io.vaultflow.graph.VaultFolder;
import io.vaultflow.model.Actors;
import io.vaultflow.model.TaskState;
import io.vaultflow.model.TaskView;
import io.vaultflow.orchestrator.SweepReport;
import io.vaultflow.runtime.VaultRuntime;
import io.vaultflow.util.Jsons;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
        name = "vaultflow",
        mixinStandardHelpOptions = true,
        description = "File-system-as-database workflow engine CLI",
        subcommands = {
                VaultFlowCommand.InitCommand.class,
                VaultFlowCommand.CreateCommand.class,
                VaultFlowCommand.ShowCommand.class,
                VaultFlowCommand.MoveCommand.class,
                VaultFlowCommand.RequestApprovalCommand.class,
                VaultFlowCommand.ApproveCommand.class,
                VaultFlowCommand.RejectCommand.class,
                VaultFlowCommand.ExpireApprovalsCommand.class,
                VaultFlowCommand.SweepCommand.class,
                VaultFlowCommand.CheckCommand.class,
                VaultFlowCommand.AuditTailCommand.class
        }
)
public final class VaultFlowCommand implements Runnable {
    static final int EXIT_VIOLATIONS = 1;
    static final int EXIT_USAGE = 2;

    @Spec
    CommandSpec spec;

    @Option(names = {"--root"}, description = "Vault root directory", defaultValue = VaultConfig.DEFAULT_ROOT)
    String root;

    @Option(names = {"--actor"}, description = "Actor recorded in history and audit rows (default: OS user)")
    String actor;

    /**
     * Command line with the vault error mapping installed: a {@link VaultException} prints
     * {@code <KIND>: <message>} and exits with the kind's code.
     */
    public static CommandLine commandLine() {
        CommandLine cmd = new CommandLine(new VaultFlowCommand());
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            PrintWriter err = commandLine.getErr();
            if (ex instanceof VaultException vault) {
                err.println(vault.kind().name() + ": " + vault.getMessage());
                err.flush();
                return vault.kind().exitCode();
            }
            if (ex instanceof IllegalArgumentException) {
                err.println("INVALID_ARGUMENT: " + ex.getMessage());
                err.flush();
                return EXIT_USAGE;
            }
            throw ex;
        });
        return cmd;
    }

    @Override
    public void run() {
        out().println("Use subcommands: init | create | show | move | request-approval | approve | reject | expire-approvals | sweep | check | audit-tail");
        out().flush();
    }

    VaultRuntime runtime() {
        return runtime(root);
    }

    VaultRuntime runtime(String vaultRoot) {
        return new VaultRuntime(VaultConfig.fromRoot(vaultRoot));
    }

    String actor() {
        return actor == null || actor.isBlank() ? Actors.current() : actor.trim();
    }

    PrintWriter out() {
        return spec.commandLine().getOut();
    }

    void print(Object value) {
        PrintWriter out = out();
        out.println(value instanceof String s ? s : Jsons.toJson(value));
        out.flush();
    }

    @Command(name = "init", description = "Create the vault directory layout")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        VaultFlowCommand parent;

        @Override
        public Integer call() {
            VaultRuntime runtime = parent.runtime();
            runtime.init();
            parent.print("Initialized vault at: " + runtime.config().rootDir());
            return 0;
        }
    }

    @Command(name = "create", description = "Create a task in the Inbox")
    static final class CreateCommand implements Callable<Integer> {
        @ParentCommand
        VaultFlowCommand parent;

        @Option(names = {"--id"}, required = true, description = "Task id, also the file name")
        String id;

        @Option(names = {"--priority"}, defaultValue = "medium", description = "Priority: high|medium|low")
        String priority;

        @Option(names = {"--body"}, description = "Task body text")
        String body;

        @Option(names = {"--body-file"}, description = "Read the task body from this file")
        String bodyFile;

        @Override
        public Integer call() throws Exception {
            String text = body == null ? "" : body;
            if (bodyFile != null && !bodyFile.isBlank()) {
                text = Files.readString(Path.of(bodyFile), StandardCharsets.UTF_8);
            }
            VaultRuntime runtime = parent.runtime();
            runtime.init();
            parent.print(runtime.create(id, priority, text, parent.actor()));
            return 0;
        }
    }

    @Command(name = "show", description = "Show one task")
    static final class ShowCommand implements Callable<Integer> {
        @ParentCommand
        VaultFlowCommand parent;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Override
        public Integer call() {
            parent.print(parent.runtime().show(taskId));
            return 0;
        }
    }

    @Command(name = "move", description = "Move a task to another state")
    static final class MoveCommand implements Callable<Integer> {
        @ParentCommand
        VaultFlowCommand parent;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Option(names = {"--to"}, required = true, description = "Target state, e.g. needs_action, in_progress, done")
        String to;

        @Option(names = {"--folder"}, description = "Destination folder when the state is licensed in more than one")
        String folder;

        @Option(names = {"--reason"}, defaultValue = "", description = "Reason recorded in the audit log")
        String reason;

        @Override
        public Integer call() {
            TaskState target = TaskState.fromWire(to);
            VaultFolder destination = folder == null ? null : VaultFolder.lookup(folder)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown folder: " + folder));
            VaultRuntime.MoveOutcome outcome = parent.runtime().move(taskId, target, destination, reason, parent.actor());
            parent.print(outcome);
            return 0;
        }
    }

    @Command(name = "request-approval", description = "Issue an approval and park the task in Approvals")
    static final class RequestApprovalCommand implements Callable<Integer> {
        @ParentCommand
        VaultFlowCommand parent;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Option(names = {"--reason"}, defaultValue = "", description = "Why sign-off is needed")
        String reason;

        @Override
        public Integer call() {
            parent.print(parent.runtime().requestApproval(taskId, parent.actor(), reason));
            return 0;
        }
    }

    @Command(name = "approve", description = "Approve a pending approval and resume the task")
    static final class ApproveCommand implements Callable<Integer> {
        @ParentCommand
        VaultFlowCommand parent;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Option(names = {"--reason"}, defaultValue = "", description = "Optional note")
        String reason;

        @Option(names = {"--no-resume"}, description = "Record the decision but leave the task in Approvals")
        boolean noResume;

        @Override
        public Integer call() {
            parent.print(parent.runtime().decide(taskId, Decision.APPROVE, parent.actor(), reason, !noResume));
            return 0;
        }
    }

    @Command(name = "reject", description = "Reject a pending approval and file the task as rejected")
    static final class RejectCommand implements Callable<Integer> {
        @ParentCommand
        VaultFlowCommand parent;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Option(names = {"--reason"}, required = true, description = "Rejection reason")
        String reason;

        @Option(names = {"--no-resume"}, description = "Record the decision but leave the task in Approvals")
        boolean noResume;

        @Override
        public Integer call() {
            parent.print(parent.runtime().decide(taskId, Decision.REJECT, parent.actor(), reason, !noResume));
            return 0;
        }
    }

    @Command(name = "expire-approvals", description = "Mark overdue pending approvals as expired")
    static final class ExpireApprovalsCommand implements Callable<Integer> {
        @ParentCommand
        VaultFlowCommand parent;

        @Override
        public Integer call() {
            List<TaskView> expired = parent.runtime().expireApprovals();
            parent.print(expired);
            return 0;
        }
    }

    @Command(name = "sweep", description = "Advance every task in one folder toward a target state")
    static final class SweepCommand implements Callable<Integer> {
        @ParentCommand
        VaultFlowCommand parent;

        @Option(names = {"--from"}, defaultValue = "INBOX", description = "Source folder: INBOX|NEEDS_ACTION|ERRORS|IN_PROGRESS|APPROVALS")
        String from;

        @Option(names = {"--to"}, defaultValue = "needs_action", description = "Target state")
        String to;

        @Override
        public Integer call() {
            VaultFolder folder = VaultFolder.lookup(from)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown folder: " + from));
            SweepReport report = parent.runtime().sweep(folder, TaskState.fromWire(to), parent.actor());
            parent.print(report);
            return report.failed() == 0 ? 0 : EXIT_VIOLATIONS;
        }
    }

    @Command(name = "check", description = "Read-only consistency check of a vault")
    static final class CheckCommand implements Callable<Integer> {
        @ParentCommand
        VaultFlowCommand parent;

        @Parameters(index = "0", arity = "0..1", description = "Vault root (defaults to --root)")
        String vaultRoot;

        @Override
        public Integer call() {
            VaultRuntime runtime = vaultRoot == null ? parent.runtime() : parent.runtime(vaultRoot);
            AuditReport report = runtime.check();
            PrintWriter out = parent.out();
            for (Violation v : report.violations()) {
                out.println(v.file() + ": " + v.rule() + ": " + v.message());
            }
            out.println("checked " + report.filesChecked() + " file(s), " + report.violations().size() + " violation(s)");
            out.flush();
            return report.clean() ? 0 : EXIT_VIOLATIONS;
        }
    }

    @Command(name = "audit-tail", description = "Print the latest audit rows of one day")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        VaultFlowCommand parent;

        @Option(names = {"--lines"}, defaultValue = "50", description = "Number of latest lines")
        int lines;

        @Option(names = {"--date"}, description = "UTC day as yyyy-MM-dd (default: today)")
        String date;

        @Override
        public Integer call() {
            LocalDate day = null;
            if (date != null && !date.isBlank()) {
                try {
                    day = LocalDate.parse(date.trim());
                } catch (DateTimeParseException e) {
                    throw new IllegalArgumentException("Invalid --date, expected yyyy-MM-dd: " + date, e);
                }
            }
            List<JsonNode> rows = parent.runtime().auditTail(day, lines);
            PrintWriter out = parent.out();
            for (JsonNode row : rows) {
                out.println(row.toString());
            }
            out.flush();
            return 0;
        }
    }
}
