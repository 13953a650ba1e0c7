package io.vaultflow.engine;

import io.vaultflow.codec.TaskFileCodec;
import io.vaultflow.config.VaultConfig;
import io.vaultflow.error.ErrorKind;
import io.vaultflow.error.FileOperationException;
import io.vaultflow.error.VaultException;
import io.vaultflow.graph.VaultFolder;
import io.vaultflow.model.Priority;
import io.vaultflow.model.TaskFile;
import io.vaultflow.model.TaskRecord;
import io.vaultflow.observability.AuditActions;
import io.vaultflow.observability.AuditEvent;
import io.vaultflow.observability.AuditLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Read side of the vault plus producer-side creation. Never moves existing files;
 * that is {@link TaskRelocator}'s job.
 */
public final class TaskStore {
    private static final Logger log = LoggerFactory.getLogger(TaskStore.class);
    public static final String TASK_SUFFIX = ".md";
    public static final String TEMP_SUFFIX = ".tmp";
    public static final String CLAIM_SUFFIX = ".moving";
    private static final Pattern SAFE_ID = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9._-]{0,127}$");

    private final VaultConfig config;
    private final FileOperations files;
    private final AuditLogger auditLogger;
    private final Clock clock;

    public TaskStore(VaultConfig config, FileOperations files, AuditLogger auditLogger, Clock clock) {
        this.config = config;
        this.files = files;
        this.auditLogger = auditLogger;
        this.clock = clock;
    }

    public VaultConfig config() {
        return config;
    }

    /**
     * Writes a new task into the entry directory. The file only becomes visible under its
     * final name once fully written.
     */
    public TaskFile create(String taskId, Priority priority, String body, String actor) {
        if (taskId == null || !SAFE_ID.matcher(taskId).matches()) {
            throw new IllegalArgumentException("Invalid task id: " + taskId);
        }
        TaskRecord record = TaskRecord.create(taskId, priority, body, actor, clock.instant());
        String content = TaskFileCodec.encode(record);
        Path target = config.inboxDir().resolve(fileNameFor(taskId));
        Path temp = hiddenSibling(target, UUID.randomUUID() + TEMP_SUFFIX);
        if (find(taskId).isPresent()) {
            throw new VaultException(ErrorKind.TASK_EXISTS, "Task already exists in the vault: " + taskId);
        }
        try {
            files.create(temp, content);
            files.publish(temp, target);
        } catch (FileAlreadyExistsException e) {
            deleteQuietly(temp);
            throw new VaultException(ErrorKind.TASK_EXISTS, "Task file already exists: " + target, e);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new FileOperationException("Failed to create task file: " + target, target, e);
        }
        auditLogger.record(AuditEvent.success(AuditActions.TASK_CREATED, taskId, null, record.state(),
                actor, "created", Map.of("file", target.getFileName().toString())));
        return new TaskFile(target, record, content);
    }

    public TaskFile load(Path path) {
        return tryLoad(path).orElseThrow(() ->
                new VaultException(ErrorKind.TASK_NOT_FOUND, "Task file not found: " + path));
    }

    /**
     * Empty when the file vanished, which callers treat as "handled by another process".
     */
    public Optional<TaskFile> tryLoad(Path path) {
        String content;
        try {
            content = files.read(path);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new FileOperationException("Failed to read task file: " + path, path, e);
        }
        TaskRecord record = TaskFileCodec.decode(content, path.toString());
        return Optional.of(new TaskFile(path, record, content));
    }

    public Optional<TaskFile> find(String taskId) {
        String name = fileNameFor(taskId);
        for (VaultFolder folder : VaultFolder.values()) {
            Path candidate = config.folder(folder).resolve(name);
            if (Files.isRegularFile(candidate)) {
                Optional<TaskFile> loaded = tryLoad(candidate);
                if (loaded.isPresent()) {
                    return loaded;
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Point-in-time snapshot of the visible task files in a folder, oldest name first.
     * Hidden temp and in-flight markers are skipped. A missing folder lists as empty.
     */
    public List<Path> list(VaultFolder folder) {
        return listTaskFiles(config.folder(folder));
    }

    public static List<Path> listTaskFiles(Path dir) {
        List<Path> out = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + TASK_SUFFIX)) {
            for (Path path : stream) {
                if (isVisibleTaskFile(path)) {
                    out.add(path);
                }
            }
        } catch (NoSuchFileException e) {
            return out;
        } catch (IOException e) {
            throw new FileOperationException("Failed to list directory: " + dir, dir, e);
        }
        out.sort(Comparator.comparing(path -> path.getFileName().toString()));
        return out;
    }

    public static boolean isVisibleTaskFile(Path path) {
        String name = path.getFileName().toString();
        return !name.startsWith(".") && name.endsWith(TASK_SUFFIX) && Files.isRegularFile(path);
    }

    public static boolean isInFlightMarker(Path path) {
        String name = path.getFileName().toString();
        return name.startsWith(".") && (name.endsWith(TEMP_SUFFIX) || name.endsWith(CLAIM_SUFFIX));
    }

    public static String fileNameFor(String taskId) {
        return taskId + TASK_SUFFIX;
    }

    static Path hiddenSibling(Path target, String suffix) {
        return target.resolveSibling("." + target.getFileName() + "." + suffix);
    }

    private void deleteQuietly(Path path) {
        try {
            files.delete(path);
        } catch (NoSuchFileException ignored) {
            // Never written.
        } catch (IOException e) {
            log.warn("Could not remove temp file {}: {}", path, e.getMessage());
        }
    }
}
