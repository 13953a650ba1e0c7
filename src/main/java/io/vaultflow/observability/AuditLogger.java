package io.vaultflow.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.vaultflow.error.FileOperationException;
import io.vaultflow.security.SensitiveDataMasker;
import io.vaultflow.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Append-only audit trail, one JSON object per line, one file per UTC day.
 *
 * <p>Every row is written with a single append call so several processes can share the
 * same daily file. {@link #record(AuditEvent)} never throws: a failed write goes to the
 * operational log instead and is counted.
 */
public final class AuditLogger {
    private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);
    private static final String FILE_SUFFIX = ".log";

    private final Path logDir;
    private final Clock clock;
    private final AtomicLong failedWrites;

    public AuditLogger(Path logDir, Clock clock) {
        this.logDir = logDir;
        this.clock = clock;
        this.failedWrites = new AtomicLong(0L);
    }

    public void record(AuditEvent event) {
        Instant now = clock.instant();
        Path file = fileFor(LocalDate.ofInstant(now, ZoneOffset.UTC));
        try {
            String line = Jsons.toCompactJson(toRow(event, now)) + "\n";
            Files.createDirectories(logDir);
            Files.write(file, line.getBytes(StandardCharsets.UTF_8),
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException | RuntimeException e) {
            failedWrites.incrementAndGet();
            log.error("Audit write failed file={} action={} task={} result={}: {}",
                    file, event.action(), event.taskId(), event.result(), e.getMessage(), e);
        }
    }

    public long failedWrites() {
        return failedWrites.get();
    }

    public Path fileFor(LocalDate date) {
        return logDir.resolve(date + FILE_SUFFIX);
    }

    public Path currentFile() {
        return fileFor(LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC));
    }

    /**
     * Last {@code limit} rows of the given day, oldest first.
     */
    public List<JsonNode> tail(LocalDate date, int limit) {
        Path file = fileFor(date);
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return List.of();
        } catch (IOException e) {
            throw new FileOperationException("Failed to read audit log: " + file, file, e);
        }
        List<JsonNode> rows = new ArrayList<>();
        int safeLimit = Math.max(1, limit);
        int start = Math.max(0, lines.size() - safeLimit);
        for (int i = start; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line == null || line.isBlank()) {
                continue;
            }
            try {
                rows.add(Jsons.mapper().readTree(line));
            } catch (IOException e) {
                log.warn("Skipping unreadable audit row {}:{}", file, i + 1);
            }
        }
        return rows;
    }

    private Map<String, Object> toRow(AuditEvent event, Instant now) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", now.toString());
        row.put("action", event.action());
        row.put("task_id", event.taskId());
        row.put("from_state", event.fromState() == null ? null : event.fromState().wireName());
        row.put("to_state", event.toState() == null ? null : event.toState().wireName());
        row.put("result", event.result());
        row.put("actor", event.actor());
        row.put("reason", event.reason());
        if (event.error() != null) {
            row.put("error", event.error());
        }
        if (!event.details().isEmpty()) {
            row.put("details", sanitizeDetails(event.details()));
        }
        return row;
    }

    private JsonNode sanitizeDetails(Map<String, Object> input) {
        JsonNode node = Jsons.mapper().valueToTree(input);
        return SensitiveDataMasker.masked(node);
    }
}
