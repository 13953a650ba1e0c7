package io.vaultflow.codec;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import io.vaultflow.error.ErrorKind;
import io.vaultflow.error.VaultException;
import io.vaultflow.model.ApprovalStamp;
import io.vaultflow.model.StateHistoryEntry;
import io.vaultflow.model.TaskRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes the persisted task layout: a YAML frontmatter block between two
 * {@code ---} lines, followed by the free-text body.
 *
 * <p>Decoding is strict. Unknown keys, unknown enum values and missing required fields are
 * rejected with {@link ErrorKind#MALFORMED_TASK_FILE} instead of being defaulted.
 */
public final class TaskFileCodec {
    public static final String SEPARATOR = "---";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(
            new YAMLFactory().disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER))
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
            .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);

    private TaskFileCodec() {
    }

    public static String encode(TaskRecord record) {
        String yaml;
        try {
            yaml = YAML_MAPPER.writeValueAsString(toFrontmatter(record));
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize task frontmatter: " + record.id(), e);
        }
        StringBuilder sb = new StringBuilder(yaml.length() + record.body().length() + 16);
        sb.append(SEPARATOR).append('\n');
        sb.append(yaml);
        if (!yaml.endsWith("\n")) {
            sb.append('\n');
        }
        sb.append(SEPARATOR).append('\n');
        sb.append(record.body());
        return sb.toString();
    }

    public static TaskRecord decode(String content, String source) {
        Split split = split(content, source);
        TaskFrontmatter fm;
        try {
            fm = YAML_MAPPER.readValue(split.frontmatter(), TaskFrontmatter.class);
        } catch (JsonProcessingException e) {
            throw malformed(source, e.getOriginalMessage(), e);
        }
        if (fm == null) {
            throw malformed(source, "empty frontmatter", null);
        }
        return toRecord(fm, split.body(), source);
    }

    /**
     * Returns the body exactly as stored, which is what approval integrity hashes cover.
     */
    public static String body(String content, String source) {
        return split(content, source).body();
    }

    private static Split split(String content, String source) {
        if (content == null || content.isEmpty()) {
            throw malformed(source, "file is empty", null);
        }
        int firstEnd = lineEnd(content, 0);
        if (!SEPARATOR.equals(stripCr(content.substring(0, firstEnd)))) {
            throw malformed(source, "missing opening '" + SEPARATOR + "' line", null);
        }
        int cursor = nextLineStart(content, firstEnd);
        int frontStart = cursor;
        while (cursor < content.length()) {
            int end = lineEnd(content, cursor);
            if (SEPARATOR.equals(stripCr(content.substring(cursor, end)))) {
                String front = content.substring(frontStart, cursor);
                String body = content.substring(nextLineStart(content, end));
                return new Split(front, body);
            }
            cursor = nextLineStart(content, end);
        }
        throw malformed(source, "missing closing '" + SEPARATOR + "' line", null);
    }

    private static TaskFrontmatter toFrontmatter(TaskRecord record) {
        List<TaskFrontmatter.HistoryRow> history = new ArrayList<>();
        for (StateHistoryEntry entry : record.stateHistory()) {
            history.add(new TaskFrontmatter.HistoryRow(entry.state(), entry.timestamp(), entry.actor()));
        }
        ApprovalStamp a = record.approval();
        TaskFrontmatter.ApprovalRow approval = a == null ? null : new TaskFrontmatter.ApprovalRow(
                a.approvalId(),
                a.taskId(),
                a.nonce(),
                a.integrityHash(),
                a.status(),
                a.createdAt(),
                a.expiresAt(),
                a.rejectionReason(),
                a.reviewedAt(),
                a.reviewedBy()
        );
        return new TaskFrontmatter(
                record.id(),
                record.state(),
                record.priority(),
                record.createdAt(),
                record.modifiedAt(),
                record.retryCount(),
                history,
                approval
        );
    }

    private static TaskRecord toRecord(TaskFrontmatter fm, String body, String source) {
        require(fm.taskId() != null && !fm.taskId().isBlank(), source, "missing 'task_id'");
        require(fm.state() != null, source, "missing 'state'");
        require(fm.createdAt() != null, source, "missing 'created_at'");
        int retryCount = fm.retryCount() == null ? 0 : fm.retryCount();
        require(retryCount >= 0, source, "'retry_count' must not be negative");

        List<StateHistoryEntry> history = new ArrayList<>();
        if (fm.stateHistory() != null) {
            int index = 0;
            for (TaskFrontmatter.HistoryRow row : fm.stateHistory()) {
                require(row != null && row.state() != null, source, "state_history[" + index + "] has no 'state'");
                require(row.timestamp() != null, source, "state_history[" + index + "] has no 'timestamp'");
                history.add(new StateHistoryEntry(row.state(), row.timestamp(), row.actor()));
                index++;
            }
        }

        ApprovalStamp approval = null;
        TaskFrontmatter.ApprovalRow a = fm.approval();
        if (a != null) {
            require(a.approvalId() != null && !a.approvalId().isBlank(), source, "approval has no 'approval_id'");
            require(a.status() != null, source, "approval has no 'approval_status'");
            require(a.createdAt() != null, source, "approval has no 'created_at'");
            require(a.expiresAt() != null, source, "approval has no 'expires_at'");
            approval = new ApprovalStamp(
                    a.approvalId(),
                    a.taskId() == null || a.taskId().isBlank() ? fm.taskId() : a.taskId(),
                    a.nonce(),
                    a.integrityHash(),
                    a.status(),
                    a.createdAt(),
                    a.expiresAt(),
                    a.rejectionReason(),
                    a.reviewedAt(),
                    a.reviewedBy()
            );
        }
        return new TaskRecord(
                fm.taskId(),
                fm.state(),
                fm.priority(),
                fm.createdAt(),
                fm.modifiedAt(),
                retryCount,
                history,
                approval,
                body
        );
    }

    private static void require(boolean condition, String source, String message) {
        if (!condition) {
            throw malformed(source, message, null);
        }
    }

    private static VaultException malformed(String source, String detail, Throwable cause) {
        String message = "Malformed task file " + source + ": " + detail;
        return cause == null
                ? new VaultException(ErrorKind.MALFORMED_TASK_FILE, message)
                : new VaultException(ErrorKind.MALFORMED_TASK_FILE, message, cause);
    }

    private static int lineEnd(String content, int from) {
        int idx = content.indexOf('\n', from);
        return idx < 0 ? content.length() : idx;
    }

    private static int nextLineStart(String content, int lineEnd) {
        return lineEnd >= content.length() ? content.length() : lineEnd + 1;
    }

    private static String stripCr(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    private record Split(String frontmatter, String body) {
    }
}
