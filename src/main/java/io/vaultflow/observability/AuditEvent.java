package io.vaultflow.observability;

import io.vaultflow.model.Actors;
import io.vaultflow.model.TaskState;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One audit row. {@code result} is {@code success}, {@code refused}, {@code failure} or
 * {@code warning}; refused attempts are audited exactly like successful ones.
 */
public record AuditEvent(
        String action,
        String taskId,
        TaskState fromState,
        TaskState toState,
        String result,
        String actor,
        String reason,
        String error,
        Map<String, Object> details
) {
    public static final String RESULT_SUCCESS = "success";
    public static final String RESULT_REFUSED = "refused";
    public static final String RESULT_FAILURE = "failure";
    public static final String RESULT_WARNING = "warning";

    public AuditEvent {
        actor = Actors.orSystem(actor);
        reason = reason == null ? "" : reason;
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static AuditEvent success(String action, String taskId, TaskState from, TaskState to,
                                     String actor, String reason, Map<String, Object> details) {
        return new AuditEvent(action, taskId, from, to, RESULT_SUCCESS, actor, reason, null, details);
    }

    public static AuditEvent refused(String action, String taskId, TaskState from, TaskState to,
                                     String actor, String reason, String error, Map<String, Object> details) {
        return new AuditEvent(action, taskId, from, to, RESULT_REFUSED, actor, reason, error, details);
    }

    public static AuditEvent failure(String action, String taskId, TaskState from, TaskState to,
                                     String actor, String reason, String error, Map<String, Object> details) {
        return new AuditEvent(action, taskId, from, to, RESULT_FAILURE, actor, reason, error, details);
    }

    public static AuditEvent warning(String action, String taskId, TaskState from, TaskState to,
                                     String actor, String reason, String error, Map<String, Object> details) {
        return new AuditEvent(action, taskId, from, to, RESULT_WARNING, actor, reason, error, details);
    }
}
