package io.vaultflow.codec;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.vaultflow.model.ApprovalStatus;
import io.vaultflow.model.Priority;
import io.vaultflow.model.TaskState;

import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"task_id", "state", "priority", "created_at", "modified_at", "retry_count", "state_history", "approval"})
record TaskFrontmatter(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("state") TaskState state,
        @JsonProperty("priority") Priority priority,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("modified_at") Instant modifiedAt,
        @JsonProperty("retry_count") Integer retryCount,
        @JsonProperty("state_history") List<HistoryRow> stateHistory,
        @JsonProperty("approval") ApprovalRow approval
) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"state", "timestamp", "actor"})
    record HistoryRow(
            @JsonProperty("state") TaskState state,
            @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("actor") String actor
    ) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"approval_id", "task_id", "nonce", "integrity_hash", "approval_status",
            "created_at", "expires_at", "rejection_reason", "reviewed_at", "reviewed_by"})
    record ApprovalRow(
            @JsonProperty("approval_id") String approvalId,
            @JsonProperty("task_id") String taskId,
            @JsonProperty("nonce") String nonce,
            @JsonProperty("integrity_hash") String integrityHash,
            @JsonProperty("approval_status") ApprovalStatus status,
            @JsonProperty("created_at") Instant createdAt,
            @JsonProperty("expires_at") Instant expiresAt,
            @JsonProperty("rejection_reason") String rejectionReason,
            @JsonProperty("reviewed_at") Instant reviewedAt,
            @JsonProperty("reviewed_by") String reviewedBy
    ) {
    }
}
