package io.vaultflow.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ApprovalStatus {
    PENDING("pending"),
    APPROVED("approved"),
    REJECTED("rejected"),
    EXPIRED("expired");

    private final String wireName;

    ApprovalStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static ApprovalStatus fromWire(String raw) {
        if (raw != null) {
            for (ApprovalStatus status : values()) {
                if (status.wireName.equals(raw.trim())) {
                    return status;
                }
            }
        }
        throw new IllegalArgumentException("Unknown approval status: " + raw);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
