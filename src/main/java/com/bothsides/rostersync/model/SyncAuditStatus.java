package com.bothsides.rostersync.model;

/**
 * Job lifecycle point recorded in the audit log
 */
public enum SyncAuditStatus {
    SCHEDULED("scheduled"),
    COMPLETED("completed"),
    FAILED("failed"),
    CANCELLED("cancelled");

    private final String value;

    SyncAuditStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
