package com.liferx.brain.audit;

/**
 * Reference to a "started" audit entry, passed back to record the outcome.
 *
 * A placeholder handle means the start entry could not be written; outcome
 * updates against it are skipped.
 */
public record AuditHandle(String id, long startedAtMs, boolean placeholder) {

    public static final String FAILED_ID = "log-failed";

    public static AuditHandle of(String id, long startedAtMs) {
        return new AuditHandle(id, startedAtMs, false);
    }

    public static AuditHandle failed(long startedAtMs) {
        return new AuditHandle(FAILED_ID, startedAtMs, true);
    }
}
