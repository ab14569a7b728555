package com.studentscheduler.backend.global.database;

/**
 * Recovery decision for a failure raised while talking to the store.
 */
public enum ErrorCategory {

    /** Connectivity or availability problem that is expected to clear up; retry after a delay. */
    TRANSIENT,

    /** Logic, constraint or input problem; retrying cannot help and must not be attempted. */
    PERMANENT;

    public boolean isRetryable() {
        return this == TRANSIENT;
    }
}
