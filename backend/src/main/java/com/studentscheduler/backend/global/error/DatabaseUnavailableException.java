package com.studentscheduler.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * The backing store stayed unreachable for the whole retry budget, usually because it is still
 * resuming from auto-pause. Clients may retry after {@link #getRetryAfterSeconds()}.
 */
public class DatabaseUnavailableException extends RetryableProblemException {

    public static final String CODE = "DATABASE_UNAVAILABLE";

    public DatabaseUnavailableException(String detail, int retryAfterSeconds, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, CODE, detail, retryAfterSeconds, cause);
    }
}
