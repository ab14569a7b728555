package com.studentscheduler.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * A natural-key or referential constraint rejected the write. Surfaced as-is, never retried.
 */
public class ConflictException extends ProblemException {

    public ConflictException(String code, String detail) {
        super(HttpStatus.CONFLICT, code, detail);
    }

    public ConflictException(String code, String detail, Throwable cause) {
        super(HttpStatus.CONFLICT, code, detail, cause);
    }
}
