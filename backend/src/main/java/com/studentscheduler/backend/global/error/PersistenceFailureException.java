package com.studentscheduler.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * Permanent store failure: bad credentials, malformed query, missing schema and the like.
 */
public class PersistenceFailureException extends ProblemException {

    public PersistenceFailureException(String code, String detail, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, code, detail, cause);
    }
}
