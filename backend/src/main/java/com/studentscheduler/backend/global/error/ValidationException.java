package com.studentscheduler.backend.global.error;

import org.springframework.http.HttpStatus;

public class ValidationException extends ProblemException {

    public ValidationException(String code, String detail) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, code, detail);
    }

    public ValidationException(String code, String detail, Throwable cause) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, code, detail, cause);
    }
}
