package com.studentscheduler.backend.modules.user.domain;

import java.util.Locale;

public enum UserRole {
    STUDENT,
    STAFF;

    /**
     * Lenient parse for caller hints; blank or unknown values fall back to {@link #STUDENT}.
     */
    public static UserRole fromHint(String value) {
        if (value == null || value.isBlank()) {
            return STUDENT;
        }
        try {
            return UserRole.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return STUDENT;
        }
    }
}
