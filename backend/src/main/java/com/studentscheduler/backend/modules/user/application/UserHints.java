package com.studentscheduler.backend.modules.user.application;

/**
 * Optional attributes used only when a user has to be created. All fields may be {@code null}.
 */
public record UserHints(
        String email,
        String displayName,
        String studentId,
        String role
) {

    public static UserHints none() {
        return new UserHints(null, null, null, null);
    }
}
