package com.studentscheduler.backend.modules.user.presentation.dto;

import com.studentscheduler.backend.modules.user.application.UserHints;

import jakarta.validation.constraints.Size;

/**
 * Either {@code email} or {@code userId} identifies the user; the rest are creation hints.
 */
public record ResolveUserRequest(
        @Size(max = 320) String email,
        String userId,
        @Size(max = 100) String name,
        @Size(max = 50) String studentId,
        String role
) {

    public String identifier() {
        return (email != null && !email.isBlank()) ? email : userId;
    }

    public UserHints toHints() {
        return new UserHints(email, name, studentId, role);
    }
}
