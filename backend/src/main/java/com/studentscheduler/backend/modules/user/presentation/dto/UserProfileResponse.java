package com.studentscheduler.backend.modules.user.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.studentscheduler.backend.modules.user.domain.AppUser;

public record UserProfileResponse(
        UUID userId,
        String email,
        String displayName,
        String studentId,
        String role,
        boolean registered,
        OffsetDateTime createdAt
) {

    public static UserProfileResponse from(AppUser user) {
        return new UserProfileResponse(
                user.getId(),
                user.getEmail(),
                user.getDisplayName(),
                user.getStudentId(),
                user.getRole().name(),
                user.hasPassword(),
                user.getCreatedAt()
        );
    }
}
