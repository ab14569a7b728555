package com.studentscheduler.backend.modules.schedule.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record ScheduleDetailResponse(
        ScheduleHeader schedule,
        List<ScheduledCourseResponse> courses
) {

    public record ScheduleHeader(
            UUID scheduleId,
            String name,
            int totalCredits,
            int courseCount,
            UUID userId,
            String userEmail,
            String userName,
            OffsetDateTime createdAt,
            OffsetDateTime updatedAt
    ) {
    }
}
