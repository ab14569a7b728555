package com.studentscheduler.backend.modules.schedule.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.studentscheduler.backend.modules.schedule.infrastructure.persistence.ScheduleSummaryProjection;

public record ScheduleSummaryResponse(
        UUID scheduleId,
        String name,
        int totalCredits,
        long courseCount,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static ScheduleSummaryResponse from(ScheduleSummaryProjection projection) {
        return new ScheduleSummaryResponse(
                projection.getScheduleId(),
                projection.getName(),
                projection.getTotalCredits() != null ? projection.getTotalCredits() : 0,
                projection.getCourseCount() != null ? projection.getCourseCount() : 0L,
                projection.getCreatedAt(),
                projection.getUpdatedAt()
        );
    }
}
