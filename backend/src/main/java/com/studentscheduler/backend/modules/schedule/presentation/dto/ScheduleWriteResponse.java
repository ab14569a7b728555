package com.studentscheduler.backend.modules.schedule.presentation.dto;

import java.util.UUID;

public record ScheduleWriteResponse(
        UUID scheduleId,
        String name,
        int totalCredits,
        int courseCount
) {
}
