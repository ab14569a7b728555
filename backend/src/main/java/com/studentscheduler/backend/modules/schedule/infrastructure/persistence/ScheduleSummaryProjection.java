package com.studentscheduler.backend.modules.schedule.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.UUID;

public interface ScheduleSummaryProjection {

    UUID getScheduleId();

    String getName();

    Integer getTotalCredits();

    Long getCourseCount();

    OffsetDateTime getCreatedAt();

    OffsetDateTime getUpdatedAt();
}
