package com.studentscheduler.backend.modules.schedule.domain;

import java.io.Serializable;
import java.util.Objects;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

@Embeddable
public class ScheduleEntryId implements Serializable {

    @Column(name = "schedule_id", nullable = false, columnDefinition = "uuid")
    private UUID scheduleId;

    @Column(name = "course_id", nullable = false, columnDefinition = "uuid")
    private UUID courseId;

    protected ScheduleEntryId() {
    }

    public ScheduleEntryId(UUID scheduleId, UUID courseId) {
        this.scheduleId = scheduleId;
        this.courseId = courseId;
    }

    public UUID getScheduleId() {
        return scheduleId;
    }

    public UUID getCourseId() {
        return courseId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScheduleEntryId that)) return false;
        return Objects.equals(scheduleId, that.scheduleId) && Objects.equals(courseId, that.courseId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scheduleId, courseId);
    }
}
