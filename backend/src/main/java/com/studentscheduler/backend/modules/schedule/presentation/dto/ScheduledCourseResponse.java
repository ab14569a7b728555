package com.studentscheduler.backend.modules.schedule.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.studentscheduler.backend.modules.course.domain.Course;
import com.studentscheduler.backend.modules.schedule.domain.ScheduleEntry;

public record ScheduledCourseResponse(
        UUID courseId,
        String courseCode,
        String name,
        int credits,
        String instructor,
        String time,
        String room,
        String weeks,
        Integer capacity,
        OffsetDateTime addedAt
) {

    public static ScheduledCourseResponse from(ScheduleEntry entry) {
        Course course = entry.getCourse();
        return new ScheduledCourseResponse(
                course.getId(),
                course.getCourseCode(),
                course.getName(),
                course.getCredits(),
                course.getInstructor(),
                course.getTimeSlot(),
                course.getRoom(),
                course.getWeeks(),
                course.getCapacity(),
                entry.getCreatedAt()
        );
    }
}
