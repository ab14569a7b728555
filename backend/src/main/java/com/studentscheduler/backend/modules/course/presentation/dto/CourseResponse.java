package com.studentscheduler.backend.modules.course.presentation.dto;

import java.util.UUID;

import com.studentscheduler.backend.modules.course.domain.Course;

public record CourseResponse(
        UUID courseId,
        String courseCode,
        String name,
        int credits,
        String instructor,
        String timeSlot,
        String room,
        String weeks,
        Integer capacity
) {

    public static CourseResponse from(Course course) {
        return new CourseResponse(
                course.getId(),
                course.getCourseCode(),
                course.getName(),
                course.getCredits(),
                course.getInstructor(),
                course.getTimeSlot(),
                course.getRoom(),
                course.getWeeks(),
                course.getCapacity()
        );
    }
}
