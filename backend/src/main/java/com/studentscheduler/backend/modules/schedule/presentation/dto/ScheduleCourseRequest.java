package com.studentscheduler.backend.modules.schedule.presentation.dto;

import com.studentscheduler.backend.modules.course.application.CourseInput;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

public record ScheduleCourseRequest(
        @NotBlank @Size(max = 32) String courseCode,
        @Size(max = 200) String name,
        @NotNull @PositiveOrZero Integer credits,
        @Size(max = 100) String instructor,
        @Size(max = 100) String time,
        @Size(max = 50) String room,
        @Size(max = 50) String weeks,
        @PositiveOrZero Integer capacity
) {

    public CourseInput toInput() {
        return new CourseInput(courseCode, name, credits, instructor, time, room, weeks, capacity);
    }
}
