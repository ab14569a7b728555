package com.studentscheduler.backend.modules.schedule.presentation.dto;

import java.util.List;

import com.studentscheduler.backend.modules.course.application.CourseInput;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;

public record UpdateScheduleRequest(
        @Size(max = 200) String scheduleName,
        List<@Valid ScheduleCourseRequest> courses
) {

    public List<CourseInput> courseInputs() {
        return courses == null ? null : courses.stream().map(ScheduleCourseRequest::toInput).toList();
    }
}
