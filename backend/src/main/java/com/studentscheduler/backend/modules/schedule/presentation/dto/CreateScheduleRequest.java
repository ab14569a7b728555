package com.studentscheduler.backend.modules.schedule.presentation.dto;

import java.util.List;

import com.studentscheduler.backend.modules.course.application.CourseInput;
import com.studentscheduler.backend.modules.user.application.UserHints;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;

/**
 * {@code userEmail} or {@code userId} names the owner; an unknown email creates the user using
 * {@code userName} and {@code studentId}.
 */
public record CreateScheduleRequest(
        @Size(max = 320) String userEmail,
        String userId,
        @Size(max = 100) String userName,
        @Size(max = 50) String studentId,
        @Size(max = 200) String scheduleName,
        List<@Valid ScheduleCourseRequest> courses
) {

    public String userIdentifier() {
        return (userEmail != null && !userEmail.isBlank()) ? userEmail : userId;
    }

    public UserHints userHints() {
        return new UserHints(userEmail, userName, studentId, null);
    }

    public List<CourseInput> courseInputs() {
        return courses == null ? null : courses.stream().map(ScheduleCourseRequest::toInput).toList();
    }
}
