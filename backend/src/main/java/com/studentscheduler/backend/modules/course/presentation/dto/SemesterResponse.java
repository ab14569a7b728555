package com.studentscheduler.backend.modules.course.presentation.dto;

public record SemesterResponse(String semesterCode, String semesterName) {
}
