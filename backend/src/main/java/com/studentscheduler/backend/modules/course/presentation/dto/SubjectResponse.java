package com.studentscheduler.backend.modules.course.presentation.dto;

public record SubjectResponse(int subjectId, String subjectName) {
}
