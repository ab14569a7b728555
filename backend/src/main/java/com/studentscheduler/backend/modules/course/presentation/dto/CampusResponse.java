package com.studentscheduler.backend.modules.course.presentation.dto;

/**
 * A campus, identified by the part of a room code before the first dot ({@code B.201} is campus {@code B}).
 */
public record CampusResponse(int campusId, String campusCode, String campusName) {
}
