package com.studentscheduler.backend.modules.course.application;

import java.util.Locale;

/**
 * A course as referenced by a schedule write. Only {@code courseCode} identifies it; the other
 * fields are used when the code is seen for the first time.
 */
public record CourseInput(
        String courseCode,
        String name,
        int credits,
        String instructor,
        String timeSlot,
        String room,
        String weeks,
        Integer capacity
) {

    public static CourseInput of(String courseCode, int credits) {
        return new CourseInput(courseCode, null, credits, null, null, null, null, null);
    }

    public String normalizedCode() {
        return normalizeCode(courseCode);
    }

    public static String normalizeCode(String code) {
        return code == null ? null : code.trim().toUpperCase(Locale.ROOT);
    }
}
