package com.studentscheduler.backend.modules.course.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.studentscheduler.backend.global.error.PersistenceFailureException;
import com.studentscheduler.backend.modules.course.domain.Course;
import com.studentscheduler.backend.modules.course.infrastructure.persistence.CourseRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resolve-or-insert for catalog rows. Runs inside the caller's transaction.
 */
@Component
public class CourseResolver {

    private static final Logger log = LoggerFactory.getLogger(CourseResolver.class);

    private final CourseRepository courseRepository;
    private final Clock clock;

    public CourseResolver(CourseRepository courseRepository, Clock clock) {
        this.courseRepository = courseRepository;
        this.clock = clock;
    }

    public Course resolveByCode(CourseInput input) {
        String code = input.normalizedCode();
        return courseRepository.findByCourseCode(code).orElseGet(() -> insert(code, input));
    }

    private Course insert(String code, CourseInput input) {
        int inserted = courseRepository.insertIfAbsent(
                code,
                (input.name() != null && !input.name().isBlank()) ? input.name().trim() : code,
                input.credits(),
                trimToNull(input.instructor()),
                trimToNull(input.timeSlot()),
                trimToNull(input.room()),
                trimToNull(input.weeks()),
                input.capacity(),
                OffsetDateTime.now(clock)
        );
        if (inserted == 1) {
            log.info("Added course {} to the catalog", code);
        }
        return courseRepository.findByCourseCode(code)
                .orElseThrow(() -> new PersistenceFailureException(
                        "COURSE_RESOLUTION_FAILED",
                        "Course row for " + code + " vanished after insert",
                        null
                ));
    }

    private static String trimToNull(String value) {
        return (value == null || value.isBlank()) ? null : value.trim();
    }
}
