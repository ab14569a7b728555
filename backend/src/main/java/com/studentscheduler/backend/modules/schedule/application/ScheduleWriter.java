package com.studentscheduler.backend.modules.schedule.application;

import java.sql.SQLException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

import com.studentscheduler.backend.global.database.RetryExecutor;
import com.studentscheduler.backend.global.error.ConflictException;
import com.studentscheduler.backend.global.error.NotFoundException;
import com.studentscheduler.backend.global.error.ValidationException;
import com.studentscheduler.backend.modules.course.application.CourseInput;
import com.studentscheduler.backend.modules.course.application.CourseResolver;
import com.studentscheduler.backend.modules.course.domain.Course;
import com.studentscheduler.backend.modules.schedule.domain.Schedule;
import com.studentscheduler.backend.modules.schedule.domain.ScheduleEntry;
import com.studentscheduler.backend.modules.schedule.infrastructure.persistence.ScheduleEntryRepository;
import com.studentscheduler.backend.modules.schedule.infrastructure.persistence.ScheduleRepository;
import com.studentscheduler.backend.modules.schedule.presentation.dto.ScheduleWriteResponse;
import com.studentscheduler.backend.modules.user.application.UserHints;
import com.studentscheduler.backend.modules.user.application.UserResolver;
import com.studentscheduler.backend.modules.user.domain.AppUser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * Multi-row schedule writes. Each public method is one transaction, retried as a whole on
 * transient failures: either every row of the write is committed or none is.
 */
@Service
public class ScheduleWriter {

    private static final Logger log = LoggerFactory.getLogger(ScheduleWriter.class);

    private static final DateTimeFormatter DEFAULT_NAME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    private static final int SCHEDULE_NAME_MAX_LENGTH = 200;
    private static final int COURSE_CODE_MAX_LENGTH = 32;
    private static final int COURSE_NAME_MAX_LENGTH = 200;
    private static final int COURSE_DETAIL_MAX_LENGTH = 100;
    private static final int COURSE_PLACE_MAX_LENGTH = 50;

    private final RetryExecutor retryExecutor;
    private final UserResolver userResolver;
    private final CourseResolver courseResolver;
    private final ScheduleRepository scheduleRepository;
    private final ScheduleEntryRepository scheduleEntryRepository;
    private final Clock clock;

    public ScheduleWriter(
            RetryExecutor retryExecutor,
            UserResolver userResolver,
            CourseResolver courseResolver,
            ScheduleRepository scheduleRepository,
            ScheduleEntryRepository scheduleEntryRepository,
            Clock clock
    ) {
        this.retryExecutor = retryExecutor;
        this.userResolver = userResolver;
        this.courseResolver = courseResolver;
        this.scheduleRepository = scheduleRepository;
        this.scheduleEntryRepository = scheduleEntryRepository;
        this.clock = clock;
    }

    /**
     * Saves a new schedule for the user, creating the user and any unknown courses on the way.
     *
     * @param userIdentifier email or user id of the owner
     * @param scheduleName   optional; defaults to {@code Schedule yyyy-MM-dd HH:mm UTC}
     * @param courses        at least one course, codes unique
     * @param userHints      optional attributes for a user created by this call
     */
    public ScheduleWriteResponse createSchedule(
            String userIdentifier,
            String scheduleName,
            List<CourseInput> courses,
            UserHints userHints
    ) {
        validateCourses(courses);
        String name = resolveName(scheduleName);
        ScheduleWriteResponse response = translateConflicts(() -> retryExecutor.inTransaction("createSchedule", status -> {
            AppUser owner = userResolver.resolveInCurrentTransaction(userIdentifier, userHints);
            List<Course> resolved = resolveCourses(courses);
            Schedule schedule = scheduleRepository.saveAndFlush(new Schedule(owner, name, sumCredits(resolved)));
            insertEntries(schedule, resolved);
            return toResponse(schedule, resolved.size());
        }));
        log.info("Created schedule {} with {} courses ({} credits)",
                response.scheduleId(), response.courseCount(), response.totalCredits());
        return response;
    }

    /**
     * Replaces every course of the schedule and recomputes its credit total.
     *
     * @param scheduleName optional new name; blank keeps the current one
     */
    public ScheduleWriteResponse updateSchedule(UUID scheduleId, String scheduleName, List<CourseInput> courses) {
        validateCourses(courses);
        String newName = (scheduleName == null || scheduleName.isBlank()) ? null : truncateName(scheduleName.trim());
        ScheduleWriteResponse response = translateConflicts(() -> retryExecutor.inTransaction("updateSchedule", status -> {
            Schedule schedule = scheduleRepository.findById(scheduleId)
                    .orElseThrow(() -> scheduleNotFound(scheduleId));
            scheduleEntryRepository.deleteByScheduleId(scheduleId);
            List<Course> resolved = resolveCourses(courses);
            if (newName != null) {
                schedule.rename(newName);
            }
            schedule.replaceCourses(sumCredits(resolved), OffsetDateTime.now(clock));
            scheduleRepository.saveAndFlush(schedule);
            insertEntries(schedule, resolved);
            return toResponse(schedule, resolved.size());
        }));
        log.info("Updated schedule {}: {} courses ({} credits)",
                scheduleId, response.courseCount(), response.totalCredits());
        return response;
    }

    /**
     * @throws NotFoundException when no schedule has the id
     */
    public void deleteSchedule(UUID scheduleId) {
        retryExecutor.inTransaction("deleteSchedule", status -> {
            int deleted = scheduleRepository.deleteScheduleById(scheduleId);
            if (deleted == 0) {
                throw scheduleNotFound(scheduleId);
            }
            return deleted;
        });
        log.info("Deleted schedule {}", scheduleId);
    }

    private List<Course> resolveCourses(List<CourseInput> courses) {
        List<Course> resolved = new ArrayList<>(courses.size());
        for (CourseInput course : courses) {
            resolved.add(courseResolver.resolveByCode(course));
        }
        return resolved;
    }

    private void insertEntries(Schedule schedule, List<Course> courses) {
        List<ScheduleEntry> entries = new ArrayList<>(courses.size());
        for (Course course : courses) {
            entries.add(new ScheduleEntry(schedule, course));
        }
        scheduleEntryRepository.saveAll(entries);
        scheduleEntryRepository.flush();
    }

    private static int sumCredits(List<Course> courses) {
        int total = 0;
        for (Course course : courses) {
            total += course.getCredits();
        }
        return total;
    }

    private static ScheduleWriteResponse toResponse(Schedule schedule, int courseCount) {
        return new ScheduleWriteResponse(schedule.getId(), schedule.getName(), schedule.getTotalCredits(), courseCount);
    }

    private static void validateCourses(List<CourseInput> courses) {
        if (courses == null || courses.isEmpty()) {
            throw new ValidationException("COURSES_REQUIRED", "A schedule needs at least one course");
        }
        Set<String> seen = new HashSet<>();
        for (CourseInput course : courses) {
            if (course == null || course.courseCode() == null || course.courseCode().isBlank()) {
                throw new ValidationException("COURSE_CODE_REQUIRED", "Every course needs a course code");
            }
            String code = course.normalizedCode();
            if (code.length() > COURSE_CODE_MAX_LENGTH) {
                throw new ValidationException("COURSE_CODE_TOO_LONG",
                        "Course code " + code + " is longer than " + COURSE_CODE_MAX_LENGTH + " characters");
            }
            requireMaxLength(code, "name", course.name(), COURSE_NAME_MAX_LENGTH);
            requireMaxLength(code, "instructor", course.instructor(), COURSE_DETAIL_MAX_LENGTH);
            requireMaxLength(code, "time", course.timeSlot(), COURSE_DETAIL_MAX_LENGTH);
            requireMaxLength(code, "room", course.room(), COURSE_PLACE_MAX_LENGTH);
            requireMaxLength(code, "weeks", course.weeks(), COURSE_PLACE_MAX_LENGTH);
            if (course.credits() < 0) {
                throw new ValidationException("INVALID_CREDITS",
                        "Credits must not be negative for " + course.normalizedCode());
            }
            if (!seen.add(course.normalizedCode())) {
                throw new ValidationException("DUPLICATE_COURSE_CODE",
                        "Course " + course.normalizedCode() + " is listed more than once");
            }
        }
    }

    private static void requireMaxLength(String courseCode, String field, String value, int maxLength) {
        if (value != null && value.trim().length() > maxLength) {
            throw new ValidationException("COURSE_FIELD_TOO_LONG",
                    "Course " + courseCode + ": " + field + " is longer than " + maxLength + " characters");
        }
    }

    private String resolveName(String scheduleName) {
        if (scheduleName != null && !scheduleName.isBlank()) {
            return truncateName(scheduleName.trim());
        }
        OffsetDateTime now = OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC);
        return "Schedule " + DEFAULT_NAME_FORMAT.format(now) + " UTC";
    }

    private static String truncateName(String name) {
        return name.length() > SCHEDULE_NAME_MAX_LENGTH ? name.substring(0, SCHEDULE_NAME_MAX_LENGTH) : name;
    }

    private static NotFoundException scheduleNotFound(UUID scheduleId) {
        return new NotFoundException("SCHEDULE_NOT_FOUND", "No schedule with id " + scheduleId);
    }

    private static <T> T translateConflicts(Supplier<T> write) {
        try {
            return write.get();
        } catch (DataIntegrityViolationException ex) {
            String sqlState = sqlState(ex);
            if (sqlState != null && sqlState.startsWith("22")) {
                throw new ValidationException("INVALID_VALUE", "A value does not fit its column", ex);
            }
            throw new ConflictException("SCHEDULE_CONFLICT", "The schedule conflicts with existing data", ex);
        }
    }

    private static String sqlState(Throwable failure) {
        for (Throwable current = failure; current != null; current = current.getCause()) {
            if (current instanceof SQLException sqlException && sqlException.getSQLState() != null) {
                return sqlException.getSQLState();
            }
        }
        return null;
    }
}
