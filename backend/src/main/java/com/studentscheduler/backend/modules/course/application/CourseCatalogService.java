package com.studentscheduler.backend.modules.course.application;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import com.studentscheduler.backend.global.database.RetryExecutor;
import com.studentscheduler.backend.global.error.NotFoundException;
import com.studentscheduler.backend.modules.course.infrastructure.persistence.CourseRepository;
import com.studentscheduler.backend.modules.course.presentation.dto.CampusResponse;
import com.studentscheduler.backend.modules.course.presentation.dto.CourseResponse;
import com.studentscheduler.backend.modules.course.presentation.dto.SemesterResponse;
import com.studentscheduler.backend.modules.course.presentation.dto.SubjectResponse;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class CourseCatalogService {

    private final CourseRepository courseRepository;
    private final RetryExecutor retryExecutor;
    private final List<SemesterResponse> semesters;

    public CourseCatalogService(
            CourseRepository courseRepository,
            RetryExecutor retryExecutor,
            @Value("${app.catalog.semesters:2025A|Semester 1 2024-2025,2025B|Semester 2 2024-2025}") List<String> semesters
    ) {
        this.courseRepository = courseRepository;
        this.retryExecutor = retryExecutor;
        this.semesters = parseSemesters(semesters);
    }

    /**
     * Lists the catalog ordered by name, optionally filtered by a case-insensitive substring of the
     * name or the code.
     */
    public List<CourseResponse> listCourses(String search) {
        String pattern = (search == null || search.isBlank())
                ? "%"
                : "%" + search.trim().toLowerCase(Locale.ROOT) + "%";
        return retryExecutor.inReadOnlyTransaction("listCourses", status -> courseRepository.search(pattern)
                .stream()
                .map(CourseResponse::from)
                .toList());
    }

    public CourseResponse getCourse(String courseCode) {
        String code = CourseInput.normalizeCode(courseCode);
        return retryExecutor.inReadOnlyTransaction("getCourse", status -> courseRepository.findByCourseCode(code)
                .map(CourseResponse::from)
                .orElseThrow(() -> new NotFoundException("COURSE_NOT_FOUND", "No course with code " + code)));
    }

    /**
     * Distinct course names, numbered from 1 in name order.
     */
    public List<SubjectResponse> listSubjects() {
        List<String> names = retryExecutor.inReadOnlyTransaction("listSubjects",
                status -> courseRepository.findDistinctNames());
        List<SubjectResponse> subjects = new ArrayList<>(names.size());
        for (String name : names) {
            subjects.add(new SubjectResponse(subjects.size() + 1, name));
        }
        return subjects;
    }

    /**
     * Campus codes taken from the room prefix before the first dot. Rooms without a dot belong to
     * no campus.
     */
    public List<CampusResponse> listCampuses() {
        List<String> rooms = retryExecutor.inReadOnlyTransaction("listCampuses",
                status -> courseRepository.findDistinctDottedRooms());
        Set<String> codes = new LinkedHashSet<>();
        for (String room : rooms) {
            String code = room.substring(0, room.indexOf('.')).trim();
            if (!code.isEmpty()) {
                codes.add(code);
            }
        }
        List<CampusResponse> campuses = new ArrayList<>(codes.size());
        for (String code : codes) {
            campuses.add(new CampusResponse(campuses.size() + 1, code, "Campus " + code));
        }
        return campuses;
    }

    public List<SemesterResponse> listSemesters() {
        return semesters;
    }

    private static List<SemesterResponse> parseSemesters(List<String> entries) {
        List<SemesterResponse> parsed = new ArrayList<>();
        for (String entry : entries) {
            int separator = entry.indexOf('|');
            if (separator <= 0) {
                throw new IllegalStateException("app.catalog.semesters entry must be CODE|Name: " + entry);
            }
            parsed.add(new SemesterResponse(entry.substring(0, separator).trim(), entry.substring(separator + 1).trim()));
        }
        return List.copyOf(parsed);
    }
}
