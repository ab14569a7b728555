package com.studentscheduler.backend.modules.course.presentation;

import java.util.List;

import com.studentscheduler.backend.modules.course.application.CourseCatalogService;
import com.studentscheduler.backend.modules.course.presentation.dto.CampusResponse;
import com.studentscheduler.backend.modules.course.presentation.dto.CourseResponse;
import com.studentscheduler.backend.modules.course.presentation.dto.SemesterResponse;
import com.studentscheduler.backend.modules.course.presentation.dto.SubjectResponse;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/courses")
public class CourseController {

    private final CourseCatalogService courseCatalogService;

    public CourseController(CourseCatalogService courseCatalogService) {
        this.courseCatalogService = courseCatalogService;
    }

    @GetMapping
    public ResponseEntity<List<CourseResponse>> listCourses(
            @RequestParam(name = "search", required = false) String search
    ) {
        return ResponseEntity.ok(courseCatalogService.listCourses(search));
    }

    @GetMapping("/subjects")
    public ResponseEntity<List<SubjectResponse>> listSubjects() {
        return ResponseEntity.ok(courseCatalogService.listSubjects());
    }

    @GetMapping("/campuses")
    public ResponseEntity<List<CampusResponse>> listCampuses() {
        return ResponseEntity.ok(courseCatalogService.listCampuses());
    }

    @GetMapping("/semesters")
    public ResponseEntity<List<SemesterResponse>> listSemesters() {
        return ResponseEntity.ok(courseCatalogService.listSemesters());
    }

    @GetMapping("/{courseCode}")
    public ResponseEntity<CourseResponse> getCourse(@PathVariable("courseCode") String courseCode) {
        return ResponseEntity.ok(courseCatalogService.getCourse(courseCode));
    }
}
