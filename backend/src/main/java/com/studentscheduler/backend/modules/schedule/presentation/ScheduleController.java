package com.studentscheduler.backend.modules.schedule.presentation;

import java.util.List;
import java.util.UUID;

import com.studentscheduler.backend.modules.schedule.application.ScheduleQueryService;
import com.studentscheduler.backend.modules.schedule.application.ScheduleWriter;
import com.studentscheduler.backend.modules.schedule.presentation.dto.CreateScheduleRequest;
import com.studentscheduler.backend.modules.schedule.presentation.dto.ScheduleDetailResponse;
import com.studentscheduler.backend.modules.schedule.presentation.dto.ScheduleSummaryResponse;
import com.studentscheduler.backend.modules.schedule.presentation.dto.ScheduleWriteResponse;
import com.studentscheduler.backend.modules.schedule.presentation.dto.UpdateScheduleRequest;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/schedules")
public class ScheduleController {

    private final ScheduleWriter scheduleWriter;
    private final ScheduleQueryService scheduleQueryService;

    public ScheduleController(ScheduleWriter scheduleWriter, ScheduleQueryService scheduleQueryService) {
        this.scheduleWriter = scheduleWriter;
        this.scheduleQueryService = scheduleQueryService;
    }

    @Operation(
            summary = "Save a schedule",
            description = """
                    Creates the owner on first use and adds unknown course codes to the catalog. \
                    Known course codes keep their stored credits. All rows are written in one transaction.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Schedule created"),
            @ApiResponse(responseCode = "422", description = "`COURSES_REQUIRED`, `DUPLICATE_COURSE_CODE` or `EMAIL_REQUIRED`"),
            @ApiResponse(responseCode = "503", description = "`DATABASE_UNAVAILABLE` while the database is resuming")
    })
    @PostMapping
    public ResponseEntity<ScheduleWriteResponse> createSchedule(@Valid @RequestBody CreateScheduleRequest request) {
        ScheduleWriteResponse response = scheduleWriter.createSchedule(
                request.userIdentifier(),
                request.scheduleName(),
                request.courseInputs(),
                request.userHints()
        );
        return ResponseEntity.status(201).body(response);
    }

    @GetMapping("/user/{userIdentifier}")
    public ResponseEntity<List<ScheduleSummaryResponse>> getUserSchedules(
            @PathVariable("userIdentifier") String userIdentifier
    ) {
        return ResponseEntity.ok(scheduleQueryService.getUserSchedules(userIdentifier));
    }

    @GetMapping("/{scheduleId}")
    public ResponseEntity<ScheduleDetailResponse> getSchedule(@PathVariable("scheduleId") UUID scheduleId) {
        return ResponseEntity.ok(scheduleQueryService.getScheduleDetails(scheduleId));
    }

    @Operation(summary = "Replace the courses of a schedule")
    @PutMapping("/{scheduleId}")
    public ResponseEntity<ScheduleWriteResponse> updateSchedule(
            @PathVariable("scheduleId") UUID scheduleId,
            @Valid @RequestBody UpdateScheduleRequest request
    ) {
        return ResponseEntity.ok(scheduleWriter.updateSchedule(scheduleId, request.scheduleName(), request.courseInputs()));
    }

    @DeleteMapping("/{scheduleId}")
    public ResponseEntity<Void> deleteSchedule(@PathVariable("scheduleId") UUID scheduleId) {
        scheduleWriter.deleteSchedule(scheduleId);
        return ResponseEntity.noContent().build();
    }
}
