package com.studentscheduler.backend.modules.schedule.application;

import java.util.List;
import java.util.UUID;

import com.studentscheduler.backend.global.database.RetryExecutor;
import com.studentscheduler.backend.global.error.NotFoundException;
import com.studentscheduler.backend.modules.schedule.domain.Schedule;
import com.studentscheduler.backend.modules.schedule.domain.ScheduleEntry;
import com.studentscheduler.backend.modules.schedule.infrastructure.persistence.ScheduleEntryRepository;
import com.studentscheduler.backend.modules.schedule.infrastructure.persistence.ScheduleRepository;
import com.studentscheduler.backend.modules.schedule.presentation.dto.ScheduleDetailResponse;
import com.studentscheduler.backend.modules.schedule.presentation.dto.ScheduleSummaryResponse;
import com.studentscheduler.backend.modules.schedule.presentation.dto.ScheduledCourseResponse;
import com.studentscheduler.backend.modules.user.application.UserResolver;
import com.studentscheduler.backend.modules.user.domain.AppUser;

import org.springframework.stereotype.Service;

@Service
public class ScheduleQueryService {

    private final RetryExecutor retryExecutor;
    private final UserResolver userResolver;
    private final ScheduleRepository scheduleRepository;
    private final ScheduleEntryRepository scheduleEntryRepository;

    public ScheduleQueryService(
            RetryExecutor retryExecutor,
            UserResolver userResolver,
            ScheduleRepository scheduleRepository,
            ScheduleEntryRepository scheduleEntryRepository
    ) {
        this.retryExecutor = retryExecutor;
        this.userResolver = userResolver;
        this.scheduleRepository = scheduleRepository;
        this.scheduleEntryRepository = scheduleEntryRepository;
    }

    /**
     * Newest first. An unknown user simply has no schedules.
     *
     * @param userIdentifier email or user id
     */
    public List<ScheduleSummaryResponse> getUserSchedules(String userIdentifier) {
        return retryExecutor.inReadOnlyTransaction("getUserSchedules", status -> userResolver.findExisting(userIdentifier)
                .map(user -> scheduleRepository.findSummariesByUserId(user.getId())
                        .stream()
                        .map(ScheduleSummaryResponse::from)
                        .toList())
                .orElseGet(List::of));
    }

    public ScheduleDetailResponse getScheduleDetails(UUID scheduleId) {
        return retryExecutor.inReadOnlyTransaction("getScheduleDetails", status -> {
            Schedule schedule = scheduleRepository.findWithOwnerById(scheduleId)
                    .orElseThrow(() -> new NotFoundException("SCHEDULE_NOT_FOUND", "No schedule with id " + scheduleId));
            List<ScheduleEntry> entries = scheduleEntryRepository.findWithCoursesByScheduleId(scheduleId);
            AppUser owner = schedule.getUser();
            ScheduleDetailResponse.ScheduleHeader header = new ScheduleDetailResponse.ScheduleHeader(
                    schedule.getId(),
                    schedule.getName(),
                    schedule.getTotalCredits(),
                    entries.size(),
                    owner.getId(),
                    owner.getEmail(),
                    owner.getDisplayName(),
                    schedule.getCreatedAt(),
                    schedule.getUpdatedAt()
            );
            List<ScheduledCourseResponse> courses = entries.stream()
                    .map(ScheduledCourseResponse::from)
                    .toList();
            return new ScheduleDetailResponse(header, courses);
        });
    }
}
