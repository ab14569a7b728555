package com.studentscheduler.backend.modules.schedule.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.studentscheduler.backend.modules.schedule.domain.Schedule;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ScheduleRepository extends JpaRepository<Schedule, UUID> {

    @Query("""
            select s.id as scheduleId,
                   s.name as name,
                   s.totalCredits as totalCredits,
                   count(e.id.courseId) as courseCount,
                   s.createdAt as createdAt,
                   s.updatedAt as updatedAt
              from Schedule s
              left join ScheduleEntry e
                     on e.schedule = s
             where s.user.id = :userId
             group by s.id, s.name, s.totalCredits, s.createdAt, s.updatedAt
             order by s.createdAt desc, s.id desc
            """)
    List<ScheduleSummaryProjection> findSummariesByUserId(@Param("userId") UUID userId);

    @Query("""
            select s
              from Schedule s
              join fetch s.user
             where s.id = :scheduleId
            """)
    Optional<Schedule> findWithOwnerById(@Param("scheduleId") UUID scheduleId);

    /**
     * Entries are removed by the {@code on delete cascade} foreign key.
     *
     * @return number of deleted schedules, 0 or 1
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from Schedule s where s.id = :scheduleId")
    int deleteScheduleById(@Param("scheduleId") UUID scheduleId);
}
