package com.studentscheduler.backend.modules.schedule.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.studentscheduler.backend.modules.schedule.domain.ScheduleEntry;
import com.studentscheduler.backend.modules.schedule.domain.ScheduleEntryId;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ScheduleEntryRepository extends JpaRepository<ScheduleEntry, ScheduleEntryId> {

    @Query("""
            select e
              from ScheduleEntry e
              join fetch e.course c
             where e.schedule.id = :scheduleId
             order by c.courseCode
            """)
    List<ScheduleEntry> findWithCoursesByScheduleId(@Param("scheduleId") UUID scheduleId);

    @Query("select count(e.id.courseId) from ScheduleEntry e where e.schedule.id = :scheduleId")
    long countByScheduleId(@Param("scheduleId") UUID scheduleId);

    @Modifying(flushAutomatically = true)
    @Query("delete from ScheduleEntry e where e.schedule.id = :scheduleId")
    int deleteByScheduleId(@Param("scheduleId") UUID scheduleId);
}
