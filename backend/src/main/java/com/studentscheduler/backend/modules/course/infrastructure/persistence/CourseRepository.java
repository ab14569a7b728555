package com.studentscheduler.backend.modules.course.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.studentscheduler.backend.modules.course.domain.Course;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CourseRepository extends JpaRepository<Course, UUID> {

    Optional<Course> findByCourseCode(String courseCode);

    @Query("""
            select c
              from Course c
             where lower(c.name) like :searchPattern
                or lower(c.courseCode) like :searchPattern
             order by c.name, c.courseCode
            """)
    List<Course> search(@Param("searchPattern") String searchPattern);

    @Query("select distinct c.name from Course c order by c.name")
    List<String> findDistinctNames();

    @Query("select distinct c.room from Course c where c.room like '%.%' order by c.room")
    List<String> findDistinctDottedRooms();

    /**
     * @return 1 when inserted, 0 when the code already existed (the existing row is left untouched)
     */
    @Modifying
    @Query(value = """
            insert into course (id, course_code, name, credits, instructor, time_slot, room, weeks, capacity, created_at)
            values (gen_random_uuid(), :courseCode, :name, :credits, cast(:instructor as varchar), cast(:timeSlot as varchar),
                    cast(:room as varchar), cast(:weeks as varchar), cast(:capacity as integer), :now)
            on conflict (course_code) do nothing
            """, nativeQuery = true)
    int insertIfAbsent(
            @Param("courseCode") String courseCode,
            @Param("name") String name,
            @Param("credits") int credits,
            @Param("instructor") String instructor,
            @Param("timeSlot") String timeSlot,
            @Param("room") String room,
            @Param("weeks") String weeks,
            @Param("capacity") Integer capacity,
            @Param("now") OffsetDateTime now
    );
}
