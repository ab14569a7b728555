package com.studentscheduler.backend.modules.schedule.domain;

import com.studentscheduler.backend.global.jpa.AbstractCreatedEntity;
import com.studentscheduler.backend.modules.course.domain.Course;

import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.MapsId;
import jakarta.persistence.Table;

@Entity
@Table(name = "schedule_entry")
public class ScheduleEntry extends AbstractCreatedEntity {

    @EmbeddedId
    private ScheduleEntryId id;

    @MapsId("scheduleId")
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "schedule_id", nullable = false)
    private Schedule schedule;

    @MapsId("courseId")
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "course_id", nullable = false)
    private Course course;

    protected ScheduleEntry() {
    }

    public ScheduleEntry(Schedule schedule, Course course) {
        this.id = new ScheduleEntryId(schedule.getId(), course.getId());
        this.schedule = schedule;
        this.course = course;
    }

    public ScheduleEntryId getId() {
        return id;
    }

    public Schedule getSchedule() {
        return schedule;
    }

    public Course getCourse() {
        return course;
    }
}
