package com.studentscheduler.backend.modules.course.domain;

import java.util.UUID;

import com.studentscheduler.backend.global.jpa.AbstractCreatedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Catalog entry keyed by course code. Rows are inserted the first time a schedule references an
 * unknown code and are never rewritten by later schedules.
 */
@Entity
@Table(name = "course")
public class Course extends AbstractCreatedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "course_code", nullable = false, unique = true, length = 32)
    private String courseCode;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "credits", nullable = false)
    private int credits;

    @Column(name = "instructor", length = 100)
    private String instructor;

    @Column(name = "time_slot", length = 100)
    private String timeSlot;

    @Column(name = "room", length = 50)
    private String room;

    @Column(name = "weeks", length = 50)
    private String weeks;

    @Column(name = "capacity")
    private Integer capacity;

    public UUID getId() {
        return id;
    }

    public String getCourseCode() {
        return courseCode;
    }

    public String getName() {
        return name;
    }

    public int getCredits() {
        return credits;
    }

    public String getInstructor() {
        return instructor;
    }

    public String getTimeSlot() {
        return timeSlot;
    }

    public String getRoom() {
        return room;
    }

    public String getWeeks() {
        return weeks;
    }

    public Integer getCapacity() {
        return capacity;
    }
}
