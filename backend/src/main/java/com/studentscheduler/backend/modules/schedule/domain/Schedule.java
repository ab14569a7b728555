package com.studentscheduler.backend.modules.schedule.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.studentscheduler.backend.global.jpa.AbstractTimestampedEntity;
import com.studentscheduler.backend.modules.user.domain.AppUser;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * A named set of courses owned by one user. {@code totalCredits} is derived from the entries and
 * rewritten on every change.
 */
@Entity
@Table(name = "schedule")
public class Schedule extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false, updatable = false)
    private AppUser user;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "total_credits", nullable = false)
    private int totalCredits;

    protected Schedule() {
    }

    public Schedule(AppUser user, String name, int totalCredits) {
        this.user = user;
        this.name = name;
        this.totalCredits = totalCredits;
    }

    public UUID getId() {
        return id;
    }

    public AppUser getUser() {
        return user;
    }

    public String getName() {
        return name;
    }

    public void rename(String name) {
        this.name = name;
    }

    public int getTotalCredits() {
        return totalCredits;
    }

    public void replaceCourses(int totalCredits, OffsetDateTime now) {
        this.totalCredits = totalCredits;
        touch(now);
    }
}
