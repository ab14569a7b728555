package com.studentscheduler.backend.global.jpa;

import java.time.OffsetDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.MappedSuperclass;

import org.springframework.data.annotation.LastModifiedDate;

/**
 * Adds {@code updated_at} on top of the creation timestamp for mutable rows (users, schedules).
 */
@MappedSuperclass
public abstract class AbstractTimestampedEntity extends AbstractCreatedEntity {

    @LastModifiedDate
    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }

    /**
     * Marks the row as modified when only its children changed, so the update timestamp moves too.
     */
    protected void touch(OffsetDateTime now) {
        this.updatedAt = now;
    }
}
