package com.studentscheduler.backend.modules.user.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.studentscheduler.backend.modules.user.domain.AppUser;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AppUserRepository extends JpaRepository<AppUser, UUID> {

    Optional<AppUser> findByEmail(String email);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select u from AppUser u where u.email = :email")
    Optional<AppUser> findByEmailForUpdate(@Param("email") String email);

    /**
     * Inserts the user unless a row with the same email already exists. Concurrent callers for
     * the same email converge on a single row instead of one of them hitting the unique constraint.
     *
     * @return 1 when a row was inserted, 0 when the email was already taken
     */
    @Modifying
    @Query(value = """
            insert into app_user (id, email, display_name, student_id, role, created_at, updated_at)
            values (gen_random_uuid(), :email, :displayName, cast(:studentId as varchar), :role, :now, :now)
            on conflict (email) do nothing
            """, nativeQuery = true)
    int insertIfAbsent(
            @Param("email") String email,
            @Param("displayName") String displayName,
            @Param("studentId") String studentId,
            @Param("role") String role,
            @Param("now") OffsetDateTime now
    );
}
