package com.studentscheduler.backend.modules.user.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

import com.studentscheduler.backend.global.database.RetryExecutor;
import com.studentscheduler.backend.global.error.PersistenceFailureException;
import com.studentscheduler.backend.global.error.ValidationException;
import com.studentscheduler.backend.modules.user.domain.AppUser;
import com.studentscheduler.backend.modules.user.domain.UserRole;
import com.studentscheduler.backend.modules.user.infrastructure.persistence.AppUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Get-or-create for users keyed by email.
 */
@Service
public class UserResolver {

    private static final Logger log = LoggerFactory.getLogger(UserResolver.class);

    private static final int DISPLAY_NAME_MAX_LENGTH = 100;

    private final AppUserRepository appUserRepository;
    private final RetryExecutor retryExecutor;
    private final Clock clock;

    public UserResolver(AppUserRepository appUserRepository, RetryExecutor retryExecutor, Clock clock) {
        this.appUserRepository = appUserRepository;
        this.retryExecutor = retryExecutor;
        this.clock = clock;
    }

    /**
     * Resolves a caller-supplied identifier to a user id, creating the user on first reference.
     *
     * @param emailOrId an email address or the UUID of an existing user
     * @param hints     optional creation attributes; {@code hints.email()} wins over the identifier
     * @throws ValidationException when no email can be derived ({@code EMAIL_REQUIRED})
     */
    public UUID resolveUser(String emailOrId, UserHints hints) {
        UserHints effectiveHints = hints != null ? hints : UserHints.none();
        return retryExecutor.inTransaction("resolveUser", status -> {
            String email = deriveEmail(emailOrId, effectiveHints);
            return resolveByEmail(email, effectiveHints).getId();
        });
    }

    /**
     * Same as {@link #resolveUser} but joins the caller's transaction and returns the entity.
     * Must be called from inside a transaction.
     */
    public AppUser resolveInCurrentTransaction(String emailOrId, UserHints hints) {
        UserHints effectiveHints = hints != null ? hints : UserHints.none();
        return resolveByEmail(deriveEmail(emailOrId, effectiveHints), effectiveHints);
    }

    /**
     * Looks up a user by identifier without creating one.
     */
    public Optional<AppUser> findExisting(String emailOrId) {
        if (emailOrId == null || emailOrId.isBlank()) {
            return Optional.empty();
        }
        String trimmed = emailOrId.trim();
        if (trimmed.contains("@")) {
            return appUserRepository.findByEmail(normalizeEmail(trimmed));
        }
        return parseUuid(trimmed).flatMap(appUserRepository::findById);
    }

    AppUser resolveByEmail(String email, UserHints hints) {
        String normalized = normalizeEmail(email);
        Optional<AppUser> existing = appUserRepository.findByEmail(normalized);
        if (existing.isPresent()) {
            return existing.get();
        }
        int inserted = appUserRepository.insertIfAbsent(
                normalized,
                displayNameFor(normalized, hints.displayName()),
                blankToNull(hints.studentId()),
                UserRole.fromHint(hints.role()).name(),
                OffsetDateTime.now(clock)
        );
        if (inserted == 1) {
            log.info("Created user for {}", normalized);
        }
        return appUserRepository.findByEmail(normalized)
                .orElseThrow(() -> new PersistenceFailureException(
                        "USER_RESOLUTION_FAILED",
                        "User row for " + normalized + " vanished after insert",
                        null
                ));
    }

    private String deriveEmail(String emailOrId, UserHints hints) {
        if (hints.email() != null && !hints.email().isBlank()) {
            return hints.email();
        }
        if (emailOrId == null || emailOrId.isBlank()) {
            throw new ValidationException("EMAIL_REQUIRED", "An email address or user id is required");
        }
        String trimmed = emailOrId.trim();
        if (trimmed.contains("@")) {
            return trimmed;
        }
        return parseUuid(trimmed)
                .flatMap(appUserRepository::findById)
                .map(AppUser::getEmail)
                .orElseThrow(() -> new ValidationException(
                        "EMAIL_REQUIRED",
                        "Cannot derive an email from identifier " + trimmed
                ));
    }

    public static String normalizeEmail(String email) {
        if (email == null || email.isBlank()) {
            throw new ValidationException("EMAIL_REQUIRED", "An email address is required");
        }
        String normalized = email.trim().toLowerCase(Locale.ROOT);
        int at = normalized.indexOf('@');
        if (at <= 0 || at == normalized.length() - 1) {
            throw new ValidationException("INVALID_EMAIL", "Not a valid email address: " + email.trim());
        }
        return normalized;
    }

    private static String displayNameFor(String email, String hint) {
        String name = (hint != null && !hint.isBlank()) ? hint.trim() : email.substring(0, email.indexOf('@'));
        return name.length() > DISPLAY_NAME_MAX_LENGTH ? name.substring(0, DISPLAY_NAME_MAX_LENGTH) : name;
    }

    private static String blankToNull(String value) {
        return (value == null || value.isBlank()) ? null : value.trim();
    }

    private static Optional<UUID> parseUuid(String value) {
        try {
            return Optional.of(UUID.fromString(value));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }
}
