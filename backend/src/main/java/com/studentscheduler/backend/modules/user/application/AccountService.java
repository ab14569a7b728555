package com.studentscheduler.backend.modules.user.application;

import java.util.UUID;

import com.studentscheduler.backend.global.database.RetryExecutor;
import com.studentscheduler.backend.global.error.ConflictException;
import com.studentscheduler.backend.global.error.NotFoundException;
import com.studentscheduler.backend.global.error.ProblemException;
import com.studentscheduler.backend.modules.user.domain.AppUser;
import com.studentscheduler.backend.modules.user.infrastructure.persistence.AppUserRepository;
import com.studentscheduler.backend.modules.user.presentation.dto.UserProfileResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

/**
 * Password accounts on top of the implicit users created by schedule writes. There are no tokens:
 * login only checks the credentials and returns the profile.
 */
@Service
public class AccountService {

    private static final Logger log = LoggerFactory.getLogger(AccountService.class);

    private final AppUserRepository appUserRepository;
    private final UserResolver userResolver;
    private final PasswordEncoder passwordEncoder;
    private final RetryExecutor retryExecutor;

    public AccountService(
            AppUserRepository appUserRepository,
            UserResolver userResolver,
            PasswordEncoder passwordEncoder,
            RetryExecutor retryExecutor
    ) {
        this.appUserRepository = appUserRepository;
        this.userResolver = userResolver;
        this.passwordEncoder = passwordEncoder;
        this.retryExecutor = retryExecutor;
    }

    /**
     * Registers a password for the email. A user that already exists without a password (created
     * by saving a schedule) is claimed rather than duplicated.
     */
    public UserProfileResponse signup(String email, String displayName, String studentId, String password) {
        String normalized = UserResolver.normalizeEmail(email);
        String passwordHash = passwordEncoder.encode(password);
        return retryExecutor.inTransaction("signup", status -> {
            userResolver.resolveByEmail(normalized, new UserHints(normalized, displayName, studentId, null));
            AppUser user = appUserRepository.findByEmailForUpdate(normalized)
                    .orElseThrow(() -> new NotFoundException("USER_NOT_FOUND", "User vanished during signup"));
            if (user.hasPassword()) {
                throw new ConflictException("EMAIL_ALREADY_REGISTERED", "An account already exists for " + normalized);
            }
            user.setPasswordHash(passwordHash);
            if (displayName != null && !displayName.isBlank()) {
                user.setDisplayName(displayName.trim());
            }
            if (studentId != null && !studentId.isBlank()) {
                user.setStudentId(studentId.trim());
            }
            appUserRepository.saveAndFlush(user);
            log.info("Registered account {}", user.getId());
            return UserProfileResponse.from(user);
        });
    }

    public UserProfileResponse login(String email, String password) {
        String normalized = UserResolver.normalizeEmail(email);
        AppUser user = retryExecutor.inReadOnlyTransaction("login",
                status -> appUserRepository.findByEmail(normalized).orElse(null));
        if (user == null || !user.hasPassword() || !passwordEncoder.matches(password, user.getPasswordHash())) {
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS", "Email or password is incorrect");
        }
        return UserProfileResponse.from(user);
    }

    public UserProfileResponse getProfile(UUID userId) {
        return retryExecutor.inReadOnlyTransaction("getProfile", status -> appUserRepository.findById(userId)
                .map(UserProfileResponse::from)
                .orElseThrow(() -> new NotFoundException("USER_NOT_FOUND", "No user with id " + userId)));
    }
}
