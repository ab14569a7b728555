package com.studentscheduler.backend.modules.user;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.studentscheduler.backend.global.error.ValidationException;
import com.studentscheduler.backend.modules.user.application.UserHints;
import com.studentscheduler.backend.modules.user.application.UserResolver;
import com.studentscheduler.backend.modules.user.domain.AppUser;
import com.studentscheduler.backend.modules.user.domain.UserRole;
import com.studentscheduler.backend.support.AbstractPostgresIntegrationTest;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class UserResolverIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private UserResolver userResolver;

    @Test
    void resolvingTheSameEmailTwiceReturnsTheSameUser() {
        UUID first = userResolver.resolveUser("alice@uni.example", null);
        UUID second = userResolver.resolveUser("  Alice@UNI.example ", UserHints.none());

        assertThat(second).isEqualTo(first);
        assertThat(countRows("select count(*) from app_user where email = 'alice@uni.example'")).isEqualTo(1);
    }

    @Test
    void newUserDefaultsToLocalPartNameAndStudentRole() {
        userResolver.resolveUser("bob.smith@uni.example", null);

        AppUser user = userResolver.findExisting("bob.smith@uni.example").orElseThrow();
        assertThat(user.getDisplayName()).isEqualTo("bob.smith");
        assertThat(user.getRole()).isEqualTo(UserRole.STUDENT);
        assertThat(user.getCreatedAt()).isNotNull();
        assertThat(user.getUpdatedAt()).isNotNull();
    }

    @Test
    void hintsAreAppliedOnlyOnCreation() {
        UUID id = userResolver.resolveUser("carol@uni.example", new UserHints(null, "Carol", "S-42", "staff"));
        userResolver.resolveUser("carol@uni.example", new UserHints(null, "Someone Else", "S-99", "student"));

        AppUser user = userResolver.findExisting(id.toString()).orElseThrow();
        assertThat(user.getDisplayName()).isEqualTo("Carol");
        assertThat(user.getStudentId()).isEqualTo("S-42");
        assertThat(user.getRole()).isEqualTo(UserRole.STAFF);
    }

    @Test
    void existingUserCanBeResolvedById() {
        UUID id = userResolver.resolveUser("dave@uni.example", null);

        assertThat(userResolver.resolveUser(id.toString(), null)).isEqualTo(id);
    }

    @Test
    void hintEmailWinsOverIdentifier() {
        UUID id = userResolver.resolveUser("not-an-email", new UserHints("erin@uni.example", null, null, null));

        assertThat(userResolver.findExisting("erin@uni.example")).get().extracting(AppUser::getId).isEqualTo(id);
    }

    @Test
    void missingEmailIsAValidationError() {
        assertThatThrownBy(() -> userResolver.resolveUser("not-an-email", null))
                .isInstanceOf(ValidationException.class)
                .extracting("code").isEqualTo("EMAIL_REQUIRED");
        assertThatThrownBy(() -> userResolver.resolveUser(UUID.randomUUID().toString(), null))
                .isInstanceOf(ValidationException.class)
                .extracting("code").isEqualTo("EMAIL_REQUIRED");
        assertThatThrownBy(() -> userResolver.resolveUser(null, null))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void concurrentFirstReferencesConvergeOnOneRow() throws Exception {
        int callers = 6;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<UUID>> futures = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                Callable<UUID> call = () -> {
                    start.await(5, TimeUnit.SECONDS);
                    return userResolver.resolveUser("race@uni.example", null);
                };
                futures.add(pool.submit(call));
            }
            start.countDown();

            HashSet<UUID> ids = new HashSet<>();
            for (Future<UUID> future : futures) {
                ids.add(future.get(30, TimeUnit.SECONDS));
            }

            assertThat(ids).hasSize(1);
            assertThat(countRows("select count(*) from app_user where email = 'race@uni.example'")).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }
}
