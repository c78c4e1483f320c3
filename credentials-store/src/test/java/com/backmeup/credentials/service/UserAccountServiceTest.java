package com.backmeup.credentials.service;

import com.backmeup.credentials.model.UserAccount;
import com.backmeup.credentials.service.UserAccountService.RegistrationException;
import com.backmeup.credentials.service.UserAccountService.UserAccountNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
class UserAccountServiceTest {

    private static final Long NON_EXISTENT = 999999L;

    @Autowired
    private UserAccountService userAccountService;

    @Autowired
    private CredentialsStoreInitializer initializer;

    @Autowired
    private PasswordEncoder passwordEncoder;

    @Autowired
    private JdbcTemplate jdbc;

    @BeforeEach
    void initializedStore() {
        jdbc.execute("DROP SCHEMA IF EXISTS backmeup_system CASCADE");
        initializer.initialize();
    }

    @Nested
    @DisplayName("register")
    class Register {

        @Test
        void createsActiveUserWithDefaultRole() {
            UserAccount account = userAccountService.register("Jane Doe", "jane", "jane@example.com", "secret1");

            assertThat(account.id()).isNotNull();
            assertThat(account.username()).isEqualTo("jane");
            assertThat(account.email()).isEqualTo("jane@example.com");
            assertThat(account.fullName()).isEqualTo("Jane Doe");
            assertThat(account.role()).isEqualTo(UserAccount.ROLE_USER);
            assertThat(account.active()).isTrue();
            assertThat(account.createdAt()).isNotNull();
        }

        @Test
        void storesEncodedPassword() {
            UserAccount account = userAccountService.register("Jane Doe", "jane", "jane@example.com", "secret1");

            assertThat(account.password()).isNotEqualTo("secret1");
            assertThat(passwordEncoder.matches("secret1", account.password())).isTrue();
        }

        @Test
        void trimsInput() {
            UserAccount account = userAccountService.register("  Jane Doe ", " jane ", " jane@example.com ", "secret1");

            assertThat(account.username()).isEqualTo("jane");
            assertThat(account.email()).isEqualTo("jane@example.com");
            assertThat(account.fullName()).isEqualTo("Jane Doe");
        }

        @Test
        void requiresAllFields() {
            assertThatThrownBy(() -> userAccountService.register("", "jane", "jane@example.com", "secret1"))
                .isInstanceOf(RegistrationException.class)
                .hasMessage("Please fill in all fields");
            assertThatThrownBy(() -> userAccountService.register("Jane", "   ", "jane@example.com", "secret1"))
                .isInstanceOf(RegistrationException.class);
            assertThatThrownBy(() -> userAccountService.register("Jane", "jane", null, "secret1"))
                .isInstanceOf(RegistrationException.class);
            assertThatThrownBy(() -> userAccountService.register("Jane", "jane", "jane@example.com", ""))
                .isInstanceOf(RegistrationException.class);
        }

        @Test
        void rejectsShortPassword() {
            assertThatThrownBy(() -> userAccountService.register("Jane", "jane", "jane@example.com", "12345"))
                .isInstanceOf(RegistrationException.class)
                .hasMessageContaining("at least 6");
        }

        @Test
        void rejectsTooLongUsername() {
            assertThatThrownBy(() -> userAccountService.register("Jane", "j".repeat(51), "jane@example.com", "secret1"))
                .isInstanceOf(RegistrationException.class)
                .hasMessageContaining("Username");
        }

        @Test
        void rejectsTakenUsername() {
            assertThatThrownBy(() -> userAccountService.register("Other", "admin", "other@example.com", "secret1"))
                .isInstanceOf(RegistrationException.class)
                .hasMessage("Username or email already exists");
        }

        @Test
        void rejectsTakenEmail() {
            assertThatThrownBy(() -> userAccountService.register("Other", "other", "admin@backmeup.com", "secret1"))
                .isInstanceOf(RegistrationException.class)
                .hasMessage("Username or email already exists");
        }
    }

    @Nested
    @DisplayName("activation")
    class Activation {

        @Test
        void deactivatedUserIsNotFoundOrListed() {
            UserAccount jane = userAccountService.register("Jane Doe", "jane", "jane@example.com", "secret1");

            userAccountService.deactivate(jane.id());

            assertThat(userAccountService.findActiveByUsername("jane")).isEmpty();
            assertThat(userAccountService.listActive())
                .extracting(UserAccount::username)
                .containsExactly("admin");
        }

        @Test
        void reactivatedUserIsListedAgain() {
            UserAccount jane = userAccountService.register("Jane Doe", "jane", "jane@example.com", "secret1");
            userAccountService.deactivate(jane.id());

            userAccountService.activate(jane.id());

            assertThat(userAccountService.findActiveByUsername("jane")).isPresent();
        }

        @Test
        void listsActiveUsersByUsername() {
            userAccountService.register("Zed", "zed", "zed@example.com", "secret1");
            userAccountService.register("Bob", "bob", "bob@example.com", "secret1");

            assertThat(userAccountService.listActive())
                .extracting(UserAccount::username)
                .containsExactly("admin", "bob", "zed");
        }

        @Test
        void unknownIdThrows() {
            assertThatThrownBy(() -> userAccountService.deactivate(NON_EXISTENT))
                .isInstanceOf(UserAccountNotFoundException.class);
        }

        @Test
        void blankUsernameFindsNothing() {
            assertThat(userAccountService.findActiveByUsername(" ")).isEmpty();
            assertThat(userAccountService.findActiveByUsername(null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("recordLogin")
    class RecordLogin {

        @Test
        void setsLastLogin() {
            LocalDateTime before = LocalDateTime.now().minusMinutes(1);
            UserAccount admin = userAccountService.findActiveByUsername("admin").orElseThrow();

            userAccountService.recordLogin(admin.id());

            UserAccount after = userAccountService.findActiveByUsername("admin").orElseThrow();
            assertThat(after.hasLoggedIn()).isTrue();
            assertThat(after.lastLogin()).isAfter(before);
        }

        @Test
        void unknownIdThrows() {
            assertThatThrownBy(() -> userAccountService.recordLogin(NON_EXISTENT))
                .isInstanceOf(UserAccountNotFoundException.class)
                .hasMessageContaining(NON_EXISTENT.toString());
        }
    }
}
