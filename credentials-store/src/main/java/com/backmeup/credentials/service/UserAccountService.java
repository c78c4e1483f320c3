package com.backmeup.credentials.service;

import com.backmeup.credentials.model.UserAccount;
import com.backmeup.credentials.repository.UserAccountRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Account bookkeeping used by the BackMeUp client: registration, last-login tracking and activation.
 * Password verification is left to the caller.
 */
@Service
public class UserAccountService {

    private static final Logger log = LoggerFactory.getLogger(UserAccountService.class);

    public static final int MIN_PASSWORD_LENGTH = 6;

    private final UserAccountRepository userAccountRepository;
    private final PasswordEncoder passwordEncoder;

    public UserAccountService(UserAccountRepository userAccountRepository, PasswordEncoder passwordEncoder) {
        this.userAccountRepository = userAccountRepository;
        this.passwordEncoder = passwordEncoder;
    }

    /**
     * Registers a new active account with the default role.
     */
    public UserAccount register(String fullName, String username, String email, String rawPassword) {
        String name = trimToNull(fullName);
        String user = trimToNull(username);
        String mail = trimToNull(email);

        if (name == null || user == null || mail == null || rawPassword == null || rawPassword.isEmpty()) {
            throw new RegistrationException("Please fill in all fields");
        }
        if (rawPassword.length() < MIN_PASSWORD_LENGTH) {
            throw new RegistrationException("Password must be at least " + MIN_PASSWORD_LENGTH + " characters long");
        }
        requireMaxLength("Username", user, UserAccount.USERNAME_MAX_LENGTH);
        requireMaxLength("Email", mail, UserAccount.EMAIL_MAX_LENGTH);
        requireMaxLength("Full name", name, UserAccount.FULL_NAME_MAX_LENGTH);

        // what is stored must fit the column, which matters when passwords are kept verbatim
        String encodedPassword = passwordEncoder.encode(rawPassword);
        requireMaxLength("Password", encodedPassword, UserAccount.PASSWORD_MAX_LENGTH);

        if (userAccountRepository.existsByUsernameOrEmail(user, mail)) {
            throw new RegistrationException("Username or email already exists");
        }

        Long id;
        try {
            id = userAccountRepository.save(user, mail, encodedPassword, name, null, true);
        } catch (DuplicateKeyException e) {
            throw new RegistrationException("Username or email already exists", e);
        }
        log.info("Registered account '{}' (id={})", user, id);

        return userAccountRepository.findById(id).orElseThrow(() -> new UserAccountNotFoundException(id));
    }

    public Optional<UserAccount> findActiveByUsername(String username) {
        if (username == null || username.isBlank()) {
            return Optional.empty();
        }
        return userAccountRepository.findActiveByUsername(username.trim());
    }

    public List<UserAccount> listActive() {
        return userAccountRepository.findAllActive();
    }

    public void recordLogin(Long id) {
        if (!userAccountRepository.updateLastLogin(id, LocalDateTime.now())) {
            throw new UserAccountNotFoundException(id);
        }
    }

    public void deactivate(Long id) {
        setActive(id, false);
    }

    public void activate(Long id) {
        setActive(id, true);
    }

    private void setActive(Long id, boolean active) {
        if (!userAccountRepository.updateActive(id, active)) {
            throw new UserAccountNotFoundException(id);
        }
        log.info("Account id={} is now {}", id, active ? "active" : "inactive");
    }

    private static void requireMaxLength(String field, String value, int max) {
        if (value.length() > max) {
            throw new RegistrationException(field + " must be at most " + max + " characters long");
        }
    }

    private static String trimToNull(String value) {
        if (value == null) return null;
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static class RegistrationException extends RuntimeException {
        public RegistrationException(String message) {
            super(message);
        }

        public RegistrationException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    public static class UserAccountNotFoundException extends RuntimeException {
        public UserAccountNotFoundException(Long id) {
            super("User account not found: " + id);
        }
    }
}
