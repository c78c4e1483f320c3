package com.backmeup.credentials.service;

import com.backmeup.credentials.model.SeedAccount;
import com.backmeup.credentials.model.UserAccount;
import com.backmeup.credentials.repository.UserAccountRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Inserts the seed account unless its username is already taken.
 * An existing seed row is never updated.
 */
@Service
public class SeedDataLoader {

    private static final Logger log = LoggerFactory.getLogger(SeedDataLoader.class);

    private final UserAccountRepository userAccountRepository;
    private final PasswordEncoder passwordEncoder;

    public SeedDataLoader(UserAccountRepository userAccountRepository, PasswordEncoder passwordEncoder) {
        this.userAccountRepository = userAccountRepository;
        this.passwordEncoder = passwordEncoder;
    }

    /**
     * @return true if the seed row was inserted, false if it was already present
     * @throws SeedConflictException if another account already holds the seed email
     */
    public boolean load(SeedAccount seed) {
        if (userAccountRepository.existsByUsername(seed.username())) {
            log.info("Seed account '{}' already present, leaving it unchanged", seed.username());
            return false;
        }

        Optional<UserAccount> emailOwner = userAccountRepository.findByEmail(seed.email());
        if (emailOwner.isPresent()) {
            throw new SeedConflictException(seed, emailOwner.get());
        }

        try {
            Long id = userAccountRepository.save(
                seed.username(),
                seed.email(),
                passwordEncoder.encode(seed.password()),
                seed.fullName(),
                seed.role(),
                seed.active()
            );
            log.info("Inserted seed account '{}' (id={}, role={})", seed.username(), id, seed.role());
            return true;
        } catch (DuplicateKeyException e) {
            // Another initializer may have inserted it between the check and the insert
            if (userAccountRepository.existsByUsername(seed.username())) {
                log.info("Seed account '{}' was inserted concurrently, leaving it unchanged", seed.username());
                return false;
            }
            throw e;
        }
    }

    public static class SeedConflictException extends RuntimeException {
        private final String seedUsername;
        private final String conflictingUsername;

        public SeedConflictException(SeedAccount seed, UserAccount conflicting) {
            super("Cannot insert seed account '" + seed.username() + "': email " + seed.email()
                + " already belongs to account '" + conflicting.username() + "' (id=" + conflicting.id() + ")");
            this.seedUsername = seed.username();
            this.conflictingUsername = conflicting.username();
        }

        public String getSeedUsername() {
            return seedUsername;
        }

        public String getConflictingUsername() {
            return conflictingUsername;
        }
    }
}
