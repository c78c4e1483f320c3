package com.backmeup.credentials.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

@Configuration
public class PasswordConfig {

    private static final Logger log = LoggerFactory.getLogger(PasswordConfig.class);

    @Bean
    public PasswordEncoder passwordEncoder(CredentialsStoreConfig config) {
        return encoderFor(config.getPasswordStorage());
    }

    static PasswordEncoder encoderFor(CredentialsStoreConfig.PasswordStorage storage) {
        if (storage == CredentialsStoreConfig.PasswordStorage.PLAIN) {
            log.warn("Password storage is PLAIN: passwords in the users table are stored verbatim");
            return new VerbatimPasswordEncoder();
        }
        return new BCryptPasswordEncoder();
    }

    /**
     * Stores passwords as given, for legacy clients that compare the column directly.
     */
    static final class VerbatimPasswordEncoder implements PasswordEncoder {

        @Override
        public String encode(CharSequence rawPassword) {
            return rawPassword.toString();
        }

        @Override
        public boolean matches(CharSequence rawPassword, String encodedPassword) {
            return rawPassword != null && rawPassword.toString().equals(encodedPassword);
        }
    }
}
