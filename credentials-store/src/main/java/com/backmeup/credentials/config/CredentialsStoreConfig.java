package com.backmeup.credentials.config;

import com.backmeup.credentials.model.SeedAccount;
import com.backmeup.credentials.model.UserAccount;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.regex.Pattern;

/**
 * Settings for the credentials store.
 * Define them in application.yml under 'backmeup.store'
 */
@Configuration
@ConfigurationProperties(prefix = "backmeup.store")
public class CredentialsStoreConfig {

    // Namespaces are spliced into DDL, so only plain identifiers are allowed
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,63}");

    public enum PasswordStorage { BCRYPT, PLAIN }

    private String namespace = "backmeup_system";
    private boolean createNamespace = true;
    private boolean initializeOnStartup = true;
    private PasswordStorage passwordStorage = PasswordStorage.BCRYPT;
    private SeedDefinition seed = new SeedDefinition();

    /**
     * Qualifies a table name with the configured namespace, e.g. "backmeup_system.users".
     */
    public String qualify(String table) {
        requireIdentifier(table, "table");
        return namespace + "." + table;
    }

    public String getNamespace() {
        return namespace;
    }

    public void setNamespace(String namespace) {
        requireIdentifier(namespace, "namespace");
        this.namespace = namespace;
    }

    public boolean isCreateNamespace() {
        return createNamespace;
    }

    public void setCreateNamespace(boolean createNamespace) {
        this.createNamespace = createNamespace;
    }

    public boolean isInitializeOnStartup() {
        return initializeOnStartup;
    }

    public void setInitializeOnStartup(boolean initializeOnStartup) {
        this.initializeOnStartup = initializeOnStartup;
    }

    public PasswordStorage getPasswordStorage() {
        return passwordStorage;
    }

    public void setPasswordStorage(PasswordStorage passwordStorage) {
        this.passwordStorage = passwordStorage;
    }

    public SeedDefinition getSeed() {
        return seed;
    }

    public void setSeed(SeedDefinition seed) {
        this.seed = seed;
    }

    private static void requireIdentifier(String value, String what) {
        if (value == null || !IDENTIFIER.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid " + what + " name: " + value);
        }
    }

    /**
     * Mutable class for Spring Boot configuration binding
     */
    public static class SeedDefinition {
        private boolean enabled = true;
        private String username = "admin";
        private String email = "admin@backmeup.com";
        private String password = "admin123";
        private String fullName = "System Administrator";
        private String role = UserAccount.ROLE_ADMIN;
        private boolean active = true;

        public SeedAccount toSeedAccount() {
            return new SeedAccount(username, email, password, fullName, role, active);
        }

        // Getters and setters for Spring Boot binding
        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }

        public String getEmail() { return email; }
        public void setEmail(String email) { this.email = email; }

        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }

        public String getFullName() { return fullName; }
        public void setFullName(String fullName) { this.fullName = fullName; }

        public String getRole() { return role; }
        public void setRole(String role) { this.role = role; }

        public boolean isActive() { return active; }
        public void setActive(boolean active) { this.active = active; }
    }
}
