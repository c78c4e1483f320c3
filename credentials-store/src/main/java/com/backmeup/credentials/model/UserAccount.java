package com.backmeup.credentials.model;

import java.time.LocalDateTime;

/**
 * A row of the {@code users} table.
 * The password holds whatever the configured encoder produced, never the raw value under bcrypt storage.
 */
public record UserAccount(
    Long id,
    String username,
    String email,
    String password,
    String fullName,
    LocalDateTime createdAt,
    LocalDateTime lastLogin,
    boolean active,
    String role
) {
    public static final String ROLE_USER = "user";
    public static final String ROLE_ADMIN = "admin";
    public static final String ROLE_SUPERADMIN = "superadmin";

    public static final int USERNAME_MAX_LENGTH = 50;
    public static final int EMAIL_MAX_LENGTH = 100;
    public static final int FULL_NAME_MAX_LENGTH = 100;
    public static final int PASSWORD_MAX_LENGTH = 255;

    /** True for both administrative roles the client knows, {@code admin} and {@code superadmin}. */
    public boolean isAdmin() {
        return ROLE_ADMIN.equalsIgnoreCase(role) || ROLE_SUPERADMIN.equalsIgnoreCase(role);
    }

    public boolean hasLoggedIn() {
        return lastLogin != null;
    }
}
