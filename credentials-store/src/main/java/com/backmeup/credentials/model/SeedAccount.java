package com.backmeup.credentials.model;

/**
 * The account written once during initialization. The password is the raw value; it is encoded on insert.
 */
public record SeedAccount(
    String username,
    String email,
    String password,
    String fullName,
    String role,
    boolean active
) {
    @Override
    public String toString() {
        // keep the raw password out of logs
        return "SeedAccount[username=" + username + ", email=" + email + ", role=" + role + ", active=" + active + "]";
    }
}
