package com.backmeup.credentials.repository;

import com.backmeup.credentials.config.CredentialsStoreConfig;
import com.backmeup.credentials.model.UserAccount;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public class UserAccountRepository {

    public static final String USERS_TABLE = "users";

    private final JdbcTemplate jdbc;
    private final String users;

    private static final RowMapper<UserAccount> USER_MAPPER = (rs, rowNum) -> new UserAccount(
        rs.getLong("id"),
        rs.getString("username"),
        rs.getString("email"),
        rs.getString("password"),
        rs.getString("full_name"),
        rs.getObject("created_at", LocalDateTime.class),
        rs.getObject("last_login", LocalDateTime.class),
        rs.getBoolean("is_active"),
        rs.getString("role")
    );

    public UserAccountRepository(JdbcTemplate jdbc, CredentialsStoreConfig config) {
        this.jdbc = jdbc;
        this.users = config.qualify(USERS_TABLE);
    }

    public Optional<UserAccount> findById(Long id) {
        return first(jdbc.query("SELECT * FROM " + users + " WHERE id = ?", USER_MAPPER, id));
    }

    public Optional<UserAccount> findByUsername(String username) {
        return first(jdbc.query("SELECT * FROM " + users + " WHERE username = ?", USER_MAPPER, username));
    }

    public Optional<UserAccount> findActiveByUsername(String username) {
        return first(jdbc.query(
            "SELECT * FROM " + users + " WHERE username = ? AND is_active = TRUE",
            USER_MAPPER,
            username
        ));
    }

    public Optional<UserAccount> findByEmail(String email) {
        return first(jdbc.query("SELECT * FROM " + users + " WHERE email = ?", USER_MAPPER, email));
    }

    public List<UserAccount> findAllActive() {
        return jdbc.query(
            "SELECT * FROM " + users + " WHERE is_active = TRUE ORDER BY username",
            USER_MAPPER
        );
    }

    public boolean existsByUsername(String username) {
        return countWhere("username = ?", username) > 0;
    }

    public boolean existsByUsernameOrEmail(String username, String email) {
        return countWhere("username = ? OR email = ?", username, email) > 0;
    }

    public long countByUsername(String username) {
        return countWhere("username = ?", username);
    }

    /**
     * Inserts a row and returns its generated id.
     * A null role is left out of the statement so the column default applies.
     */
    public Long save(String username, String email, String password, String fullName, String role, boolean active) {
        String sql = role != null
            ? "INSERT INTO " + users + " (username, email, password, full_name, is_active, role) VALUES (?, ?, ?, ?, ?, ?)"
            : "INSERT INTO " + users + " (username, email, password, full_name, is_active) VALUES (?, ?, ?, ?, ?)";

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(con -> {
            PreparedStatement ps = con.prepareStatement(sql, new String[] {"id"});
            ps.setString(1, username);
            ps.setString(2, email);
            ps.setString(3, password);
            ps.setString(4, fullName);
            ps.setBoolean(5, active);
            if (role != null) {
                ps.setString(6, role);
            }
            return ps;
        }, keyHolder);

        Number key = keyHolder.getKey();
        return key != null ? key.longValue() : null;
    }

    public boolean updateLastLogin(Long id, LocalDateTime loggedInAt) {
        return jdbc.update("UPDATE " + users + " SET last_login = ? WHERE id = ?", loggedInAt, id) > 0;
    }

    public boolean updateActive(Long id, boolean active) {
        return jdbc.update("UPDATE " + users + " SET is_active = ? WHERE id = ?", active, id) > 0;
    }

    private long countWhere(String condition, Object... args) {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM " + users + " WHERE " + condition, Long.class, args);
        return count != null ? count : 0L;
    }

    private static <T> Optional<T> first(List<T> results) {
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }
}
