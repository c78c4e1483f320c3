package com.backmeup.credentials.schema;

import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Engines the store runs on: MySQL (and MariaDB) in production, H2 in MySQL mode for tests.
 * Table DDL differences are handled by the Liquibase changelog; only the namespace is created here.
 */
public enum DatabaseDialect {

    MYSQL {
        @Override
        public String createNamespaceSql(String namespace) {
            return "CREATE DATABASE IF NOT EXISTS " + namespace;
        }
    },

    H2 {
        @Override
        public String createNamespaceSql(String namespace) {
            return "CREATE SCHEMA IF NOT EXISTS " + namespace;
        }
    };

    public abstract String createNamespaceSql(String namespace);

    public static DatabaseDialect fromProductName(String productName) {
        if (productName == null) {
            throw new UnsupportedDatabaseException("Unknown database product");
        }
        String name = productName.toLowerCase();
        if (name.contains("mysql") || name.contains("mariadb")) {
            return MYSQL;
        }
        if (name.equals("h2")) {
            return H2;
        }
        throw new UnsupportedDatabaseException("Unsupported database product: " + productName);
    }

    public static DatabaseDialect detect(JdbcTemplate jdbc) {
        String productName = jdbc.execute(
            (ConnectionCallback<String>) con -> con.getMetaData().getDatabaseProductName());
        return fromProductName(productName);
    }

    public static class UnsupportedDatabaseException extends RuntimeException {
        public UnsupportedDatabaseException(String message) {
            super(message);
        }
    }
}
