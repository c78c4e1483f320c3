package com.backmeup.credentials.schema;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DatabaseDialectTest {

    @Nested
    @DisplayName("fromProductName")
    class FromProductName {

        @Test
        void recognisesMySqlAndMariaDb() {
            assertThat(DatabaseDialect.fromProductName("MySQL")).isEqualTo(DatabaseDialect.MYSQL);
            assertThat(DatabaseDialect.fromProductName("MariaDB")).isEqualTo(DatabaseDialect.MYSQL);
        }

        @Test
        void recognisesH2() {
            assertThat(DatabaseDialect.fromProductName("H2")).isEqualTo(DatabaseDialect.H2);
        }

        @Test
        void rejectsOtherEngines() {
            assertThatThrownBy(() -> DatabaseDialect.fromProductName("PostgreSQL"))
                .isInstanceOf(DatabaseDialect.UnsupportedDatabaseException.class)
                .hasMessageContaining("PostgreSQL");
            assertThatThrownBy(() -> DatabaseDialect.fromProductName(null))
                .isInstanceOf(DatabaseDialect.UnsupportedDatabaseException.class);
        }
    }

    @Test
    void mySqlCreatesDatabase() {
        assertThat(DatabaseDialect.MYSQL.createNamespaceSql("backmeup_system"))
            .isEqualTo("CREATE DATABASE IF NOT EXISTS backmeup_system");
    }

    @Test
    void h2CreatesSchema() {
        assertThat(DatabaseDialect.H2.createNamespaceSql("backmeup_system"))
            .isEqualTo("CREATE SCHEMA IF NOT EXISTS backmeup_system");
    }
}
