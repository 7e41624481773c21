package com.tessera.database.migration;

import static org.assertj.core.api.Assertions.assertThat;

import java.sql.Connection;
import java.sql.SQLException;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("FlywayMigrationConfig")
class FlywayMigrationConfigTest {

    private static FlywayConfigProperties.DatabaseConfig h2(String name) {
        return new FlywayConfigProperties.DatabaseConfig(
                "jdbc:h2:mem:" + name + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1", "sa", "", null, true);
    }

    @Test
    @DisplayName("migrations apply cleanly to H2 in PostgreSQL mode")
    void migratesH2() throws SQLException {
        Flyway flyway = FlywayMigrationConfig.createFlyway(h2("flyway-config-test"));

        var result = flyway.migrate();

        assertThat(result.success).isTrue();
        assertThat(result.migrationsExecuted).isGreaterThanOrEqualTo(1);
        try (Connection connection = flyway.getConfiguration().getDataSource().getConnection();
                var rs =
                        connection
                                .getMetaData()
                                .getTables(null, null, "EVENT_LOG", new String[] {"TABLE"})) {
            assertThat(rs.next()).as("event_log table exists").isTrue();
        }
    }

    @Test
    @DisplayName("migrating twice is a no-op")
    void idempotent() {
        Flyway flyway = FlywayMigrationConfig.createFlyway(h2("flyway-config-twice"));
        flyway.migrate();

        assertThat(flyway.migrate().migrationsExecuted).isZero();
    }

    @Test
    @DisplayName("bean name constant is stable")
    void beanName() {
        assertThat(FlywayMigrationConfig.EVENTLOG_FLYWAY_BEAN).isEqualTo("eventlogFlyway");
        assertThat(
                        FlywayMigrationConfig.class.isAnnotationPresent(
                                org.springframework.context.annotation.Configuration.class))
                .isTrue();
    }
}
