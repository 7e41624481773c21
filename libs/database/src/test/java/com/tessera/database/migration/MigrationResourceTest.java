package com.tessera.database.migration;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests that the SQL migration files are packaged on the classpath where Flyway looks for them.
 *
 * <p>WHY: a missing resource only surfaces at deployment time otherwise.
 */
@DisplayName("Migration SQL Resource Verification")
class MigrationResourceTest {

    private static final String EVENT_LOG = "db/migration/tessera/V1__event_log.sql";

    @Test
    @DisplayName("V1__event_log.sql is on the classpath")
    void eventLogOnClasspath() {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(EVENT_LOG)) {
            assertThat(is).as("V1__event_log.sql must be on the classpath").isNotNull();
        } catch (IOException e) {
            throw new AssertionError("Failed to read migration resource", e);
        }
    }

    @Test
    @DisplayName("V1__event_log.sql enforces one version per stream position")
    void streamVersionUnique() throws IOException {
        String sql = readClasspathResource(EVENT_LOG);

        assertThat(sql).containsIgnoringCase("CREATE TABLE event_log");
        assertThat(sql).containsIgnoringCase("UNIQUE (subject_id, version)");
        assertThat(sql).doesNotContainIgnoringCase("DROP TABLE");
    }

    private String readClasspathResource(String path) throws IOException {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            assertThat(is).as("Resource must exist: " + path).isNotNull();
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
