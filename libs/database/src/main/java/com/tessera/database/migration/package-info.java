/**
 * Flyway migration configuration.
 *
 * <ul>
 *   <li>{@link com.tessera.database.migration.FlywayConfigProperties} externalized connection and
 *       location settings
 *   <li>{@link com.tessera.database.migration.FlywayMigrationConfig} the Spring
 *       {@code @Configuration} creating and running the event log Flyway instance
 * </ul>
 *
 * <p>Migrations live under {@code db/migration/tessera} and follow Flyway's {@code V{n}__{desc}.sql}
 * naming. They stick to SQL that PostgreSQL and H2 (PostgreSQL mode) both accept, so the same files
 * run in production and in tests.
 */
package com.tessera.database.migration;
