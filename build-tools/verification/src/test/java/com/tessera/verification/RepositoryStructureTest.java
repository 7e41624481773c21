package com.tessera.verification;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Structural checks of the multi-module layout. They run with the normal Maven build so an
 * accidental deletion or a misplaced package fails CI.
 */
@DisplayName("Repository structure")
class RepositoryStructureTest {

    private static final List<String> MODULES =
            List.of(
                    "libs/event-model",
                    "libs/event-store",
                    "libs/security",
                    "libs/observability",
                    "libs/database",
                    "libs/pipeline",
                    "libs/threads",
                    "services/knowledge-service",
                    "build-tools/verification");

    private static final Pattern MIGRATION_NAME = Pattern.compile("V(\\d+)__[a-z0-9_]+\\.sql");
    private static final Pattern PACKAGE_LINE = Pattern.compile("^package ([\\w.]+);", Pattern.MULTILINE);

    private static Path projectRoot;

    @BeforeAll
    static void resolveProjectRoot() {
        // Maven runs tests with the module directory (build-tools/verification) as working directory
        projectRoot = Path.of(System.getProperty("user.dir")).getParent().getParent();

        assertThat(projectRoot.resolve("pom.xml"))
                .as("Root pom.xml must exist at project root: %s", projectRoot)
                .exists();
    }

    private static String rootPom() throws IOException {
        return Files.readString(projectRoot.resolve("pom.xml"));
    }

    private static List<Path> javaSources(String module) throws IOException {
        Path src = projectRoot.resolve(module).resolve("src");
        if (!Files.isDirectory(src)) {
            return List.of();
        }
        try (Stream<Path> files = Files.walk(src)) {
            return files.filter(p -> p.toString().endsWith(".java")).toList();
        }
    }

    @Nested
    @DisplayName("Maven multi-module configuration")
    class MavenMultiModule {

        @Test
        @DisplayName("root POM has groupId com.tessera and packaging pom")
        void rootCoordinates() throws IOException {
            assertThat(rootPom())
                    .contains("<groupId>com.tessera</groupId>")
                    .contains("<artifactId>tessera-parent</artifactId>")
                    .contains("<packaging>pom</packaging>");
        }

        @Test
        @DisplayName("root POM inherits the Spring Boot starter parent")
        void springBootParent() throws IOException {
            assertThat(rootPom()).contains("spring-boot-starter-parent");
        }

        @Test
        @DisplayName("root POM compiles for Java 17 with UTF-8 sources")
        void javaRelease() throws IOException {
            assertThat(rootPom())
                    .contains("<maven.compiler.release>17</maven.compiler.release>")
                    .contains("<project.build.sourceEncoding>UTF-8</project.build.sourceEncoding>");
        }

        @Test
        @DisplayName("every module is declared and has its own POM")
        void modulesDeclared() throws IOException {
            String pom = rootPom();
            for (String module : MODULES) {
                assertThat(pom).contains("<module>" + module + "</module>");
                assertThat(projectRoot.resolve(module).resolve("pom.xml")).exists().isRegularFile();
            }
        }

        @Test
        @DisplayName("no other build system is present")
        void mavenOnly() {
            assertThat(projectRoot.resolve("build.gradle")).doesNotExist();
            assertThat(projectRoot.resolve("settings.gradle")).doesNotExist();
            assertThat(projectRoot.resolve("mvnw")).doesNotExist();
        }
    }

    @Nested
    @DisplayName("Packages")
    class Packages {

        @Test
        @DisplayName("every source file lives under com.tessera, in the directory its package names")
        void packagesMatchDirectories() throws IOException {
            for (String module : MODULES) {
                for (Path source : javaSources(module)) {
                    Matcher matcher = PACKAGE_LINE.matcher(Files.readString(source));
                    assertThat(matcher.find()).as("package declaration in %s", source).isTrue();
                    String pkg = matcher.group(1);
                    assertThat(pkg).as("package of %s", source).startsWith("com.tessera");
                    assertThat(source.getParent().endsWith(Path.of(pkg.replace('.', '/'))))
                            .as("%s is in the directory of package %s", source, pkg)
                            .isTrue();
                }
            }
        }

        @Test
        @DisplayName("test classes are named so Surefire picks them up")
        void testClassNames() throws IOException {
            for (String module : MODULES) {
                for (Path source : javaSources(module)) {
                    if (!source.toString().contains("/src/test/")) {
                        continue;
                    }
                    String content = Files.readString(source);
                    if (content.contains("@Test")) {
                        assertThat(source.getFileName().toString())
                                .as("test class %s", source)
                                .endsWith("Test.java");
                    }
                }
            }
        }
    }

    @Nested
    @DisplayName("Database migrations")
    class Migrations {

        private final Path migrationDir =
                projectRoot.resolve("libs/database/src/main/resources/db/migration/tessera");

        @Test
        @DisplayName("the event log migration exists")
        void eventLogMigration() {
            assertThat(migrationDir.resolve("V1__event_log.sql")).exists().isRegularFile();
        }

        @Test
        @DisplayName("migration files follow V<n>__<snake_case>.sql with unique, gap-free versions")
        void migrationNaming() throws IOException {
            List<Integer> versions;
            try (Stream<Path> files = Files.list(migrationDir)) {
                versions =
                        files.map(p -> p.getFileName().toString())
                                .map(
                                        name -> {
                                            Matcher m = MIGRATION_NAME.matcher(name);
                                            assertThat(m.matches()).as("migration name %s", name).isTrue();
                                            return Integer.parseInt(m.group(1));
                                        })
                                .sorted()
                                .toList();
            }
            assertThat(versions).isNotEmpty();
            for (int i = 0; i < versions.size(); i++) {
                assertThat(versions.get(i)).isEqualTo(i + 1);
            }
        }
    }

    @Nested
    @DisplayName("Service configuration")
    class ServiceConfiguration {

        private final Path resources = projectRoot.resolve("services/knowledge-service/src");

        @Test
        @DisplayName("application, test profile and logging configuration exist")
        void configurationFiles() {
            assertThat(resources.resolve("main/resources/application.yml")).exists();
            assertThat(resources.resolve("test/resources/application-test.yml")).exists();
            assertThat(resources.resolve("main/resources/logback-spring.xml")).exists();
        }

        @Test
        @DisplayName("the log pattern carries the correlation MDC keys")
        void logPatternHasMdcKeys() throws IOException {
            String logback = Files.readString(resources.resolve("main/resources/logback-spring.xml"));
            assertThat(logback)
                    .contains("%X{correlationId")
                    .contains("%X{userId")
                    .contains("%X{requestId")
                    .contains("%X{eventId");
        }

        @Test
        @DisplayName("Boot's own Flyway is disabled in favour of the event log migration")
        void flywayOwnership() throws IOException {
            String yaml = Files.readString(resources.resolve("main/resources/application.yml"));
            assertThat(yaml).contains("enabled: false").contains("eventlog:");
        }
    }
}
