package io.fleetquery.tools.multiquery;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

@DisplayName("PathResolver Tests")
class PathResolverTest {

    @TempDir
    Path tempDir;

    private Path workDir;
    private Path installDir;
    private PathResolver resolver;

    @BeforeEach
    void setUp() throws Exception {
        workDir = Files.createDirectory(tempDir.resolve("work"));
        installDir = Files.createDirectory(tempDir.resolve("install"));
        resolver = new PathResolver(workDir, installDir);
    }

    @Test
    @DisplayName("Should resolve relative paths against the working directory")
    void shouldResolveRelative() {
        assertThat(resolver.resolve("queries/../report.sql")).isEqualTo(workDir.resolve("report.sql"));
    }

    @Test
    @DisplayName("Should reject blank paths")
    void shouldRejectBlank() {
        assertThatThrownBy(() -> resolver.resolve(" "))
            .isInstanceOf(ValidationException.class)
            .hasMessage("File path cannot be null or empty");
    }

    @Test
    @DisplayName("Should explain where a missing query file was looked for")
    void shouldDescribeMissingFile() {
        assertThatThrownBy(() -> resolver.resolveExisting("missing.sql", "query file"))
            .isInstanceOf(ValidationException.class)
            .hasMessageStartingWith("The query file 'missing.sql' was not found.")
            .hasMessageContaining("Resolved path: " + workDir.resolve("missing.sql"))
            .hasMessageContaining("Current working directory: " + workDir);
    }

    @Test
    @DisplayName("Should prefer the working directory for the environments file")
    void shouldPreferWorkingDirectory() throws Exception {
        Files.writeString(workDir.resolve("environments.json"), "{}");
        Files.writeString(installDir.resolve("environments.json"), "{}");

        assertThat(resolver.resolveEnvironmentsFile("environments.json"))
            .isEqualTo(workDir.resolve("environments.json"));
    }

    @Test
    @DisplayName("Should fall back to the install directory for the environments file")
    void shouldFallBackToInstallDirectory() throws Exception {
        Files.writeString(installDir.resolve("environments.json"), "{}");

        assertThat(resolver.resolveEnvironmentsFile("environments.json"))
            .isEqualTo(installDir.resolve("environments.json"));
    }

    @Test
    @DisplayName("Should list both searched locations when the environments file is missing")
    void shouldListSearchedLocations() {
        assertThatThrownBy(() -> resolver.resolveEnvironmentsFile("environments.json"))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("1. Current working directory: " + workDir.resolve("environments.json"))
            .hasMessageContaining("2. Application install directory: " + installDir.resolve("environments.json"));
    }

    @Test
    @DisplayName("Should not search the install directory for absolute paths")
    void shouldUseAbsolutePathAsGiven() throws Exception {
        Files.writeString(installDir.resolve("environments.json"), "{}");
        Path absolute = tempDir.resolve("elsewhere/environments.json").toAbsolutePath();

        assertThatThrownBy(() -> resolver.resolveEnvironmentsFile(absolute.toString()))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("Ensure the file exists at the specified absolute path");
    }
}
