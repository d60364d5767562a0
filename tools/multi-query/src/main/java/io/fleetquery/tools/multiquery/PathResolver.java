package io.fleetquery.tools.multiquery;

import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.CodeSource;
import java.util.List;
import java.util.Objects;

/**
 * Resolves the query and environments file arguments to absolute paths.
 * <p>
 * Relative paths resolve against the working directory. The environments file additionally
 * falls back to the application install directory, so a global default can sit next to the jar.
 */
public class PathResolver {

    private final Path workingDirectory;
    private final Path installDirectory;

    public PathResolver() {
        this(Path.of(System.getProperty("user.dir")), detectInstallDirectory());
    }

    PathResolver(Path workingDirectory, Path installDirectory) {
        this.workingDirectory = Objects.requireNonNull(workingDirectory, "Working directory cannot be null");
        this.installDirectory = Objects.requireNonNull(installDirectory, "Install directory cannot be null");
    }

    public Path workingDirectory() {
        return workingDirectory;
    }

    public Path installDirectory() {
        return installDirectory;
    }

    public Path resolve(String filePath) {
        if (filePath == null || filePath.isBlank()) {
            throw new ValidationException("File path cannot be null or empty");
        }
        return workingDirectory.resolve(filePath).toAbsolutePath().normalize();
    }

    /**
     * Resolves {@code filePath} and requires the file to exist.
     */
    public Path resolveExisting(String filePath, String fileDescription) {
        Path resolved = resolve(filePath);
        if (!Files.isRegularFile(resolved)) {
            throw new ValidationException(
                "The " + fileDescription + " '" + filePath + "' was not found.\n"
                    + "Resolved path: " + resolved + "\n"
                    + "Current working directory: " + workingDirectory + "\n"
                    + "Tip: Ensure the file exists in the current directory or provide an absolute path.");
        }
        return resolved;
    }

    /**
     * Resolves the environments file: absolute paths as given, relative paths in the working
     * directory first and then in the install directory.
     */
    public Path resolveEnvironmentsFile(String filePath) {
        if (filePath == null || filePath.isBlank()) {
            throw new ValidationException("File path cannot be null or empty");
        }
        if (Path.of(filePath).isAbsolute()) {
            Path absolute = Path.of(filePath).normalize();
            if (!Files.isRegularFile(absolute)) {
                throw new ValidationException(
                    "The environments file '" + filePath + "' was not found.\n"
                        + "Resolved path: " + absolute + "\n"
                        + "Tip: Ensure the file exists at the specified absolute path.");
            }
            return absolute;
        }

        List<Path> candidates = environmentsSearchLocations(filePath);
        for (Path candidate : candidates) {
            if (Files.isRegularFile(candidate)) {
                return candidate;
            }
        }
        throw new ValidationException(
            "The environments file '" + filePath + "' was not found.\n"
                + "Searched locations:\n"
                + "  1. Current working directory: " + candidates.get(0) + "\n"
                + "  2. Application install directory: " + candidates.get(1) + "\n"
                + "Tip: Place the file in your current directory for project-specific configs, "
                + "or in the application install directory for global defaults.");
    }

    /**
     * Locations searched for a relative environments file, in search order.
     */
    public List<Path> environmentsSearchLocations(String filePath) {
        return List.of(
            workingDirectory.resolve(filePath).toAbsolutePath().normalize(),
            installDirectory.resolve(filePath).toAbsolutePath().normalize());
    }

    private static Path detectInstallDirectory() {
        CodeSource codeSource = PathResolver.class.getProtectionDomain().getCodeSource();
        if (codeSource != null && codeSource.getLocation() != null) {
            try {
                Path location = Path.of(codeSource.getLocation().toURI());
                // a jar's install directory is its parent; an exploded classes directory is itself
                Path directory = Files.isDirectory(location) ? location : location.getParent();
                if (directory != null) {
                    return directory;
                }
            } catch (URISyntaxException | IllegalArgumentException e) {
                return Path.of(System.getProperty("user.dir"));
            }
        }
        return Path.of(System.getProperty("user.dir"));
    }
}
