package io.fleetquery.tools.multiquery.security;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Checks that files holding credentials, such as the environments file, are private to their owner.
 */
public class FilePermissionValidator {

    private static final Set<PosixFilePermission> SHARED_ACCESS = EnumSet.of(
        PosixFilePermission.GROUP_READ, PosixFilePermission.GROUP_WRITE,
        PosixFilePermission.OTHERS_READ, PosixFilePermission.OTHERS_WRITE);

    /**
     * Returns a warning when the file can be read or written by group or others.
     * Empty on file systems without POSIX permissions.
     */
    public Optional<String> check(Path credentialFile) {
        if (!credentialFile.getFileSystem().supportedFileAttributeViews().contains("posix")) {
            return Optional.empty();
        }
        try {
            Set<PosixFilePermission> perms = Files.getPosixFilePermissions(credentialFile);
            if (perms.stream().anyMatch(SHARED_ACCESS::contains)) {
                return Optional.of("File contains database passwords but is accessible to group/others "
                    + "(consider chmod 600): " + credentialFile);
            }
            return Optional.empty();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read permissions of " + credentialFile, e);
        }
    }
}
