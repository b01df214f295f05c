package com.finfocus.common.infra;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.util.Locale;
import java.util.Set;

/**
 * Decides whether a regular file counts as an executable on a platform family.
 */
public interface ExecutabilityChecker {

    /**
     * @param file an existing regular file
     */
    boolean isExecutable(Path file);

    /**
     * Checker for the running JVM's platform.
     */
    static ExecutabilityChecker current() {
        return forPlatform(Platform.current());
    }

    static ExecutabilityChecker forPlatform(Platform platform) {
        return platform.isWindows() ? new Windows() : new Posix();
    }

    /**
     * Windows: executability is a matter of the {@code .exe} extension.
     */
    final class Windows implements ExecutabilityChecker {
        @Override
        public boolean isExecutable(Path file) {
            return file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".exe");
        }
    }

    /**
     * POSIX: any of the owner/group/other execute bits.
     */
    final class Posix implements ExecutabilityChecker {
        private static final Set<PosixFilePermission> EXECUTE_BITS = Set.of(
                PosixFilePermission.OWNER_EXECUTE,
                PosixFilePermission.GROUP_EXECUTE,
                PosixFilePermission.OTHERS_EXECUTE);

        @Override
        public boolean isExecutable(Path file) {
            try {
                Set<PosixFilePermission> perms = Files.getPosixFilePermissions(file);
                return perms.stream().anyMatch(EXECUTE_BITS::contains);
            } catch (UnsupportedOperationException e) {
                return Files.isExecutable(file);
            } catch (IOException e) {
                return false;
            }
        }
    }
}
