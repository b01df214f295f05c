package com.finfocus.common.infra;

import java.util.Optional;

/**
 * Answers whether a process id belongs to a running process.
 */
@FunctionalInterface
public interface ProcessChecker {

    boolean isRunning(long pid);

    /**
     * Checker backed by {@link ProcessHandle}, which queries the native
     * process table on every platform the JDK supports.
     */
    static ProcessChecker system() {
        return pid -> {
            if (pid <= 0) {
                return false;
            }
            try {
                Optional<ProcessHandle> handle = ProcessHandle.of(pid);
                return handle.map(ProcessHandle::isAlive).orElse(false);
            } catch (SecurityException e) {
                // the process exists but belongs to someone we may not inspect
                return true;
            }
        };
    }
}
