package com.barometer.core.system;

import java.util.List;

/**
 * Captured output of a finished subprocess.
 *
 * @param exitCode process exit status
 * @param stdout   standard output, trimmed
 * @param stderr   standard error, trimmed
 */
public record CommandResult(int exitCode, String stdout, String stderr) {

    public boolean succeeded() {
        return exitCode == 0;
    }

    /** Non-blank stdout lines. */
    public List<String> lines() {
        return stdout.lines().map(String::strip).filter(line -> !line.isEmpty()).toList();
    }
}
