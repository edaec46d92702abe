package com.phillippitts.livescribe.service.process;

import java.util.Objects;

/**
 * Captured result of a completed one-shot process.
 *
 * @param stdout     captured standard output (capped)
 * @param stderr     captured standard error (capped)
 * @param exitCode   process exit code
 * @param durationMs wall-clock duration in milliseconds
 */
public record ProcessOutput(String stdout, String stderr, int exitCode, long durationMs) {
    public ProcessOutput {
        stdout = Objects.requireNonNullElse(stdout, "");
        stderr = Objects.requireNonNullElse(stderr, "");
    }
}
