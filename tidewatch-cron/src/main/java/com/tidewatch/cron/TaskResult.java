package com.tidewatch.cron;

/**
 * What an isolated task execution produced.
 */
public record TaskResult(String stdout, String stderr, int exitCode, boolean timedOut) {

    public TaskResult {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
    }

    public static TaskResult success(String stdout) {
        return new TaskResult(stdout, "", 0, false);
    }
}
