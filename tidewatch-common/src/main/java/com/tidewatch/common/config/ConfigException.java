package com.tidewatch.common.config;

import java.util.List;

/**
 * Thrown when the configuration cannot be used. Raised once at load time,
 * never while the loops are running.
 */
public class ConfigException extends RuntimeException {

    private final List<String> problems;

    public ConfigException(String message, List<String> problems) {
        super(message + ": " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
        this.problems = List.of(message);
    }

    public List<String> getProblems() {
        return problems;
    }
}
