package com.tidewatch.common.config;

import java.nio.file.Path;
import java.util.Map;

/**
 * Configuration and state paths.
 */
public final class ConfigPaths {

    private ConfigPaths() {
    }

    private static final String STATE_DIRNAME = ".tidewatch";
    private static final String CONFIG_FILENAME = "config.json";

    /**
     * State directory, overridable via TIDEWATCH_STATE_DIR. Default: ~/.tidewatch
     */
    public static Path resolveStateDir() {
        return resolveStateDir(System.getenv(), System.getProperty("user.home"));
    }

    public static Path resolveStateDir(Map<String, String> env, String homedir) {
        String override = env.get("TIDEWATCH_STATE_DIR");
        if (override != null && !override.isBlank()) {
            return resolveUserPath(override.trim());
        }
        return Path.of(homedir, STATE_DIRNAME);
    }

    /**
     * Default config file location: {@code <stateDir>/config.json}.
     */
    public static Path resolveDefaultConfigPath() {
        return resolveStateDir().resolve(CONFIG_FILENAME);
    }

    /**
     * Expand a leading {@code ~} to the user's home directory.
     */
    public static Path resolveUserPath(String raw) {
        if (raw.equals("~")) {
            return Path.of(System.getProperty("user.home"));
        }
        if (raw.startsWith("~/") || raw.startsWith("~\\")) {
            return Path.of(System.getProperty("user.home"), raw.substring(2));
        }
        return Path.of(raw);
    }
}
