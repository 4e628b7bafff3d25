package com.tidewatch.common.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration type for Tidewatch.
 * Every field carries its documented default, so a missing section or key
 * in the JSON file behaves exactly like the default.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TidewatchConfig {

    /** Job scheduler settings. */
    private CronConfig cron = new CronConfig();

    /** Heartbeat monitor settings. */
    private HeartbeatConfig heartbeat = new HeartbeatConfig();

    /** Alert delivery settings shared by both loops. */
    private AlertsConfig alerts = new AlertsConfig();

    // --- Nested config types ---

    /**
     * Daily wall-clock window, "HH:mm" strings. An end before the start spans
     * midnight.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ActiveHoursConfig {
        private String start;
        private String end;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CronConfig {
        private boolean autostart = false;
        /** Path of the schedule file; relative paths resolve against the working directory. */
        private String scheduleFile = ".tidewatch/cron.tab";
        /** null means always active. */
        private ActiveHoursConfig activeHours = new ActiveHoursConfig("06:00", "02:00");
        private String alertChannel = "";
        /** Also alert on successful runs, not only failures. */
        private boolean showOk = false;
        private int tickSeconds = 30;
        /** Command line of the task executor; the task text is appended as the last argument. */
        private List<String> executorCommand = new ArrayList<>(
                List.of("pi", "-p", "--no-session", "--no-extensions"));
        private String workingDirectory;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class HeartbeatConfig {
        private boolean autostart = false;
        private int intervalMinutes = 15;
        /** null means always active. */
        private ActiveHoursConfig activeHours = new ActiveHoursConfig("06:00", "02:00");
        private String alertChannel = "";
        private boolean alertOnUrgent = true;
        /** Wake the consuming agent when a beat is urgent. */
        private boolean injectUrgent = true;
        private List<String> prioritySenders = new ArrayList<>();
        private List<String> botSenders = new ArrayList<>();
        private int wakeDebounceSeconds = 60;
        private int historySize = 100;
        private int checkTimeoutSeconds = 30;
        private String watermarkFile = "~/.tidewatch/watermarks.json";
        /** Shell command printing new messages as JSON; null disables the message check. */
        private String messageSourceCommand;
        /** Shell command whose exit status tells whether the message source is reachable. */
        private String messageSourcePingCommand;
        private List<DependencyConfig> dependencies = new ArrayList<>();
        private String diskPath = ".";
        private int diskThresholdPercent = 85;
    }

    /**
     * A named dependency probed by the infrastructure check.
     * {@code type} is "tcp" (host + port) or "http" (url).
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DependencyConfig {
        private String name;
        private String type = "tcp";
        private String host;
        private Integer port;
        private String url;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AlertsConfig {
        /** Webhook receiving alert messages as JSON; null logs alerts instead. */
        private String webhookUrl;
        private int timeoutSeconds = 10;
    }
}
