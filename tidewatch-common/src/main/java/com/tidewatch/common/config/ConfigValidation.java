package com.tidewatch.common.config;

import com.tidewatch.common.infra.ActiveHours;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * Semantic checks run once when the configuration is loaded, so the loops
 * never have to second-guess a value at runtime.
 */
public final class ConfigValidation {

    private ConfigValidation() {
    }

    /**
     * Collect every problem in the config; an empty list means valid.
     */
    public static List<String> validate(TidewatchConfig config) {
        List<String> problems = new ArrayList<>();

        TidewatchConfig.CronConfig cron = config.getCron();
        if (cron != null) {
            checkActiveHours("cron.activeHours", cron.getActiveHours(), problems);
            if (cron.getScheduleFile() == null || cron.getScheduleFile().isBlank()) {
                problems.add("cron.scheduleFile must not be empty");
            }
            if (cron.getTickSeconds() < 1 || cron.getTickSeconds() > 60) {
                problems.add("cron.tickSeconds must be between 1 and 60 (got " + cron.getTickSeconds() + ")");
            }
            if (cron.getExecutorCommand() == null || cron.getExecutorCommand().isEmpty()) {
                problems.add("cron.executorCommand must name a program");
            }
        }

        TidewatchConfig.HeartbeatConfig hb = config.getHeartbeat();
        if (hb != null) {
            checkActiveHours("heartbeat.activeHours", hb.getActiveHours(), problems);
            if (hb.getIntervalMinutes() < 1) {
                problems.add("heartbeat.intervalMinutes must be positive (got " + hb.getIntervalMinutes() + ")");
            }
            if (hb.getWakeDebounceSeconds() < 0) {
                problems.add("heartbeat.wakeDebounceSeconds must not be negative");
            }
            if (hb.getHistorySize() < 1) {
                problems.add("heartbeat.historySize must be positive (got " + hb.getHistorySize() + ")");
            }
            if (hb.getCheckTimeoutSeconds() < 1) {
                problems.add("heartbeat.checkTimeoutSeconds must be positive");
            }
            if (hb.getDiskThresholdPercent() < 1 || hb.getDiskThresholdPercent() > 100) {
                problems.add("heartbeat.diskThresholdPercent must be between 1 and 100 (got "
                        + hb.getDiskThresholdPercent() + ")");
            }
            if (hb.getDependencies() != null) {
                for (int i = 0; i < hb.getDependencies().size(); i++) {
                    checkDependency("heartbeat.dependencies[" + i + "]", hb.getDependencies().get(i), problems);
                }
            }
        }

        TidewatchConfig.AlertsConfig alerts = config.getAlerts();
        if (alerts != null && alerts.getWebhookUrl() != null && !alerts.getWebhookUrl().isBlank()) {
            checkUrl("alerts.webhookUrl", alerts.getWebhookUrl(), problems);
        }
        return problems;
    }

    /**
     * @throws ConfigException listing every problem, if any
     */
    public static TidewatchConfig requireValid(TidewatchConfig config) {
        List<String> problems = validate(config);
        if (!problems.isEmpty()) {
            throw new ConfigException("Invalid configuration", problems);
        }
        return config;
    }

    private static void checkActiveHours(String path, TidewatchConfig.ActiveHoursConfig hours,
            List<String> problems) {
        try {
            ActiveHours.from(hours);
        } catch (IllegalArgumentException e) {
            problems.add(path + ": " + e.getMessage());
        }
    }

    private static void checkDependency(String path, TidewatchConfig.DependencyConfig dep, List<String> problems) {
        if (dep == null) {
            problems.add(path + " is null");
            return;
        }
        if (dep.getName() == null || dep.getName().isBlank()) {
            problems.add(path + ".name must not be empty");
        }
        String type = dep.getType() == null ? "tcp" : dep.getType().toLowerCase();
        switch (type) {
            case "tcp" -> {
                if (dep.getHost() == null || dep.getHost().isBlank()) {
                    problems.add(path + ".host is required for tcp probes");
                }
                if (dep.getPort() == null || dep.getPort() < 1 || dep.getPort() > 65535) {
                    problems.add(path + ".port must be between 1 and 65535");
                }
            }
            case "http" -> {
                if (dep.getUrl() == null || dep.getUrl().isBlank()) {
                    problems.add(path + ".url is required for http probes");
                } else {
                    checkUrl(path + ".url", dep.getUrl(), problems);
                }
            }
            default -> problems.add(path + ".type must be \"tcp\" or \"http\" (got \"" + dep.getType() + "\")");
        }
    }

    private static void checkUrl(String path, String raw, List<String> problems) {
        try {
            URI uri = URI.create(raw);
            if (uri.getScheme() == null || !uri.getScheme().toLowerCase().startsWith("http")) {
                problems.add(path + " must be an http(s) URL");
            }
        } catch (IllegalArgumentException e) {
            problems.add(path + " is not a valid URL: " + e.getMessage());
        }
    }
}
