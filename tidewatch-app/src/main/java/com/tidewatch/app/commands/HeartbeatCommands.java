package com.tidewatch.app.commands;

import com.tidewatch.common.config.TidewatchConfig;
import com.tidewatch.common.infra.FormatDuration;
import com.tidewatch.heartbeat.BeatResult;
import com.tidewatch.heartbeat.HeartbeatRunner;
import com.tidewatch.heartbeat.HeartbeatStatus;
import com.tidewatch.heartbeat.Tier;
import com.tidewatch.heartbeat.check.CheckResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Awareness commands: /heartbeat, /heartbeat on|off|run|history|briefing.
 */
@Slf4j
@Component
public class HeartbeatCommands {

    private static final String RULE = "═══════════════════════════════════════";
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");
    static final int HISTORY_SHOWN = 20;

    private final HeartbeatRunner runner;
    private final Clock clock;

    @Autowired
    public HeartbeatCommands(HeartbeatRunner runner) {
        this(runner, Clock.systemDefaultZone());
    }

    HeartbeatCommands(HeartbeatRunner runner, Clock clock) {
        this.runner = runner;
        this.clock = clock;
    }

    public CommandResult handleHeartbeat(String args, CommandContext ctx) {
        String sub = args.trim().toLowerCase();
        return switch (sub) {
            case "on", "start" -> start();
            case "off", "stop" -> stop();
            case "run", "now" -> runNow();
            case "history" -> history();
            case "briefing", "brief" -> briefing();
            default -> status(ctx);
        };
    }

    private CommandResult start() {
        if (runner.isActive()) {
            return CommandResult.error("Heartbeat is already running.");
        }
        runner.start();
        return CommandResult.text("✓ Heartbeat started (every " + runner.getSettings().intervalMinutes()
                + "m, pulse/breath/tide)");
    }

    private CommandResult stop() {
        if (!runner.isActive()) {
            return CommandResult.error("Heartbeat is not running.");
        }
        runner.stop();
        return CommandResult.text("✓ Heartbeat stopped.");
    }

    // =========================================================================
    // /heartbeat run
    // =========================================================================

    private CommandResult runNow() {
        log.info("Manual heartbeat requested");
        BeatResult result = runner.runNow();

        List<String> lines = new ArrayList<>();
        lines.add(RULE);
        lines.add(result.ok() ? "  💚 HEARTBEAT - All Clear" : "  🫀 HEARTBEAT - Issues Detected");
        lines.add("  Beat #" + result.beatNumber() + " [" + result.tier().label() + "] - "
                + FormatDuration.format(result.duration()));
        lines.add(RULE);
        lines.add("");
        lines.add(result.briefing());
        lines.add("");
        lines.add("─── Check Details ───");
        for (CheckResult check : result.checks()) {
            lines.add(formatCheckLine(check));
        }
        return CommandResult.text(String.join("\n", lines));
    }

    static String formatCheckLine(CheckResult check) {
        return String.format("  %s %-20s %s (%s)", check.ok() ? "✓" : "✗", check.name(), check.message(),
                FormatDuration.format(check.duration()));
    }

    // =========================================================================
    // /heartbeat history
    // =========================================================================

    private CommandResult history() {
        int total = runner.getHistorySize();
        if (total == 0) {
            return CommandResult.text("No heartbeat history yet. Use /heartbeat run to start.");
        }
        List<String> lines = new ArrayList<>();
        lines.add(RULE);
        lines.add("  HEARTBEAT HISTORY");
        lines.add(RULE);
        lines.add("");
        for (BeatResult entry : runner.getHistory(HISTORY_SHOWN)) {
            lines.add(formatHistoryLine(entry));
        }
        if (total > HISTORY_SHOWN) {
            lines.add("");
            lines.add("  … and " + (total - HISTORY_SHOWN) + " older entries");
        }
        return CommandResult.text(String.join("\n", lines));
    }

    String formatHistoryLine(BeatResult entry) {
        StringBuilder line = new StringBuilder("  ")
                .append(entry.ok() ? "💚" : "⚠").append(' ')
                .append(tierIcon(entry.tier())).append(" #").append(entry.beatNumber()).append(' ')
                .append(formatTime(entry.timestamp())).append(" - ")
                .append(entry.passedCount()).append('/').append(entry.checks().size())
                .append(" (").append(FormatDuration.format(entry.duration())).append(')');
        if (entry.urgent()) {
            line.append(" ❗");
        }
        if (!entry.ok()) {
            line.append(" [").append(String.join(", ", entry.failedChecks())).append(']');
        }
        return line.toString();
    }

    private static String tierIcon(Tier tier) {
        return switch (tier) {
            case TIDE -> "🌊";
            case BREATH -> "🌬️";
            case PULSE -> "🫀";
        };
    }

    // =========================================================================
    // /heartbeat briefing
    // =========================================================================

    private CommandResult briefing() {
        Optional<BeatResult> last = runner.getLastResult();
        if (last.isEmpty()) {
            return CommandResult.text("No heartbeat has run yet. Use /heartbeat run first.");
        }
        return CommandResult.text(last.get().briefing());
    }

    // =========================================================================
    // /heartbeat (status)
    // =========================================================================

    private CommandResult status(CommandContext ctx) {
        HeartbeatStatus s = runner.getStatus();
        HeartbeatRunner.Settings settings = runner.getSettings();
        List<String> lines = new ArrayList<>();
        lines.add(RULE);
        lines.add("  HEARTBEAT - Awareness System");
        lines.add(RULE);
        lines.add("");

        if (!s.active()) {
            lines.add("  State: Inactive");
            lines.add("");
            lines.add("  Use /heartbeat on to start periodic awareness.");
            lines.add("  Use /heartbeat run for an immediate check.");
        } else {
            lines.add("  State: Active (every " + s.intervalMinutes() + "m)");
            lines.add("");
            lines.add("  ─── Statistics ───");
            lines.add("  Beats: " + s.runCount() + " (current: #" + s.beatNumber() + ")");
            lines.add("  OK: " + s.okCount() + " · Alerts: " + s.alertCount());
            if (s.runCount() > 0) {
                lines.add("  Health: " + Math.round(s.okCount() * 100.0 / s.runCount()) + "%");
            }
            if (s.lastRun() != null) {
                long ago = Math.round(Duration.between(s.lastRun(), clock.instant()).toSeconds() / 60.0);
                String tier = runner.getLastResult().map(r -> r.tier().label()).orElse("?");
                lines.add("  Last: " + formatTime(s.lastRun()) + " (" + ago + "m ago) - " + tier);
            } else {
                lines.add("  Last: No beats yet (first at next interval)");
            }
            lines.add("");
            lines.add("  ─── Tiers ───");
            lines.add("  🫀 Pulse   every beat      messages, infrastructure");
            lines.add("  🌬️ Breath  every 3rd beat  pulse checks plus periodic extras");
            lines.add("  🌊 Tide    every 6th beat  pulse checks plus deep extras");
        }

        TidewatchConfig.HeartbeatConfig config = ctx.config().getHeartbeat();
        lines.add("");
        lines.add("  ─── Configuration ───");
        lines.add("  Interval: " + settings.intervalMinutes() + "m");
        lines.add("  Active Hours: " + settings.activeHours());
        lines.add("  Urgent Alerts: " + enabled(settings.alertOnUrgent()));
        lines.add("  Urgent Injection: " + enabled(settings.injectUrgent()));
        lines.add("  Priority Senders: " + (config.getPrioritySenders().isEmpty()
                ? "none" : String.join(", ", config.getPrioritySenders())));
        lines.add("  History: " + s.historySize() + " entries");
        return CommandResult.text(String.join("\n", lines));
    }

    private static String enabled(boolean flag) {
        return flag ? "enabled" : "disabled";
    }

    private String formatTime(Instant instant) {
        return LocalTime.ofInstant(instant, clock.getZone()).format(TIME);
    }
}
