package com.tidewatch.app.commands;

import com.tidewatch.common.infra.ActiveHours;
import com.tidewatch.cron.CronExpression;
import com.tidewatch.cron.CronJob;
import com.tidewatch.cron.CronJobUpdate;
import com.tidewatch.cron.CronJobView;
import com.tidewatch.cron.CronScheduler;
import com.tidewatch.cron.CronStatus;
import com.tidewatch.cron.ScheduleFile;
import com.tidewatch.cron.ScheduleStore;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Scheduled job commands: /cron, /cron on|off, /cron run|add|remove|enable|disable.
 */
@Component
public class CronCommands {

    private static final String RULE = "═══════════════════════════════════════";
    private static final int TASK_PREVIEW = 60;

    private final CronScheduler scheduler;
    private final ScheduleStore store;

    public CronCommands(CronScheduler scheduler, ScheduleStore store) {
        this.scheduler = scheduler;
        this.store = store;
    }

    public CommandResult handleCron(String args, CommandContext ctx) {
        String[] parts = args.isBlank() ? new String[0] : args.trim().split("\\s+");
        String sub = parts.length == 0 ? "" : parts[0].toLowerCase();

        return switch (sub) {
            case "on", "start" -> start();
            case "off", "stop" -> stop();
            case "run" -> run(parts);
            case "add" -> add(parts);
            case "remove", "rm" -> remove(parts);
            case "enable" -> setDisabled(parts, false);
            case "disable" -> setDisabled(parts, true);
            default -> status(ctx);
        };
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    private CommandResult start() {
        if (scheduler.isActive()) {
            return CommandResult.error("Scheduler is already running.");
        }
        scheduler.start();
        return CommandResult.text("✓ Cron scheduler started (" + scheduler.getStatus().enabledCount()
                + " active jobs)");
    }

    private CommandResult stop() {
        if (!scheduler.isActive()) {
            return CommandResult.error("Scheduler is not running.");
        }
        scheduler.stop();
        return CommandResult.text("✓ Cron scheduler stopped.");
    }

    // =========================================================================
    // Job management
    // =========================================================================

    private CommandResult run(String[] parts) {
        if (parts.length < 2) {
            return CommandResult.error("Usage: /cron run <job-name>");
        }
        String name = parts[1];
        return switch (scheduler.runNow(name)) {
            case TRIGGERED -> CommandResult.text("✓ Triggered \"" + name + "\"");
            case ALREADY_RUNNING -> CommandResult.error("Job \"" + name + "\" is already running.");
            case NOT_FOUND -> CommandResult.error("Job \"" + name + "\" not found.");
        };
    }

    private CommandResult add(String[] parts) {
        if (parts.length < 8) {
            return CommandResult.error(
                    "Usage: /cron add <name> <min> <hour> <dom> <month> <dow> <task...>\n"
                            + "Example: /cron add morning-brief 0 9 * * 1-5 Check messages and summarize the state of things");
        }
        String name = parts[1];
        String schedule = String.join(" ", Arrays.copyOfRange(parts, 2, 7));
        String task = String.join(" ", Arrays.copyOfRange(parts, 7, parts.length));

        Optional<String> problem = CronExpression.validate(schedule);
        if (problem.isPresent()) {
            return CommandResult.error("Invalid cron expression: " + problem.get());
        }
        CronJob job = CronJob.builder().name(name).schedule(schedule).task(task).build();
        Optional<String> unrepresentable = ScheduleFile.problem(job);
        if (unrepresentable.isPresent()) {
            return CommandResult.error(unrepresentable.get());
        }
        if (!store.add(job)) {
            return CommandResult.error("Job \"" + name + "\" already exists.");
        }
        refresh();
        return CommandResult.text("✓ Added job \"" + name + "\" (" + schedule + ")");
    }

    private CommandResult remove(String[] parts) {
        if (parts.length < 2) {
            return CommandResult.error("Usage: /cron remove <name>");
        }
        String name = parts[1];
        if (!store.remove(name)) {
            return CommandResult.error("Job \"" + name + "\" not found.");
        }
        refresh();
        return CommandResult.text("✓ Removed \"" + name + "\"");
    }

    private CommandResult setDisabled(String[] parts, boolean disabled) {
        String verb = disabled ? "disable" : "enable";
        if (parts.length < 2) {
            return CommandResult.error("Usage: /cron " + verb + " <name>");
        }
        String name = parts[1];
        if (!store.update(name, CronJobUpdate.disabled(disabled))) {
            return CommandResult.error("Job \"" + name + "\" not found.");
        }
        refresh();
        return CommandResult.text("✓ " + (disabled ? "Disabled" : "Enabled") + " \"" + name + "\"");
    }

    /** The file watcher catches edits too; reloading here makes the next listing exact. */
    private void refresh() {
        if (scheduler.isActive()) {
            scheduler.reload();
        }
    }

    // =========================================================================
    // Status
    // =========================================================================

    private CommandResult status(CommandContext ctx) {
        List<String> lines = new ArrayList<>();
        lines.add(RULE);
        lines.add("  CRON - Scheduled Jobs");
        lines.add(RULE);
        lines.add("");

        List<CronJobView> jobs;
        if (scheduler.isActive()) {
            CronStatus s = scheduler.getStatus();
            lines.add("  Scheduler: Active");
            lines.add("  Jobs: " + s.enabledCount() + " active of " + s.jobCount() + " total");
            lines.add("  Runs: " + s.runCount() + " (" + s.okCount() + " OK, " + s.errorCount() + " errors)");
            if (!s.runningNames().isEmpty()) {
                lines.add("  Running: " + String.join(", ", s.runningNames()));
            }
            jobs = scheduler.list();
        } else {
            lines.add("  Scheduler: Inactive");
            lines.add("  Use /cron on to start.");
            jobs = store.load().stream().map(job -> new CronJobView(job, false)).toList();
        }

        lines.add("");
        lines.add("  Active Hours: " + ActiveHours.from(ctx.config().getCron().getActiveHours()));

        lines.add("");
        if (jobs.isEmpty()) {
            lines.add("  No jobs configured.");
            lines.add("  Edit " + store.getPath() + " or use /cron add <name> <schedule> <task>");
        } else {
            lines.add("  ─── Jobs ───");
            for (CronJobView view : jobs) {
                lines.add(formatJobLine(view));
            }
        }
        return CommandResult.text(String.join("\n", lines));
    }

    static String formatJobLine(CronJobView view) {
        CronJob job = view.job();
        String state = job.isDisabled() ? "⏸ disabled" : view.running() ? "🔄 running" : "✓ active";
        String channel = CronJob.DEFAULT_CHANNEL.equals(job.getChannel()) ? "" : " [" + job.getChannel() + "]";
        String task = job.getTask().length() > TASK_PREVIEW
                ? job.getTask().substring(0, TASK_PREVIEW) + "…"
                : job.getTask();
        return "  " + state + " " + job.getName() + " " + job.getSchedule() + channel + "\n    " + task;
    }
}
