package com.tidewatch.cron;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Text codec for the schedule file. One job per line:
 *
 * <pre>
 * &lt;min&gt; &lt;hour&gt; &lt;dom&gt; &lt;month&gt; &lt;dow&gt;  &lt;name&gt;  [channel:&lt;ch&gt;]  [timeout:&lt;minutes&gt;]  [disabled]  &lt;task&gt;
 * </pre>
 *
 * Comment lines start with {@code #}; blank lines are ignored.
 */
public final class ScheduleFile {

    private ScheduleFile() {
    }

    static final String HEADER = String.join("\n",
            "# cron.tab - Scheduled jobs",
            "# Format: <min> <hour> <dom> <month> <dow>  <name>  [channel:<ch>]  [timeout:<min>]  [disabled]  <task>",
            "#",
            "# The schedule follows standard cron syntax:",
            "#   min(0-59) hour(0-23) dom(1-31) month(1-12) dow(0-6, 0=Sun)",
            "#   * = any, */N = every N, N-M = range, N,M = list",
            "#",
            "# Examples:",
            "#   0 9 * * 1-5  morning-brief  Check messages and summarize the day",
            "#   */30 * * * *  metrics-pulse  channel:data  Ingest platform metrics",
            "#   0 2 * * *  night-work  timeout:60  Run the overnight work session",
            "#   0 * * * *  housekeeping  disabled  Run the housekeeping patrol",
            "");

    private static final String CHANNEL_FLAG = "channel:";
    private static final String TIMEOUT_FLAG = "timeout:";
    private static final String DISABLED_FLAG = "disabled";

    /**
     * Parse file content. Lines with fewer than seven tokens, or with no task
     * text after the flags, are skipped. Cron expressions are not validated
     * here.
     */
    public static List<CronJob> parse(String content) {
        List<CronJob> jobs = new ArrayList<>();
        if (content == null) {
            return jobs;
        }
        for (String raw : content.split("\n")) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            String[] tokens = line.split("\\s+");
            if (tokens.length < 7) {
                continue;
            }

            CronJob job = CronJob.builder()
                    .schedule(String.join(" ", Arrays.copyOfRange(tokens, 0, 5)))
                    .name(tokens[5])
                    .build();

            int idx = 6;
            while (idx < tokens.length) {
                String token = tokens[idx];
                if (token.startsWith(CHANNEL_FLAG)) {
                    job.setChannel(token.substring(CHANNEL_FLAG.length()));
                } else if (token.startsWith(TIMEOUT_FLAG)) {
                    Duration timeout = parseTimeout(token.substring(TIMEOUT_FLAG.length()));
                    if (timeout != null) {
                        job.setTimeout(timeout);
                    }
                } else if (token.equals(DISABLED_FLAG)) {
                    job.setDisabled(true);
                } else {
                    break;
                }
                idx++;
            }

            if (idx >= tokens.length) {
                continue;
            }
            job.setTask(String.join(" ", Arrays.copyOfRange(tokens, idx, tokens.length)));
            jobs.add(job);
        }
        return jobs;
    }

    /**
     * Render jobs with the documentation header. Default channel and timeout
     * are omitted; timeouts are written in whole minutes, never below one.
     */
    public static String serialize(List<CronJob> jobs) {
        StringBuilder sb = new StringBuilder(HEADER).append('\n');
        for (CronJob job : jobs) {
            sb.append(job.getSchedule()).append("  ").append(job.getName());
            if (job.getChannel() != null && !job.getChannel().equals(CronJob.DEFAULT_CHANNEL)) {
                sb.append("  ").append(CHANNEL_FLAG).append(job.getChannel());
            }
            Duration timeout = job.getTimeout();
            if (timeout != null && !timeout.isZero() && !timeout.equals(CronJob.DEFAULT_TIMEOUT)) {
                long minutes = Math.max(1, Math.round(timeout.toMillis() / 60_000.0));
                sb.append("  ").append(TIMEOUT_FLAG).append(minutes);
            }
            if (job.isDisabled()) {
                sb.append("  ").append(DISABLED_FLAG);
            }
            sb.append("  ").append(job.getTask()).append('\n');
        }
        return sb.toString();
    }

    /**
     * Check that a job survives a write and re-read unchanged. The cron
     * expression itself is not checked here.
     *
     * @return a description of the first problem, or empty if the job is
     *         representable
     */
    public static Optional<String> problem(CronJob job) {
        String name = job.getName();
        if (name == null || name.isEmpty() || hasWhitespace(name)) {
            return Optional.of("Job name must be a single word: \"" + name + "\"");
        }
        String channel = job.getChannel();
        if (channel != null && (channel.isEmpty() || hasWhitespace(channel))) {
            return Optional.of("Channel must be a single word: \"" + channel + "\"");
        }
        String task = job.getTask();
        if (task == null || task.isBlank()) {
            return Optional.of("Task must not be empty");
        }
        if (task.indexOf('\n') >= 0 || task.indexOf('\r') >= 0) {
            return Optional.of("Task must be a single line");
        }
        String first = task.trim().split("\\s+", 2)[0];
        if (isFlag(first)) {
            return Optional.of("Task must not start with \"" + first + "\"; it would be read back as a flag");
        }
        return Optional.empty();
    }

    private static boolean isFlag(String token) {
        return token.startsWith(CHANNEL_FLAG) || token.startsWith(TIMEOUT_FLAG) || token.equals(DISABLED_FLAG);
    }

    private static boolean hasWhitespace(String s) {
        return s.chars().anyMatch(Character::isWhitespace);
    }

    private static Duration parseTimeout(String minutes) {
        try {
            int value = Integer.parseInt(minutes);
            return value > 0 ? Duration.ofMinutes(value) : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
