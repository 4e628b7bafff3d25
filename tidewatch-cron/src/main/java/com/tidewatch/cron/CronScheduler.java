package com.tidewatch.cron;

import com.tidewatch.common.alert.AlertSink;
import com.tidewatch.common.config.TidewatchConfig;
import com.tidewatch.common.infra.ActiveHours;
import com.tidewatch.common.infra.FormatDuration;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Fires schedule-file jobs when their cron expression matches the current
 * minute.
 * <p>
 * A timer ticks every {@code tickInterval} (30 s by default); each distinct
 * wall-clock minute is evaluated at most once. A job never runs twice at the
 * same time: a match while it is still executing is dropped, not queued.
 * The job list is re-read whenever the schedule file changes on disk.
 */
@Slf4j
public class CronScheduler implements AutoCloseable {

    static final int MAX_RESPONSE_LENGTH = 2000;
    static final int MAX_ERROR_LENGTH = 500;

    /**
     * Runtime settings, swappable while running.
     */
    public record Settings(ActiveHours activeHours, boolean showOk, Duration tickInterval) {

        public static Settings from(TidewatchConfig.CronConfig config) {
            return new Settings(ActiveHours.from(config.getActiveHours()), config.isShowOk(),
                    Duration.ofSeconds(config.getTickSeconds()));
        }
    }

    private final ScheduleStore store;
    private final TaskExecutor executor;
    private final AlertSink alertSink;
    private final Clock clock;
    private final List<CronListener> listeners = new CopyOnWriteArrayList<>();

    /** A loaded job paired with its parsed expression; null when malformed. */
    private record Entry(CronJob job, CronExpression expression) {
    }

    private volatile Settings settings;
    private volatile List<Entry> entries = List.of();
    private volatile boolean reloadPending;
    private final Set<String> running = ConcurrentHashMap.newKeySet();

    private final AtomicLong runCount = new AtomicLong();
    private final AtomicLong okCount = new AtomicLong();
    private final AtomicLong errorCount = new AtomicLong();

    private final Object tickLock = new Object();
    private String lastTickMinute = "";

    private final AtomicBoolean active = new AtomicBoolean(false);
    private ScheduledExecutorService timer;
    private ScheduledFuture<?> tickTask;
    private ScheduleWatcher watcher;

    public CronScheduler(ScheduleStore store, TaskExecutor executor, Settings settings, AlertSink alertSink) {
        this(store, executor, settings, alertSink, Clock.systemDefaultZone());
    }

    public CronScheduler(ScheduleStore store, TaskExecutor executor, Settings settings, AlertSink alertSink,
            Clock clock) {
        this.store = store;
        this.executor = executor;
        this.settings = settings;
        this.alertSink = alertSink == null ? AlertSink.NONE : alertSink;
        this.clock = clock;
    }

    public void addListener(CronListener listener) {
        listeners.add(listener);
    }

    public void updateSettings(Settings settings) {
        boolean intervalChanged = !settings.tickInterval().equals(this.settings.tickInterval());
        this.settings = settings;
        if (intervalChanged && active.get()) {
            synchronized (this) {
                if (tickTask != null) {
                    tickTask.cancel(false);
                    tickTask = timer.scheduleAtFixedRate(this::safeTick,
                            settings.tickInterval().toMillis(), settings.tickInterval().toMillis(),
                            TimeUnit.MILLISECONDS);
                }
            }
        }
    }

    // ── Lifecycle ──────────────────────────────────────────────

    /**
     * Load jobs, start watching the schedule file, tick immediately and then
     * on every interval. No-op if already active.
     */
    public synchronized void start() {
        if (!active.compareAndSet(false, true)) {
            log.debug("Cron scheduler already running");
            return;
        }
        reload();
        watcher = new ScheduleWatcher(store.getPath(), this::reload);
        watcher.start();
        timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cron-tick");
            t.setDaemon(true);
            return t;
        });
        long intervalMs = settings.tickInterval().toMillis();
        tickTask = timer.scheduleAtFixedRate(this::safeTick, 0, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Cron scheduler started ({} jobs, tick {}, active hours {})",
                entries.size(), FormatDuration.format(intervalMs), settings.activeHours());
    }

    /**
     * Stop ticking and watching. Jobs already executing run to completion.
     */
    public synchronized void stop() {
        if (!active.compareAndSet(true, false)) {
            return;
        }
        if (tickTask != null) {
            tickTask.cancel(false);
            tickTask = null;
        }
        if (timer != null) {
            timer.shutdown();
            timer = null;
        }
        if (watcher != null) {
            watcher.close();
            watcher = null;
        }
        log.info("Cron scheduler stopped");
    }

    public boolean isActive() {
        return active.get();
    }

    @Override
    public void close() {
        stop();
    }

    // ── Reload ─────────────────────────────────────────────────

    /**
     * Re-read the schedule file and swap in the new job list. Jobs whose
     * expression is malformed are reported once here and skipped by every
     * tick until fixed. A read failure keeps the previous list and is retried
     * on the next tick. Lines sharing a name each keep their own schedule but
     * share one running slot.
     */
    public synchronized void reload() {
        List<CronJob> loaded;
        try {
            loaded = store.load();
        } catch (ScheduleStoreException e) {
            reloadPending = true;
            log.debug("Schedule reload failed, keeping {} jobs: {}", entries.size(), e.getMessage());
            return;
        }
        reloadPending = false;

        List<Entry> parsed = new ArrayList<>(loaded.size());
        Set<String> names = new HashSet<>();
        int valid = 0;
        for (CronJob job : loaded) {
            if (!names.add(job.getName())) {
                log.warn("Duplicate cron job name \"{}\" in {}", job.getName(), store.getPath());
            }
            CronExpression expression = null;
            try {
                expression = CronExpression.parse(job.getSchedule());
                valid++;
            } catch (CronValidationException e) {
                log.warn("Skipping cron job \"{}\": {}", job.getName(), e.getMessage());
                notifyListeners(l -> l.onInvalidJob(job, e.getMessage()));
            }
            parsed.add(new Entry(job, expression));
        }
        entries = List.copyOf(parsed);
        log.debug("Schedule reloaded: {} jobs ({} valid)", loaded.size(), valid);
        List<CronJob> snapshot = List.copyOf(loaded);
        notifyListeners(l -> l.onReload(snapshot));
    }

    // ── Tick ───────────────────────────────────────────────────

    private void safeTick() {
        try {
            tick(LocalDateTime.now(clock));
        } catch (Exception e) {
            log.error("Cron tick failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Evaluate one instant. A second call within the same wall-clock minute
     * does nothing. Outside active hours the minute is consumed but no job
     * fires.
     */
    public void tick(LocalDateTime now) {
        if (reloadPending) {
            reload();
        }
        synchronized (tickLock) {
            String minuteKey = now.getYear() + "-" + now.getMonthValue() + "-" + now.getDayOfMonth()
                    + "-" + now.getHour() + "-" + now.getMinute();
            if (minuteKey.equals(lastTickMinute)) {
                return;
            }
            lastTickMinute = minuteKey;

            if (!settings.activeHours().contains(now)) {
                log.debug("Outside active hours ({}), skipping {}", settings.activeHours(), minuteKey);
                return;
            }

            for (Entry entry : entries) {
                CronJob job = entry.job();
                if (job.isDisabled() || running.contains(job.getName())) {
                    continue;
                }
                if (entry.expression() == null || !entry.expression().matches(now)) {
                    continue;
                }
                dispatch(job);
            }
        }
    }

    // ── Manual trigger and queries ─────────────────────────────

    /**
     * Execute a job right away, subject to the same single-flight guard as
     * scheduled runs. Works whether or not the timer is running.
     */
    public RunNowResult runNow(String name) {
        Optional<CronJob> job = find(name);
        if (job.isEmpty()) {
            reload();
            job = find(name);
        }
        if (job.isEmpty()) {
            return RunNowResult.NOT_FOUND;
        }
        return dispatch(job.get()) ? RunNowResult.TRIGGERED : RunNowResult.ALREADY_RUNNING;
    }

    public List<CronJobView> list() {
        List<CronJobView> views = new ArrayList<>();
        for (Entry entry : entries) {
            CronJob job = entry.job();
            views.add(new CronJobView(job.toBuilder().build(), running.contains(job.getName())));
        }
        return views;
    }

    public CronStatus getStatus() {
        List<Entry> snapshot = entries;
        return new CronStatus(
                active.get(),
                snapshot.size(),
                (int) snapshot.stream().filter(e -> e.job().isEnabled()).count(),
                List.copyOf(running),
                runCount.get(),
                okCount.get(),
                errorCount.get());
    }

    public boolean isRunning(String name) {
        return running.contains(name);
    }

    private Optional<CronJob> find(String name) {
        return entries.stream().map(Entry::job).filter(j -> j.getName().equals(name)).findFirst();
    }

    // ── Execution ──────────────────────────────────────────────

    /**
     * Claim the job's running slot and hand it to the executor.
     *
     * @return false if the job is already running
     */
    private boolean dispatch(CronJob job) {
        if (!running.add(job.getName())) {
            return false;
        }
        Instant startedAt = clock.instant();
        log.info("Cron job \"{}\" started", job.getName());
        notifyListeners(l -> l.onJobStart(job, startedAt));

        CompletableFuture<TaskResult> future;
        try {
            future = executor.execute(job.getTask(), job.getTimeout());
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        future.whenComplete((result, error) -> {
            try {
                complete(job, startedAt, result, error);
            } catch (Exception e) {
                log.error("Failed to record outcome of cron job \"{}\": {}", job.getName(), e.getMessage(), e);
            } finally {
                running.remove(job.getName());
            }
        });
        return true;
    }

    private void complete(CronJob job, Instant startedAt, TaskResult result, Throwable error) {
        Duration duration = Duration.between(startedAt, clock.instant());
        runCount.incrementAndGet();

        String failure = failureOf(job, result, error);
        if (failure == null) {
            okCount.incrementAndGet();
            String response = truncate(result.stdout().trim(), MAX_RESPONSE_LENGTH);
            if (result.exitCode() != 0) {
                log.warn("Cron job \"{}\" exited with code {} but produced output; treating as success",
                        job.getName(), result.exitCode());
            }
            log.info("Cron job \"{}\" completed in {}", job.getName(), FormatDuration.format(duration));
            CronListener.JobOutcome outcome = new CronListener.JobOutcome(job, startedAt, duration, true,
                    response.isEmpty() ? null : response, null);
            notifyListeners(l -> l.onJobComplete(outcome));
            if (settings.showOk()) {
                AlertSink.notifyQuietly(alertSink, "✅ Cron \"" + job.getName() + "\" completed ("
                        + FormatDuration.formatSeconds(duration.toMillis()) + ")");
            }
        } else {
            errorCount.incrementAndGet();
            String message = truncate(failure, MAX_ERROR_LENGTH);
            log.warn("Cron job \"{}\" failed after {}: {}", job.getName(), FormatDuration.format(duration), message);
            CronListener.JobOutcome outcome = new CronListener.JobOutcome(job, startedAt, duration, false,
                    null, message);
            notifyListeners(l -> l.onJobComplete(outcome));
            AlertSink.notifyQuietly(alertSink, "❌ Cron \"" + job.getName() + "\" failed ("
                    + FormatDuration.formatSeconds(duration.toMillis()) + "): " + message);
        }
    }

    /**
     * @return the failure message, or null if the run counts as a success
     */
    static String failureOf(CronJob job, TaskResult result, Throwable error) {
        if (error != null) {
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause()
                    : error;
            return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        }
        if (result == null) {
            return "Executor returned no result";
        }
        if (result.timedOut()) {
            return "Timed out after " + FormatDuration.format(job.getTimeout());
        }
        if (result.exitCode() != 0 && result.stdout().isBlank()) {
            return result.stderr().isBlank()
                    ? "Process exited with code " + result.exitCode()
                    : result.stderr().trim();
        }
        return null;
    }

    private static String truncate(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max);
    }

    private void notifyListeners(Consumer<CronListener> event) {
        for (CronListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (Exception e) {
                log.warn("Cron listener failed: {}", e.getMessage(), e);
            }
        }
    }
}
