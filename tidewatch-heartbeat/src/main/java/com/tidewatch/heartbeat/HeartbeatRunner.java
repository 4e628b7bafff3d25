package com.tidewatch.heartbeat;

import com.tidewatch.common.alert.AlertSink;
import com.tidewatch.common.config.TidewatchConfig;
import com.tidewatch.common.infra.ActiveHours;
import com.tidewatch.common.infra.FormatDuration;
import com.tidewatch.heartbeat.check.CheckContext;
import com.tidewatch.heartbeat.check.CheckRegistry;
import com.tidewatch.heartbeat.check.CheckResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Runs the registered awareness checks every {@code intervalMinutes} and
 * escalates urgent beats.
 * <p>
 * Beats never overlap: a scheduled beat that finds one in flight is skipped,
 * and {@link #runNow()} waits for the in-flight beat before running its own.
 * Urgent beats are sent to the alert sink every time; the wake callback is
 * debounced.
 */
@Slf4j
public class HeartbeatRunner implements AutoCloseable {

    /**
     * Runtime settings, swappable while running.
     */
    public record Settings(int intervalMinutes, ActiveHours activeHours, boolean alertOnUrgent,
            boolean injectUrgent, Duration wakeDebounce, int historySize) {

        public static Settings from(TidewatchConfig.HeartbeatConfig config) {
            return new Settings(config.getIntervalMinutes(), ActiveHours.from(config.getActiveHours()),
                    config.isAlertOnUrgent(), config.isInjectUrgent(),
                    Duration.ofSeconds(config.getWakeDebounceSeconds()), config.getHistorySize());
        }
    }

    private final CheckRegistry registry;
    private final AlertSink alertSink;
    private final WakeCallback wakeCallback;
    private final Clock clock;
    private final List<HeartbeatListener> listeners = new CopyOnWriteArrayList<>();

    private volatile Settings settings;
    private volatile UrgencyDebouncer debouncer;

    private final AtomicBoolean active = new AtomicBoolean(false);
    private final AtomicBoolean executing = new AtomicBoolean(false);
    private final ReentrantLock beatLock = new ReentrantLock();
    private final ScheduledExecutorService scheduler;
    private ScheduledFuture<?> scheduledTask;

    private final AtomicLong beatNumber = new AtomicLong();
    private final AtomicLong runCount = new AtomicLong();
    private final AtomicLong okCount = new AtomicLong();
    private final AtomicLong alertCount = new AtomicLong();
    private volatile Instant lastRun;
    private volatile BeatResult lastResult;
    private final Deque<BeatResult> history = new ArrayDeque<>();

    public HeartbeatRunner(CheckRegistry registry, Settings settings, AlertSink alertSink,
            WakeCallback wakeCallback) {
        this(registry, settings, alertSink, wakeCallback, Clock.systemDefaultZone());
    }

    public HeartbeatRunner(CheckRegistry registry, Settings settings, AlertSink alertSink,
            WakeCallback wakeCallback, Clock clock) {
        this.registry = registry;
        this.settings = settings;
        this.alertSink = alertSink == null ? AlertSink.NONE : alertSink;
        this.wakeCallback = wakeCallback == null ? WakeCallback.NONE : wakeCallback;
        this.clock = clock;
        this.debouncer = new UrgencyDebouncer(settings.wakeDebounce(), clock);
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "heartbeat-runner");
            t.setDaemon(true);
            return t;
        });
    }

    public void addListener(HeartbeatListener listener) {
        listeners.add(listener);
    }

    // ── Lifecycle ──────────────────────────────────────────────

    /**
     * Start the fixed-rate timer. The first beat happens one interval from
     * now.
     */
    public synchronized void start() {
        if (!active.compareAndSet(false, true)) {
            log.debug("Heartbeat runner already running");
            return;
        }
        scheduleTimer();
        log.info("Heartbeat started (every {}m, active hours {})",
                settings.intervalMinutes(), settings.activeHours());
    }

    public synchronized void stop() {
        if (!active.compareAndSet(true, false)) {
            return;
        }
        if (scheduledTask != null) {
            scheduledTask.cancel(false);
            scheduledTask = null;
        }
        log.info("Heartbeat stopped");
    }

    public boolean isActive() {
        return active.get();
    }

    /** True while a beat is executing. */
    public boolean isRunning() {
        return executing.get();
    }

    /**
     * Apply new settings; the timer is restarted when the interval changed
     * while active.
     */
    public synchronized void updateSettings(Settings newSettings) {
        boolean intervalChanged = newSettings.intervalMinutes() != settings.intervalMinutes();
        if (!newSettings.wakeDebounce().equals(settings.wakeDebounce())) {
            debouncer = new UrgencyDebouncer(newSettings.wakeDebounce(), clock);
        }
        settings = newSettings;
        if (intervalChanged && active.get()) {
            if (scheduledTask != null) {
                scheduledTask.cancel(false);
            }
            scheduleTimer();
            log.info("Heartbeat interval updated to {}m", newSettings.intervalMinutes());
        }
    }

    @Override
    public void close() {
        stop();
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.shutdownNow();
        }
    }

    private void scheduleTimer() {
        long intervalMs = Duration.ofMinutes(settings.intervalMinutes()).toMillis();
        scheduledTask = scheduler.scheduleAtFixedRate(this::scheduledBeat, intervalMs, intervalMs,
                TimeUnit.MILLISECONDS);
    }

    // ── Beats ──────────────────────────────────────────────────

    /**
     * Timer entry point. Skipped, without consuming a beat number, when a
     * beat is in flight or the current time is outside active hours.
     */
    void scheduledBeat() {
        try {
            if (executing.get()) {
                log.debug("Previous beat still running, skipping");
                return;
            }
            if (!settings.activeHours().contains(LocalDateTime.now(clock))) {
                log.debug("Outside active hours ({}), skipping beat", settings.activeHours());
                return;
            }
            if (!beatLock.tryLock()) {
                return;
            }
            try {
                executeBeat();
            } finally {
                beatLock.unlock();
            }
        } catch (Exception e) {
            log.error("Scheduled heartbeat failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Run a beat now, regardless of active hours and of whether the timer is
     * running. Waits for an in-flight beat to finish first.
     */
    public BeatResult runNow() {
        beatLock.lock();
        try {
            return executeBeat();
        } finally {
            beatLock.unlock();
        }
    }

    private BeatResult executeBeat() {
        executing.set(true);
        try {
            long n = beatNumber.incrementAndGet();
            Instant start = clock.instant();
            Settings current = settings;
            int sinceMinutes = lookbackMinutes(start, current);
            notifyListeners(l -> l.onBeatStart(n, sinceMinutes));

            BeatResult result;
            try {
                result = runChecks(n, sinceMinutes, start);
            } catch (Exception e) {
                log.error("Heartbeat #{} failed: {}", n, e.getMessage(), e);
                result = BeatResult.error(n, String.valueOf(e.getMessage()), clock.instant());
                record(result, current);
                if (current.alertOnUrgent()) {
                    AlertSink.notifyQuietly(alertSink, "Heartbeat #" + n + " [" + result.tier().label()
                            + "] - Runner error\n\n" + result.briefing());
                }
                return result;
            }

            record(result, current);
            if (result.urgent()) {
                escalate(result, current);
            }
            return result;
        } finally {
            executing.set(false);
        }
    }

    private BeatResult runChecks(long n, int sinceMinutes, Instant start) {
        List<CheckResult> checks = registry.runAll(new CheckContext(n, sinceMinutes));
        Tier tier = Tier.forBeat(n);
        BriefingAssembler.Briefing briefing = BriefingAssembler.assemble(checks, tier, n, LocalTime.now(clock));
        List<String> failed = checks.stream().filter(c -> !c.ok()).map(CheckResult::name).toList();
        Instant end = clock.instant();
        return new BeatResult(n, tier, failed.isEmpty(), checks, failed, briefing.text(), briefing.urgent(),
                end, Duration.between(start, end));
    }

    /**
     * Minutes since the previous beat, rounded up, plus one; the first beat
     * looks back one interval plus one.
     */
    private int lookbackMinutes(Instant now, Settings current) {
        Instant previous = lastRun;
        if (previous == null) {
            return current.intervalMinutes() + 1;
        }
        long ms = Math.max(0, Duration.between(previous, now).toMillis());
        return (int) Math.ceil(ms / 60_000.0) + 1;
    }

    private void record(BeatResult result, Settings current) {
        lastRun = clock.instant();
        lastResult = result;
        runCount.incrementAndGet();
        if (result.ok()) {
            okCount.incrementAndGet();
        } else {
            alertCount.incrementAndGet();
        }
        synchronized (history) {
            history.addFirst(result);
            while (history.size() > current.historySize()) {
                history.removeLast();
            }
        }

        if (result.urgent()) {
            log.warn("Heartbeat #{} [{}] urgent: {}", result.beatNumber(), result.tier().label(),
                    result.failedChecks().isEmpty() ? "priority messages" : String.join(", ", result.failedChecks()));
        } else {
            log.info("Heartbeat #{} [{}] ok ({})", result.beatNumber(), result.tier().label(),
                    FormatDuration.format(result.duration()));
        }
        notifyListeners(l -> l.onBeat(result));
    }

    private void escalate(BeatResult result, Settings current) {
        if (current.alertOnUrgent()) {
            AlertSink.notifyQuietly(alertSink, "Heartbeat #" + result.beatNumber() + " [" + result.tier().label()
                    + "] - Issues detected\n\n" + result.briefing());
        }
        if (!current.injectUrgent()) {
            return;
        }
        if (!debouncer.tryAcquire()) {
            log.debug("Wake for heartbeat #{} debounced", result.beatNumber());
            return;
        }
        try {
            wakeCallback.wake(result.briefing());
        } catch (Exception e) {
            log.warn("Wake callback failed: {}", e.getMessage(), e);
        }
    }

    // ── Queries ────────────────────────────────────────────────

    /** Most recent first. */
    public List<BeatResult> getHistory(int limit) {
        synchronized (history) {
            return history.stream().limit(Math.max(0, limit)).toList();
        }
    }

    public int getHistorySize() {
        synchronized (history) {
            return history.size();
        }
    }

    public Optional<BeatResult> getLastResult() {
        return Optional.ofNullable(lastResult);
    }

    public Settings getSettings() {
        return settings;
    }

    public HeartbeatStatus getStatus() {
        return new HeartbeatStatus(active.get(), executing.get(), beatNumber.get(), runCount.get(),
                okCount.get(), alertCount.get(), lastRun, settings.intervalMinutes(), getHistorySize());
    }

    private void notifyListeners(Consumer<HeartbeatListener> event) {
        for (HeartbeatListener listener : new ArrayList<>(listeners)) {
            try {
                event.accept(listener);
            } catch (Exception e) {
                log.warn("Heartbeat listener failed: {}", e.getMessage(), e);
            }
        }
    }
}
