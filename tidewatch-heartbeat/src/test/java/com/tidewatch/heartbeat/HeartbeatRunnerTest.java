package com.tidewatch.heartbeat;

import com.tidewatch.common.infra.ActiveHours;
import com.tidewatch.heartbeat.check.AwarenessCheck;
import com.tidewatch.heartbeat.check.CheckContext;
import com.tidewatch.heartbeat.check.CheckRegistry;
import com.tidewatch.heartbeat.check.CheckResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class HeartbeatRunnerTest {

    private static final ZoneId UTC = ZoneId.of("UTC");
    private static final Instant MONDAY_0900 = LocalDateTime.of(2024, 1, 1, 9, 0).toInstant(ZoneOffset.UTC);

    private final ExecutorService pool = Executors.newCachedThreadPool();
    private MutableClock clock;
    private CheckRegistry registry;
    private List<String> alerts;
    private List<String> wakes;
    private HeartbeatRunner runner;
    private final AtomicBoolean healthy = new AtomicBoolean(true);

    /** A check whose outcome the test flips through {@link #healthy}. */
    private final AwarenessCheck toggle = new AwarenessCheck() {
        @Override
        public String name() {
            return "Toggle";
        }

        @Override
        public CheckResult run(CheckContext context) {
            return new CheckResult("Toggle", healthy.get(), healthy.get() ? "fine" : "broken", Duration.ZERO,
                    Map.of());
        }
    };

    private static HeartbeatRunner.Settings settings(int historySize) {
        return new HeartbeatRunner.Settings(15, ActiveHours.ALWAYS, true, true, Duration.ofSeconds(60), historySize);
    }

    @BeforeEach
    void setUp() {
        clock = new MutableClock(MONDAY_0900, UTC);
        registry = new CheckRegistry(pool);
        registry.register(toggle);
        alerts = new CopyOnWriteArrayList<>();
        wakes = new CopyOnWriteArrayList<>();
        runner = new HeartbeatRunner(registry, settings(100), alerts::add, wakes::add, clock);
    }

    @AfterEach
    void tearDown() {
        runner.close();
        pool.shutdownNow();
    }

    @Test
    void healthyBeat() {
        BeatResult result = runner.runNow();

        assertEquals(1, result.beatNumber());
        assertEquals(Tier.PULSE, result.tier());
        assertTrue(result.ok());
        assertFalse(result.urgent());
        assertEquals(List.of(), result.failedChecks());
        assertTrue(result.briefing().startsWith("Heartbeat #1 [pulse] - 09:00"));
        assertTrue(alerts.isEmpty());
        assertTrue(wakes.isEmpty());

        HeartbeatStatus status = runner.getStatus();
        assertEquals(1, status.runCount());
        assertEquals(1, status.okCount());
        assertEquals(0, status.alertCount());
        assertEquals(MONDAY_0900, status.lastRun());
    }

    @Test
    void tiersFollowBeatNumber() {
        List<Tier> tiers = new CopyOnWriteArrayList<>();
        for (int i = 0; i < 6; i++) {
            tiers.add(runner.runNow().tier());
        }
        assertEquals(List.of(Tier.PULSE, Tier.PULSE, Tier.BREATH, Tier.PULSE, Tier.PULSE, Tier.TIDE), tiers);
    }

    @Test
    void lookbackCoversTimeSinceLastBeat() {
        List<Integer> since = new CopyOnWriteArrayList<>();
        runner.addListener(new HeartbeatListener() {
            @Override
            public void onBeatStart(long beatNumber, int sinceMinutes) {
                since.add(sinceMinutes);
            }
        });

        runner.runNow();
        clock.advance(Duration.ofSeconds(14 * 60 + 30));
        runner.runNow();
        clock.advance(Duration.ofMinutes(15));
        runner.runNow();

        assertEquals(List.of(16, 16, 16), since);
    }

    @Nested
    class Urgency {

        @BeforeEach
        void breakIt() {
            healthy.set(false);
        }

        @Test
        void alertEveryTimeButWakeDebounced() {
            BeatResult first = runner.runNow();
            clock.advance(Duration.ofSeconds(10));
            runner.runNow();

            assertTrue(first.urgent());
            assertEquals(List.of("Toggle"), first.failedChecks());
            assertEquals(2, alerts.size());
            assertTrue(alerts.get(0).startsWith("Heartbeat #1 [pulse] - Issues detected\n\nHeartbeat #1 [pulse]"));
            assertEquals(List.of(first.briefing()), wakes);

            clock.advance(Duration.ofSeconds(61));
            runner.runNow();
            assertEquals(2, wakes.size());
            assertEquals(3, runner.getStatus().alertCount());
        }

        @Test
        void alertAndWakeCanBeDisabled() {
            runner.updateSettings(new HeartbeatRunner.Settings(15, ActiveHours.ALWAYS, false, false,
                    Duration.ofSeconds(60), 100));

            BeatResult result = runner.runNow();

            assertTrue(result.urgent());
            assertTrue(alerts.isEmpty());
            assertTrue(wakes.isEmpty());
        }

        @Test
        void failingSinksDoNotBreakTheBeat() {
            try (HeartbeatRunner fragile = new HeartbeatRunner(registry, settings(100),
                    message -> {
                        throw new IllegalStateException("webhook down");
                    },
                    briefing -> {
                        throw new IllegalStateException("agent gone");
                    }, clock)) {
                BeatResult result = fragile.runNow();
                assertTrue(result.urgent());
                assertEquals(1, fragile.getHistory(10).size());
            }
        }
    }

    @Test
    void orchestrationFailureBecomesSyntheticResult() {
        CheckRegistry exploding = new CheckRegistry(pool) {
            @Override
            public List<CheckResult> runAll(CheckContext context) {
                throw new IllegalStateException("registry exploded");
            }
        };
        try (HeartbeatRunner broken = new HeartbeatRunner(exploding, settings(100), alerts::add, wakes::add, clock)) {
            BeatResult result = broken.runNow();

            assertEquals(1, result.beatNumber());
            assertEquals(Tier.PULSE, result.tier());
            assertFalse(result.ok());
            assertTrue(result.urgent());
            assertEquals(List.of("runner: registry exploded"), result.failedChecks());
            assertEquals("Heartbeat error: registry exploded", result.briefing());
            assertEquals(result, broken.getLastResult().orElseThrow());
            assertEquals(1, broken.getStatus().alertCount());
            assertFalse(broken.isRunning());

            assertEquals(List.of("Heartbeat #1 [pulse] - Runner error\n\nHeartbeat error: registry exploded"), alerts);
            assertTrue(wakes.isEmpty());
        }
    }

    @Test
    void orchestrationFailureIsNotAlertedWhenUrgentAlertsAreOff() {
        CheckRegistry exploding = new CheckRegistry(pool) {
            @Override
            public List<CheckResult> runAll(CheckContext context) {
                throw new IllegalStateException("registry exploded");
            }
        };
        HeartbeatRunner.Settings quiet = new HeartbeatRunner.Settings(15, ActiveHours.ALWAYS, false, true,
                Duration.ofSeconds(60), 100);
        try (HeartbeatRunner broken = new HeartbeatRunner(exploding, quiet, alerts::add, wakes::add, clock)) {
            assertTrue(broken.runNow().urgent());
            assertTrue(alerts.isEmpty());
        }
    }

    @Test
    void historyIsBoundedNewestFirst() {
        try (HeartbeatRunner small = new HeartbeatRunner(registry, settings(3), alerts::add, wakes::add, clock)) {
            for (int i = 0; i < 5; i++) {
                small.runNow();
            }
            assertEquals(List.of(5L, 4L, 3L),
                    small.getHistory(10).stream().map(BeatResult::beatNumber).toList());
            assertEquals(List.of(5L), small.getHistory(1).stream().map(BeatResult::beatNumber).toList());
            assertEquals(3, small.getStatus().historySize());
        }
    }

    @Nested
    class ScheduledBeats {

        @Test
        void skippedOutsideActiveHoursWithoutConsumingABeat() {
            runner.updateSettings(new HeartbeatRunner.Settings(15, ActiveHours.of("22:00", "06:00"), true, true,
                    Duration.ofSeconds(60), 100));

            runner.scheduledBeat();
            assertEquals(0, runner.getStatus().beatNumber());

            clock.advance(Duration.ofHours(14));
            runner.scheduledBeat();
            assertEquals(1, runner.getStatus().beatNumber());
        }

        @Test
        void skippedWhileABeatIsInFlightAndRunNowWaits() throws Exception {
            CountDownLatch entered = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            AtomicInteger concurrent = new AtomicInteger();
            AtomicInteger maxConcurrent = new AtomicInteger();
            registry.register(new AwarenessCheck() {
                @Override
                public String name() {
                    return "Gate";
                }

                @Override
                public CheckResult run(CheckContext context) throws Exception {
                    int now = concurrent.incrementAndGet();
                    maxConcurrent.accumulateAndGet(now, Math::max);
                    entered.countDown();
                    release.await(10, TimeUnit.SECONDS);
                    concurrent.decrementAndGet();
                    return new CheckResult("Gate", true, "open", Duration.ZERO, Map.of());
                }
            });

            CompletableFuture<BeatResult> first = CompletableFuture.supplyAsync(runner::runNow, pool);
            assertTrue(entered.await(10, TimeUnit.SECONDS));
            assertTrue(runner.isRunning());

            runner.scheduledBeat();
            assertEquals(1, runner.getStatus().beatNumber());

            CompletableFuture<BeatResult> second = CompletableFuture.supplyAsync(runner::runNow, pool);
            Thread.sleep(200);
            assertFalse(second.isDone());

            release.countDown();
            assertEquals(1, first.get(10, TimeUnit.SECONDS).beatNumber());
            assertEquals(2, second.get(10, TimeUnit.SECONDS).beatNumber());
            assertEquals(1, maxConcurrent.get());
        }

        @Test
        void startAndStop() {
            runner.start();
            runner.start();
            assertTrue(runner.getStatus().active());
            assertEquals(0, runner.getStatus().beatNumber());

            runner.stop();
            assertFalse(runner.isActive());
        }
    }

    @Test
    void listenerFailuresAreIgnored() {
        runner.addListener(new HeartbeatListener() {
            @Override
            public void onBeat(BeatResult result) {
                throw new IllegalStateException("listener bug");
            }
        });

        assertTrue(runner.runNow().ok());
        assertTrue(runner.getLastResult().isPresent());
    }
}
