package com.tidewatch.app.commands;

import com.tidewatch.common.config.TidewatchConfig;
import com.tidewatch.common.infra.ActiveHours;
import com.tidewatch.heartbeat.HeartbeatRunner;
import com.tidewatch.heartbeat.check.AwarenessCheck;
import com.tidewatch.heartbeat.check.CheckContext;
import com.tidewatch.heartbeat.check.CheckRegistry;
import com.tidewatch.heartbeat.check.CheckResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class HeartbeatCommandsTest {

    private final ExecutorService pool = Executors.newCachedThreadPool();
    private final AtomicBoolean healthy = new AtomicBoolean(true);
    private HeartbeatRunner runner;
    private HeartbeatCommands commands;
    private CommandContext ctx;

    @BeforeEach
    void setUp() {
        CheckRegistry registry = new CheckRegistry(pool);
        registry.register(new AwarenessCheck() {
            @Override
            public String name() {
                return "Infra";
            }

            @Override
            public CheckResult run(CheckContext context) {
                return new CheckResult("Infra", healthy.get(),
                        healthy.get() ? "all up, disk 40% (10.0GB free)" : "db down",
                        Duration.ofMillis(12), Map.of());
            }
        });
        runner = new HeartbeatRunner(registry,
                new HeartbeatRunner.Settings(15, ActiveHours.ALWAYS, false, false, Duration.ofSeconds(60), 100),
                null, null);
        commands = new HeartbeatCommands(runner);
        ctx = new CommandContext(null, new TidewatchConfig());
    }

    @AfterEach
    void tearDown() {
        runner.close();
        pool.shutdownNow();
    }

    private CommandResult heartbeat(String args) {
        return commands.handleHeartbeat(args, ctx);
    }

    @Test
    void briefingAndHistory_beforeAnyBeat() {
        assertEquals("No heartbeat has run yet. Use /heartbeat run first.", heartbeat("briefing").text());
        assertEquals("No heartbeat history yet. Use /heartbeat run to start.", heartbeat("history").text());
    }

    @Test
    void run_healthy_reportsAllClearWithCheckLines() {
        String text = heartbeat("run").text();

        assertTrue(text.contains("💚 HEARTBEAT - All Clear"), text);
        assertTrue(text.contains("Beat #1 [pulse]"), text);
        assertTrue(text.contains("Heartbeat #1 [pulse]"), text);
        assertTrue(text.contains("✓ Infra"), text);
        assertTrue(text.contains("all up, disk 40% (10.0GB free) (12ms)"), text);
    }

    @Test
    void run_failingCheck_reportsIssues() {
        healthy.set(false);

        String text = heartbeat("now").text();

        assertTrue(text.contains("🫀 HEARTBEAT - Issues Detected"), text);
        assertTrue(text.contains("✗ Infra"), text);
        assertTrue(text.contains("⚠ Infra: db down"), text);
    }

    @Test
    void briefing_returnsLastBriefing() {
        heartbeat("run");
        String briefing = runner.getLastResult().orElseThrow().briefing();

        assertEquals(briefing, heartbeat("brief").text());
    }

    @Test
    void history_showsTwentyMostRecentWithOverflow() {
        for (int i = 0; i < 22; i++) {
            runner.runNow();
        }
        healthy.set(false);
        runner.runNow();

        String text = heartbeat("history").text();

        assertTrue(text.contains("HEARTBEAT HISTORY"));
        assertTrue(text.contains("⚠ 🫀 #23"), text);
        assertTrue(text.contains("0/1"), text);
        assertTrue(text.contains("❗ [Infra]"), text);
        assertTrue(text.contains("🌊 #18"), text);
        assertFalse(text.contains("#3 "), text);
        assertTrue(text.contains("… and 3 older entries"), text);
    }

    @Test
    void status_reflectsLifecycle() {
        String inactive = heartbeat("").text();
        assertTrue(inactive.contains("State: Inactive"));
        assertTrue(inactive.contains("Interval: 15m"));
        assertTrue(inactive.contains("Active Hours: 24/7"));
        assertTrue(inactive.contains("Urgent Alerts: disabled"));

        assertEquals("✓ Heartbeat started (every 15m, pulse/breath/tide)", heartbeat("on").text());
        assertEquals("Heartbeat is already running.", heartbeat("start").text());

        runner.runNow();
        String active = heartbeat("status").text();
        assertTrue(active.contains("State: Active (every 15m)"), active);
        assertTrue(active.contains("Beats: 1 (current: #1)"), active);
        assertTrue(active.contains("Health: 100%"), active);
        assertTrue(active.contains("- pulse"), active);

        assertEquals("✓ Heartbeat stopped.", heartbeat("off").text());
        assertEquals("Heartbeat is not running.", heartbeat("stop").text());
    }

    @Test
    void formatCheckLine_padsName() {
        var check = new CheckResult("Messages", true, "No new messages", Duration.ofMillis(5), Map.of());

        assertEquals("  ✓ Messages             No new messages (5ms)", HeartbeatCommands.formatCheckLine(check));
    }
}
