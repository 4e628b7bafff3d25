package com.tidewatch.app.commands;

import com.tidewatch.common.config.TidewatchConfig;
import com.tidewatch.common.infra.ActiveHours;
import com.tidewatch.cron.CronScheduler;
import com.tidewatch.cron.ScheduleStore;
import com.tidewatch.cron.TaskResult;
import com.tidewatch.heartbeat.HeartbeatRunner;
import com.tidewatch.heartbeat.check.CheckRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Dispatcher layer only: routing, argument parsing, unknown commands and
 * error handling.
 */
class CommandProcessorTest {

    @TempDir
    Path tempDir;

    private CronScheduler cronScheduler;
    private HeartbeatRunner heartbeatRunner;

    @AfterEach
    void tearDown() {
        if (cronScheduler != null) {
            cronScheduler.close();
        }
        if (heartbeatRunner != null) {
            heartbeatRunner.close();
        }
    }

    private CommandProcessor buildProcessor(Path schedulePath) {
        ScheduleStore store = new ScheduleStore(schedulePath);
        cronScheduler = new CronScheduler(store,
                (task, timeout) -> CompletableFuture.completedFuture(TaskResult.success("done")),
                new CronScheduler.Settings(ActiveHours.ALWAYS, false, Duration.ofSeconds(30)), null);
        heartbeatRunner = new HeartbeatRunner(new CheckRegistry(Runnable::run),
                new HeartbeatRunner.Settings(15, ActiveHours.ALWAYS, false, false, Duration.ofSeconds(60), 10),
                null, null);
        return new CommandProcessor(new TidewatchConfig(),
                new CronCommands(cronScheduler, store),
                new HeartbeatCommands(heartbeatRunner));
    }

    private CommandProcessor buildProcessor() {
        return buildProcessor(tempDir.resolve("cron.tab"));
    }

    @Test
    void handleCommand_nullOrBlank_returnsNull() {
        var proc = buildProcessor();
        assertNull(proc.handleCommand(null, "u1"));
        assertNull(proc.handleCommand("", "u1"));
        assertNull(proc.handleCommand("  ", "u1"));
    }

    @Test
    void handleCommand_noSlashPrefix_returnsNull() {
        var proc = buildProcessor();
        assertNull(proc.handleCommand("cron", "u1"));
        assertNull(proc.handleCommand("hello there", "u1"));
    }

    @Test
    void handleCommand_unknownCommand_returnsNull() {
        var proc = buildProcessor();
        assertNull(proc.handleCommand("/nonexistent", "u1"));
        assertNull(proc.handleCommand("/status", null));
    }

    @Test
    void handleCommand_caseInsensitiveName() {
        var proc = buildProcessor();
        assertNotNull(proc.handleCommand("/CRON", "u1"));
        assertNotNull(proc.handleCommand("/Heartbeat", "u1"));
    }

    @Test
    void handleCommand_parsesArgs() {
        var proc = buildProcessor();

        var r = proc.handleCommand("  /cron   add   brief 0 9 * * * say hi  ", "u1");

        assertNotNull(r);
        assertEquals("✓ Added job \"brief\" (0 9 * * *)", r.text());
    }

    @Test
    void handleCommand_handlerFailure_returnsErrorReply() {
        // A directory where the schedule file should be makes every read fail
        var proc = buildProcessor(tempDir);

        var r = proc.handleCommand("/cron", "u1");

        assertNotNull(r);
        assertTrue(r.failed());
        assertTrue(r.text().startsWith("❌ Command failed: "), r.text());
    }

    @Test
    void commandNames_listsRegisteredHandlers() {
        assertEquals(List.of("cron", "heartbeat"), List.copyOf(buildProcessor().commandNames()));
    }
}
