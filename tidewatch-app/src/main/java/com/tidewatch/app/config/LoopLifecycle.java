package com.tidewatch.app.config;

import com.tidewatch.common.config.TidewatchConfig;
import com.tidewatch.cron.CronScheduler;
import com.tidewatch.heartbeat.HeartbeatRunner;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Starts the cron scheduler and the heartbeat once the application is ready,
 * each only when its {@code autostart} flag is set, and stops both on
 * shutdown.
 */
@Slf4j
@Component
public class LoopLifecycle {

    private final TidewatchConfig config;
    private final CronScheduler cronScheduler;
    private final HeartbeatRunner heartbeatRunner;

    public LoopLifecycle(TidewatchConfig config, CronScheduler cronScheduler, HeartbeatRunner heartbeatRunner) {
        this.config = config;
        this.cronScheduler = cronScheduler;
        this.heartbeatRunner = heartbeatRunner;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (config.getCron().isAutostart()) {
            cronScheduler.start();
        } else {
            log.info("Cron scheduler not started (autostart off), use /cron on");
        }
        if (config.getHeartbeat().isAutostart()) {
            heartbeatRunner.start();
        } else {
            log.info("Heartbeat not started (autostart off), use /heartbeat on");
        }
    }

    @PreDestroy
    public void shutdown() {
        cronScheduler.stop();
        heartbeatRunner.stop();
    }
}
