package com.tidewatch.app.health;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tidewatch.cron.CronScheduler;
import com.tidewatch.cron.CronStatus;
import com.tidewatch.heartbeat.HeartbeatRunner;
import com.tidewatch.heartbeat.HeartbeatStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.lang.management.ManagementFactory;

/**
 * Health REST endpoint: liveness plus a snapshot of both loops.
 */
@RestController
public class HealthEndpoint {

    private final ObjectMapper mapper;
    private final CronScheduler cronScheduler;
    private final HeartbeatRunner heartbeatRunner;

    public HealthEndpoint(ObjectMapper mapper, CronScheduler cronScheduler, HeartbeatRunner heartbeatRunner) {
        this.mapper = mapper;
        this.cronScheduler = cronScheduler;
        this.heartbeatRunner = heartbeatRunner;
    }

    /**
     * Always 200 while the JVM is up; the loop sections say whether each one
     * is active.
     */
    @GetMapping("/health")
    public ObjectNode health() {
        var node = mapper.createObjectNode();
        node.put("status", "ok");
        node.put("uptime", ManagementFactory.getRuntimeMXBean().getUptime());

        CronStatus cron = cronScheduler.getStatus();
        var cronNode = node.putObject("cron");
        cronNode.put("active", cron.active());
        cronNode.put("jobs", cron.jobCount());
        cronNode.put("enabled", cron.enabledCount());
        var running = cronNode.putArray("running");
        cron.runningNames().forEach(running::add);
        cronNode.put("runs", cron.runCount());
        cronNode.put("ok", cron.okCount());
        cronNode.put("errors", cron.errorCount());

        HeartbeatStatus hb = heartbeatRunner.getStatus();
        var hbNode = node.putObject("heartbeat");
        hbNode.put("active", hb.active());
        hbNode.put("running", hb.running());
        hbNode.put("beatNumber", hb.beatNumber());
        hbNode.put("runs", hb.runCount());
        hbNode.put("ok", hb.okCount());
        hbNode.put("alerts", hb.alertCount());
        hbNode.put("intervalMinutes", hb.intervalMinutes());
        if (hb.lastRun() != null) {
            hbNode.put("lastRun", hb.lastRun().toString());
        } else {
            hbNode.putNull("lastRun");
        }
        return node;
    }
}
