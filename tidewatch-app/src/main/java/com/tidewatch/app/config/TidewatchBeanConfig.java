package com.tidewatch.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tidewatch.app.alert.LoggingAlertSink;
import com.tidewatch.app.alert.WebhookAlertSink;
import com.tidewatch.app.wake.TaskWakeDelivery;
import com.tidewatch.common.alert.AlertSink;
import com.tidewatch.common.config.ConfigPaths;
import com.tidewatch.common.config.ConfigService;
import com.tidewatch.common.config.TidewatchConfig;
import com.tidewatch.cron.CronScheduler;
import com.tidewatch.cron.ProcessTaskExecutor;
import com.tidewatch.cron.ScheduleStore;
import com.tidewatch.cron.TaskExecutor;
import com.tidewatch.heartbeat.HeartbeatListener;
import com.tidewatch.heartbeat.HeartbeatRunner;
import com.tidewatch.heartbeat.check.CheckRegistry;
import com.tidewatch.heartbeat.check.CommandMessageSource;
import com.tidewatch.heartbeat.check.DependencyProbe;
import com.tidewatch.heartbeat.check.InfrastructureCheck;
import com.tidewatch.heartbeat.check.JsonWatermarkStore;
import com.tidewatch.heartbeat.check.MessageSourceCheck;
import com.tidewatch.heartbeat.wake.QueueingWakeCallback;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Spring configuration wiring the scheduler and the heartbeat from the
 * JSON config file.
 */
@Slf4j
@Configuration
public class TidewatchBeanConfig {

    private static final Duration PROBE_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration MESSAGE_SOURCE_TIMEOUT = Duration.ofSeconds(20);

    @Value("${tidewatch.config.path:}")
    private String configPath;

    @Bean
    public ConfigService configService() {
        Path path = configPath == null || configPath.isBlank()
                ? ConfigPaths.resolveDefaultConfigPath()
                : ConfigPaths.resolveUserPath(configPath.trim());
        return new ConfigService(path);
    }

    @Bean
    public TidewatchConfig tidewatchConfig(ConfigService configService) {
        return configService.loadConfig();
    }

    /** Shared pool for task processes, checks and probes. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService tidewatchExecutor() {
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "tidewatch-worker");
            t.setDaemon(true);
            return t;
        });
    }

    // ── Cron ───────────────────────────────────────────────────

    @Bean
    public ScheduleStore scheduleStore(TidewatchConfig config) {
        ScheduleStore store = new ScheduleStore(ConfigPaths.resolveUserPath(config.getCron().getScheduleFile()));
        store.ensureFile();
        return store;
    }

    @Bean
    public TaskExecutor taskExecutor(TidewatchConfig config, ExecutorService tidewatchExecutor) {
        TidewatchConfig.CronConfig cron = config.getCron();
        return new ProcessTaskExecutor(cron.getExecutorCommand(), cron.getWorkingDirectory(), tidewatchExecutor);
    }

    @Bean
    public AlertSink cronAlertSink(TidewatchConfig config, ObjectMapper objectMapper) {
        return alertSink(config, config.getCron().getAlertChannel(), objectMapper);
    }

    @Bean(destroyMethod = "close")
    public CronScheduler cronScheduler(ScheduleStore scheduleStore, TaskExecutor taskExecutor,
            TidewatchConfig config, @Qualifier("cronAlertSink") AlertSink cronAlertSink) {
        return new CronScheduler(scheduleStore, taskExecutor, CronScheduler.Settings.from(config.getCron()),
                cronAlertSink);
    }

    // ── Heartbeat ──────────────────────────────────────────────

    @Bean
    public CheckRegistry checkRegistry(TidewatchConfig config, ExecutorService tidewatchExecutor,
            ObjectMapper objectMapper) {
        TidewatchConfig.HeartbeatConfig hb = config.getHeartbeat();
        CheckRegistry registry = new CheckRegistry(tidewatchExecutor,
                Duration.ofSeconds(hb.getCheckTimeoutSeconds()));

        if (hb.getMessageSourceCommand() != null && !hb.getMessageSourceCommand().isBlank()) {
            CommandMessageSource source = new CommandMessageSource("Matrix", hb.getMessageSourceCommand(),
                    hb.getMessageSourcePingCommand(), objectMapper, MESSAGE_SOURCE_TIMEOUT);
            JsonWatermarkStore watermarks = new JsonWatermarkStore(
                    ConfigPaths.resolveUserPath(hb.getWatermarkFile()), objectMapper);
            registry.register(new MessageSourceCheck(source, watermarks,
                    hb.getPrioritySenders(), hb.getBotSenders()));
        } else {
            log.info("No message source command configured, message check disabled");
        }

        List<DependencyProbe> probes = hb.getDependencies().stream()
                .map(dep -> DependencyProbe.from(dep, PROBE_TIMEOUT))
                .toList();
        registry.register(new InfrastructureCheck(probes, ConfigPaths.resolveUserPath(hb.getDiskPath()),
                hb.getDiskThresholdPercent(), tidewatchExecutor));
        return registry;
    }

    @Bean
    public AlertSink heartbeatAlertSink(TidewatchConfig config, ObjectMapper objectMapper) {
        return alertSink(config, config.getHeartbeat().getAlertChannel(), objectMapper);
    }

    /**
     * The agent counts as busy while any cron task is running; wakes raised
     * meanwhile are queued and handed over at the start of the next beat.
     */
    @Bean
    public QueueingWakeCallback wakeCallback(CronScheduler cronScheduler, TaskExecutor taskExecutor) {
        return new QueueingWakeCallback(() -> cronScheduler.getStatus().runningNames().isEmpty(),
                new TaskWakeDelivery(taskExecutor));
    }

    @Bean(destroyMethod = "close")
    public HeartbeatRunner heartbeatRunner(CheckRegistry checkRegistry, TidewatchConfig config,
            @Qualifier("heartbeatAlertSink") AlertSink heartbeatAlertSink, QueueingWakeCallback wakeCallback) {
        HeartbeatRunner runner = new HeartbeatRunner(checkRegistry, HeartbeatRunner.Settings.from(config.getHeartbeat()),
                heartbeatAlertSink, wakeCallback);
        runner.addListener(new HeartbeatListener() {
            @Override
            public void onBeatStart(long beatNumber, int sinceMinutes) {
                int delivered = wakeCallback.drainFollowUps();
                if (delivered > 0) {
                    log.info("Delivered {} queued wake message(s)", delivered);
                }
            }
        });
        return runner;
    }

    private static AlertSink alertSink(TidewatchConfig config, String channel, ObjectMapper objectMapper) {
        TidewatchConfig.AlertsConfig alerts = config.getAlerts();
        if (alerts.getWebhookUrl() == null || alerts.getWebhookUrl().isBlank()) {
            return new LoggingAlertSink(channel);
        }
        return new WebhookAlertSink(alerts.getWebhookUrl().trim(), channel,
                Duration.ofSeconds(alerts.getTimeoutSeconds()), objectMapper);
    }
}
