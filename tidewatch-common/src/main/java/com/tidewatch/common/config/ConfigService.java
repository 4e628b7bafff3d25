package com.tidewatch.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads, validates and caches the Tidewatch configuration.
 * <p>
 * The JSON file may reference environment variables as {@code ${VAR}} or
 * {@code ${VAR:-default}}. A missing file yields the defaults; a file that
 * parses but fails validation raises {@link ConfigException}.
 */
@Slf4j
public class ConfigService {

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMillis(200);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, TidewatchConfig> cache;
    private final Path configPath;
    private final UnaryOperator<String> env;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL, System::getenv);
    }

    public ConfigService(Path configPath, Duration cacheTtl, UnaryOperator<String> env) {
        this.configPath = ConfigPaths.resolveUserPath(configPath.toString());
        this.env = env;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    /**
     * Load config with caching.
     *
     * @throws ConfigException if the file content fails validation
     */
    public TidewatchConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public TidewatchConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    /**
     * Write the config back to disk as pretty-printed JSON.
     */
    public void saveConfig(TidewatchConfig config) throws IOException {
        ConfigValidation.requireValid(config);
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + "\n");
        cache.invalidateAll();
        log.info("Config saved to: {}", configPath);
    }

    public Path getConfigPath() {
        return configPath;
    }

    private TidewatchConfig doLoadConfig() {
        TidewatchConfig config;
        if (!Files.exists(configPath)) {
            log.warn("Config file not found: {}, using defaults", configPath);
            config = new TidewatchConfig();
        } else {
            try {
                String raw = substituteEnvVars(Files.readString(configPath));
                config = objectMapper.readValue(raw, TidewatchConfig.class);
                log.info("Config loaded from: {}", configPath);
            } catch (IOException e) {
                log.error("Failed to load config from: {}, using defaults", configPath, e);
                config = new TidewatchConfig();
            }
        }
        return ConfigValidation.requireValid(applyDefaults(config));
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns.
     */
    String substituteEnvVars(String raw) {
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String varName = matcher.group(1);
            String defaultValue = matcher.group(2);
            String value = env.apply(varName);
            if (value == null) {
                value = defaultValue != null ? defaultValue : "";
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Fill sections that the file set to null explicitly. An explicit null
     * {@code activeHours} is kept: it means "always active".
     */
    TidewatchConfig applyDefaults(TidewatchConfig config) {
        if (config.getCron() == null) {
            config.setCron(new TidewatchConfig.CronConfig());
        }
        if (config.getHeartbeat() == null) {
            config.setHeartbeat(new TidewatchConfig.HeartbeatConfig());
        }
        if (config.getAlerts() == null) {
            config.setAlerts(new TidewatchConfig.AlertsConfig());
        }
        TidewatchConfig.HeartbeatConfig hb = config.getHeartbeat();
        if (hb.getPrioritySenders() == null) {
            hb.setPrioritySenders(new ArrayList<>());
        }
        if (hb.getBotSenders() == null) {
            hb.setBotSenders(new ArrayList<>());
        }
        if (hb.getDependencies() == null) {
            hb.setDependencies(new ArrayList<>());
        }
        return config;
    }
}
