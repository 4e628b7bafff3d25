package com.tidewatch.app.commands;

import com.tidewatch.common.config.TidewatchConfig;
import jakarta.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Slash command dispatcher: routes "/cmd args" to the registered handler.
 */
@Slf4j
@Component
public class CommandProcessor {

    private final TidewatchConfig config;
    private final Map<String, CommandHandler> handlers = new LinkedHashMap<>();

    public CommandProcessor(TidewatchConfig config, CronCommands cronCommands,
            HeartbeatCommands heartbeatCommands) {
        this.config = config;
        handlers.put("cron", cronCommands::handleCron);
        handlers.put("heartbeat", heartbeatCommands::handleHeartbeat);
    }

    public Set<String> commandNames() {
        return handlers.keySet();
    }

    /**
     * Handle a slash command.
     *
     * @param command  the full command text (e.g. "/cron run morning-brief")
     * @param senderId who sent it, nullable
     * @return the reply, or null if the text is not a known command
     */
    public CommandResult handleCommand(String command, @Nullable String senderId) {
        if (command == null || command.isBlank()) {
            return null;
        }

        String trimmed = command.trim();
        if (!trimmed.startsWith("/")) {
            return null;
        }

        String withoutSlash = trimmed.substring(1);
        int spaceIdx = withoutSlash.indexOf(' ');
        String name;
        String args;
        if (spaceIdx < 0) {
            name = withoutSlash.toLowerCase();
            args = "";
        } else {
            name = withoutSlash.substring(0, spaceIdx).toLowerCase();
            args = withoutSlash.substring(spaceIdx + 1).trim();
        }

        CommandHandler handler = handlers.get(name);
        if (handler == null) {
            log.debug("Unknown command: /{}", name);
            return null;
        }

        try {
            return handler.handle(args, new CommandContext(senderId, config));
        } catch (Exception e) {
            log.error("Command /{} failed: {}", name, e.getMessage(), e);
            return CommandResult.error("❌ Command failed: " + e.getMessage());
        }
    }
}
