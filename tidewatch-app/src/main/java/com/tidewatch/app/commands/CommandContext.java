package com.tidewatch.app.commands;

import com.tidewatch.common.config.TidewatchConfig;
import jakarta.annotation.Nullable;

/**
 * Context passed to every command handler.
 */
public record CommandContext(
        @Nullable String senderId,
        TidewatchConfig config) {
}
