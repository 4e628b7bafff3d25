package com.tidewatch.app.commands;

/**
 * Functional interface for slash command handlers.
 */
@FunctionalInterface
public interface CommandHandler {

    /**
     * @param args text after the command name, trimmed; empty when absent
     * @param ctx  sender and config of the invocation
     */
    CommandResult handle(String args, CommandContext ctx);
}
