package com.tidewatch.app.commands;

/**
 * Reply to a slash command.
 *
 * @param text    reply text
 * @param failed true when the command was rejected or failed
 */
public record CommandResult(String text, boolean failed) {

    public static CommandResult text(String text) {
        return new CommandResult(text, false);
    }

    public static CommandResult error(String text) {
        return new CommandResult(text, true);
    }
}
