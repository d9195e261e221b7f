package com.ocpbot.commands;

/**
 * A handler paired with its metadata, as stored under each dispatch key.
 */
public record RegisteredCommand(CommandHandler handler, CommandMetadata metadata) {
}
