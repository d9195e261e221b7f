package com.ocpbot.commands;

/**
 * Functional interface for command handlers.
 * <p>
 * Handlers return nothing; all user-visible results go through
 * {@link CommandContext#say(String)}. A handler is expected to catch failures
 * of the external calls it makes and report them itself.
 */
@FunctionalInterface
public interface CommandHandler {
    void handle(CommandContext ctx);
}
