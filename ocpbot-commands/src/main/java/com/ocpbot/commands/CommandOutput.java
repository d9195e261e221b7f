package com.ocpbot.commands;

/**
 * Output callback handed to command handlers; each call posts one message
 * back to the requesting conversation.
 */
@FunctionalInterface
public interface CommandOutput {
    void say(String message);
}
