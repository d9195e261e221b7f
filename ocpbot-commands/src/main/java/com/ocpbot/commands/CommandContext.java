package com.ocpbot.commands;

import jakarta.annotation.Nullable;

/**
 * Context passed to every command handler.
 *
 * @param command    the dispatch key the user typed
 * @param parameters parsed positional and {@code --key=value} parameters
 * @param userId     the requesting user, null when unknown
 * @param region     cloud region resolved for this request
 * @param output     callback for replies
 */
public record CommandContext(
        String command,
        CommandParameters parameters,
        @Nullable String userId,
        String region,
        CommandOutput output) {

    public void say(String message) {
        output.say(message);
    }

    public CommandContext withOutput(CommandOutput replacement) {
        return new CommandContext(command, parameters, userId, region, replacement);
    }

    /** "Hello &lt;@user&gt;! " or "Hello! " for an anonymous request. */
    public String greeting() {
        return greeting(userId);
    }

    public static String greeting(@Nullable String userId) {
        return userId != null ? "Hello " + mention(userId) + "! " : "Hello! ";
    }

    /** "Sorry &lt;@user&gt;, " or "Sorry, " for an anonymous request. */
    public static String apology(@Nullable String userId) {
        return userId != null ? "Sorry " + mention(userId) + ", " : "Sorry, ";
    }

    public static String mention(String userId) {
        return "<@" + userId + ">";
    }
}
