package com.ocpbot.commands;

import jakarta.annotation.Nullable;

/**
 * Routes one inbound chat message to a command handler.
 */
public interface MessageDispatcher {

    String FALLBACK_SUFFIX = "I couldn't understand your request. Please try again or type 'help' for assistance.";

    /**
     * @param text   raw message text, possibly starting with a bot mention
     * @param userId requesting user, null when unknown
     * @param output reply callback
     */
    DispatchOutcome dispatch(String text, @Nullable String userId, CommandOutput output);

    static String fallbackMessage(@Nullable String userId) {
        return CommandContext.greeting(userId) + FALLBACK_SUFFIX;
    }
}
