package com.ocpbot.commands;

/**
 * What a dispatcher did with one inbound message.
 */
public enum DispatchOutcome {
    /** A registered handler was invoked. */
    DISPATCHED,
    /** The message was answered by the help surface. */
    HELP,
    /** Unknown command; similar commands were suggested. */
    SUGGESTED,
    /** Unknown command with nothing similar. */
    NOT_FOUND,
    /** Nothing to dispatch; the generic fallback was sent. */
    EMPTY
}
