package com.ocpbot.channel.slack;

/**
 * What the router did with an inbound event.
 */
public enum EventDisposition {
    /** Handed to the dispatcher. */
    ACCEPTED,
    /** Sender is not on the allow-list; a denial was sent. */
    DENIED,
    /** Already handled under another delivery. */
    DUPLICATE,
    /** Ignored: bot message, edit, or no user. */
    DROPPED
}
