package com.ocpbot.channel;

import java.util.function.Consumer;

/**
 * Channel event logging utilities.
 */
public final class ChannelLogging {

    private ChannelLogging() {
    }

    /**
     * Log an inbound message drop.
     */
    public static void logInboundDrop(Consumer<String> log, String channel,
            String reason, String target) {
        String targetPart = target != null ? " target=" + target : "";
        log.accept(channel + ": drop " + reason + targetPart);
    }

    /**
     * Log an access denial with allow-list match metadata.
     */
    public static void logAccessDenied(Consumer<String> log, String channel,
            String userId, UserAllowlist.Match match) {
        log.accept(channel + ": denied user=" + userId + " "
                + UserAllowlist.formatMatchMeta(match.matchKey(), match.matchSource()));
    }
}
