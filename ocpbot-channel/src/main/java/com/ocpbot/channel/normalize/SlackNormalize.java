package com.ocpbot.channel.normalize;

import java.util.regex.Pattern;

/**
 * Slack mention and user id helpers.
 */
public final class SlackNormalize {

    private SlackNormalize() {
    }

    private static final Pattern USER_MENTION = Pattern.compile(
            "^<@([A-Z0-9]+)(\\|[^>]*)?>$", Pattern.CASE_INSENSITIVE);
    private static final Pattern SLACK_USER_ID = Pattern.compile(
            "^[UW][A-Z0-9]{6,}$");

    /**
     * Whether a token is a user mention such as {@code <@U012ABCDEF>} or
     * {@code <@U012ABCDEF|name>}.
     */
    public static boolean isMentionToken(String token) {
        if (token == null)
            return false;
        return USER_MENTION.matcher(token.trim()).matches();
    }

    /**
     * User id inside a mention token, or null if the token is not a mention.
     */
    public static String mentionedUserId(String token) {
        if (token == null)
            return null;
        var matcher = USER_MENTION.matcher(token.trim());
        return matcher.matches() ? matcher.group(1).toUpperCase() : null;
    }

    /**
     * Remove a leading mention token from a message. A message that is only
     * a mention becomes empty.
     */
    public static String stripLeadingMention(String text) {
        if (text == null)
            return "";
        String trimmed = text.trim();
        if (trimmed.isEmpty())
            return trimmed;
        String[] parts = trimmed.split("\\s+", 2);
        if (!isMentionToken(parts[0]))
            return trimmed;
        return parts.length > 1 ? parts[1].trim() : "";
    }

    public static String mentionUser(String userId) {
        return "<@" + userId + ">";
    }

    /**
     * Whether a raw string looks like a Slack user id (U... or W...).
     */
    public static boolean looksLikeUserId(String raw) {
        if (raw == null)
            return false;
        return SLACK_USER_ID.matcher(raw.trim()).matches();
    }
}
