package com.ocpbot.common.logging;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Masks credentials (Slack tokens, AWS keys, env-style secrets) before they
 * reach a log line.
 */
public final class LogRedact {

    private LogRedact() {
    }

    // -----------------------------------------------------------------------
    // Modes
    // -----------------------------------------------------------------------

    public enum RedactMode {
        OFF,
        TOOLS;

        public static RedactMode normalize(String value) {
            if ("off".equalsIgnoreCase(value)) {
                return OFF;
            }
            return TOOLS;
        }
    }

    // -----------------------------------------------------------------------
    // Constants
    // -----------------------------------------------------------------------

    private static final int MIN_TOKEN_LENGTH = 18;
    private static final int KEEP_START = 6;
    private static final int KEEP_END = 4;

    private static final List<Pattern> DEFAULT_PATTERNS = List.of(
            // ENV-style assignments
            Pattern.compile("\\b[A-Z0-9_]*(?:KEY|TOKEN|SECRET|PASSWORD)\\b\\s*[=:]\\s*([\"']?)([^\\s\"'\\\\]+)\\1",
                    Pattern.CASE_INSENSITIVE),
            // Slack bot/user/app tokens
            Pattern.compile("\\b(xox[baprs]-[A-Za-z0-9-]{10,})\\b"),
            Pattern.compile("\\b(xapp-[A-Za-z0-9-]{10,})\\b"),
            // AWS access key ids
            Pattern.compile("\\b((?:AKIA|ASIA)[0-9A-Z]{16})\\b"));

    // -----------------------------------------------------------------------
    // Public API
    // -----------------------------------------------------------------------

    /**
     * Redact sensitive tokens in text using default patterns.
     */
    public static String redactSensitiveText(String text) {
        return redactSensitiveText(text, RedactMode.TOOLS);
    }

    public static String redactSensitiveText(String text, RedactMode mode) {
        if (text == null || text.isEmpty() || mode == RedactMode.OFF) {
            return text;
        }
        String result = text;
        for (Pattern pattern : DEFAULT_PATTERNS) {
            result = redactWithPattern(result, pattern);
        }
        return result;
    }

    /**
     * Mask a single token, preserving start/end characters.
     */
    public static String maskToken(String token) {
        if (token == null || token.length() < MIN_TOKEN_LENGTH) {
            return "***";
        }
        String start = token.substring(0, KEEP_START);
        String end = token.substring(token.length() - KEEP_END);
        return start + "…" + end;
    }

    // -----------------------------------------------------------------------
    // Internals
    // -----------------------------------------------------------------------

    private static String redactWithPattern(String text, Pattern pattern) {
        Matcher matcher = pattern.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String fullMatch = matcher.group(0);
            String token = fullMatch;
            for (int i = matcher.groupCount(); i >= 1; i--) {
                String group = matcher.group(i);
                if (group != null && !group.isEmpty()) {
                    token = group;
                    break;
                }
            }
            String masked = maskToken(token);
            String replacement = token.equals(fullMatch) ? masked : fullMatch.replace(token, masked);
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
