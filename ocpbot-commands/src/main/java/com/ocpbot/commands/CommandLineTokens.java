package com.ocpbot.commands;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Whitespace tokenization and bot-mention stripping shared by the
 * dispatchers.
 */
public final class CommandLineTokens {

    /** Slack-style addressing token, e.g. {@code <@U012ABCDEF>}. */
    public static final Predicate<String> SLACK_MENTION = token -> token.startsWith("<@") && token.endsWith(">");

    private CommandLineTokens() {
    }

    /**
     * Split on whitespace, dropping empty tokens.
     */
    public static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null) {
            return tokens;
        }
        for (String token : text.trim().split("\\s+")) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    /**
     * Tokenize and drop a leading addressing token. A message consisting only
     * of the addressing token yields no tokens.
     */
    public static List<String> effectiveTokens(String text, Predicate<String> addressingToken) {
        List<String> tokens = tokenize(text);
        if (!tokens.isEmpty() && addressingToken.test(tokens.get(0))) {
            return tokens.subList(1, tokens.size());
        }
        return tokens;
    }
}
