package com.ocpbot.commands;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Parameters extracted from a command line.
 * <p>
 * {@code --key=value} tokens become named parameters (the value keeps any
 * further {@code =}); a bare {@code --flag} maps to {@code "true"}; every
 * other token after the command word is positional. A repeated key keeps the
 * last value.
 *
 * @param positional tokens that are not {@code --} options, in order
 * @param named      option name → value, in first-seen order
 */
public record CommandParameters(List<String> positional, Map<String, String> named) {

    public static final CommandParameters EMPTY = new CommandParameters(List.of(), Map.of());

    public CommandParameters {
        positional = List.copyOf(positional);
        named = Collections.unmodifiableMap(new LinkedHashMap<>(named));
    }

    /**
     * Parse the tokens that follow the command word.
     */
    public static CommandParameters parse(List<String> tokens) {
        List<String> positional = new ArrayList<>();
        Map<String, String> named = new LinkedHashMap<>();
        for (String token : tokens) {
            if (token.startsWith("--") && token.length() > 2) {
                String body = token.substring(2);
                int eq = body.indexOf('=');
                if (eq < 0) {
                    named.put(body, "true");
                } else if (eq > 0) {
                    named.put(body.substring(0, eq), body.substring(eq + 1));
                } else {
                    positional.add(token);
                }
            } else {
                positional.add(token);
            }
        }
        return new CommandParameters(positional, named);
    }

    /**
     * Parse a full command line; the first whitespace-separated token is the
     * command word and is skipped.
     */
    public static CommandParameters parseCommandLine(String commandLine) {
        if (commandLine == null || commandLine.isBlank()) {
            return EMPTY;
        }
        List<String> tokens = List.of(commandLine.trim().split("\\s+"));
        return parse(tokens.subList(1, tokens.size()));
    }

    public Optional<String> get(String name) {
        return Optional.ofNullable(named.get(name));
    }

    public String getOrDefault(String name, String fallback) {
        return named.getOrDefault(name, fallback);
    }

    public boolean has(String name) {
        return named.containsKey(name);
    }

    public boolean isEmpty() {
        return positional.isEmpty() && named.isEmpty();
    }
}
