package com.ocpbot.commands;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders command metadata as Slack mrkdwn help text.
 * <p>
 * Two forms are produced: a one-line summary ({@code `name` - description})
 * and a detailed block with usage, arguments, examples and aliases. Choices
 * and defaults are resolved through {@link DynamicValues}, so a failing
 * producer only degrades its own argument line.
 */
public class HelpFormatter {

    /** Choices beyond this count are elided with {@code , ...}. */
    public static final int MAX_CHOICES = 10;

    private final CommandRegistry registry;

    public HelpFormatter(CommandRegistry registry) {
        this.registry = registry;
    }

    /**
     * Format help for a dispatch key.
     *
     * @param name     canonical name or alias
     * @param detailed false for the one-line summary
     * @return the rendered text, or a not-found message for unknown keys
     */
    public String formatCommandHelp(String name, boolean detailed) {
        var entry = registry.lookup(name);
        if (entry.isEmpty()) {
            return notFound(name);
        }
        CommandMetadata metadata = entry.get().metadata();
        if (!detailed) {
            return summary(name, metadata);
        }
        return detailed(name, metadata);
    }

    public static String notFound(String name) {
        return "Command '" + name + "' not found.";
    }

    static String summary(String name, CommandMetadata metadata) {
        return "`" + name + "` - " + metadata.description();
    }

    static String detailed(String name, CommandMetadata metadata) {
        List<String> lines = new ArrayList<>();
        lines.add("*" + name + "*");
        lines.add("_" + metadata.description() + "_");
        lines.add("");

        Map<String, ArgumentSpec> arguments = metadata.arguments();
        if (!arguments.isEmpty()) {
            lines.add("*Usage:* `" + usage(name, metadata) + "`");
            lines.add("");

            lines.add("*Arguments:*");
            for (ArgumentSpec argument : arguments.values()) {
                lines.add(argumentLine(argument));
            }
            lines.add("");
        }

        if (!metadata.examples().isEmpty()) {
            lines.add("*Examples:*");
            for (String example : metadata.examples()) {
                lines.add("  `" + example + "`");
            }
            lines.add("");
        }

        if (!metadata.aliases().isEmpty()) {
            lines.add("*Aliases:* " + String.join(", ", metadata.aliases()));
        }

        return String.join("\n", lines).strip();
    }

    /**
     * {@code name --required=<required> [--optional=<optional>]}
     */
    static String usage(String name, CommandMetadata metadata) {
        StringBuilder sb = new StringBuilder(name);
        for (ArgumentSpec argument : metadata.arguments().values()) {
            String flag = "--" + argument.getName() + "=<" + argument.getName() + ">";
            sb.append(' ').append(argument.isRequired() ? flag : "[" + flag + "]");
        }
        return sb.toString();
    }

    static String argumentLine(ArgumentSpec argument) {
        StringBuilder sb = new StringBuilder("  `--").append(argument.getName()).append('`');
        if (argument.isRequired()) {
            sb.append(" *(required)*");
        }
        sb.append(" - ").append(argument.getDescription());

        if (argument.hasChoices()) {
            String options = renderChoices(DynamicValues.resolve(argument.getChoices()));
            if (options != null) {
                sb.append(" (Options: ").append(options).append(')');
            }
        }
        if (argument.hasDefault()) {
            sb.append(" (Default: ").append(DynamicValues.resolve(argument.getDefaultValue())).append(')');
        }
        return sb.toString();
    }

    /**
     * @return the comma-separated options, the error placeholder, or null when
     *         there is nothing to show
     */
    static String renderChoices(Object resolved) {
        if (DynamicValues.isError(resolved)) {
            return DynamicValues.ERROR_SENTINEL;
        }
        if (!(resolved instanceof List<?> choices) || choices.isEmpty()) {
            return null;
        }
        String shown = choices.stream()
                .limit(MAX_CHOICES)
                .map(String::valueOf)
                .collect(Collectors.joining(", "));
        return choices.size() > MAX_CHOICES ? shown + ", ..." : shown;
    }
}
