package com.ocpbot.commands;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Lazily built listing of every command.
 * <p>
 * The text is rendered on the first {@link #get()} and then returned unchanged
 * for the life of the process, even if commands are registered afterwards.
 * Build it only once startup registration is complete.
 */
@Slf4j
public class GeneralHelpCache {

    static final List<String> TRAILER = List.of(
            "",
            "For detailed help on any command, use: `help <command-name>` or `<command-name> --help`",
            "",
            "Example: `help list-aws-vms` or `list-aws-vms --help`");

    private final CommandRegistry registry;
    private volatile String cached;

    public GeneralHelpCache(CommandRegistry registry) {
        this.registry = registry;
    }

    public String get() {
        String text = cached;
        if (text == null) {
            synchronized (this) {
                text = cached;
                if (text == null) {
                    List<String> lines = listing();
                    text = String.join("\n", lines);
                    cached = text;
                    log.debug("General help built for {} command(s)", lines.size() - 1 - TRAILER.size());
                }
            }
        }
        return text;
    }

    public boolean isBuilt() {
        return cached != null;
    }

    private List<String> listing() {
        List<String> lines = new ArrayList<>();
        lines.add("*Available Commands:*");

        Map<String, CommandMetadata> sorted = new TreeMap<>(registry.uniqueCommands());
        for (Map.Entry<String, CommandMetadata> entry : sorted.entrySet()) {
            lines.add("`" + compactUsage(entry.getKey(), entry.getValue()) + "` - "
                    + entry.getValue().description());
        }

        lines.addAll(TRAILER);
        return lines;
    }

    /**
     * {@code name <required> [optional]}
     */
    static String compactUsage(String name, CommandMetadata metadata) {
        StringBuilder sb = new StringBuilder(name);
        for (ArgumentSpec argument : metadata.arguments().values()) {
            sb.append(' ').append(argument.isRequired()
                    ? "<" + argument.getName() + ">"
                    : "[" + argument.getName() + "]");
        }
        return sb.toString();
    }
}
