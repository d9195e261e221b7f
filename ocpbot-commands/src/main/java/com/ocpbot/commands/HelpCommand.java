package com.ocpbot.commands;

import jakarta.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * The {@code help} surface: general listing, per-command detail, and
 * suggestions for unknown targets.
 */
@Slf4j
public class HelpCommand {

    /** {@code help <something>} or {@code <something> [--|-]h[elp]}. */
    private static final Pattern HELP_REQUEST = Pattern.compile("^help\\b\\s.+|.*\\S.*\\s(-{0,2}h(elp)?)$");
    private static final Pattern HELP_TOKEN = Pattern.compile("-{0,2}h(elp)?");

    private final CommandRegistry registry;
    private final HelpFormatter formatter;
    private final GeneralHelpCache generalHelp;

    public HelpCommand(CommandRegistry registry, HelpFormatter formatter, GeneralHelpCache generalHelp) {
        this.registry = registry;
        this.formatter = formatter;
        this.generalHelp = generalHelp;
    }

    /**
     * Whether a command line asks for help about a command.
     */
    public static boolean isHelpRequest(String commandLine) {
        return commandLine != null && HELP_REQUEST.matcher(commandLine.trim()).matches();
    }

    /**
     * Remove a leading {@code help} and trailing help flags, leaving the target
     * command text. Lines that are not help requests are returned unchanged.
     */
    public static String stripHelpTokens(String commandLine) {
        if (commandLine == null || !isHelpRequest(commandLine)) {
            return commandLine;
        }
        List<String> tokens = new ArrayList<>(Arrays.asList(commandLine.trim().split("\\s+")));
        while (!tokens.isEmpty() && CommandRegistry.HELP_COMMAND.equals(tokens.get(0))) {
            tokens.remove(0);
        }
        while (!tokens.isEmpty() && HELP_TOKEN.matcher(tokens.get(tokens.size() - 1)).matches()) {
            tokens.remove(tokens.size() - 1);
        }
        return String.join(" ", tokens);
    }

    /**
     * Answer a help request.
     *
     * @param target command to describe; null or blank for the general listing
     */
    public void handle(CommandOutput output, @Nullable String userId, @Nullable String target) {
        String greeting = CommandContext.greeting(userId);
        try {
            String name = target == null ? null : stripHelpTokens(target.trim());
            if (name == null || name.isEmpty()) {
                output.say(greeting + "Here's what I can help you with:\n\n" + generalHelp.get());
                return;
            }

            if (registry.contains(name)) {
                output.say(greeting + "Here's help for `" + name + "`:\n\n"
                        + formatter.formatCommandHelp(name, true));
                return;
            }

            List<String> suggestions = registry.suggest(name, CommandSuggestions.DEFAULT_LIMIT);
            if (!suggestions.isEmpty()) {
                output.say(greeting + "Command `" + name + "` not found. Did you mean: "
                        + String.join(", ", suggestions) + "?");
            } else {
                output.say(greeting + "Command `" + name + "` not found. Use `help` to see all available commands.");
            }
        } catch (RuntimeException e) {
            log.error("Error in help command: {}", e.getMessage(), e);
            output.say(CommandContext.apology(userId) + "I encountered an error while generating help information.");
        }
    }
}
