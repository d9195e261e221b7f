package com.ocpbot.commands;

import jakarta.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Registry-backed dispatcher.
 * <p>
 * The first effective token (after dropping a leading bot mention) selects
 * the command. {@code help ...} and {@code <command> --help} go to the help
 * surface; a registry hit runs the handler through the {@link HandlerInvoker}
 * with the remaining tokens parsed into {@link CommandParameters}; a miss
 * replies with suggestions or a pointer to {@code help}.
 */
@Slf4j
public class CommandDispatcher implements MessageDispatcher {

    private final CommandRegistry registry;
    private final HelpCommand helpCommand;
    private final HandlerInvoker invoker;
    private final Supplier<String> regionSupplier;
    private final Predicate<String> addressingToken;
    private final boolean caseInsensitive;

    public CommandDispatcher(CommandRegistry registry, HelpCommand helpCommand, HandlerInvoker invoker,
            Supplier<String> regionSupplier) {
        this(registry, helpCommand, invoker, regionSupplier, CommandLineTokens.SLACK_MENTION, true);
    }

    public CommandDispatcher(CommandRegistry registry, HelpCommand helpCommand, HandlerInvoker invoker,
            Supplier<String> regionSupplier, Predicate<String> addressingToken, boolean caseInsensitive) {
        this.registry = registry;
        this.helpCommand = helpCommand;
        this.invoker = invoker;
        this.regionSupplier = regionSupplier;
        this.addressingToken = addressingToken;
        this.caseInsensitive = caseInsensitive;
    }

    @Override
    public DispatchOutcome dispatch(String text, @Nullable String userId, CommandOutput output) {
        List<String> tokens = CommandLineTokens.effectiveTokens(text, addressingToken);
        if (tokens.isEmpty()) {
            output.say(MessageDispatcher.fallbackMessage(userId));
            return DispatchOutcome.EMPTY;
        }

        String key = caseInsensitive ? tokens.get(0).toLowerCase(Locale.ROOT) : tokens.get(0);
        List<String> rest = tokens.subList(1, tokens.size());
        String commandLine = rest.isEmpty() ? key : key + " " + String.join(" ", rest);

        if (CommandRegistry.HELP_COMMAND.equals(key)) {
            helpCommand.handle(output, userId, rest.isEmpty() ? null : String.join(" ", rest));
            return DispatchOutcome.HELP;
        }
        if (HelpCommand.isHelpRequest(commandLine)) {
            helpCommand.handle(output, userId, HelpCommand.stripHelpTokens(commandLine));
            return DispatchOutcome.HELP;
        }

        var entry = registry.lookup(key);
        if (entry.isPresent()) {
            log.info("Dispatching {} for user {}", key, userId);
            CommandContext ctx = new CommandContext(key, CommandParameters.parse(rest), userId,
                    regionSupplier.get(), output);
            invoker.invoke(entry.get().handler(), ctx);
            return DispatchOutcome.DISPATCHED;
        }

        log.debug("Unknown command: {}", key);
        List<String> suggestions = registry.suggest(key, CommandSuggestions.DEFAULT_LIMIT);
        String greeting = CommandContext.greeting(userId);
        if (!suggestions.isEmpty()) {
            output.say(greeting + "Command `" + key + "` not found. Did you mean: "
                    + String.join(", ", suggestions) + "?");
            return DispatchOutcome.SUGGESTED;
        }
        output.say(greeting + "Command `" + key + "` not found. Type `help` to see all available commands.");
        return DispatchOutcome.NOT_FOUND;
    }
}
