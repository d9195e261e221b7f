package com.ocpbot.commands;

import jakarta.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Pattern-list dispatcher: routes are tried in registration order and the
 * first match wins.
 * <p>
 * Order is precedence. Put exact and prefix routes before substring or
 * regex routes that could also match them, otherwise the broader route
 * shadows the specific one. EXACT, PREFIX and SUBSTRING compare ignoring
 * case against the message with any leading bot mention removed.
 */
@Slf4j
public class PatternCommandRouter implements MessageDispatcher {

    public enum MatchKind {
        /** Whole command line equals the pattern. */
        EXACT,
        /** First token equals the pattern (the rest are parameters). */
        PREFIX,
        /** Command line contains the pattern anywhere. */
        SUBSTRING,
        /** Java regex found anywhere in the command line. */
        REGEX
    }

    /**
     * One ordered route; {@code regex} is the compiled pattern for REGEX
     * routes and null otherwise.
     */
    public record PatternRoute(String name, MatchKind kind, String pattern, @Nullable Pattern regex,
            CommandHandler handler) {

        static PatternRoute of(String name, MatchKind kind, String pattern, CommandHandler handler) {
            Pattern regex = kind == MatchKind.REGEX ? Pattern.compile(pattern) : null;
            return new PatternRoute(name, kind, pattern, regex, handler);
        }

        boolean matches(String commandLine, List<String> tokens) {
            String line = commandLine.toLowerCase(Locale.ROOT);
            String needle = pattern.toLowerCase(Locale.ROOT);
            return switch (kind) {
                case EXACT -> line.equals(needle);
                case PREFIX -> !tokens.isEmpty() && tokens.get(0).equalsIgnoreCase(pattern);
                case SUBSTRING -> line.contains(needle);
                case REGEX -> regex.matcher(commandLine).find();
            };
        }
    }

    private final List<PatternRoute> routes = new ArrayList<>();
    private final HandlerInvoker invoker;
    private final Supplier<String> regionSupplier;
    private final Predicate<String> addressingToken;

    public PatternCommandRouter(HandlerInvoker invoker, Supplier<String> regionSupplier) {
        this(invoker, regionSupplier, CommandLineTokens.SLACK_MENTION);
    }

    public PatternCommandRouter(HandlerInvoker invoker, Supplier<String> regionSupplier,
            Predicate<String> addressingToken) {
        this.invoker = invoker;
        this.regionSupplier = regionSupplier;
        this.addressingToken = addressingToken;
    }

    /**
     * Append a route; it has lower precedence than every route added before.
     */
    public PatternCommandRouter route(String name, MatchKind kind, String pattern, CommandHandler handler) {
        routes.add(PatternRoute.of(name, kind, pattern, handler));
        return this;
    }

    public List<PatternRoute> routes() {
        return List.copyOf(routes);
    }

    @Override
    public DispatchOutcome dispatch(String text, @Nullable String userId, CommandOutput output) {
        List<String> tokens = CommandLineTokens.effectiveTokens(text, addressingToken);
        if (tokens.isEmpty()) {
            output.say(MessageDispatcher.fallbackMessage(userId));
            return DispatchOutcome.EMPTY;
        }
        String commandLine = String.join(" ", tokens);

        for (PatternRoute route : routes) {
            if (route.matches(commandLine, tokens)) {
                log.info("Pattern route {} matched for user {}", route.name(), userId);
                CommandParameters parameters = CommandParameters.parse(tokens.subList(1, tokens.size()));
                CommandContext ctx = new CommandContext(route.name(), parameters, userId, regionSupplier.get(),
                        output);
                invoker.invoke(route.handler(), ctx);
                return DispatchOutcome.DISPATCHED;
            }
        }

        output.say(MessageDispatcher.fallbackMessage(userId));
        return DispatchOutcome.NOT_FOUND;
    }
}
