package com.ocpbot.commands;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Help metadata declared alongside a command handler.
 * <p>
 * Immutable. Argument order is declaration order and drives both the usage
 * string and the detailed argument listing.
 *
 * @param name        canonical dispatch key, non-blank, no whitespace
 * @param description one-line description
 * @param arguments   argument name to {@link ArgumentSpec}, in declaration order
 * @param examples    literal example invocations
 * @param aliases     additional dispatch keys
 */
public record CommandMetadata(
        String name,
        String description,
        Map<String, ArgumentSpec> arguments,
        List<String> examples,
        List<String> aliases) {

    public static final String NO_DESCRIPTION = "No description available";

    public CommandMetadata {
        requireKey(name, "name");
        description = description == null || description.isBlank() ? NO_DESCRIPTION : description;
        arguments = arguments == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
        examples = examples == null ? List.of() : List.copyOf(examples);
        if (aliases == null) {
            aliases = List.of();
        } else {
            aliases.forEach(alias -> requireKey(alias, "alias"));
            aliases = List.copyOf(new LinkedHashSet<>(aliases));
        }
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    private static void requireKey(String key, String what) {
        Objects.requireNonNull(key, what);
        if (key.isBlank() || key.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException("Command " + what + " must be a single non-blank token: '" + key + "'");
        }
    }

    /** Fluent builder; {@link #argument(ArgumentSpec)} keys by the argument name. */
    public static final class Builder {
        private final String name;
        private String description;
        private final Map<String, ArgumentSpec> arguments = new LinkedHashMap<>();
        private final List<String> examples = new ArrayList<>();
        private final List<String> aliases = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder argument(ArgumentSpec argument) {
            arguments.put(argument.getName(), argument);
            return this;
        }

        public Builder example(String example) {
            examples.add(example);
            return this;
        }

        public Builder examples(List<String> examples) {
            this.examples.addAll(examples);
            return this;
        }

        public Builder alias(String alias) {
            aliases.add(alias);
            return this;
        }

        public Builder aliases(List<String> aliases) {
            this.aliases.addAll(aliases);
            return this;
        }

        public CommandMetadata build() {
            return new CommandMetadata(name, description, arguments, examples, aliases);
        }
    }
}
