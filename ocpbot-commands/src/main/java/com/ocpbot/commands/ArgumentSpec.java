package com.ocpbot.commands;

import jakarta.annotation.Nullable;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.List;

/**
 * One named {@code --name=value} parameter of a command.
 */
@Value
@Builder
public class ArgumentSpec {

    public static final String NO_DESCRIPTION = "No description";

    @NonNull
    String name;

    boolean required;

    @Builder.Default
    String description = NO_DESCRIPTION;

    /** Allowed values, resolved when help is rendered. */
    @Nullable
    DynamicValue<List<String>> choices;

    /** Default value, resolved when help is rendered. */
    @Nullable
    DynamicValue<?> defaultValue;

    public boolean hasChoices() {
        return choices != null;
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }
}
