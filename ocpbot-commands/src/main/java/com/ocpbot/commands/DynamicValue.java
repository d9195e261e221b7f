package com.ocpbot.commands;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * A value that is either fixed at declaration time or produced on demand
 * when help is rendered.
 *
 * @param <T> the resolved value type
 */
public sealed interface DynamicValue<T> permits DynamicValue.Static, DynamicValue.Producer {

    /** A literal value. */
    record Static<T>(T value) implements DynamicValue<T> {
    }

    /** A zero-argument producer, invoked on every resolution. */
    record Producer<T>(Supplier<? extends T> supplier) implements DynamicValue<T> {
        public Producer {
            Objects.requireNonNull(supplier, "supplier");
        }
    }

    static <T> DynamicValue<T> of(T value) {
        return new Static<>(value);
    }

    static <T> DynamicValue<T> from(Supplier<? extends T> supplier) {
        return new Producer<>(supplier);
    }
}
