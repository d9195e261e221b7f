package com.ocpbot.commands;

import lombok.extern.slf4j.Slf4j;

/**
 * Resolves {@link DynamicValue}s for help rendering.
 * A failing producer never propagates: it is logged and replaced by
 * {@link #ERROR_SENTINEL}.
 */
@Slf4j
public final class DynamicValues {

    public static final String ERROR_SENTINEL = "<error getting value>";

    private DynamicValues() {
    }

    /**
     * Resolve a value.
     *
     * @return the static value, the producer's result, {@link #ERROR_SENTINEL}
     *         if the producer threw, or null for a null input
     */
    public static Object resolve(DynamicValue<?> value) {
        if (value == null) {
            return null;
        }
        if (value instanceof DynamicValue.Static<?> s) {
            return s.value();
        }
        DynamicValue.Producer<?> producer = (DynamicValue.Producer<?>) value;
        try {
            return producer.supplier().get();
        } catch (RuntimeException e) {
            log.error("Error getting dynamic value: {}", e.getMessage(), e);
            return ERROR_SENTINEL;
        }
    }

    /**
     * Whether a resolved value is the failure placeholder.
     */
    public static boolean isError(Object resolved) {
        return ERROR_SENTINEL.equals(resolved);
    }
}
