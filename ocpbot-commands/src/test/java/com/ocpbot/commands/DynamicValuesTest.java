package com.ocpbot.commands;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class DynamicValuesTest {

    @Test
    void resolve_staticValue_returnedUnchanged() {
        List<String> states = List.of("running", "stopped");
        assertSame(states, DynamicValues.resolve(DynamicValue.of(states)));
    }

    @Test
    void resolve_producer_invokedOnEveryResolution() {
        AtomicInteger calls = new AtomicInteger();
        DynamicValue<Integer> value = DynamicValue.from(calls::incrementAndGet);

        assertEquals(1, DynamicValues.resolve(value));
        assertEquals(2, DynamicValues.resolve(value));
    }

    @Test
    void resolve_failingProducer_returnsSentinel() {
        DynamicValue<List<String>> value = DynamicValue.from(() -> {
            throw new IllegalStateException("config map unavailable");
        });

        Object resolved = DynamicValues.resolve(value);

        assertEquals("<error getting value>", resolved);
        assertTrue(DynamicValues.isError(resolved));
    }

    @Test
    void resolve_null_returnsNull() {
        assertNull(DynamicValues.resolve(null));
        assertNull(DynamicValues.resolve(DynamicValue.of(null)));
    }
}
