package com.ryuqq.runcontrol.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CorrelationIdTest {

    @Test
    void unset_IsUnknownSentinel() {
        assertEquals("unknown", CorrelationId.UNSET.getValue());
        assertTrue(CorrelationId.UNSET.isUnset());
    }

    @Test
    void of_UnknownValue_IsTreatedAsUnset() {
        assertTrue(CorrelationId.of("unknown").isUnset());
        assertEquals(CorrelationId.UNSET, CorrelationId.of("unknown"));
    }

    @Test
    void generate_IsNotUnset() {
        assertFalse(CorrelationId.generate().isUnset());
    }

    @Test
    void toString_ReturnsRawValue() {
        assertEquals("abc-123", CorrelationId.of("abc-123").toString());
    }

    @Test
    void of_BlankValue_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> CorrelationId.of(""));
    }
}
