package com.di.phenostore.stream;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("IntegerValueFormatter Tests")
class IntegerValueFormatterTest {

    @Test
    @DisplayName("Numbers render as integer text")
    void testFormat_Numbers() {
        assertEquals("40", IntegerValueFormatter.format(40L));
        assertEquals("3", IntegerValueFormatter.format(3.0d));
        assertEquals("7", IntegerValueFormatter.format(7));
        assertEquals("12", IntegerValueFormatter.format(new BigDecimal("12.000")));
        assertEquals("12345678901234", IntegerValueFormatter.format(1.2345678901234E13));
    }

    @Test
    @DisplayName("Halves round to even")
    void testFormat_Rounding() {
        assertEquals("2", IntegerValueFormatter.format(2.5d));
        assertEquals("4", IntegerValueFormatter.format(3.5d));
        assertEquals("-2", IntegerValueFormatter.format(-2.5d));
    }

    @Test
    @DisplayName("Missing and non-finite values are null, text is unchanged")
    void testFormat_Missing() {
        assertNull(IntegerValueFormatter.format(null));
        assertNull(IntegerValueFormatter.format(Double.NaN));
        assertNull(IntegerValueFormatter.format(Double.POSITIVE_INFINITY));
        assertEquals("n/a", IntegerValueFormatter.format("n/a"));
    }
}
