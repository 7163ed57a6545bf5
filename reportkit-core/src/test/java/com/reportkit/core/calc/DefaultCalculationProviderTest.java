package com.reportkit.core.calc;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DefaultCalculationProviderTest {

    private final CalculationProvider provider = new DefaultCalculationProvider();

    @Test
    @DisplayName("Numeric aggregates skip cells that are not numbers")
    void aggregatesSkipUnparseable() {
        List<String> values = List.of("10", " 20 ", "abc", "", "30.5");

        assertEquals(60.5, provider.sum(values), 1e-9);
        assertEquals(60.5 / 3, provider.average(values), 1e-9);
        assertEquals(10.0, provider.min(values), 1e-9);
        assertEquals(30.5, provider.max(values), 1e-9);
    }

    @Test
    @DisplayName("Empty or all-invalid input aggregates to zero")
    void emptyInputIsZero() {
        assertEquals(0.0, provider.sum(List.of()));
        assertEquals(0.0, provider.average(List.of()));
        assertEquals(0.0, provider.min(List.of("x", "y")));
        assertEquals(0.0, provider.max(List.of("NaN", "Infinity")));
    }

    @Test
    @DisplayName("Negative values take part in min and max")
    void negativeValues() {
        List<String> values = List.of("-5", "3", "-1.5");

        assertEquals(-5.0, provider.min(values));
        assertEquals(3.0, provider.max(values));
        assertEquals(-3.5, provider.sum(values), 1e-9);
    }

    @Test
    @DisplayName("Comma decimals are not numbers for aggregation")
    void commaDecimalNotParsed() {
        assertEquals(1.0, provider.sum(List.of("2,5", "1")));
    }

    @Test
    @DisplayName("count counts every cell, countIf matches exactly")
    void countAndCountIf() {
        List<String> values = Arrays.asList("100", "100 ", "200", "", "100");

        assertEquals(5, provider.count(values));
        assertEquals(2, provider.countIf(values, "100"));
        assertEquals(1, provider.countIf(values, ""));
        assertEquals(0, provider.countIf(values, "300"));
        assertEquals(0, provider.count(List.of()));
    }
}
