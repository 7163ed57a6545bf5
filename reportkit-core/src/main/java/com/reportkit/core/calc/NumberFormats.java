package com.reportkit.core.calc;

import java.math.BigDecimal;
import java.util.OptionalDouble;

/**
 * Parsing and formatting of numeric cell values. Cells stay strings everywhere,
 * numbers only exist while a value is being computed.
 */
public final class NumberFormats {

    private NumberFormats() {
    }

    /**
     * Parse a cell for aggregation: trimmed, dot as decimal separator.
     * Unparseable, NaN and infinite values are absent.
     */
    public static OptionalDouble parse(String value) {
        if (value == null) {
            return OptionalDouble.empty();
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return OptionalDouble.empty();
        }
        try {
            double parsed = Double.parseDouble(trimmed);
            return Double.isFinite(parsed) ? OptionalDouble.of(parsed) : OptionalDouble.empty();
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    /**
     * Parse a cell for column arithmetic. Same as {@link #parse(String)} but a
     * comma is accepted as decimal separator ("2,5" is 2.5).
     */
    public static OptionalDouble parseLenient(String value) {
        if (value == null) {
            return OptionalDouble.empty();
        }
        return parse(value.replace(',', '.'));
    }

    /**
     * Canonical decimal text of a computed value: no fractional part for
     * integral values ("200", "0"), plain notation otherwise ("2.5"), never
     * scientific notation.
     */
    public static String canonical(double value) {
        if (!Double.isFinite(value)) {
            return String.valueOf(value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
