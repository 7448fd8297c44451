package com.di.phenostore.stream;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Renders values of integer fields as integer text ({@code 3.0} becomes {@code "3"}).
 */
public final class IntegerValueFormatter {

    private IntegerValueFormatter() {}

    /**
     * @return integer text for numbers, {@code null} for null and non-finite values,
     *         anything else unchanged
     */
    public static Object format(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (!Double.isFinite(d)) {
                return null;
            }
            return BigDecimal.valueOf(d).setScale(0, RoundingMode.HALF_EVEN).toPlainString();
        }
        if (value instanceof BigDecimal bd) {
            return bd.setScale(0, RoundingMode.HALF_EVEN).toPlainString();
        }
        if (value instanceof Number n) {
            return new BigDecimal(n.toString()).setScale(0, RoundingMode.HALF_EVEN).toPlainString();
        }
        return value;
    }
}
