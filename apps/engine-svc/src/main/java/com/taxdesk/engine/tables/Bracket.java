package com.taxdesk.engine.tables;

import java.math.BigDecimal;

/**
 * One marginal band {@code [min, max)}. {@code max == null} marks the unbounded top band;
 * {@code base} is the cumulative tax owed on income up to {@code min}.
 */
public record Bracket(BigDecimal min, BigDecimal max, BigDecimal rate, BigDecimal base) {

    public boolean contains(BigDecimal income) {
        return income.compareTo(min) >= 0 && (max == null || income.compareTo(max) < 0);
    }
}
