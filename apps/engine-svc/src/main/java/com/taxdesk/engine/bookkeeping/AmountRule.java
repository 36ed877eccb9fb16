package com.taxdesk.engine.bookkeeping;

import java.math.BigDecimal;

/**
 * Magnitude rule evaluated on {@code |amount|}: MIN fires at or above the bound, MAX at or below it.
 */
public record AmountRule(BoundKind kind, BigDecimal boundValue, String category, String subcategory) {

    public enum BoundKind {
        MIN,
        MAX
    }

    public boolean matches(BigDecimal amount) {
        int cmp = amount.abs().compareTo(boundValue);
        return kind == BoundKind.MIN ? cmp >= 0 : cmp <= 0;
    }
}
