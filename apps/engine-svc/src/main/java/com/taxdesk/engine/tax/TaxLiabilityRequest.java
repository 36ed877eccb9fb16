package com.taxdesk.engine.tax;

import com.taxdesk.engine.model.FilingStatus;
import java.math.BigDecimal;

/**
 * Input of a tax liability run. When both {@code grossIncome} and {@code businessExpenses} are
 * supplied they are used as-is; otherwise the projection method derives them from stored transactions.
 */
public record TaxLiabilityRequest(
        String clientId,
        String entityType,
        String state,
        FilingStatus filingStatus,
        Integer taxYear,
        ProjectionMethod projectionMethod,
        BigDecimal grossIncome,
        BigDecimal businessExpenses
) {

    public boolean hasProvidedFigures() {
        return grossIncome != null && businessExpenses != null;
    }
}
