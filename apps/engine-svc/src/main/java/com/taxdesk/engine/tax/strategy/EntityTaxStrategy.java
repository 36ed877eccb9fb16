package com.taxdesk.engine.tax.strategy;

import com.taxdesk.engine.tax.FinancialProjection;
import com.taxdesk.engine.tax.TaxCalculationResult;

public interface EntityTaxStrategy {

    EntityType entityType();

    TaxCalculationResult computeTax(FinancialProjection projection, TaxContext context);
}
