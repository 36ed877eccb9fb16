package com.taxdesk.engine.tax;

import com.taxdesk.engine.error.CalculationException;
import java.math.BigDecimal;

/**
 * Annual income and deductible business expenses a tax estimate is computed from.
 */
public record FinancialProjection(BigDecimal grossIncome, BigDecimal totalExpenses, ProjectionMethod method) {

    public FinancialProjection {
        if (grossIncome == null || totalExpenses == null) {
            throw CalculationException.invalidInput("gross income and expenses must be provided");
        }
        if (grossIncome.signum() < 0) {
            throw CalculationException.invalidInput("gross income must not be negative: " + grossIncome);
        }
        if (totalExpenses.signum() < 0) {
            throw CalculationException.invalidInput("business expenses must not be negative: " + totalExpenses);
        }
    }

    public static FinancialProjection of(BigDecimal grossIncome, BigDecimal totalExpenses) {
        return new FinancialProjection(grossIncome, totalExpenses, ProjectionMethod.PROVIDED);
    }

    public BigDecimal netIncome() {
        return grossIncome.subtract(totalExpenses);
    }
}
