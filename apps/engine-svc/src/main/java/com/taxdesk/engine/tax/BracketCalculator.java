package com.taxdesk.engine.tax;

import com.taxdesk.engine.error.CalculationException;
import com.taxdesk.engine.tables.Bracket;
import com.taxdesk.engine.tables.RateTable;
import java.math.BigDecimal;
import org.springframework.stereotype.Component;

/**
 * Evaluates a progressive {@link RateTable}. Results are unrounded; callers round once at the end
 * of their own composition.
 */
@Component
public class BracketCalculator {

    public BigDecimal computeTax(BigDecimal taxableIncome, RateTable table) {
        Bracket bracket = locate(taxableIncome, table);
        return bracket.base().add(bracket.rate().multiply(taxableIncome.subtract(bracket.min())));
    }

    public BigDecimal marginalRate(BigDecimal taxableIncome, RateTable table) {
        return locate(taxableIncome, table).rate();
    }

    private Bracket locate(BigDecimal taxableIncome, RateTable table) {
        if (taxableIncome == null) {
            throw CalculationException.invalidInput("taxable income must be provided");
        }
        if (taxableIncome.signum() < 0) {
            throw CalculationException.invalidInput("taxable income must not be negative: " + taxableIncome);
        }
        if (table == null) {
            throw CalculationException.configuration("rate table must be provided");
        }
        return table.bracketFor(taxableIncome);
    }
}
