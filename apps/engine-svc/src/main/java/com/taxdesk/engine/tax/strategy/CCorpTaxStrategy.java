package com.taxdesk.engine.tax.strategy;

import com.taxdesk.engine.model.Money;
import com.taxdesk.engine.tax.FinancialProjection;
import com.taxdesk.engine.tax.TaxCalculationResult;
import java.math.BigDecimal;

/**
 * C-corporation: flat federal and state corporate rates, no owner-level taxes.
 */
public class CCorpTaxStrategy implements EntityTaxStrategy {

    private final TaxPolicy policy;

    public CCorpTaxStrategy(TaxPolicy policy) {
        this.policy = policy;
    }

    @Override
    public EntityType entityType() {
        return EntityType.C_CORP;
    }

    @Override
    public TaxCalculationResult computeTax(FinancialProjection projection, TaxContext context) {
        BigDecimal netIncome = projection.netIncome();
        BigDecimal taxable = Money.floorAtZero(netIncome);

        return TaxCalculationResult.builder(entityType())
                .grossIncome(projection.grossIncome())
                .businessExpenses(projection.totalExpenses())
                .adjustedGrossIncome(netIncome)
                .taxableIncome(taxable)
                .federalTax(taxable.multiply(policy.corporateRate()))
                .stateTax(policy.stateTax(taxable, context.state(), policy.corporateStateRate()))
                .marginalRate(policy.corporateRate())
                .build();
    }
}
