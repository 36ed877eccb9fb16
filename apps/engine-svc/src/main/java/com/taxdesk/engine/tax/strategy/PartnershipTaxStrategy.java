package com.taxdesk.engine.tax.strategy;

import com.taxdesk.engine.model.FilingStatus;
import com.taxdesk.engine.model.Money;
import com.taxdesk.engine.tables.RateTable;
import com.taxdesk.engine.tax.BracketCalculator;
import com.taxdesk.engine.tax.FinancialProjection;
import com.taxdesk.engine.tax.TaxCalculationResult;
import java.math.BigDecimal;

/**
 * Multi-owner pass-through. Unlike the S-corp split, self-employment tax applies to the full net income.
 * Brackets come from the single-filer table.
 */
public class PartnershipTaxStrategy implements EntityTaxStrategy {

    private final BracketCalculator bracketCalculator;
    private final SelfEmploymentTaxCalculator selfEmploymentTaxCalculator;
    private final TaxPolicy policy;

    public PartnershipTaxStrategy(BracketCalculator bracketCalculator,
                                  SelfEmploymentTaxCalculator selfEmploymentTaxCalculator,
                                  TaxPolicy policy) {
        this.bracketCalculator = bracketCalculator;
        this.selfEmploymentTaxCalculator = selfEmploymentTaxCalculator;
        this.policy = policy;
    }

    @Override
    public EntityType entityType() {
        return EntityType.PARTNERSHIP;
    }

    @Override
    public TaxCalculationResult computeTax(FinancialProjection projection, TaxContext context) {
        BigDecimal netIncome = projection.netIncome();
        BigDecimal taxable = Money.floorAtZero(netIncome);
        RateTable table = context.tables().incomeTaxTable(FilingStatus.SINGLE);

        return TaxCalculationResult.builder(entityType())
                .grossIncome(projection.grossIncome())
                .businessExpenses(projection.totalExpenses())
                .adjustedGrossIncome(netIncome)
                .taxableIncome(taxable)
                .federalTax(bracketCalculator.computeTax(taxable, table))
                .selfEmploymentTax(selfEmploymentTaxCalculator.compute(netIncome, context.tables().selfEmployment()))
                .stateTax(policy.stateTax(taxable, context.state(), policy.stateIncomeTaxRate()))
                .marginalRate(bracketCalculator.marginalRate(taxable, table))
                .build();
    }
}
