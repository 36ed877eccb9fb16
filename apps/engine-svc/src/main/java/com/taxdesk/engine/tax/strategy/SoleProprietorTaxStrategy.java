package com.taxdesk.engine.tax.strategy;

import com.taxdesk.engine.model.Money;
import com.taxdesk.engine.tables.RateTable;
import com.taxdesk.engine.tax.BracketCalculator;
import com.taxdesk.engine.tax.FinancialProjection;
import com.taxdesk.engine.tax.TaxCalculationResult;
import java.math.BigDecimal;

/**
 * Single-owner pass-through: individual brackets after the standard deduction plus
 * self-employment tax on the whole net profit.
 */
public class SoleProprietorTaxStrategy implements EntityTaxStrategy {

    private final BracketCalculator bracketCalculator;
    private final SelfEmploymentTaxCalculator selfEmploymentTaxCalculator;
    private final TaxPolicy policy;

    public SoleProprietorTaxStrategy(BracketCalculator bracketCalculator,
                                     SelfEmploymentTaxCalculator selfEmploymentTaxCalculator,
                                     TaxPolicy policy) {
        this.bracketCalculator = bracketCalculator;
        this.selfEmploymentTaxCalculator = selfEmploymentTaxCalculator;
        this.policy = policy;
    }

    @Override
    public EntityType entityType() {
        return EntityType.SOLE_PROPRIETORSHIP;
    }

    @Override
    public TaxCalculationResult computeTax(FinancialProjection projection, TaxContext context) {
        BigDecimal agi = projection.grossIncome().subtract(projection.totalExpenses());
        BigDecimal standardDeduction = context.tables().standardDeduction(context.filingStatus());
        BigDecimal taxable = Money.floorAtZero(agi.subtract(standardDeduction));
        RateTable table = context.tables().incomeTaxTable(context.filingStatus());

        return TaxCalculationResult.builder(entityType())
                .grossIncome(projection.grossIncome())
                .businessExpenses(projection.totalExpenses())
                .adjustedGrossIncome(agi)
                .standardDeduction(standardDeduction)
                .taxableIncome(taxable)
                .federalTax(bracketCalculator.computeTax(taxable, table))
                .selfEmploymentTax(selfEmploymentTaxCalculator.compute(projection.netIncome(), context.tables().selfEmployment()))
                .stateTax(policy.stateTax(taxable, context.state(), policy.stateIncomeTaxRate()))
                .marginalRate(bracketCalculator.marginalRate(taxable, table))
                .build();
    }
}
