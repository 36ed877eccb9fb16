package com.taxdesk.engine.tax.strategy;

import com.taxdesk.engine.model.FilingStatus;
import com.taxdesk.engine.model.Money;
import com.taxdesk.engine.tables.RateTable;
import com.taxdesk.engine.tax.BracketCalculator;
import com.taxdesk.engine.tax.FinancialProjection;
import com.taxdesk.engine.tax.TaxCalculationResult;
import java.math.BigDecimal;

/**
 * S-corporation owner: a capped reasonable salary carries payroll tax, the remainder is a
 * distribution free of self-employment tax. Federal tax is taken on the whole net income at
 * single-filer rates, whatever status the owner files under.
 */
public class SCorpTaxStrategy implements EntityTaxStrategy {

    private final BracketCalculator bracketCalculator;
    private final TaxPolicy policy;

    public SCorpTaxStrategy(BracketCalculator bracketCalculator, TaxPolicy policy) {
        this.bracketCalculator = bracketCalculator;
        this.policy = policy;
    }

    @Override
    public EntityType entityType() {
        return EntityType.S_CORP;
    }

    @Override
    public TaxCalculationResult computeTax(FinancialProjection projection, TaxContext context) {
        BigDecimal netIncome = projection.netIncome();
        BigDecimal salary = Money.floorAtZero(netIncome.multiply(policy.sCorpSalaryRatio()).min(policy.sCorpSalaryCeiling()));
        BigDecimal distribution = netIncome.subtract(salary);
        BigDecimal taxable = Money.floorAtZero(netIncome);
        RateTable table = context.tables().incomeTaxTable(FilingStatus.SINGLE);

        return TaxCalculationResult.builder(entityType())
                .grossIncome(projection.grossIncome())
                .businessExpenses(projection.totalExpenses())
                .adjustedGrossIncome(netIncome)
                .taxableIncome(taxable)
                .reasonableSalary(salary)
                .distribution(distribution)
                .payrollTax(salary.multiply(policy.combinedPayrollRate()))
                .federalTax(bracketCalculator.computeTax(taxable, table))
                .stateTax(policy.stateTax(taxable, context.state(), policy.stateIncomeTaxRate()))
                .marginalRate(bracketCalculator.marginalRate(taxable, table))
                .build();
    }
}
