package com.taxdesk.engine.payroll;

import com.taxdesk.engine.error.CalculationException;
import com.taxdesk.engine.model.FilingStatus;
import com.taxdesk.engine.model.Money;
import com.taxdesk.engine.tables.FicaRates;
import com.taxdesk.engine.tables.TaxTableRegistry;
import com.taxdesk.engine.tables.TaxTables;
import com.taxdesk.engine.tables.WithholdingSchedule;
import com.taxdesk.engine.tax.BracketCalculator;
import java.math.BigDecimal;

/**
 * Federal income tax withholding and the employee FICA components for a pay period.
 *
 * <p>Bracket withholding always works on annualized figures; callers divide by the number of pay
 * periods. FICA works on the per-period gross directly and never interacts with the bracket part.
 */
public class WithholdingComposer {

    private final BracketCalculator bracketCalculator;
    private final TaxTableRegistry tableRegistry;
    private final int periodsPerYear;
    private final BigDecimal stateWithholdingRate;

    public WithholdingComposer(BracketCalculator bracketCalculator, TaxTableRegistry tableRegistry,
                               int periodsPerYear, BigDecimal stateWithholdingRate) {
        this.bracketCalculator = bracketCalculator;
        this.tableRegistry = tableRegistry;
        this.periodsPerYear = periodsPerYear;
        this.stateWithholdingRate = stateWithholdingRate;
    }

    /**
     * Full per-period breakdown for one employee. Each component is rounded to cents before the
     * totals are taken. A negative net pay is rejected rather than clamped.
     */
    public PayrollLine composeLine(EmployeePayInput input, BigDecimal grossPay, TaxTables tables) {
        BigDecimal periods = BigDecimal.valueOf(periodsPerYear);
        BigDecimal annualWithholding = computeWithholding(grossPay.multiply(periods), input.filingStatus(),
                input.allowances(), input.additionalWithholding(), tables);
        BigDecimal federal = Money.round(Money.divide(annualWithholding, periods));
        BigDecimal state = Money.round(grossPay.multiply(stateWithholdingRate));
        FicaBreakdown fica = computeFica(grossPay, periodsPerYear, tables);
        BigDecimal socialSecurity = Money.round(fica.socialSecurity());
        BigDecimal medicare = Money.round(fica.medicare());
        BigDecimal additionalMedicare = Money.round(fica.additionalMedicare());
        BigDecimal otherDeductions = Money.round(input.otherDeductions());
        if (otherDeductions.signum() < 0) {
            throw CalculationException.invalidInput("other deductions must not be negative for " + input.employeeId());
        }

        BigDecimal totalTaxes = federal.add(state).add(socialSecurity).add(medicare).add(additionalMedicare);
        BigDecimal netPay = grossPay.subtract(totalTaxes).subtract(otherDeductions);
        if (netPay.signum() < 0) {
            throw CalculationException.invalidInput("Net pay for " + input.employeeId() + " would be negative: " + netPay);
        }
        return new PayrollLine(
                input.employeeId(),
                input.hoursWorked(),
                input.overtimeHours(),
                grossPay,
                federal,
                state,
                socialSecurity,
                medicare,
                additionalMedicare,
                otherDeductions,
                totalTaxes,
                netPay
        );
    }

    public BigDecimal computeWithholding(BigDecimal annualizedGross, FilingStatus filingStatus, int allowances,
                                         BigDecimal additionalFlatAmount, int year) {
        return computeWithholding(annualizedGross, filingStatus, allowances, additionalFlatAmount, tableRegistry.forYear(year));
    }

    public BigDecimal computeWithholding(BigDecimal annualizedGross, FilingStatus filingStatus, int allowances,
                                         BigDecimal additionalFlatAmount, TaxTables tables) {
        if (annualizedGross == null || annualizedGross.signum() < 0) {
            throw CalculationException.invalidInput("annualized gross must not be negative");
        }
        if (allowances < 0) {
            throw CalculationException.invalidInput("allowances must not be negative");
        }
        BigDecimal additional = additionalFlatAmount == null ? BigDecimal.ZERO : additionalFlatAmount;
        if (additional.signum() < 0) {
            throw CalculationException.invalidInput("additional withholding must not be negative");
        }
        WithholdingSchedule schedule = tables.withholding();
        BigDecimal allowanceAmount = schedule.perAllowanceAmount().multiply(BigDecimal.valueOf(allowances));
        BigDecimal taxableBase = Money.floorAtZero(annualizedGross
                .subtract(allowanceAmount)
                .subtract(schedule.standardDeductionFor(filingStatus)));
        return bracketCalculator.computeTax(taxableBase, schedule.tableFor(filingStatus)).add(additional);
    }

    public FicaBreakdown computeFica(BigDecimal grossPay, int periodsPerYear, int year) {
        return computeFica(grossPay, periodsPerYear, tableRegistry.forYear(year));
    }

    public FicaBreakdown computeFica(BigDecimal grossPay, int periodsPerYear, TaxTables tables) {
        if (grossPay == null || grossPay.signum() < 0) {
            throw CalculationException.invalidInput("gross pay must not be negative");
        }
        if (periodsPerYear <= 0) {
            throw CalculationException.invalidInput("periods per year must be positive");
        }
        FicaRates rates = tables.fica();
        BigDecimal periods = BigDecimal.valueOf(periodsPerYear);
        BigDecimal periodWageBase = Money.divide(rates.socialSecurityWageBase(), periods);
        BigDecimal socialSecurity = grossPay.min(periodWageBase).multiply(rates.socialSecurityRate());
        BigDecimal medicare = grossPay.multiply(rates.medicareRate());
        BigDecimal additionalMedicare = BigDecimal.ZERO;
        if (grossPay.multiply(periods).compareTo(rates.additionalMedicareThreshold()) > 0) {
            additionalMedicare = grossPay.multiply(rates.additionalMedicareRate());
        }
        return new FicaBreakdown(socialSecurity, medicare, additionalMedicare);
    }
}
