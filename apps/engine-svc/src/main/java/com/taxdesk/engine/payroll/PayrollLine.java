package com.taxdesk.engine.payroll;

import java.math.BigDecimal;

/**
 * Per-period pay breakdown. All amounts are rounded to cents and
 * {@code netPay = grossPay - totalTaxes - otherDeductions} holds exactly on the rounded values.
 */
public record PayrollLine(
        String employeeId,
        BigDecimal hoursWorked,
        BigDecimal overtimeHours,
        BigDecimal grossPay,
        BigDecimal federalWithholding,
        BigDecimal stateWithholding,
        BigDecimal socialSecurity,
        BigDecimal medicare,
        BigDecimal additionalMedicare,
        BigDecimal otherDeductions,
        BigDecimal totalTaxes,
        BigDecimal netPay
) {
}
