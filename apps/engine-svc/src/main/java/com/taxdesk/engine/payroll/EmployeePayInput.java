package com.taxdesk.engine.payroll;

import com.taxdesk.engine.model.FilingStatus;
import java.math.BigDecimal;

/**
 * One employee's pay data for a period. {@code rateOrSalary} is the hourly rate for hourly staff
 * and the annual salary for salaried staff. Values are checked per employee when the run is
 * computed so a bad row only fails its own item.
 */
public record EmployeePayInput(
        String employeeId,
        PayBasis payBasis,
        BigDecimal hoursWorked,
        BigDecimal overtimeHours,
        BigDecimal rateOrSalary,
        FilingStatus filingStatus,
        int allowances,
        BigDecimal additionalWithholding,
        BigDecimal otherDeductions
) {

    public EmployeePayInput {
        if (payBasis == null) {
            payBasis = PayBasis.HOURLY;
        }
        if (hoursWorked == null) {
            hoursWorked = BigDecimal.ZERO;
        }
        if (overtimeHours == null) {
            overtimeHours = BigDecimal.ZERO;
        }
        if (filingStatus == null) {
            filingStatus = FilingStatus.SINGLE;
        }
        if (additionalWithholding == null) {
            additionalWithholding = BigDecimal.ZERO;
        }
        if (otherDeductions == null) {
            otherDeductions = BigDecimal.ZERO;
        }
    }

    public static EmployeePayInput hourly(String employeeId, BigDecimal hours, BigDecimal overtimeHours, BigDecimal rate) {
        return new EmployeePayInput(employeeId, PayBasis.HOURLY, hours, overtimeHours, rate, FilingStatus.SINGLE, 0, null, null);
    }

    public static EmployeePayInput salaried(String employeeId, BigDecimal annualSalary) {
        return new EmployeePayInput(employeeId, PayBasis.SALARY, null, null, annualSalary, FilingStatus.SINGLE, 0, null, null);
    }
}
