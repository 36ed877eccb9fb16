package com.taxdesk.engine.payroll;

import com.taxdesk.engine.error.CalculationException;
import com.taxdesk.engine.model.Money;
import java.math.BigDecimal;

public class GrossPayCalculator {

    private final BigDecimal overtimeMultiplier;
    private final int periodsPerYear;

    public GrossPayCalculator(BigDecimal overtimeMultiplier, int periodsPerYear) {
        this.overtimeMultiplier = overtimeMultiplier;
        this.periodsPerYear = periodsPerYear;
    }

    public BigDecimal grossPay(EmployeePayInput input) {
        if (input.rateOrSalary() == null) {
            throw CalculationException.invalidInput("rate or salary must be provided for " + input.employeeId());
        }
        if (input.rateOrSalary().signum() < 0 || input.hoursWorked().signum() < 0 || input.overtimeHours().signum() < 0) {
            throw CalculationException.invalidInput("hours and pay rate must not be negative for " + input.employeeId());
        }
        if (input.payBasis() == PayBasis.SALARY) {
            return Money.round(Money.divide(input.rateOrSalary(), BigDecimal.valueOf(periodsPerYear)));
        }
        BigDecimal regular = input.hoursWorked().multiply(input.rateOrSalary());
        BigDecimal overtime = input.overtimeHours().multiply(input.rateOrSalary()).multiply(overtimeMultiplier);
        return Money.round(regular.add(overtime));
    }

    public int periodsPerYear() {
        return periodsPerYear;
    }
}
