package com.taxdesk.engine.payroll;

import java.math.BigDecimal;
import java.time.LocalDate;

public record DepositRequirement(
        BigDecimal totalAmount,
        DepositSchedule schedule,
        LocalDate depositDate,
        BigDecimal federalAmount,
        BigDecimal stateAmount
) {
}
