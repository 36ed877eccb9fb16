package com.taxdesk.engine.payroll;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

public record PayrollRunResult(
        UUID runId,
        String clientId,
        String payPeriod,
        LocalDate payDate,
        int employeeCount,
        BigDecimal totalGross,
        BigDecimal totalNet,
        BigDecimal totalTaxes,
        List<PayrollItem> items,
        DepositRequirement depositRequirement,
        List<ComplianceAlert> complianceAlerts
) {

    public long errorCount() {
        return items.stream().filter(PayrollItem::failed).count();
    }
}
