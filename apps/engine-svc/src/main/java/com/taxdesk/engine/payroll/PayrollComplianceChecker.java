package com.taxdesk.engine.payroll;

import com.taxdesk.engine.config.EngineProperties;
import com.taxdesk.engine.model.Money;
import com.taxdesk.engine.model.Severity;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Flags computed pay lines that deserve review. Never changes the pay itself.
 */
public class PayrollComplianceChecker {

    private final EngineProperties.Payroll settings;

    public PayrollComplianceChecker(EngineProperties.Payroll settings) {
        this.settings = settings;
    }

    public List<ComplianceAlert> check(List<PayrollLine> lines) {
        List<ComplianceAlert> alerts = new ArrayList<>();
        for (PayrollLine line : lines) {
            if (line.hoursWorked().signum() > 0) {
                BigDecimal effectiveRate = Money.divide(line.grossPay(), line.hoursWorked());
                if (effectiveRate.compareTo(settings.minimumWage()) < 0) {
                    alerts.add(new ComplianceAlert(
                            ComplianceAlert.AlertType.MINIMUM_WAGE_VIOLATION,
                            Severity.HIGH,
                            line.employeeId(),
                            "Effective rate $" + Money.round(effectiveRate).toPlainString() + " below federal minimum wage",
                            "Review hourly rate and ensure compliance"
                    ));
                }
            }
        }
        for (PayrollLine line : lines) {
            if (line.hoursWorked().compareTo(settings.overtimeHoursThreshold()) > 0 && line.overtimeHours().signum() == 0) {
                alerts.add(new ComplianceAlert(
                        ComplianceAlert.AlertType.OVERTIME_COMPLIANCE,
                        Severity.MEDIUM,
                        line.employeeId(),
                        "Employee worked " + line.hoursWorked().stripTrailingZeros().toPlainString() + " hours with no overtime recorded",
                        "Verify overtime exemption status or correct hours"
                ));
            }
        }
        for (PayrollLine line : lines) {
            BigDecimal ratio = Money.divide(line.totalTaxes(), line.grossPay());
            if (ratio.compareTo(settings.highWithholdingRatio()) > 0) {
                alerts.add(new ComplianceAlert(
                        ComplianceAlert.AlertType.HIGH_WITHHOLDING,
                        Severity.LOW,
                        line.employeeId(),
                        String.format(Locale.US, "High withholding rate: %s%%", ratio.movePointRight(2).setScale(1, RoundingMode.HALF_UP).toPlainString()),
                        "Review withholding elections and deductions"
                ));
            }
        }
        return List.copyOf(alerts);
    }
}
