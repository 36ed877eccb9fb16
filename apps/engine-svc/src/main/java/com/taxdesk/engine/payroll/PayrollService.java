package com.taxdesk.engine.payroll;

import com.taxdesk.engine.audit.CalculationAuditLogger;
import com.taxdesk.engine.error.CalculationException;
import com.taxdesk.engine.error.ItemError;
import com.taxdesk.engine.repository.CalculationKind;
import com.taxdesk.engine.repository.CalculationRecord;
import com.taxdesk.engine.repository.CalculationRecordRepository;
import com.taxdesk.engine.tables.TaxTableRegistry;
import com.taxdesk.engine.tables.TaxTables;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Payroll run for a client: one item per employee, totals over the successful items, the deposit
 * requirement for those totals and compliance alerts.
 */
public class PayrollService {

    private static final Logger log = LoggerFactory.getLogger(PayrollService.class);

    private final TaxTableRegistry tableRegistry;
    private final GrossPayCalculator grossPayCalculator;
    private final WithholdingComposer withholdingComposer;
    private final DepositScheduleCalculator depositScheduleCalculator;
    private final PayrollComplianceChecker complianceChecker;
    private final CalculationRecordRepository calculationRecordRepository;
    private final CalculationAuditLogger auditLogger;
    private final int payDateOffsetDays;

    public PayrollService(TaxTableRegistry tableRegistry,
                          GrossPayCalculator grossPayCalculator,
                          WithholdingComposer withholdingComposer,
                          DepositScheduleCalculator depositScheduleCalculator,
                          PayrollComplianceChecker complianceChecker,
                          CalculationRecordRepository calculationRecordRepository,
                          CalculationAuditLogger auditLogger,
                          int payDateOffsetDays) {
        this.tableRegistry = tableRegistry;
        this.grossPayCalculator = grossPayCalculator;
        this.withholdingComposer = withholdingComposer;
        this.depositScheduleCalculator = depositScheduleCalculator;
        this.complianceChecker = complianceChecker;
        this.calculationRecordRepository = calculationRecordRepository;
        this.auditLogger = auditLogger;
        this.payDateOffsetDays = payDateOffsetDays;
    }

    public PayrollRunResult calculatePayroll(String clientId, String payPeriod, List<EmployeePayInput> employees) {
        if (clientId == null || clientId.isBlank()) {
            throw CalculationException.invalidInput("clientId must be provided");
        }
        if (employees == null || employees.isEmpty()) {
            throw CalculationException.invalidInput("No employees supplied");
        }
        PayPeriod period = PayPeriod.parse(payPeriod);
        LocalDate payDate = period.end().plusDays(payDateOffsetDays);
        TaxTables tables = tableRegistry.forYear(period.end().getYear());

        List<PayrollItem> items = new ArrayList<>(employees.size());
        List<PayrollLine> lines = new ArrayList<>();
        BigDecimal totalGross = BigDecimal.ZERO;
        BigDecimal totalNet = BigDecimal.ZERO;
        BigDecimal totalTaxes = BigDecimal.ZERO;
        for (EmployeePayInput employee : employees) {
            try {
                PayrollLine line = calculateLine(employee, tables);
                items.add(PayrollItem.success(line));
                lines.add(line);
                totalGross = totalGross.add(line.grossPay());
                totalNet = totalNet.add(line.netPay());
                totalTaxes = totalTaxes.add(line.totalTaxes());
            } catch (CalculationException ex) {
                log.warn("payroll_item_failed clientId={} employeeId={} kind={} message={}",
                        clientId, employee.employeeId(), ex.kind(), ex.getMessage());
                items.add(PayrollItem.failure(employee.employeeId(), ItemError.from(ex)));
            }
        }

        DepositRequirement deposit = depositScheduleCalculator.depositFor(totalTaxes, payDate);
        List<ComplianceAlert> alerts = complianceChecker.check(lines);
        PayrollRunResult result = new PayrollRunResult(
                UUID.randomUUID(),
                clientId,
                period.toString(),
                payDate,
                employees.size(),
                totalGross,
                totalNet,
                totalTaxes,
                List.copyOf(items),
                deposit,
                alerts
        );
        calculationRecordRepository.save(CalculationRecord.of(clientId, CalculationKind.PAYROLL_RUN, period.toString(),
                totalTaxes, "employees=" + employees.size() + " errors=" + result.errorCount()));
        auditLogger.record("payroll_run", clientId, period.toString(), employees.size(), (int) result.errorCount());
        return result;
    }

    public PayrollLine calculateLine(EmployeePayInput employee, TaxTables tables) {
        if (employee.employeeId() == null || employee.employeeId().isBlank()) {
            throw CalculationException.invalidInput("employeeId must be provided");
        }
        BigDecimal gross = grossPayCalculator.grossPay(employee);
        return withholdingComposer.composeLine(employee, gross, tables);
    }
}
