package com.taxdesk.engine.tables;

import com.taxdesk.engine.error.CalculationException;
import com.taxdesk.engine.model.FilingStatus;
import java.math.BigDecimal;
import java.util.Map;

/**
 * Annual percentage-method withholding tables plus the adjustments applied before them.
 */
public record WithholdingSchedule(
        BigDecimal perAllowanceAmount,
        Map<FilingStatus, BigDecimal> standardDeductions,
        Map<FilingStatus, RateTable> tables
) {

    public WithholdingSchedule {
        standardDeductions = Map.copyOf(standardDeductions);
        tables = Map.copyOf(tables);
    }

    public RateTable tableFor(FilingStatus status) {
        RateTable table = tables.get(status);
        if (table == null) {
            throw CalculationException.configuration("No withholding table configured for " + status.code());
        }
        return table;
    }

    public BigDecimal standardDeductionFor(FilingStatus status) {
        BigDecimal deduction = standardDeductions.get(status);
        if (deduction == null) {
            throw CalculationException.configuration("No withholding standard deduction configured for " + status.code());
        }
        return deduction;
    }
}
