package com.taxdesk.engine.tables;

import com.taxdesk.engine.error.CalculationException;
import com.taxdesk.engine.model.FilingStatus;
import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Every rate, bracket and threshold needed for one tax year. Built once by {@link TaxTableLoader}
 * and passed to the calculators; never mutated afterwards.
 */
public record TaxTables(
        int year,
        Map<FilingStatus, RateTable> incomeTax,
        Map<FilingStatus, BigDecimal> standardDeductions,
        WithholdingSchedule withholding,
        FicaRates fica,
        SelfEmploymentRates selfEmployment,
        Map<String, JurisdictionRule> jurisdictions
) {

    public TaxTables {
        incomeTax = Map.copyOf(incomeTax);
        standardDeductions = Map.copyOf(standardDeductions);
        jurisdictions = Map.copyOf(jurisdictions);
        if (withholding == null || fica == null || selfEmployment == null) {
            throw CalculationException.configuration("Tax tables for " + year + " are incomplete");
        }
    }

    public RateTable incomeTaxTable(FilingStatus status) {
        RateTable table = incomeTax.get(status);
        if (table == null) {
            throw CalculationException.configuration("No income tax table for " + status.code() + " in " + year);
        }
        return table;
    }

    public BigDecimal standardDeduction(FilingStatus status) {
        BigDecimal deduction = standardDeductions.get(status);
        if (deduction == null) {
            throw CalculationException.configuration("No standard deduction for " + status.code() + " in " + year);
        }
        return deduction;
    }

    public Optional<JurisdictionRule> jurisdiction(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(jurisdictions.get(code.trim().toUpperCase(Locale.ROOT)));
    }

    public JurisdictionRule requireJurisdiction(String code) {
        return jurisdiction(code).orElseThrow(() -> CalculationException.unsupportedJurisdiction(code));
    }
}
