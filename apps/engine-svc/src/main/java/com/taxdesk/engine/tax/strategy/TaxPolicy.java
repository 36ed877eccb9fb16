package com.taxdesk.engine.tax.strategy;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Simplifying policy parameters the entity strategies rely on. None of these are statutory; they
 * are illustrative defaults overridable through configuration.
 */
public record TaxPolicy(
        BigDecimal stateIncomeTaxRate,
        Set<String> noIncomeTaxStates,
        BigDecimal corporateRate,
        BigDecimal corporateStateRate,
        BigDecimal sCorpSalaryRatio,
        BigDecimal sCorpSalaryCeiling,
        BigDecimal combinedPayrollRate
) {

    public TaxPolicy {
        noIncomeTaxStates = noIncomeTaxStates == null ? Set.of() : noIncomeTaxStates.stream()
                .map(s -> s.trim().toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public static TaxPolicy defaults() {
        return new TaxPolicy(
                new BigDecimal("0.05"),
                Set.of("TX"),
                new BigDecimal("0.21"),
                new BigDecimal("0.06"),
                new BigDecimal("0.40"),
                new BigDecimal("100000"),
                new BigDecimal("0.153")
        );
    }

    /**
     * Flat-rate state approximation; zero when no state is known or the state has no income tax.
     */
    public BigDecimal stateTax(BigDecimal base, String state, BigDecimal rate) {
        if (state == null || state.isBlank() || noIncomeTaxStates.contains(state.trim().toUpperCase(Locale.ROOT))) {
            return BigDecimal.ZERO;
        }
        return base.multiply(rate);
    }
}
