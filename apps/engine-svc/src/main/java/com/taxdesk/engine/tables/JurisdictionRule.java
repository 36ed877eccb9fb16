package com.taxdesk.engine.tables;

import java.math.BigDecimal;

/**
 * Sales-tax rates and economic-nexus thresholds for one state. A null {@code nexusSales} means the
 * state levies no sales tax and nothing is tracked there.
 */
public record JurisdictionRule(
        String code,
        BigDecimal stateRate,
        BigDecimal combinedRate,
        BigDecimal nexusSales,
        Integer nexusTransactions
) {

    public boolean hasSalesTaxRegime() {
        return nexusSales != null;
    }

    /**
     * State rate for the {@code State} jurisdiction, the combined state+local average otherwise.
     */
    public BigDecimal rateFor(String jurisdiction) {
        if (jurisdiction == null || jurisdiction.isBlank() || "state".equalsIgnoreCase(jurisdiction.trim())) {
            return stateRate;
        }
        return combinedRate != null ? combinedRate : stateRate;
    }
}
