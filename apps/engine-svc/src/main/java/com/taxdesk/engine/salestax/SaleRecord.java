package com.taxdesk.engine.salestax;

import java.math.BigDecimal;

/**
 * One sale for the sales-tax run. {@code jurisdiction} is {@code State} for state-level sales,
 * any other value selects the combined state and local rate.
 */
public record SaleRecord(String state, String jurisdiction, BigDecimal amount, boolean taxable) {

    public static final String STATE_JURISDICTION = "State";

    public SaleRecord {
        if (jurisdiction == null || jurisdiction.isBlank()) {
            jurisdiction = STATE_JURISDICTION;
        }
    }
}
