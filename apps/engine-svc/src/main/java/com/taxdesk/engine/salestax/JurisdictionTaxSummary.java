package com.taxdesk.engine.salestax;

import com.taxdesk.engine.error.ItemError;
import com.taxdesk.engine.filing.FilingRequirement;
import java.math.BigDecimal;

/**
 * Totals for one (state, jurisdiction) group. When {@code error} is set the monetary fields
 * other than the gross sums are null.
 */
public record JurisdictionTaxSummary(
        String state,
        String jurisdiction,
        int transactionCount,
        BigDecimal grossSales,
        BigDecimal taxableSales,
        BigDecimal exemptSales,
        BigDecimal taxRate,
        BigDecimal taxDue,
        NexusUpdate nexus,
        FilingRequirement filingRequirement,
        ItemError error
) {
}
