package com.taxdesk.engine.salestax;

import com.taxdesk.engine.filing.FilingRequirement;
import java.math.BigDecimal;
import java.util.List;

public record SalesTaxResult(
        String clientId,
        String period,
        int totalTransactions,
        BigDecimal totalTaxDue,
        List<JurisdictionTaxSummary> calculationsByJurisdiction,
        List<NexusAlert> nexusAlerts,
        List<FilingRequirement> filingRequirements
) {
}
