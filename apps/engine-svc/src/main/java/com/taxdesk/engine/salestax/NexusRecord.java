package com.taxdesk.engine.salestax;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Running economic-nexus totals for one client in one state.
 */
public record NexusRecord(
        String clientId,
        String jurisdiction,
        BigDecimal thresholdSalesAmount,
        Integer thresholdTransactionCount,
        BigDecimal cumulativeSales,
        long cumulativeTransactionCount,
        NexusStatus status,
        Instant lastUpdated
) {
}
