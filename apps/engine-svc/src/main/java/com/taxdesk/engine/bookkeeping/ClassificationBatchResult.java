package com.taxdesk.engine.bookkeeping;

import java.math.BigDecimal;
import java.util.List;

public record ClassificationBatchResult(
        String clientId,
        String account,
        int transactionsProcessed,
        BigDecimal totalDebits,
        BigDecimal totalCredits,
        BigDecimal netChange,
        List<CategorySummary> categorySummary,
        int lowConfidenceCount,
        List<ClassifiedTransaction> transactions
) {
}
