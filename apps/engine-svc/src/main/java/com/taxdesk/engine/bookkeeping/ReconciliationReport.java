package com.taxdesk.engine.bookkeeping;

import java.math.BigDecimal;
import java.util.List;

public record ReconciliationReport(
        String clientId,
        String account,
        String period,
        BigDecimal beginningBalance,
        BigDecimal endingBalance,
        int totalTransactions,
        BigDecimal totalDebits,
        BigDecimal totalCredits,
        List<ReconciliationIssue> issues,
        ReconciliationStatus status
) {

    public enum ReconciliationStatus {
        COMPLETED,
        NEEDS_REVIEW
    }

    public int issuesFound() {
        return issues.size();
    }
}
