package com.taxdesk.engine.bookkeeping;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

public record ReconciliationIssue(IssueType type, int count, List<FlaggedTransaction> transactions) {

    public enum IssueType {
        DUPLICATES,
        LARGE_AMOUNTS,
        ROUND_AMOUNTS
    }

    /**
     * {@code originalId} is only set for duplicates and points at the first occurrence.
     */
    public record FlaggedTransaction(UUID id, UUID originalId, LocalDate date, BigDecimal amount, String description) {
    }
}
