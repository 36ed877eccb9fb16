package com.taxdesk.engine.bookkeeping;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

public record ClassifiedTransaction(
        UUID id,
        LocalDate date,
        String description,
        BigDecimal amount,
        String referenceId,
        TransactionType type,
        String category,
        String subcategory,
        BigDecimal confidence
) {

    public static ClassifiedTransaction of(TransactionRecord record, Classification classification) {
        return new ClassifiedTransaction(
                UUID.randomUUID(),
                record.date(),
                record.description(),
                record.amount(),
                record.referenceId(),
                TransactionType.fromAmount(record.amount()),
                classification.category(),
                classification.subcategory(),
                classification.confidence()
        );
    }
}
