package com.taxdesk.engine.bookkeeping;

import com.taxdesk.engine.error.CalculationException;
import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Normalized bank-feed row. Amounts are signed: negative for money leaving the account.
 */
public record TransactionRecord(LocalDate date, String description, BigDecimal amount, String referenceId) {

    public TransactionRecord {
        if (date == null) {
            throw CalculationException.invalidInput("transaction date must be provided");
        }
        if (amount == null) {
            throw CalculationException.invalidInput("transaction amount must be provided");
        }
        if (description == null) {
            description = "";
        }
    }
}
