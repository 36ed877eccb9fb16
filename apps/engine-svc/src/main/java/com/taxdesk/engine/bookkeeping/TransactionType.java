package com.taxdesk.engine.bookkeeping;

import java.math.BigDecimal;

public enum TransactionType {
    DEBIT,
    CREDIT;

    public static TransactionType fromAmount(BigDecimal amount) {
        return amount.signum() < 0 ? DEBIT : CREDIT;
    }
}
