package com.taxdesk.engine.repository;

public enum CalculationKind {
    TAX_LIABILITY,
    PAYROLL_RUN,
    SALES_TAX,
    BOOKKEEPING_BATCH,
    RECONCILIATION
}
