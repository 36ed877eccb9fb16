package com.taxdesk.engine.payroll;

public enum DepositSchedule {
    NEXT_BUSINESS_DAY,
    SEMI_WEEKLY,
    MONTHLY
}
