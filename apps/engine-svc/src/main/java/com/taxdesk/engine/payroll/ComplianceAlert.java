package com.taxdesk.engine.payroll;

import com.taxdesk.engine.model.Severity;

public record ComplianceAlert(AlertType type, Severity severity, String employeeId, String message, String recommendation) {

    public enum AlertType {
        MINIMUM_WAGE_VIOLATION,
        OVERTIME_COMPLIANCE,
        HIGH_WITHHOLDING
    }
}
