package com.taxdesk.engine.payroll;

import com.taxdesk.engine.error.ItemError;

/**
 * Outcome for one employee: exactly one of {@code line} and {@code error} is set.
 */
public record PayrollItem(String employeeId, PayrollLine line, ItemError error) {

    public static PayrollItem success(PayrollLine line) {
        return new PayrollItem(line.employeeId(), line, null);
    }

    public static PayrollItem failure(String employeeId, ItemError error) {
        return new PayrollItem(employeeId, null, error);
    }

    public boolean failed() {
        return error != null;
    }
}
