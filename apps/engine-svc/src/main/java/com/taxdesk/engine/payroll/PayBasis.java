package com.taxdesk.engine.payroll;

import com.taxdesk.engine.error.CalculationException;
import java.util.Locale;

public enum PayBasis {
    HOURLY,
    SALARY;

    public static PayBasis fromCode(String raw) {
        if (raw == null || raw.isBlank()) {
            return HOURLY;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw CalculationException.invalidInput("Unsupported pay basis: " + raw);
        }
    }
}
