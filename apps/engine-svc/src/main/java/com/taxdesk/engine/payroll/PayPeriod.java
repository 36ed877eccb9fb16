package com.taxdesk.engine.payroll;

import com.taxdesk.engine.error.CalculationException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Inclusive pay period, written {@code YYYY-MM-DD to YYYY-MM-DD}.
 */
public record PayPeriod(LocalDate start, LocalDate end) {

    private static final String SEPARATOR = " to ";

    public PayPeriod {
        if (start == null || end == null) {
            throw CalculationException.invalidInput("pay period start and end must be provided");
        }
        if (end.isBefore(start)) {
            throw CalculationException.invalidInput("pay period end " + end + " is before start " + start);
        }
    }

    public static PayPeriod parse(String raw) {
        if (raw == null || !raw.contains(SEPARATOR)) {
            throw CalculationException.invalidInput("Invalid pay period, expected 'YYYY-MM-DD to YYYY-MM-DD': " + raw);
        }
        String[] parts = raw.split(SEPARATOR, 2);
        try {
            return new PayPeriod(LocalDate.parse(parts[0].trim()), LocalDate.parse(parts[1].trim()));
        } catch (DateTimeParseException ex) {
            throw CalculationException.invalidInput("Invalid pay period dates: " + raw);
        }
    }

    @Override
    public String toString() {
        return start + SEPARATOR + end;
    }
}
