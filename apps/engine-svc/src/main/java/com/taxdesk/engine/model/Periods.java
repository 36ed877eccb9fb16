package com.taxdesk.engine.model;

import com.taxdesk.engine.error.CalculationException;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;

public final class Periods {

    private Periods() {
    }

    public static YearMonth parseMonth(String period) {
        if (period == null || period.isBlank()) {
            throw CalculationException.invalidInput("period must be provided as YYYY-MM");
        }
        try {
            return YearMonth.parse(period.trim());
        } catch (DateTimeParseException ex) {
            throw CalculationException.invalidInput("Invalid period format, expected YYYY-MM: " + period);
        }
    }
}
