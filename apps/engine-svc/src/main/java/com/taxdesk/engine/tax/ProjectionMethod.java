package com.taxdesk.engine.tax;

import com.taxdesk.engine.error.CalculationException;
import java.util.Locale;

public enum ProjectionMethod {
    /** Year-to-date actuals scaled to a full year. */
    YTD_ANNUALIZED,
    /** Prior calendar year actuals. */
    PRIOR_YEAR,
    /** Figures supplied directly by the caller. */
    PROVIDED;

    public static ProjectionMethod fromCode(String raw) {
        if (raw == null || raw.isBlank()) {
            return YTD_ANNUALIZED;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw CalculationException.invalidInput("Unsupported projection method: " + raw);
        }
    }
}
