package com.taxdesk.engine.model;

import com.taxdesk.engine.error.CalculationException;
import java.util.Locale;

public enum FilingStatus {
    SINGLE("single"),
    MARRIED_JOINT("married_joint"),
    MARRIED_SEPARATE("married_separate"),
    HEAD_OF_HOUSEHOLD("head_of_household");

    private final String code;

    FilingStatus(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Parses the external code. {@code married} is accepted as an alias of {@code married_joint}
     * because withholding elections are usually recorded that way.
     */
    public static FilingStatus fromCode(String raw) {
        if (raw == null || raw.isBlank()) {
            throw CalculationException.invalidInput("filing status must be provided");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        if ("married".equals(normalized)) {
            return MARRIED_JOINT;
        }
        for (FilingStatus status : values()) {
            if (status.code.equals(normalized) || status.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return status;
            }
        }
        throw CalculationException.invalidInput("Unknown filing status: " + raw);
    }
}
