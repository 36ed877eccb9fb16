package com.taxdesk.engine.salestax;

import com.taxdesk.engine.error.CalculationException;
import java.util.Locale;

public record NexusKey(String clientId, String jurisdiction) {

    public NexusKey {
        if (clientId == null || clientId.isBlank()) {
            throw CalculationException.invalidInput("clientId must be provided");
        }
        if (jurisdiction == null || jurisdiction.isBlank()) {
            throw CalculationException.invalidInput("jurisdiction must be provided");
        }
        jurisdiction = jurisdiction.trim().toUpperCase(Locale.ROOT);
    }
}
