package com.taxdesk.engine.filing;

import com.taxdesk.engine.config.EngineProperties;
import java.math.BigDecimal;

/**
 * Tax-due cut-offs: above {@code monthly} files monthly, above {@code quarterly} files quarterly,
 * anything else annually.
 */
public record FilingThresholds(BigDecimal monthly, BigDecimal quarterly) {

    public static FilingThresholds from(EngineProperties.Filing filing) {
        return new FilingThresholds(filing.monthlyThreshold(), filing.quarterlyThreshold());
    }

    public static FilingThresholds defaults() {
        return from(EngineProperties.defaults().filing());
    }
}
