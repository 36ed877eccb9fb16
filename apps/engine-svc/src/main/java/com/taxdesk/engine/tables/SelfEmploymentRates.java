package com.taxdesk.engine.tables;

import java.math.BigDecimal;

/**
 * Self-employment tax constants. {@code netEarningsFactor} is the share of net earnings subject to
 * the tax (92.35%).
 */
public record SelfEmploymentRates(
        BigDecimal netEarningsFactor,
        BigDecimal socialSecurityRate,
        BigDecimal socialSecurityWageBase,
        BigDecimal medicareRate,
        BigDecimal additionalMedicareRate,
        BigDecimal additionalMedicareThreshold
) {
}
