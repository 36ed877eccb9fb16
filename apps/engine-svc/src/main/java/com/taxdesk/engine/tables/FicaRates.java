package com.taxdesk.engine.tables;

import java.math.BigDecimal;

/**
 * Employee-side payroll tax constants for one tax year.
 */
public record FicaRates(
        BigDecimal socialSecurityRate,
        BigDecimal socialSecurityWageBase,
        BigDecimal medicareRate,
        BigDecimal additionalMedicareRate,
        BigDecimal additionalMedicareThreshold
) {
}
