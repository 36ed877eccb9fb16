package com.taxdesk.engine.tax.strategy;

import com.taxdesk.engine.tables.SelfEmploymentRates;
import java.math.BigDecimal;
import org.springframework.stereotype.Component;

/**
 * Social Security (capped at the wage base) plus Medicare (uncapped) plus additional Medicare above
 * the threshold, all on the taxable share of net earnings.
 */
@Component
public class SelfEmploymentTaxCalculator {

    public BigDecimal compute(BigDecimal netEarnings, SelfEmploymentRates rates) {
        if (netEarnings == null || netEarnings.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal seIncome = netEarnings.multiply(rates.netEarningsFactor());
        BigDecimal socialSecurity = seIncome.min(rates.socialSecurityWageBase()).multiply(rates.socialSecurityRate());
        BigDecimal medicare = seIncome.multiply(rates.medicareRate());
        BigDecimal additionalMedicare = BigDecimal.ZERO;
        if (seIncome.compareTo(rates.additionalMedicareThreshold()) > 0) {
            additionalMedicare = seIncome.subtract(rates.additionalMedicareThreshold()).multiply(rates.additionalMedicareRate());
        }
        return socialSecurity.add(medicare).add(additionalMedicare);
    }
}
