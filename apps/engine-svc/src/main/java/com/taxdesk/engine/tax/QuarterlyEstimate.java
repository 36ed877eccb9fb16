package com.taxdesk.engine.tax;

import com.taxdesk.engine.model.Money;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Four equal estimated payments for a tax year plus the 110% safe-harbor amount.
 */
public record QuarterlyEstimate(
        BigDecimal annualTotal,
        BigDecimal quarterlyAmount,
        List<Installment> installments,
        BigDecimal safeHarborAmount
) {

    private static final BigDecimal QUARTERS = BigDecimal.valueOf(4);
    private static final BigDecimal SAFE_HARBOR_FACTOR = new BigDecimal("1.1");

    public record Installment(int quarter, LocalDate dueDate, BigDecimal amount) {
    }

    public static QuarterlyEstimate of(BigDecimal annualTax, int taxYear) {
        BigDecimal quarterly = Money.round(Money.divide(annualTax, QUARTERS));
        List<Installment> installments = List.of(
                new Installment(1, LocalDate.of(taxYear, 4, 15), quarterly),
                new Installment(2, LocalDate.of(taxYear, 6, 15), quarterly),
                new Installment(3, LocalDate.of(taxYear, 9, 15), quarterly),
                new Installment(4, LocalDate.of(taxYear + 1, 1, 15), quarterly)
        );
        return new QuarterlyEstimate(Money.round(annualTax), quarterly, installments,
                Money.round(annualTax.multiply(SAFE_HARBOR_FACTOR)));
    }
}
