package com.taxdesk.engine.tax;

import com.taxdesk.engine.model.Money;
import com.taxdesk.engine.tax.strategy.EntityType;
import java.math.BigDecimal;

/**
 * Uniform output of every entity strategy. Fields that do not apply to a variant are null
 * (self-employment tax for C-corps, salary split outside S-corps).
 */
public record TaxCalculationResult(
        EntityType entityType,
        BigDecimal grossIncome,
        BigDecimal businessExpenses,
        BigDecimal adjustedGrossIncome,
        BigDecimal standardDeduction,
        BigDecimal taxableIncome,
        BigDecimal federalTax,
        BigDecimal stateTax,
        BigDecimal selfEmploymentTax,
        BigDecimal payrollTax,
        BigDecimal reasonableSalary,
        BigDecimal distribution,
        BigDecimal totalTax,
        BigDecimal effectiveRate,
        BigDecimal marginalRate
) {

    public static Builder builder(EntityType entityType) {
        return new Builder(entityType);
    }

    public BigDecimal selfEmploymentTaxOrZero() {
        return selfEmploymentTax != null ? selfEmploymentTax : Money.ZERO;
    }

    public static final class Builder {
        private final EntityType entityType;
        private BigDecimal grossIncome;
        private BigDecimal businessExpenses;
        private BigDecimal adjustedGrossIncome;
        private BigDecimal standardDeduction;
        private BigDecimal taxableIncome;
        private BigDecimal federalTax;
        private BigDecimal stateTax;
        private BigDecimal selfEmploymentTax;
        private BigDecimal payrollTax;
        private BigDecimal reasonableSalary;
        private BigDecimal distribution;
        private BigDecimal marginalRate;

        private Builder(EntityType entityType) {
            this.entityType = entityType;
        }

        public Builder grossIncome(BigDecimal value) {
            this.grossIncome = value;
            return this;
        }

        public Builder businessExpenses(BigDecimal value) {
            this.businessExpenses = value;
            return this;
        }

        public Builder adjustedGrossIncome(BigDecimal value) {
            this.adjustedGrossIncome = value;
            return this;
        }

        public Builder standardDeduction(BigDecimal value) {
            this.standardDeduction = value;
            return this;
        }

        public Builder taxableIncome(BigDecimal value) {
            this.taxableIncome = value;
            return this;
        }

        public Builder federalTax(BigDecimal value) {
            this.federalTax = value;
            return this;
        }

        public Builder stateTax(BigDecimal value) {
            this.stateTax = value;
            return this;
        }

        public Builder selfEmploymentTax(BigDecimal value) {
            this.selfEmploymentTax = value;
            return this;
        }

        public Builder payrollTax(BigDecimal value) {
            this.payrollTax = value;
            return this;
        }

        public Builder reasonableSalary(BigDecimal value) {
            this.reasonableSalary = value;
            return this;
        }

        public Builder distribution(BigDecimal value) {
            this.distribution = value;
            return this;
        }

        public Builder marginalRate(BigDecimal value) {
            this.marginalRate = value;
            return this;
        }

        /**
         * Rounds every component, sums the rounded components into the total and derives the
         * effective rate from the adjusted gross income.
         */
        public TaxCalculationResult build() {
            BigDecimal federal = Money.round(federalTax);
            BigDecimal state = Money.round(stateTax);
            BigDecimal se = selfEmploymentTax == null ? null : Money.round(selfEmploymentTax);
            BigDecimal payroll = payrollTax == null ? null : Money.round(payrollTax);
            BigDecimal total = federal.add(state)
                    .add(se == null ? BigDecimal.ZERO : se)
                    .add(payroll == null ? BigDecimal.ZERO : payroll);
            BigDecimal agi = Money.round(adjustedGrossIncome);
            BigDecimal effective = agi.signum() > 0 ? Money.divide(total, agi) : BigDecimal.ZERO;
            return new TaxCalculationResult(
                    entityType,
                    Money.round(grossIncome),
                    Money.round(businessExpenses),
                    agi,
                    standardDeduction == null ? null : Money.round(standardDeduction),
                    Money.round(taxableIncome),
                    federal,
                    state,
                    se,
                    payroll,
                    reasonableSalary == null ? null : Money.round(reasonableSalary),
                    distribution == null ? null : Money.round(distribution),
                    total,
                    Money.rate(effective),
                    Money.rate(marginalRate)
            );
        }
    }
}
