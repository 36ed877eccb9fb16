package com.taxdesk.engine.tax;

import com.taxdesk.engine.config.EngineProperties;
import com.taxdesk.engine.model.Money;
import com.taxdesk.engine.model.Severity;
import com.taxdesk.engine.tax.strategy.EntityType;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Post-processing applied to every strategy result: planning hints with a rough savings figure.
 */
public class TaxPlanningAdvisor {

    private static final BigDecimal TAX_REDUCTION_SHARE = new BigDecimal("0.10");
    private static final BigDecimal ENTITY_ELECTION_SHARE = new BigDecimal("0.5");
    private static final BigDecimal RETIREMENT_CONTRIBUTION_SHARE = new BigDecimal("0.25");

    private final EngineProperties.Advisory advisory;

    public TaxPlanningAdvisor(EngineProperties.Advisory advisory) {
        this.advisory = advisory;
    }

    public QuarterlyEstimate quarterlyEstimate(TaxCalculationResult result, int taxYear) {
        return QuarterlyEstimate.of(result.totalTax(), taxYear);
    }

    public List<TaxRecommendation> recommend(TaxCalculationResult result) {
        List<TaxRecommendation> recommendations = new ArrayList<>();
        if (result.effectiveRate().compareTo(advisory.effectiveRateThreshold()) > 0) {
            recommendations.add(new TaxRecommendation(
                    TaxRecommendation.RecommendationType.TAX_REDUCTION,
                    Severity.HIGH,
                    "High Tax Rate - Consider Tax Strategies",
                    "Your effective tax rate is above " + percent(advisory.effectiveRateThreshold())
                            + ". Consider retirement contributions, equipment purchases, or entity restructuring.",
                    Money.round(result.totalTax().multiply(TAX_REDUCTION_SHARE))
            ));
        }
        if (result.entityType() == EntityType.SOLE_PROPRIETORSHIP
                && result.grossIncome().compareTo(advisory.entityElectionIncome()) > 0) {
            recommendations.add(new TaxRecommendation(
                    TaxRecommendation.RecommendationType.ENTITY_ELECTION,
                    Severity.MEDIUM,
                    "Consider S-Corp Election",
                    "With your income level, an S-Corp election could save on self-employment taxes.",
                    Money.round(result.selfEmploymentTaxOrZero().multiply(ENTITY_ELECTION_SHARE))
            ));
        }
        if (result.taxableIncome().compareTo(advisory.retirementIncome()) > 0) {
            BigDecimal contribution = result.taxableIncome().multiply(RETIREMENT_CONTRIBUTION_SHARE)
                    .min(advisory.retirementContributionCap());
            recommendations.add(new TaxRecommendation(
                    TaxRecommendation.RecommendationType.RETIREMENT_PLANNING,
                    Severity.MEDIUM,
                    "Maximize Retirement Contributions",
                    "Consider maximizing SEP-IRA or Solo 401(k) contributions to reduce taxable income.",
                    Money.round(contribution.multiply(result.marginalRate()))
            ));
        }
        return List.copyOf(recommendations);
    }

    private static String percent(BigDecimal ratio) {
        return ratio.movePointRight(2).stripTrailingZeros().toPlainString() + "%";
    }
}
