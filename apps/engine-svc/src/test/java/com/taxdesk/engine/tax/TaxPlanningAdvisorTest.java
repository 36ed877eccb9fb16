package com.taxdesk.engine.tax;

import static org.assertj.core.api.Assertions.assertThat;

import com.taxdesk.engine.config.EngineProperties;
import com.taxdesk.engine.model.FilingStatus;
import com.taxdesk.engine.model.Severity;
import com.taxdesk.engine.tables.TestTables;
import com.taxdesk.engine.tax.strategy.SelfEmploymentTaxCalculator;
import com.taxdesk.engine.tax.strategy.SoleProprietorTaxStrategy;
import com.taxdesk.engine.tax.strategy.TaxContext;
import com.taxdesk.engine.tax.strategy.TaxPolicy;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

class TaxPlanningAdvisorTest {

    private final TaxPlanningAdvisor advisor = new TaxPlanningAdvisor(EngineProperties.defaults().advisory());
    private final SoleProprietorTaxStrategy strategy =
            new SoleProprietorTaxStrategy(new BracketCalculator(), new SelfEmploymentTaxCalculator(), TaxPolicy.defaults());

    @Test
    void highEarningSoleProprietorGetsAllHints() {
        TaxCalculationResult result = soleProprietor("120000", "20000", "CA");

        List<TaxRecommendation> recommendations = advisor.recommend(result);

        assertThat(recommendations).extracting(TaxRecommendation::type).containsExactly(
                TaxRecommendation.RecommendationType.TAX_REDUCTION,
                TaxRecommendation.RecommendationType.ENTITY_ELECTION,
                TaxRecommendation.RecommendationType.RETIREMENT_PLANNING);
        TaxRecommendation reduction = recommendations.get(0);
        assertThat(reduction.priority()).isEqualTo(Severity.HIGH);
        assertThat(reduction.description()).startsWith("Your effective tax rate is above 25%.");
        assertThat(reduction.estimatedSavings()).isEqualByComparingTo("3224.06");
        assertThat(recommendations.get(1).estimatedSavings()).isEqualByComparingTo("7064.78");
        assertThat(recommendations.get(2).estimatedSavings()).isEqualByComparingTo("4697.00");
    }

    @Test
    void modestIncomeGetsNoHints() {
        TaxCalculationResult result = soleProprietor("30000", "10000", "TX");

        assertThat(advisor.recommend(result)).isEmpty();
    }

    @Test
    void quarterlyEstimateSplitsAnnualTax() {
        QuarterlyEstimate estimate = advisor.quarterlyEstimate(soleProprietor("120000", "20000", "CA"), 2024);

        assertThat(estimate.annualTotal()).isEqualByComparingTo("32240.55");
        assertThat(estimate.quarterlyAmount()).isEqualByComparingTo("8060.14");
        assertThat(estimate.safeHarborAmount()).isEqualByComparingTo("35464.61");
        assertThat(estimate.installments()).extracting(QuarterlyEstimate.Installment::dueDate).containsExactly(
                LocalDate.of(2024, 4, 15),
                LocalDate.of(2024, 6, 15),
                LocalDate.of(2024, 9, 15),
                LocalDate.of(2025, 1, 15));
    }

    private TaxCalculationResult soleProprietor(String gross, String expenses, String state) {
        return strategy.computeTax(FinancialProjection.of(new BigDecimal(gross), new BigDecimal(expenses)),
                new TaxContext(TestTables.tables2024(), state, FilingStatus.SINGLE));
    }
}
