package com.taxdesk.engine.tax;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.taxdesk.engine.bookkeeping.ClassifiedTransaction;
import com.taxdesk.engine.bookkeeping.TransactionType;
import com.taxdesk.engine.error.CalculationException;
import com.taxdesk.engine.error.ErrorKind;
import com.taxdesk.engine.repository.InMemoryClassifiedTransactionRepository;
import com.taxdesk.engine.tax.DeductionAnalysis.CategoryDeduction;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DeductionAnalyzerTest {

    private InMemoryClassifiedTransactionRepository transactions;
    private DeductionAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        transactions = new InMemoryClassifiedTransactionRepository();
        analyzer = new DeductionAnalyzer(transactions);
    }

    @Test
    void analyzesSuppliedExpenses() {
        Map<String, Map<String, BigDecimal>> expenses = new LinkedHashMap<>();
        expenses.put("Meals & Entertainment", Map.of("Business Meals", new BigDecimal("6000")));
        Map<String, BigDecimal> equipment = new LinkedHashMap<>();
        equipment.put("Laptops", new BigDecimal("3000"));
        equipment.put("Furniture", new BigDecimal("1000"));
        expenses.put("Equipment", equipment);
        expenses.put("Widgets", Map.of("Parts", new BigDecimal("100")));

        DeductionAnalysis analysis = analyzer.analyze("client-1", 2024, expenses);

        assertThat(analysis.totalExpenses()).isEqualByComparingTo("10100.00");
        CategoryDeduction meals = analysis.categories().get(0);
        assertThat(meals.deductiblePercentage()).isEqualTo(50);
        assertThat(meals.documentationNeeded()).contains("Attendees");
        CategoryDeduction widgets = analysis.categories().get(2);
        assertThat(widgets.deductiblePercentage()).isEqualTo(100);
        assertThat(widgets.notes()).isEqualTo("Review for business purpose");
        assertThat(widgets.documentationNeeded()).containsExactly("Receipts", "Business purpose documentation");

        assertThat(analysis.recommendations()).extracting(DeductionAnalysis.DeductionRecommendation::type)
                .containsExactly("meals_optimization", "depreciation_strategy", "section_179");
        assertThat(analysis.recommendations().get(0).description())
                .isEqualTo("$6,000 in meals - ensure proper documentation for 50% deduction");
        assertThat(analysis.recommendations().get(0).estimatedImpact()).isEqualByComparingTo("750.00");
        assertThat(analysis.recommendations().get(1).estimatedImpact()).isEqualByComparingTo("1000.00");
        assertThat(analysis.recommendations().get(2).description())
                .isEqualTo("Consider Section 179 deduction for $4,000 in equipment purchases");

        assertThat(analysis.section179().totalEquipment()).isEqualByComparingTo("4000.00");
        assertThat(analysis.section179().eligibleAmount()).isEqualByComparingTo("4000.00");
        assertThat(analysis.section179().maxDeduction()).isEqualByComparingTo("1220000.00");
        assertThat(analysis.section179().phaseOutApplies()).isFalse();
    }

    @Test
    void section179IsCappedAndPhasesOut() {
        DeductionAnalysis analysis = analyzer.analyze("client-1", 2024,
                Map.of("Equipment", Map.of("Machinery", new BigDecimal("3100000"))));

        assertThat(analysis.section179().eligibleAmount()).isEqualByComparingTo("1220000.00");
        assertThat(analysis.section179().estimatedSavings()).isEqualByComparingTo("305000.00");
        assertThat(analysis.section179().phaseOutApplies()).isTrue();
    }

    @Test
    void groupsStoredExpensesLargestFirst() {
        transactions.saveAll("client-2", "checking", List.of(
                tx(LocalDate.of(2024, 2, 1), "Travel", "Lodging", "-500.00"),
                tx(LocalDate.of(2024, 3, 1), "Travel", "Airfare", "-300.00"),
                tx(LocalDate.of(2024, 4, 1), "Office Supplies", "General", "-1000.00"),
                tx(LocalDate.of(2024, 5, 1), "Income", "Unclassified Income", "5000.00"),
                tx(LocalDate.of(2023, 5, 1), "Insurance", "General", "-700.00")
        ));

        DeductionAnalysis analysis = analyzer.analyze("client-2", 2024, null);

        assertThat(analysis.categories()).extracting(CategoryDeduction::category)
                .containsExactly("Office Supplies", "Travel");
        assertThat(analysis.categories().get(1).subcategories())
                .containsEntry("Lodging", new BigDecimal("500.00"))
                .containsEntry("Airfare", new BigDecimal("300.00"));
        assertThat(analysis.totalExpenses()).isEqualByComparingTo("1800.00");
        assertThat(analysis.section179()).isNull();
    }

    @Test
    void rejectsNegativeExpenses() {
        assertThatThrownBy(() -> analyzer.analyze("client-1", 2024, Map.of("Travel", Map.of("Airfare", new BigDecimal("-5")))))
                .isInstanceOf(CalculationException.class)
                .extracting(ex -> ((CalculationException) ex).kind())
                .isEqualTo(ErrorKind.INVALID_INPUT);
    }

    private static ClassifiedTransaction tx(LocalDate date, String category, String subcategory, String amount) {
        BigDecimal value = new BigDecimal(amount);
        return new ClassifiedTransaction(UUID.randomUUID(), date, category, value, null,
                TransactionType.fromAmount(value), category, subcategory, new BigDecimal("0.9"));
    }
}
