package com.taxdesk.engine.tax;

import com.taxdesk.engine.bookkeeping.ClassifiedTransaction;
import com.taxdesk.engine.error.CalculationException;
import com.taxdesk.engine.model.Money;
import com.taxdesk.engine.model.Severity;
import com.taxdesk.engine.repository.ClassifiedTransactionRepository;
import com.taxdesk.engine.tax.DeductionAnalysis.CategoryDeduction;
import com.taxdesk.engine.tax.DeductionAnalysis.DeductionRecommendation;
import com.taxdesk.engine.tax.DeductionAnalysis.Section179Analysis;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reviews a year's business expenses by category: deductible share, records to keep and
 * category-specific suggestions.
 */
public class DeductionAnalyzer {

    static final String MEALS = "Meals & Entertainment";
    static final String VEHICLE = "Vehicle Expenses";
    static final String EQUIPMENT = "Equipment";

    private static final BigDecimal MEALS_REVIEW = new BigDecimal("5000");
    private static final BigDecimal VEHICLE_REVIEW = new BigDecimal("10000");
    private static final BigDecimal EQUIPMENT_REVIEW = new BigDecimal("2500");
    private static final BigDecimal SECTION_179_MAX = new BigDecimal("1220000");
    private static final BigDecimal SECTION_179_PHASE_OUT = new BigDecimal("3050000");
    private static final BigDecimal ASSUMED_RATE = new BigDecimal("0.25");

    private static final Map<String, Deductibility> DEDUCTIBILITY = Map.of(
            "Office Supplies", new Deductibility(100, "Fully deductible if used for business"),
            "Travel", new Deductibility(100, "Business travel is fully deductible"),
            MEALS, new Deductibility(50, "Generally 50% deductible for business meals"),
            VEHICLE, new Deductibility(100, "Business use percentage applies"),
            "Professional Services", new Deductibility(100, "Fully deductible business expenses"),
            "Utilities", new Deductibility(100, "Business portion is deductible"),
            "Insurance", new Deductibility(100, "Business insurance is fully deductible"),
            "Marketing", new Deductibility(100, "Advertising and marketing expenses are deductible")
    );
    private static final Deductibility DEFAULT_DEDUCTIBILITY = new Deductibility(100, "Review for business purpose");

    private static final Map<String, List<String>> DOCUMENTATION = Map.of(
            "Travel", List.of("Receipts", "Business purpose", "Dates and locations"),
            MEALS, List.of("Receipts", "Business purpose", "Attendees", "Business relationship"),
            VEHICLE, List.of("Mileage log", "Business purpose", "Receipts for expenses"),
            EQUIPMENT, List.of("Receipts", "Business use percentage", "Depreciation records"),
            "Professional Services", List.of("Invoices", "Contracts", "Business purpose"),
            "Office Supplies", List.of("Receipts", "Business use verification")
    );
    private static final List<String> DEFAULT_DOCUMENTATION = List.of("Receipts", "Business purpose documentation");

    private final ClassifiedTransactionRepository transactionRepository;

    public DeductionAnalyzer(ClassifiedTransactionRepository transactionRepository) {
        this.transactionRepository = transactionRepository;
    }

    /**
     * @param expenseData category to subcategory to amount; when null the year's stored expense
     *                    transactions are grouped instead
     */
    public DeductionAnalysis analyze(String clientId, int taxYear, Map<String, Map<String, BigDecimal>> expenseData) {
        if (clientId == null || clientId.isBlank()) {
            throw CalculationException.invalidInput("clientId must be provided");
        }
        Map<String, Map<String, BigDecimal>> expenses = expenseData != null ? expenseData : storedExpenses(clientId, taxYear);

        BigDecimal grandTotal = BigDecimal.ZERO;
        List<CategoryDeduction> categories = new ArrayList<>();
        List<DeductionRecommendation> recommendations = new ArrayList<>();
        for (Map.Entry<String, Map<String, BigDecimal>> entry : expenses.entrySet()) {
            String category = entry.getKey();
            Map<String, BigDecimal> subcategories = entry.getValue();
            BigDecimal total = subcategories.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
            if (total.signum() < 0) {
                throw CalculationException.invalidInput("Expense amounts for " + category + " must not be negative");
            }
            grandTotal = grandTotal.add(total);
            Deductibility deductibility = DEDUCTIBILITY.getOrDefault(category, DEFAULT_DEDUCTIBILITY);
            Map<String, BigDecimal> rounded = new LinkedHashMap<>();
            subcategories.forEach((name, amount) -> rounded.put(name, Money.round(amount)));
            categories.add(new CategoryDeduction(
                    category,
                    Money.round(total),
                    rounded,
                    deductibility.percentage(),
                    deductibility.notes(),
                    DOCUMENTATION.getOrDefault(category, DEFAULT_DOCUMENTATION)
            ));
            recommendations.addAll(categoryRecommendations(category, total));
        }

        Section179Analysis section179 = null;
        Map<String, BigDecimal> equipment = expenses.get(EQUIPMENT);
        if (equipment != null && !equipment.isEmpty()) {
            section179 = section179(equipment);
            if (section179.eligibleAmount().signum() > 0) {
                recommendations.add(new DeductionRecommendation(
                        "section_179",
                        Severity.HIGH,
                        "Section 179 Deduction Opportunity",
                        String.format(Locale.US, "Consider Section 179 deduction for $%,.0f in equipment purchases", section179.eligibleAmount()),
                        section179.estimatedSavings()
                ));
            }
        }
        return new DeductionAnalysis(clientId, taxYear, Money.round(grandTotal), List.copyOf(categories),
                List.copyOf(recommendations), section179);
    }

    private Map<String, Map<String, BigDecimal>> storedExpenses(String clientId, int taxYear) {
        List<ClassifiedTransaction> transactions = transactionRepository.findByClientAndRange(
                clientId, LocalDate.of(taxYear, 1, 1), LocalDate.of(taxYear, 12, 31));
        Map<String, Map<String, BigDecimal>> grouped = new LinkedHashMap<>();
        transactions.stream()
                .filter(ClassifiedTransaction::isExpense)
                .forEach(tx -> grouped.computeIfAbsent(tx.category(), k -> new LinkedHashMap<>())
                        .merge(tx.subcategory(), tx.amount().abs(), BigDecimal::add));
        // largest categories first
        Map<String, Map<String, BigDecimal>> ordered = new LinkedHashMap<>();
        grouped.entrySet().stream()
                .sorted(Comparator.comparing((Map.Entry<String, Map<String, BigDecimal>> e) ->
                        e.getValue().values().stream().reduce(BigDecimal.ZERO, BigDecimal::add)).reversed())
                .forEach(e -> ordered.put(e.getKey(), e.getValue()));
        return ordered;
    }

    private List<DeductionRecommendation> categoryRecommendations(String category, BigDecimal total) {
        List<DeductionRecommendation> recommendations = new ArrayList<>();
        if (MEALS.equals(category) && total.compareTo(MEALS_REVIEW) > 0) {
            recommendations.add(new DeductionRecommendation(
                    "meals_optimization",
                    Severity.MEDIUM,
                    "Optimize Meal Deductions",
                    String.format(Locale.US, "$%,.0f in meals - ensure proper documentation for 50%% deduction", total),
                    Money.round(total.multiply(new BigDecimal("0.5")).multiply(ASSUMED_RATE))
            ));
        }
        if (VEHICLE.equals(category) && total.compareTo(VEHICLE_REVIEW) > 0) {
            recommendations.add(new DeductionRecommendation(
                    "vehicle_method",
                    Severity.MEDIUM,
                    "Compare Vehicle Deduction Methods",
                    "Compare actual expense method vs. standard mileage rate",
                    Money.round(total.multiply(new BigDecimal("0.1")))
            ));
        }
        if (EQUIPMENT.equals(category) && total.compareTo(EQUIPMENT_REVIEW) > 0) {
            recommendations.add(new DeductionRecommendation(
                    "depreciation_strategy",
                    Severity.HIGH,
                    "Equipment Depreciation Strategy",
                    String.format(Locale.US, "$%,.0f in equipment - consider Section 179 vs. bonus depreciation", total),
                    Money.round(total.multiply(ASSUMED_RATE))
            ));
        }
        return recommendations;
    }

    private Section179Analysis section179(Map<String, BigDecimal> equipment) {
        BigDecimal totalEquipment = equipment.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal eligible = totalEquipment.min(SECTION_179_MAX);
        return new Section179Analysis(
                Money.round(totalEquipment),
                Money.round(eligible),
                Money.round(SECTION_179_MAX),
                Money.round(eligible.multiply(ASSUMED_RATE)),
                totalEquipment.compareTo(SECTION_179_PHASE_OUT) > 0
        );
    }

    private record Deductibility(int percentage, String notes) {
    }
}
