package com.taxdesk.engine.tax;

import com.taxdesk.engine.bookkeeping.ClassifiedTransaction;
import com.taxdesk.engine.error.CalculationException;
import com.taxdesk.engine.model.Money;
import com.taxdesk.engine.repository.ClassifiedTransactionRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.Year;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives annual income and expenses for a tax year from the client's classified transactions.
 * Amounts are netted per category first; a category with a positive balance counts as income.
 */
public class FinancialProjector {

    private final ClassifiedTransactionRepository transactionRepository;
    private final Clock clock;

    public FinancialProjector(ClassifiedTransactionRepository transactionRepository, Clock clock) {
        this.transactionRepository = transactionRepository;
        this.clock = clock;
    }

    public FinancialProjection project(String clientId, int taxYear, ProjectionMethod method) {
        return switch (method) {
            case YTD_ANNUALIZED -> yearToDateAnnualized(clientId, taxYear);
            case PRIOR_YEAR -> priorYear(clientId, taxYear);
            case PROVIDED -> throw CalculationException.invalidInput("PROVIDED projections need explicit income and expenses");
        };
    }

    private FinancialProjection yearToDateAnnualized(String clientId, int taxYear) {
        LocalDate start = LocalDate.of(taxYear, 1, 1);
        LocalDate today = LocalDate.now(clock);
        LocalDate yearEnd = LocalDate.of(taxYear, 12, 31);
        LocalDate end = today.isAfter(yearEnd) ? yearEnd : today;
        // both ends inclusive, matching the repository range query
        long daysElapsed = ChronoUnit.DAYS.between(start, end) + 1;
        BigDecimal factor = daysElapsed > 0
                ? BigDecimal.valueOf(Year.of(taxYear).length()).divide(BigDecimal.valueOf(daysElapsed), Money.DIVISION)
                : BigDecimal.ONE;

        Totals totals = totalsOf(end.isBefore(start) ? List.of() : transactionRepository.findByClientAndRange(clientId, start, end));
        return new FinancialProjection(totals.income().multiply(factor), totals.expenses().multiply(factor),
                ProjectionMethod.YTD_ANNUALIZED);
    }

    private FinancialProjection priorYear(String clientId, int taxYear) {
        int prior = taxYear - 1;
        Totals totals = totalsOf(transactionRepository.findByClientAndRange(clientId,
                LocalDate.of(prior, 1, 1), LocalDate.of(prior, 12, 31)));
        return new FinancialProjection(totals.income(), totals.expenses(), ProjectionMethod.PRIOR_YEAR);
    }

    private Totals totalsOf(List<ClassifiedTransaction> transactions) {
        Map<String, BigDecimal> byCategory = new LinkedHashMap<>();
        for (ClassifiedTransaction tx : transactions) {
            byCategory.merge(tx.category(), tx.amount(), BigDecimal::add);
        }
        BigDecimal income = BigDecimal.ZERO;
        BigDecimal expenses = BigDecimal.ZERO;
        for (BigDecimal total : byCategory.values()) {
            if (total.signum() > 0) {
                income = income.add(total);
            } else {
                expenses = expenses.add(total.abs());
            }
        }
        return new Totals(income, expenses);
    }

    private record Totals(BigDecimal income, BigDecimal expenses) {
    }
}
