package com.taxdesk.engine.tax;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.taxdesk.engine.bookkeeping.ClassifiedTransaction;
import com.taxdesk.engine.bookkeeping.TransactionType;
import com.taxdesk.engine.error.CalculationException;
import com.taxdesk.engine.model.Money;
import com.taxdesk.engine.repository.InMemoryClassifiedTransactionRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FinancialProjectorTest {

    private InMemoryClassifiedTransactionRepository transactions;
    private FinancialProjector projector;

    @BeforeEach
    void setUp() {
        transactions = new InMemoryClassifiedTransactionRepository();
        // Jan 1 through Apr 1 2024 inclusive is 92 of 366 days
        Clock clock = Clock.fixed(Instant.parse("2024-04-01T09:00:00Z"), ZoneOffset.UTC);
        projector = new FinancialProjector(transactions, clock);
    }

    @Test
    void annualizesYearToDateActuals() {
        transactions.saveAll("client-1", "checking", List.of(
                tx(LocalDate.of(2024, 1, 15), "Income", "9200.00"),
                tx(LocalDate.of(2024, 2, 10), "Office Supplies", "-920.00"),
                tx(LocalDate.of(2024, 4, 10), "Income", "50000.00")
        ));

        FinancialProjection projection = projector.project("client-1", 2024, ProjectionMethod.YTD_ANNUALIZED);

        assertThat(projection.method()).isEqualTo(ProjectionMethod.YTD_ANNUALIZED);
        assertThat(Money.round(projection.grossIncome())).isEqualByComparingTo("36600.00");
        assertThat(Money.round(projection.totalExpenses())).isEqualByComparingTo("3660.00");
    }

    @Test
    void finishedYearProjectsItsActuals() {
        Clock afterYearEnd = Clock.fixed(Instant.parse("2024-06-01T09:00:00Z"), ZoneOffset.UTC);
        FinancialProjector lateProjector = new FinancialProjector(transactions, afterYearEnd);
        transactions.saveAll("client-1", "checking", List.of(
                tx(LocalDate.of(2023, 1, 1), "Income", "30000.00"),
                tx(LocalDate.of(2023, 12, 31), "Income", "6400.00"),
                tx(LocalDate.of(2023, 7, 4), "Travel", "-1200.00")
        ));

        FinancialProjection ytd = lateProjector.project("client-1", 2023, ProjectionMethod.YTD_ANNUALIZED);
        FinancialProjection prior = lateProjector.project("client-1", 2024, ProjectionMethod.PRIOR_YEAR);

        assertThat(Money.round(ytd.grossIncome())).isEqualByComparingTo("36400.00");
        assertThat(Money.round(ytd.totalExpenses())).isEqualByComparingTo("1200.00");
        assertThat(ytd.grossIncome()).isEqualByComparingTo(prior.grossIncome());
    }

    @Test
    void priorYearNetsEachCategory() {
        transactions.saveAll("client-1", "checking", List.of(
                tx(LocalDate.of(2023, 3, 1), "Income", "50000.00"),
                tx(LocalDate.of(2023, 5, 1), "Office Supplies", "-3000.00"),
                tx(LocalDate.of(2023, 5, 20), "Office Supplies", "500.00"),
                tx(LocalDate.of(2023, 8, 1), "Travel", "-1000.00"),
                tx(LocalDate.of(2024, 1, 2), "Travel", "-9999.00")
        ));

        FinancialProjection projection = projector.project("client-1", 2024, ProjectionMethod.PRIOR_YEAR);

        assertThat(projection.grossIncome()).isEqualByComparingTo("50000.00");
        assertThat(projection.totalExpenses()).isEqualByComparingTo("3500.00");
    }

    @Test
    void futureYearProjectsNothing() {
        transactions.saveAll("client-1", "checking", List.of(tx(LocalDate.of(2024, 1, 15), "Income", "9100.00")));

        FinancialProjection projection = projector.project("client-1", 2025, ProjectionMethod.YTD_ANNUALIZED);

        assertThat(projection.grossIncome()).isEqualByComparingTo("0");
        assertThat(projection.totalExpenses()).isEqualByComparingTo("0");
    }

    @Test
    void providedFiguresCannotBeProjected() {
        assertThatThrownBy(() -> projector.project("client-1", 2024, ProjectionMethod.PROVIDED))
                .isInstanceOf(CalculationException.class);
    }

    private static ClassifiedTransaction tx(LocalDate date, String category, String amount) {
        BigDecimal value = new BigDecimal(amount);
        return new ClassifiedTransaction(UUID.randomUUID(), date, category + " entry", value, null,
                TransactionType.fromAmount(value), category, "General", new BigDecimal("0.9"));
    }
}
