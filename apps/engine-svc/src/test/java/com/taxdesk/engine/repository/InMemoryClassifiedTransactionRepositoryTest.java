package com.taxdesk.engine.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.taxdesk.engine.bookkeeping.ClassifiedTransaction;
import com.taxdesk.engine.bookkeeping.TransactionType;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class InMemoryClassifiedTransactionRepositoryTest {

    private final InMemoryClassifiedTransactionRepository repository = new InMemoryClassifiedTransactionRepository();

    @Test
    void filtersByClientAccountAndInclusiveRange() {
        repository.saveAll("client-1", "checking", List.of(
                tx(LocalDate.of(2024, 3, 31), "-10.00"),
                tx(LocalDate.of(2024, 3, 1), "-20.00"),
                tx(LocalDate.of(2024, 4, 1), "-30.00")
        ));
        repository.saveAll("client-1", "savings", List.of(tx(LocalDate.of(2024, 3, 15), "100.00")));
        repository.saveAll("client-2", "checking", List.of(tx(LocalDate.of(2024, 3, 15), "5.00")));

        LocalDate from = LocalDate.of(2024, 3, 1);
        LocalDate to = LocalDate.of(2024, 3, 31);
        assertThat(repository.findByClientAndAccountAndRange("client-1", "checking", from, to))
                .extracting(ClassifiedTransaction::date)
                .containsExactly(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 31));
        assertThat(repository.findByClientAndRange("client-1", from, to)).hasSize(3);
    }

    @Test
    void deleteRemovesOnlyThatClient() {
        repository.saveAll("client-1", "checking", List.of(tx(LocalDate.of(2024, 3, 1), "-1.00")));
        repository.saveAll("client-2", "checking", List.of(tx(LocalDate.of(2024, 3, 1), "-1.00")));

        repository.deleteByClientId("client-1");

        LocalDate day = LocalDate.of(2024, 3, 1);
        assertThat(repository.findByClientAndRange("client-1", day, day)).isEmpty();
        assertThat(repository.findByClientAndRange("client-2", day, day)).hasSize(1);
    }

    private static ClassifiedTransaction tx(LocalDate date, String amount) {
        BigDecimal value = new BigDecimal(amount);
        return new ClassifiedTransaction(UUID.randomUUID(), date, "entry", value, null,
                TransactionType.fromAmount(value), "Expenses", "Unclassified Expenses", new BigDecimal("0.3"));
    }
}
