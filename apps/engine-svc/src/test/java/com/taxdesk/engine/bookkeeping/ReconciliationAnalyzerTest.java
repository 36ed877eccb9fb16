package com.taxdesk.engine.bookkeeping;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import com.taxdesk.engine.audit.CalculationAuditLogger;
import com.taxdesk.engine.error.CalculationException;
import com.taxdesk.engine.error.ErrorKind;
import com.taxdesk.engine.repository.CalculationKind;
import com.taxdesk.engine.repository.InMemoryCalculationRecordRepository;
import com.taxdesk.engine.repository.InMemoryClassifiedTransactionRepository;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ReconciliationAnalyzerTest {

    private InMemoryClassifiedTransactionRepository transactions;
    private InMemoryCalculationRecordRepository calculationRecords;
    private ReconciliationAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        transactions = new InMemoryClassifiedTransactionRepository();
        calculationRecords = new InMemoryCalculationRecordRepository();
        analyzer = new ReconciliationAnalyzer(transactions, calculationRecords, new CalculationAuditLogger());
    }

    @Test
    void flagsDuplicatesLargeAndRoundAmounts() {
        transactions.saveAll("client-1", "checking", List.of(
                tx(LocalDate.of(2024, 3, 5), "Office rent March", "-2500.00"),
                tx(LocalDate.of(2024, 3, 5), "Office rent March", "-2500"),
                tx(LocalDate.of(2024, 3, 10), "Client payment", "12500.50"),
                tx(LocalDate.of(2024, 3, 12), "Coffee", "-4.75"),
                tx(LocalDate.of(2024, 4, 1), "Office rent April", "-2500.00")
        ));

        ReconciliationReport report = analyzer.reconcile("client-1", "checking", "2024-03");

        assertThat(report.totalTransactions()).isEqualTo(4);
        assertThat(report.totalDebits()).isEqualByComparingTo("-5004.75");
        assertThat(report.totalCredits()).isEqualByComparingTo("12500.50");
        assertThat(report.endingBalance()).isEqualByComparingTo("7495.75");
        assertThat(report.status()).isEqualTo(ReconciliationReport.ReconciliationStatus.NEEDS_REVIEW);
        assertThat(report.issues()).extracting(ReconciliationIssue::type, ReconciliationIssue::count)
                .containsExactly(
                        tuple(ReconciliationIssue.IssueType.DUPLICATES, 1),
                        tuple(ReconciliationIssue.IssueType.LARGE_AMOUNTS, 1),
                        tuple(ReconciliationIssue.IssueType.ROUND_AMOUNTS, 2));
        ReconciliationIssue.FlaggedTransaction duplicate = report.issues().get(0).transactions().get(0);
        assertThat(duplicate.originalId()).isNotNull().isNotEqualTo(duplicate.id());
        assertThat(calculationRecords.findByClientIdAndKind("client-1", CalculationKind.RECONCILIATION)).hasSize(1);
    }

    @Test
    void cleanMonthCompletes() {
        transactions.saveAll("client-2", "checking", List.of(
                tx(LocalDate.of(2024, 5, 2), "Coffee", "-4.75"),
                tx(LocalDate.of(2024, 5, 3), "Lunch", "-12.30")
        ));

        ReconciliationReport report = analyzer.reconcile("client-2", null, "2024-05");

        assertThat(report.status()).isEqualTo(ReconciliationReport.ReconciliationStatus.COMPLETED);
        assertThat(report.issuesFound()).isZero();
        assertThat(report.account()).isEqualTo("checking");
    }

    @Test
    void otherAccountsAreIgnored() {
        transactions.saveAll("client-3", "savings", List.of(tx(LocalDate.of(2024, 5, 2), "Transfer", "500.00")));

        assertThatThrownBy(() -> analyzer.reconcile("client-3", "checking", "2024-05"))
                .isInstanceOf(CalculationException.class)
                .extracting(ex -> ((CalculationException) ex).kind())
                .isEqualTo(ErrorKind.INVALID_INPUT);
    }

    @Test
    void rejectsMalformedPeriod() {
        assertThatThrownBy(() -> analyzer.reconcile("client-1", "checking", "2024-13"))
                .isInstanceOf(CalculationException.class)
                .extracting(ex -> ((CalculationException) ex).kind())
                .isEqualTo(ErrorKind.INVALID_INPUT);
    }

    private static ClassifiedTransaction tx(LocalDate date, String description, String amount) {
        BigDecimal value = new BigDecimal(amount);
        return new ClassifiedTransaction(UUID.randomUUID(), date, description, value, null,
                TransactionType.fromAmount(value), "Expenses", "Unclassified Expenses", new BigDecimal("0.3"));
    }
}
