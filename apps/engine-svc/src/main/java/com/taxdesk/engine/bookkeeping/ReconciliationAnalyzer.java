package com.taxdesk.engine.bookkeeping;

import com.taxdesk.engine.audit.CalculationAuditLogger;
import com.taxdesk.engine.error.CalculationException;
import com.taxdesk.engine.model.Money;
import com.taxdesk.engine.model.Periods;
import com.taxdesk.engine.repository.CalculationKind;
import com.taxdesk.engine.repository.CalculationRecord;
import com.taxdesk.engine.repository.CalculationRecordRepository;
import com.taxdesk.engine.repository.ClassifiedTransactionRepository;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Reviews one account-month of stored transactions for entries worth a second look.
 */
public class ReconciliationAnalyzer {

    private static final BigDecimal LARGE_AMOUNT = new BigDecimal("10000");
    private static final BigDecimal ROUND_UNIT = new BigDecimal("100");
    private static final int DESCRIPTION_KEY_LENGTH = 50;

    private final ClassifiedTransactionRepository transactionRepository;
    private final CalculationRecordRepository calculationRecordRepository;
    private final CalculationAuditLogger auditLogger;

    public ReconciliationAnalyzer(ClassifiedTransactionRepository transactionRepository,
                                  CalculationRecordRepository calculationRecordRepository,
                                  CalculationAuditLogger auditLogger) {
        this.transactionRepository = transactionRepository;
        this.calculationRecordRepository = calculationRecordRepository;
        this.auditLogger = auditLogger;
    }

    public ReconciliationReport reconcile(String clientId, String account, String period) {
        if (clientId == null || clientId.isBlank()) {
            throw CalculationException.invalidInput("clientId must be provided");
        }
        if (account == null || account.isBlank()) {
            account = BookkeepingService.DEFAULT_ACCOUNT;
        }
        YearMonth month = Periods.parseMonth(period);
        List<ClassifiedTransaction> transactions = transactionRepository.findByClientAndAccountAndRange(
                clientId, account, month.atDay(1), month.atEndOfMonth());
        if (transactions.isEmpty()) {
            throw CalculationException.invalidInput("No transactions found for " + account + " in " + period);
        }

        BigDecimal beginning = BigDecimal.ZERO;
        BigDecimal debits = BigDecimal.ZERO;
        BigDecimal credits = BigDecimal.ZERO;
        for (ClassifiedTransaction tx : transactions) {
            if (tx.amount().signum() < 0) {
                debits = debits.add(tx.amount());
            } else if (tx.amount().signum() > 0) {
                credits = credits.add(tx.amount());
            }
        }
        BigDecimal ending = beginning.add(credits).add(debits);

        List<ReconciliationIssue> issues = new ArrayList<>();
        List<ReconciliationIssue.FlaggedTransaction> duplicates = findDuplicates(transactions);
        if (!duplicates.isEmpty()) {
            issues.add(new ReconciliationIssue(ReconciliationIssue.IssueType.DUPLICATES, duplicates.size(), duplicates));
        }
        List<ReconciliationIssue.FlaggedTransaction> large = transactions.stream()
                .filter(tx -> tx.amount().abs().compareTo(LARGE_AMOUNT) > 0)
                .map(ReconciliationAnalyzer::flag)
                .toList();
        if (!large.isEmpty()) {
            issues.add(new ReconciliationIssue(ReconciliationIssue.IssueType.LARGE_AMOUNTS, large.size(), large));
        }
        List<ReconciliationIssue.FlaggedTransaction> round = transactions.stream()
                .filter(ReconciliationAnalyzer::isRoundAmount)
                .map(ReconciliationAnalyzer::flag)
                .toList();
        if (!round.isEmpty()) {
            issues.add(new ReconciliationIssue(ReconciliationIssue.IssueType.ROUND_AMOUNTS, round.size(), round));
        }

        ReconciliationReport.ReconciliationStatus status = issues.isEmpty()
                ? ReconciliationReport.ReconciliationStatus.COMPLETED
                : ReconciliationReport.ReconciliationStatus.NEEDS_REVIEW;
        calculationRecordRepository.save(CalculationRecord.of(clientId, CalculationKind.RECONCILIATION, period,
                Money.round(ending), "account=" + account + " status=" + status));
        auditLogger.record("reconcile", clientId, period, transactions.size(), issues.size());

        return new ReconciliationReport(
                clientId,
                account,
                period,
                Money.round(beginning),
                Money.round(ending),
                transactions.size(),
                Money.round(debits),
                Money.round(credits),
                List.copyOf(issues),
                status
        );
    }

    private List<ReconciliationIssue.FlaggedTransaction> findDuplicates(List<ClassifiedTransaction> transactions) {
        Map<DuplicateKey, UUID> seen = new HashMap<>();
        List<ReconciliationIssue.FlaggedTransaction> duplicates = new ArrayList<>();
        for (ClassifiedTransaction tx : transactions) {
            DuplicateKey key = DuplicateKey.of(tx);
            UUID original = seen.putIfAbsent(key, tx.id());
            if (original != null) {
                duplicates.add(new ReconciliationIssue.FlaggedTransaction(tx.id(), original, tx.date(), tx.amount(), tx.description()));
            }
        }
        return duplicates;
    }

    private static boolean isRoundAmount(ClassifiedTransaction tx) {
        BigDecimal abs = tx.amount().abs();
        return abs.compareTo(ROUND_UNIT) >= 0 && abs.remainder(ROUND_UNIT).signum() == 0;
    }

    private static ReconciliationIssue.FlaggedTransaction flag(ClassifiedTransaction tx) {
        return new ReconciliationIssue.FlaggedTransaction(tx.id(), null, tx.date(), tx.amount(), tx.description());
    }

    // amounts compare by value so 100.0 and 100.00 collide
    private record DuplicateKey(LocalDate date, BigDecimal amount, String descriptionPrefix) {
        static DuplicateKey of(ClassifiedTransaction tx) {
            String description = tx.description();
            String prefix = description.length() > DESCRIPTION_KEY_LENGTH ? description.substring(0, DESCRIPTION_KEY_LENGTH) : description;
            return new DuplicateKey(tx.date(), tx.amount().stripTrailingZeros(), prefix);
        }
    }
}
