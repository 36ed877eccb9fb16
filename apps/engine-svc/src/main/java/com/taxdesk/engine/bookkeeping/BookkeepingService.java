package com.taxdesk.engine.bookkeeping;

import com.taxdesk.engine.audit.CalculationAuditLogger;
import com.taxdesk.engine.error.CalculationException;
import com.taxdesk.engine.model.Money;
import com.taxdesk.engine.repository.CalculationKind;
import com.taxdesk.engine.repository.CalculationRecord;
import com.taxdesk.engine.repository.CalculationRecordRepository;
import com.taxdesk.engine.repository.ClassifiedTransactionRepository;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class BookkeepingService {

    static final String DEFAULT_ACCOUNT = "checking";

    private final TransactionClassifier classifier;
    private final ClassifiedTransactionRepository transactionRepository;
    private final CalculationRecordRepository calculationRecordRepository;
    private final CalculationAuditLogger auditLogger;
    private final BigDecimal lowConfidenceThreshold;

    public BookkeepingService(TransactionClassifier classifier,
                              ClassifiedTransactionRepository transactionRepository,
                              CalculationRecordRepository calculationRecordRepository,
                              CalculationAuditLogger auditLogger,
                              BigDecimal lowConfidenceThreshold) {
        this.classifier = classifier;
        this.transactionRepository = transactionRepository;
        this.calculationRecordRepository = calculationRecordRepository;
        this.auditLogger = auditLogger;
        this.lowConfidenceThreshold = lowConfidenceThreshold;
    }

    public ClassificationBatchResult classifyBatch(String clientId, String account, List<TransactionRecord> transactions) {
        if (clientId == null || clientId.isBlank()) {
            throw CalculationException.invalidInput("clientId must be provided");
        }
        if (transactions == null || transactions.isEmpty()) {
            throw CalculationException.invalidInput("No transactions supplied");
        }
        String accountName = account == null || account.isBlank() ? DEFAULT_ACCOUNT : account;

        List<ClassifiedTransaction> classified = new ArrayList<>(transactions.size());
        BigDecimal debits = BigDecimal.ZERO;
        BigDecimal credits = BigDecimal.ZERO;
        Map<String, BigDecimal> categoryTotals = new LinkedHashMap<>();
        Map<String, Integer> categoryCounts = new LinkedHashMap<>();
        int lowConfidence = 0;

        for (TransactionRecord record : transactions) {
            ClassifiedTransaction tx = classifier.classify(record);
            classified.add(tx);
            if (tx.amount().signum() < 0) {
                debits = debits.add(tx.amount());
            } else {
                credits = credits.add(tx.amount());
            }
            categoryTotals.merge(tx.category(), tx.amount().abs(), BigDecimal::add);
            categoryCounts.merge(tx.category(), 1, Integer::sum);
            if (tx.confidence().compareTo(lowConfidenceThreshold) < 0) {
                lowConfidence++;
            }
        }

        transactionRepository.saveAll(clientId, accountName, classified);

        List<CategorySummary> summary = categoryTotals.entrySet().stream()
                .map(e -> new CategorySummary(e.getKey(), categoryCounts.get(e.getKey()), Money.round(e.getValue())))
                .toList();
        BigDecimal net = credits.add(debits);
        calculationRecordRepository.save(CalculationRecord.of(clientId, CalculationKind.BOOKKEEPING_BATCH, null,
                Money.round(net), "account=" + accountName));
        auditLogger.record("classify_batch", clientId, null, classified.size(), 0);

        return new ClassificationBatchResult(
                clientId,
                accountName,
                classified.size(),
                Money.round(debits),
                Money.round(credits),
                Money.round(net),
                summary,
                lowConfidence,
                List.copyOf(classified)
        );
    }
}
