package com.taxdesk.engine.bookkeeping;

import com.taxdesk.engine.error.CalculationException;
import java.math.BigDecimal;
import java.util.Optional;

/**
 * Assigns a category to a transaction from its description and amount. Pure and deterministic:
 * pattern rules first, then amount rules, then the income/expense default.
 */
public class TransactionClassifier {

    static final BigDecimal PATTERN_CONFIDENCE = new BigDecimal("0.9");
    static final BigDecimal MIN_AMOUNT_CONFIDENCE = new BigDecimal("0.7");
    static final BigDecimal MAX_AMOUNT_CONFIDENCE = new BigDecimal("0.6");
    static final BigDecimal DEFAULT_CONFIDENCE = new BigDecimal("0.3");

    private final ClassificationRuleSet rules;

    public TransactionClassifier(ClassificationRuleSet rules) {
        this.rules = rules;
    }

    public Classification classify(String description, BigDecimal amount) {
        if (amount == null) {
            throw CalculationException.invalidInput("Transaction amount is required");
        }
        Optional<ClassificationRule> pattern = rules.firstPatternMatch(description);
        if (pattern.isPresent()) {
            return new Classification(pattern.get().category(), pattern.get().subcategory(), PATTERN_CONFIDENCE);
        }
        Optional<AmountRule> amountRule = rules.firstAmountMatch(amount);
        if (amountRule.isPresent()) {
            AmountRule rule = amountRule.get();
            BigDecimal confidence = rule.kind() == AmountRule.BoundKind.MIN ? MIN_AMOUNT_CONFIDENCE : MAX_AMOUNT_CONFIDENCE;
            return new Classification(rule.category(), rule.subcategory(), confidence);
        }
        if (amount.signum() > 0) {
            return new Classification("Income", "Unclassified Income", DEFAULT_CONFIDENCE);
        }
        return new Classification("Expenses", "Unclassified Expenses", DEFAULT_CONFIDENCE);
    }

    public ClassifiedTransaction classify(TransactionRecord record) {
        return ClassifiedTransaction.of(record, classify(record.description(), record.amount()));
    }
}
