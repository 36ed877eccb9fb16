package com.taxdesk.engine.bookkeeping;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Ordered rule lists. Order is significant: the first matching pattern rule wins, and amount rules
 * are only consulted when no pattern matched.
 */
public final class ClassificationRuleSet {

    private final List<ClassificationRule> patternRules;
    private final List<AmountRule> amountRules;

    public ClassificationRuleSet(List<ClassificationRule> patternRules, List<AmountRule> amountRules) {
        this.patternRules = List.copyOf(patternRules);
        this.amountRules = List.copyOf(amountRules);
    }

    public Optional<ClassificationRule> firstPatternMatch(String description) {
        for (ClassificationRule rule : patternRules) {
            if (rule.matches(description)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    public Optional<AmountRule> firstAmountMatch(BigDecimal amount) {
        for (AmountRule rule : amountRules) {
            if (rule.matches(amount)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    public List<ClassificationRule> patternRules() {
        return patternRules;
    }

    public List<AmountRule> amountRules() {
        return amountRules;
    }
}
