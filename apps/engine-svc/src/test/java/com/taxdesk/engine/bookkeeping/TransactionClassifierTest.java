package com.taxdesk.engine.bookkeeping;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taxdesk.engine.error.CalculationException;
import com.taxdesk.engine.error.ErrorKind;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

class TransactionClassifierTest {

    private final TransactionClassifier classifier = new TransactionClassifier(
            new ClassificationRuleLoader(new ObjectMapper()).load("classification-rules.json"));

    @Test
    void patternMatchWinsWithHighConfidence() {
        Classification result = classifier.classify("SHELL OIL #1234", new BigDecimal("-65.43"));

        assertThat(result.category()).isEqualTo("Vehicle Expenses");
        assertThat(result.subcategory()).isEqualTo("Fuel");
        assertThat(result.confidence()).isEqualByComparingTo("0.9");
    }

    @Test
    void earlierPatternTakesPrecedence() {
        assertThat(classifier.classify("AMZN Mktp fuel can", new BigDecimal("-30")).category()).isEqualTo("Office Supplies");
        // "gas" in the fuel rule is listed before the "gas company" utility rule
        assertThat(classifier.classify("City Gas Company", new BigDecimal("-120")).category()).isEqualTo("Vehicle Expenses");
    }

    @Test
    void patternBeatsAmountRule() {
        Classification result = classifier.classify("Best Buy laptop", new BigDecimal("-7500"));

        assertThat(result.category()).isEqualTo("Office Supplies");
        assertThat(result.subcategory()).isEqualTo("Equipment");
    }

    @Test
    void minimumAmountRuleAppliesAtBound() {
        Classification large = classifier.classify("Widget Corp", new BigDecimal("-5000"));

        assertThat(large.category()).isEqualTo("Equipment");
        assertThat(large.subcategory()).isEqualTo("Major Equipment");
        assertThat(large.confidence()).isEqualByComparingTo("0.7");
    }

    @Test
    void maximumAmountRuleAppliesToSmallAmounts() {
        Classification small = classifier.classify("Widget Corp", new BigDecimal("-25"));

        assertThat(small.category()).isEqualTo("Office Supplies");
        assertThat(small.subcategory()).isEqualTo("Miscellaneous");
        assertThat(small.confidence()).isEqualByComparingTo("0.6");
    }

    @Test
    void unmatchedFallsBackBySign() {
        Classification income = classifier.classify("Deposit ACME", new BigDecimal("1500"));
        Classification expense = classifier.classify("Widget Corp", new BigDecimal("-300"));

        assertThat(income.category()).isEqualTo("Income");
        assertThat(income.subcategory()).isEqualTo("Unclassified Income");
        assertThat(income.confidence()).isEqualByComparingTo("0.3");
        assertThat(expense.category()).isEqualTo("Expenses");
        assertThat(expense.subcategory()).isEqualTo("Unclassified Expenses");
    }

    @Test
    void classificationIsDeterministic() {
        assertThat(classifier.classify("Hotel downtown", new BigDecimal("-250")))
                .isEqualTo(classifier.classify("Hotel downtown", new BigDecimal("-250")));
    }

    @Test
    void ruleOrderIsTheConfiguredOrder() {
        TransactionClassifier custom = new TransactionClassifier(new ClassificationRuleSet(
                List.of(
                        ClassificationRule.caseInsensitive("uber eats", "Meals & Entertainment", "Delivery"),
                        ClassificationRule.caseInsensitive("uber", "Travel", "Rideshare")
                ),
                List.of()));

        assertThat(custom.classify("UBER EATS order", new BigDecimal("-18")).category()).isEqualTo("Meals & Entertainment");
        assertThat(custom.classify("UBER trip", new BigDecimal("-18")).category()).isEqualTo("Travel");
    }

    @Test
    void annotatesRecordWithTypeAndId() {
        ClassifiedTransaction tx = classifier.classify(new TransactionRecord(LocalDate.of(2024, 3, 1), "Verizon Wireless",
                new BigDecimal("-89.99"), "ref-1"));

        assertThat(tx.id()).isNotNull();
        assertThat(tx.type()).isEqualTo(TransactionType.DEBIT);
        assertThat(tx.category()).isEqualTo("Utilities");
        assertThat(tx.referenceId()).isEqualTo("ref-1");
    }

    @Test
    void missingAmountIsInvalidInput() {
        assertThatThrownBy(() -> classifier.classify("Widget Corp", null))
                .isInstanceOf(CalculationException.class)
                .extracting(ex -> ((CalculationException) ex).kind())
                .isEqualTo(ErrorKind.INVALID_INPUT);
    }
}
