package com.taxdesk.engine.bookkeeping;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taxdesk.engine.error.CalculationException;
import com.taxdesk.engine.error.ErrorKind;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;

class ClassificationRuleLoaderTest {

    private final ClassificationRuleLoader loader = new ClassificationRuleLoader(new ObjectMapper());

    @Test
    void keepsBundledRuleOrder() {
        ClassificationRuleSet rules = loader.load("classification-rules.json");

        assertThat(rules.patternRules()).hasSize(16);
        assertThat(rules.patternRules().get(0).category()).isEqualTo("Office Supplies");
        assertThat(rules.patternRules().get(1).subcategory()).isEqualTo("Fuel");
        assertThat(rules.amountRules()).extracting(AmountRule::kind)
                .containsExactly(AmountRule.BoundKind.MIN, AmountRule.BoundKind.MAX);
    }

    @Test
    void missingResourceIsConfigurationError() {
        assertThatThrownBy(() -> loader.load("no-such-rules.json"))
                .isInstanceOf(CalculationException.class)
                .extracting(ex -> ((CalculationException) ex).kind())
                .isEqualTo(ErrorKind.CONFIGURATION_ERROR);
    }

    @Test
    void rejectsInvalidPattern() {
        var doc = new ClassificationRuleLoader.RulesDocument(
                List.of(new ClassificationRuleLoader.PatternDocument("([", "Travel", "Lodging")), List.of());

        assertThatThrownBy(() -> loader.toRuleSet(doc))
                .isInstanceOf(CalculationException.class)
                .hasMessageContaining("Invalid classification pattern");
    }

    @Test
    void amountRuleNeedsExactlyOneBound() {
        var doc = new ClassificationRuleLoader.RulesDocument(List.of(), List.of(
                new ClassificationRuleLoader.AmountDocument(BigDecimal.ONE, BigDecimal.TEN, "Equipment", "Major Equipment")));

        assertThatThrownBy(() -> loader.toRuleSet(doc))
                .isInstanceOf(CalculationException.class)
                .hasMessageContaining("exactly one");
    }
}
