package com.taxdesk.engine.bookkeeping;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taxdesk.engine.error.CalculationException;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;

public class ClassificationRuleLoader {

    private static final Logger log = LoggerFactory.getLogger(ClassificationRuleLoader.class);

    private final ObjectMapper objectMapper;

    public ClassificationRuleLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ClassificationRuleSet load(String location) {
        Resource resource = new ClassPathResource(location);
        if (!resource.exists()) {
            throw CalculationException.configuration("Classification rules not found at " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            ClassificationRuleSet rules = toRuleSet(objectMapper.readValue(in, RulesDocument.class));
            log.info("classification_rules_loaded location={} patterns={} amountRules={}",
                    location, rules.patternRules().size(), rules.amountRules().size());
            return rules;
        } catch (IOException ex) {
            throw CalculationException.configuration("Failed to read classification rules: " + ex.getMessage(), ex);
        }
    }

    ClassificationRuleSet toRuleSet(RulesDocument doc) {
        List<ClassificationRule> patterns = new ArrayList<>();
        if (doc.patterns() != null) {
            for (PatternDocument p : doc.patterns()) {
                try {
                    patterns.add(ClassificationRule.caseInsensitive(p.pattern(), p.category(), p.subcategory()));
                } catch (PatternSyntaxException | NullPointerException ex) {
                    throw CalculationException.configuration("Invalid classification pattern: " + p.pattern(), ex);
                }
            }
        }
        List<AmountRule> amountRules = new ArrayList<>();
        if (doc.amountRules() != null) {
            for (AmountDocument a : doc.amountRules()) {
                if ((a.minAmount() == null) == (a.maxAmount() == null)) {
                    throw CalculationException.configuration("Amount rule for " + a.category() + " needs exactly one of minAmount/maxAmount");
                }
                amountRules.add(a.minAmount() != null
                        ? new AmountRule(AmountRule.BoundKind.MIN, a.minAmount(), a.category(), a.subcategory())
                        : new AmountRule(AmountRule.BoundKind.MAX, a.maxAmount(), a.category(), a.subcategory()));
            }
        }
        return new ClassificationRuleSet(patterns, amountRules);
    }

    record RulesDocument(List<PatternDocument> patterns, List<AmountDocument> amountRules) {
    }

    record PatternDocument(String pattern, String category, String subcategory) {
    }

    record AmountDocument(BigDecimal minAmount, BigDecimal maxAmount, String category, String subcategory) {
    }
}
