package com.taxdesk.engine.tax;

import com.taxdesk.engine.model.Severity;
import java.math.BigDecimal;

public record TaxRecommendation(
        RecommendationType type,
        Severity priority,
        String title,
        String description,
        BigDecimal estimatedSavings
) {

    public enum RecommendationType {
        TAX_REDUCTION,
        ENTITY_ELECTION,
        RETIREMENT_PLANNING
    }
}
