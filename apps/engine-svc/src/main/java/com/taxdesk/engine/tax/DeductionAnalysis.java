package com.taxdesk.engine.tax;

import com.taxdesk.engine.model.Severity;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

public record DeductionAnalysis(
        String clientId,
        int taxYear,
        BigDecimal totalExpenses,
        List<CategoryDeduction> categories,
        List<DeductionRecommendation> recommendations,
        Section179Analysis section179
) {

    public record CategoryDeduction(
            String category,
            BigDecimal total,
            Map<String, BigDecimal> subcategories,
            int deductiblePercentage,
            String notes,
            List<String> documentationNeeded
    ) {
    }

    public record DeductionRecommendation(
            String type,
            Severity priority,
            String title,
            String description,
            BigDecimal estimatedImpact
    ) {
    }

    public record Section179Analysis(
            BigDecimal totalEquipment,
            BigDecimal eligibleAmount,
            BigDecimal maxDeduction,
            BigDecimal estimatedSavings,
            boolean phaseOutApplies
    ) {
    }
}
