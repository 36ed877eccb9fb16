package com.taxdesk.engine.tax;

import java.util.List;

public record TaxLiabilityReport(
        String clientId,
        int taxYear,
        ProjectionMethod projectionMethod,
        TaxCalculationResult calculation,
        QuarterlyEstimate quarterlyEstimates,
        List<TaxRecommendation> recommendations
) {
}
