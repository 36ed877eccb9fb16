package com.taxdesk.engine.controller.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.util.Map;

/**
 * {@code expenseData} maps category to subcategory to amount. When absent the analysis reads the
 * client's classified transactions for the tax year.
 */
public record DeductionAnalysisRequestDto(
        @NotBlank @Size(max = 128) String clientId,
        Integer taxYear,
        Map<String, Map<String, BigDecimal>> expenseData
) {
}
