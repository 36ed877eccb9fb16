package com.taxdesk.engine.controller.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;

public record TaxLiabilityRequestDto(
        @NotBlank @Size(max = 128) String clientId,
        @NotBlank String entityType,
        @Size(max = 2) String state,
        String filingStatus,
        Integer taxYear,
        String projectionMethod,
        BigDecimal grossIncome,
        BigDecimal businessExpenses
) {
}
