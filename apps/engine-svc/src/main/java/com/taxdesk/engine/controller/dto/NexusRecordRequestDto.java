package com.taxdesk.engine.controller.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;

public record NexusRecordRequestDto(
        @NotBlank @Size(max = 128) String clientId,
        @NotBlank @Size(max = 2) String jurisdiction,
        @NotNull BigDecimal salesAmount,
        @Min(0) Integer transactionCount
) {
}
