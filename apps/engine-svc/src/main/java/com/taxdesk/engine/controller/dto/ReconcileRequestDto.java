package com.taxdesk.engine.controller.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record ReconcileRequestDto(
        @NotBlank @Size(max = 128) String clientId,
        @Size(max = 64) String account,
        @NotBlank @Pattern(regexp = "\\d{4}-\\d{2}", message = "must be YYYY-MM") String period
) {
}
