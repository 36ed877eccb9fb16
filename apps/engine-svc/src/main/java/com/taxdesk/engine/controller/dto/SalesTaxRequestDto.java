package com.taxdesk.engine.controller.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.util.List;

public record SalesTaxRequestDto(
        @NotBlank @Size(max = 128) String clientId,
        @NotBlank @Pattern(regexp = "\\d{4}-\\d{2}", message = "must be YYYY-MM") String period,
        @NotEmpty List<@Valid SaleDto> sales
) {

    public record SaleDto(
            String state,
            String jurisdiction,
            @NotNull BigDecimal amount,
            Boolean taxable
    ) {
        public boolean taxableFlag() {
            return taxable == null || taxable;
        }
    }
}
