package com.taxdesk.engine.controller.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record ClassifyTransactionsRequestDto(
        @NotBlank @Size(max = 128) String clientId,
        @Size(max = 64) String account,
        @NotEmpty List<@Valid TransactionDto> transactions
) {

    public record TransactionDto(
            @NotNull @JsonFormat(pattern = "yyyy-MM-dd") LocalDate date,
            @Size(max = 512) String description,
            @NotNull BigDecimal amount,
            String referenceId
    ) {
    }
}
