package com.taxdesk.engine.controller.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.util.List;

public record PayrollRunRequestDto(
        @NotBlank @Size(max = 128) String clientId,
        @NotBlank String payPeriod,
        @NotEmpty List<@Valid EmployeeDto> employees
) {

    /**
     * Per-employee values are validated by the payroll run itself so one bad row fails only its own line.
     */
    public record EmployeeDto(
            @NotBlank String employeeId,
            String payType,
            BigDecimal hoursWorked,
            BigDecimal overtimeHours,
            BigDecimal rate,
            String filingStatus,
            @Min(0) Integer allowances,
            BigDecimal additionalWithholding,
            BigDecimal otherDeductions
    ) {
    }
}
