package com.taxdesk.engine.controller;

import com.taxdesk.engine.controller.dto.PayrollRunRequestDto;
import com.taxdesk.engine.model.FilingStatus;
import com.taxdesk.engine.payroll.EmployeePayInput;
import com.taxdesk.engine.payroll.PayBasis;
import com.taxdesk.engine.payroll.PayrollRunResult;
import com.taxdesk.engine.payroll.PayrollService;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/payroll")
@Validated
public class PayrollController {

    private final PayrollService payrollService;

    public PayrollController(PayrollService payrollService) {
        this.payrollService = payrollService;
    }

    @PostMapping("/runs")
    public ResponseEntity<PayrollRunResult> run(@RequestBody @Valid PayrollRunRequestDto request) {
        List<EmployeePayInput> employees = request.employees().stream()
                .map(this::toInput)
                .toList();
        return ResponseEntity.ok(payrollService.calculatePayroll(request.clientId(), request.payPeriod(), employees));
    }

    private EmployeePayInput toInput(PayrollRunRequestDto.EmployeeDto dto) {
        FilingStatus status = dto.filingStatus() == null || dto.filingStatus().isBlank()
                ? FilingStatus.SINGLE
                : FilingStatus.fromCode(dto.filingStatus());
        return new EmployeePayInput(
                dto.employeeId(),
                PayBasis.fromCode(dto.payType()),
                dto.hoursWorked(),
                dto.overtimeHours(),
                dto.rate(),
                status,
                dto.allowances() == null ? 0 : dto.allowances(),
                dto.additionalWithholding(),
                dto.otherDeductions()
        );
    }
}
