package com.taxdesk.engine.controller;

import com.taxdesk.engine.controller.dto.DeductionAnalysisRequestDto;
import com.taxdesk.engine.controller.dto.TaxLiabilityRequestDto;
import com.taxdesk.engine.model.FilingStatus;
import com.taxdesk.engine.tables.TaxTableRegistry;
import com.taxdesk.engine.tax.DeductionAnalysis;
import com.taxdesk.engine.tax.DeductionAnalyzer;
import com.taxdesk.engine.tax.ProjectionMethod;
import com.taxdesk.engine.tax.TaxLiabilityReport;
import com.taxdesk.engine.tax.TaxLiabilityRequest;
import com.taxdesk.engine.tax.TaxLiabilityService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/tax")
@Validated
public class TaxController {

    private final TaxLiabilityService taxLiabilityService;
    private final DeductionAnalyzer deductionAnalyzer;
    private final TaxTableRegistry tableRegistry;

    public TaxController(TaxLiabilityService taxLiabilityService,
                         DeductionAnalyzer deductionAnalyzer,
                         TaxTableRegistry tableRegistry) {
        this.taxLiabilityService = taxLiabilityService;
        this.deductionAnalyzer = deductionAnalyzer;
        this.tableRegistry = tableRegistry;
    }

    @PostMapping("/liability")
    public ResponseEntity<TaxLiabilityReport> liability(@RequestBody @Valid TaxLiabilityRequestDto request) {
        FilingStatus filingStatus = request.filingStatus() == null || request.filingStatus().isBlank()
                ? null
                : FilingStatus.fromCode(request.filingStatus());
        var liabilityRequest = new TaxLiabilityRequest(
                request.clientId(),
                request.entityType(),
                request.state(),
                filingStatus,
                request.taxYear(),
                ProjectionMethod.fromCode(request.projectionMethod()),
                request.grossIncome(),
                request.businessExpenses()
        );
        return ResponseEntity.ok(taxLiabilityService.calculate(liabilityRequest));
    }

    @PostMapping("/deductions")
    public ResponseEntity<DeductionAnalysis> deductions(@RequestBody @Valid DeductionAnalysisRequestDto request) {
        int taxYear = request.taxYear() != null ? request.taxYear() : tableRegistry.defaultYear();
        return ResponseEntity.ok(deductionAnalyzer.analyze(request.clientId(), taxYear, request.expenseData()));
    }
}
