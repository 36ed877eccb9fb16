package com.taxdesk.engine.controller;

import com.taxdesk.engine.controller.dto.NexusRecordRequestDto;
import com.taxdesk.engine.controller.dto.NexusRecordResponseDto;
import com.taxdesk.engine.controller.dto.SalesTaxRequestDto;
import com.taxdesk.engine.salestax.NexusAnalysis;
import com.taxdesk.engine.salestax.NexusAnalyzer;
import com.taxdesk.engine.salestax.NexusThresholdTracker;
import com.taxdesk.engine.salestax.SaleRecord;
import com.taxdesk.engine.salestax.SalesTaxResult;
import com.taxdesk.engine.salestax.SalesTaxService;
import com.taxdesk.engine.web.RequestContextHolder;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/sales-tax")
@Validated
public class SalesTaxController {

    private final SalesTaxService salesTaxService;
    private final NexusThresholdTracker nexusTracker;
    private final NexusAnalyzer nexusAnalyzer;

    public SalesTaxController(SalesTaxService salesTaxService,
                              NexusThresholdTracker nexusTracker,
                              NexusAnalyzer nexusAnalyzer) {
        this.salesTaxService = salesTaxService;
        this.nexusTracker = nexusTracker;
        this.nexusAnalyzer = nexusAnalyzer;
    }

    @PostMapping("/calculate")
    public ResponseEntity<SalesTaxResult> calculate(@RequestBody @Valid SalesTaxRequestDto request) {
        List<SaleRecord> sales = request.sales().stream()
                .map(sale -> new SaleRecord(sale.state(), sale.jurisdiction(), sale.amount(), sale.taxableFlag()))
                .toList();
        return ResponseEntity.ok(salesTaxService.calculate(request.clientId(), request.period(), sales));
    }

    @PostMapping("/nexus/record")
    public ResponseEntity<NexusRecordResponseDto> recordSales(@RequestBody @Valid NexusRecordRequestDto request) {
        int count = request.transactionCount() == null ? 0 : request.transactionCount();
        String traceId = RequestContextHolder.traceId().orElse(null);
        var response = nexusTracker.recordSales(request.clientId(), request.jurisdiction(), request.salesAmount(), count)
                .map(update -> new NexusRecordResponseDto(true, update.record(), update.alert(), traceId))
                .orElseGet(() -> new NexusRecordResponseDto(false, null, null, traceId));
        return ResponseEntity.ok(response);
    }

    @GetMapping("/nexus/{clientId}")
    public ResponseEntity<NexusAnalysis> nexusAnalysis(@PathVariable("clientId") @NotBlank String clientId) {
        return ResponseEntity.ok(nexusAnalyzer.analyze(clientId));
    }
}
