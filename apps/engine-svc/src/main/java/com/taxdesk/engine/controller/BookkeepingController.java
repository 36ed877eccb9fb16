package com.taxdesk.engine.controller;

import com.taxdesk.engine.bookkeeping.BookkeepingService;
import com.taxdesk.engine.bookkeeping.ClassificationBatchResult;
import com.taxdesk.engine.bookkeeping.ReconciliationAnalyzer;
import com.taxdesk.engine.bookkeeping.ReconciliationReport;
import com.taxdesk.engine.bookkeeping.TransactionRecord;
import com.taxdesk.engine.controller.dto.ClassifyTransactionsRequestDto;
import com.taxdesk.engine.controller.dto.ReconcileRequestDto;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/bookkeeping")
@Validated
public class BookkeepingController {

    private final BookkeepingService bookkeepingService;
    private final ReconciliationAnalyzer reconciliationAnalyzer;

    public BookkeepingController(BookkeepingService bookkeepingService, ReconciliationAnalyzer reconciliationAnalyzer) {
        this.bookkeepingService = bookkeepingService;
        this.reconciliationAnalyzer = reconciliationAnalyzer;
    }

    @PostMapping("/classify")
    public ResponseEntity<ClassificationBatchResult> classify(@RequestBody @Valid ClassifyTransactionsRequestDto request) {
        List<TransactionRecord> records = request.transactions().stream()
                .map(tx -> new TransactionRecord(tx.date(), tx.description(), tx.amount(), tx.referenceId()))
                .toList();
        return ResponseEntity.ok(bookkeepingService.classifyBatch(request.clientId(), request.account(), records));
    }

    @PostMapping("/reconcile")
    public ResponseEntity<ReconciliationReport> reconcile(@RequestBody @Valid ReconcileRequestDto request) {
        return ResponseEntity.ok(reconciliationAnalyzer.reconcile(request.clientId(), request.account(), request.period()));
    }
}
