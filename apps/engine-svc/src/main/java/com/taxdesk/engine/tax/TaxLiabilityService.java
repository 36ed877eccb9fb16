package com.taxdesk.engine.tax;

import com.taxdesk.engine.audit.CalculationAuditLogger;
import com.taxdesk.engine.error.CalculationException;
import com.taxdesk.engine.repository.CalculationKind;
import com.taxdesk.engine.repository.CalculationRecord;
import com.taxdesk.engine.repository.CalculationRecordRepository;
import com.taxdesk.engine.tables.TaxTableRegistry;
import com.taxdesk.engine.tables.TaxTables;
import com.taxdesk.engine.tax.strategy.EntityTaxStrategySelector;
import com.taxdesk.engine.tax.strategy.EntityType;
import com.taxdesk.engine.tax.strategy.TaxContext;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Projection, entity strategy, quarterly estimate and planning advice for one client and year.
 */
public class TaxLiabilityService {

    private static final Logger log = LoggerFactory.getLogger(TaxLiabilityService.class);

    private final TaxTableRegistry tableRegistry;
    private final FinancialProjector projector;
    private final EntityTaxStrategySelector strategySelector;
    private final TaxPlanningAdvisor advisor;
    private final CalculationRecordRepository calculationRecordRepository;
    private final CalculationAuditLogger auditLogger;

    public TaxLiabilityService(TaxTableRegistry tableRegistry,
                               FinancialProjector projector,
                               EntityTaxStrategySelector strategySelector,
                               TaxPlanningAdvisor advisor,
                               CalculationRecordRepository calculationRecordRepository,
                               CalculationAuditLogger auditLogger) {
        this.tableRegistry = tableRegistry;
        this.projector = projector;
        this.strategySelector = strategySelector;
        this.advisor = advisor;
        this.calculationRecordRepository = calculationRecordRepository;
        this.auditLogger = auditLogger;
    }

    public TaxLiabilityReport calculate(TaxLiabilityRequest request) {
        if (request.clientId() == null || request.clientId().isBlank()) {
            throw CalculationException.invalidInput("clientId must be provided");
        }
        EntityType entityType = EntityType.fromTag(request.entityType());
        TaxTables tables = tableRegistry.forYear(request.taxYear());
        int taxYear = tables.year();

        FinancialProjection projection;
        if (request.hasProvidedFigures()) {
            projection = FinancialProjection.of(request.grossIncome(), request.businessExpenses());
        } else {
            ProjectionMethod method = request.projectionMethod() != null ? request.projectionMethod() : ProjectionMethod.YTD_ANNUALIZED;
            projection = projector.project(request.clientId(), taxYear, method);
        }

        TaxCalculationResult result = strategySelector.computeTax(entityType, projection,
                new TaxContext(tables, request.state(), request.filingStatus()));
        QuarterlyEstimate quarterly = advisor.quarterlyEstimate(result, taxYear);
        List<TaxRecommendation> recommendations = advisor.recommend(result);

        calculationRecordRepository.save(CalculationRecord.of(request.clientId(), CalculationKind.TAX_LIABILITY,
                String.valueOf(taxYear), result.totalTax(), "Projection method: " + projection.method()));
        auditLogger.record("tax_liability", request.clientId(), String.valueOf(taxYear), 1, 0);
        log.debug("tax_liability clientId={} entityType={} totalTax={} effectiveRate={}",
                request.clientId(), entityType, result.totalTax(), result.effectiveRate());

        return new TaxLiabilityReport(request.clientId(), taxYear, projection.method(), result, quarterly, recommendations);
    }
}
