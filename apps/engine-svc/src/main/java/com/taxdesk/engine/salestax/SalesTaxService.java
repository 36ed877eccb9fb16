package com.taxdesk.engine.salestax;

import com.taxdesk.engine.audit.CalculationAuditLogger;
import com.taxdesk.engine.error.CalculationException;
import com.taxdesk.engine.error.ItemError;
import com.taxdesk.engine.filing.FilingRequirement;
import com.taxdesk.engine.filing.FilingRequirementDeriver;
import com.taxdesk.engine.filing.FilingThresholds;
import com.taxdesk.engine.model.Money;
import com.taxdesk.engine.model.Periods;
import com.taxdesk.engine.repository.CalculationKind;
import com.taxdesk.engine.repository.CalculationRecord;
import com.taxdesk.engine.repository.CalculationRecordRepository;
import com.taxdesk.engine.tables.JurisdictionRule;
import com.taxdesk.engine.tables.TaxTableRegistry;
import com.taxdesk.engine.tables.TaxTables;
import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sales-tax run for one period: groups sales by state and jurisdiction, prices each group and
 * derives its filing requirement. The nexus tracker is fed once per state with the state's combined
 * sales, so a state reports at most one alert per run. A group that cannot be priced carries its
 * own error and the rest of the run still completes.
 */
public class SalesTaxService {

    private static final Logger log = LoggerFactory.getLogger(SalesTaxService.class);

    private final TaxTableRegistry tableRegistry;
    private final NexusThresholdTracker nexusTracker;
    private final FilingRequirementDeriver filingDeriver;
    private final FilingThresholds filingThresholds;
    private final CalculationRecordRepository calculationRecordRepository;
    private final CalculationAuditLogger auditLogger;

    public SalesTaxService(TaxTableRegistry tableRegistry,
                           NexusThresholdTracker nexusTracker,
                           FilingRequirementDeriver filingDeriver,
                           FilingThresholds filingThresholds,
                           CalculationRecordRepository calculationRecordRepository,
                           CalculationAuditLogger auditLogger) {
        this.tableRegistry = tableRegistry;
        this.nexusTracker = nexusTracker;
        this.filingDeriver = filingDeriver;
        this.filingThresholds = filingThresholds;
        this.calculationRecordRepository = calculationRecordRepository;
        this.auditLogger = auditLogger;
    }

    public SalesTaxResult calculate(String clientId, String period, List<SaleRecord> sales) {
        if (clientId == null || clientId.isBlank()) {
            throw CalculationException.invalidInput("clientId must be provided");
        }
        if (sales == null || sales.isEmpty()) {
            throw CalculationException.invalidInput("No sales supplied");
        }
        YearMonth month = Periods.parseMonth(period);
        TaxTables tables = tableRegistry.forYear(month.getYear());

        Map<GroupKey, Group> groups = new LinkedHashMap<>();
        Map<String, Group> stateTotals = new HashMap<>();
        for (SaleRecord sale : sales) {
            if (sale.amount() == null) {
                throw CalculationException.invalidInput("sale amount must be provided");
            }
            String state = sale.state() == null ? "UNKNOWN" : sale.state().trim().toUpperCase(Locale.ROOT);
            groups.computeIfAbsent(new GroupKey(state, sale.jurisdiction()), k -> new Group()).add(sale);
            stateTotals.computeIfAbsent(state, k -> new Group()).add(sale);
        }
        Map<String, Optional<NexusUpdate>> nexusByState = new HashMap<>();

        List<JurisdictionTaxSummary> summaries = new ArrayList<>();
        List<NexusAlert> alerts = new ArrayList<>();
        List<FilingRequirement> filings = new ArrayList<>();
        BigDecimal totalTaxDue = BigDecimal.ZERO;
        int errors = 0;
        for (Map.Entry<GroupKey, Group> entry : groups.entrySet()) {
            GroupKey key = entry.getKey();
            Group group = entry.getValue();
            try {
                JurisdictionRule rule = tables.requireJurisdiction(key.state());
                BigDecimal rate = rule.rateFor(key.jurisdiction());
                BigDecimal taxDue = Money.round(group.taxable.multiply(rate));
                Optional<NexusUpdate> nexus = recordStateSales(clientId, key.state(), stateTotals.get(key.state()),
                        tables, nexusByState, alerts);
                Optional<FilingRequirement> filing = filingDeriver.deriveFiling(taxDue, month.toString(), filingThresholds);
                filing.ifPresent(filings::add);
                totalTaxDue = totalTaxDue.add(taxDue);
                summaries.add(new JurisdictionTaxSummary(
                        key.state(),
                        key.jurisdiction(),
                        group.count,
                        Money.round(group.gross),
                        Money.round(group.taxable),
                        Money.round(group.exempt),
                        rate,
                        taxDue,
                        nexus.orElse(null),
                        filing.orElse(null),
                        null
                ));
            } catch (CalculationException ex) {
                errors++;
                log.warn("sales_tax_group_failed clientId={} state={} jurisdiction={} kind={} message={}",
                        clientId, key.state(), key.jurisdiction(), ex.kind(), ex.getMessage());
                summaries.add(new JurisdictionTaxSummary(
                        key.state(),
                        key.jurisdiction(),
                        group.count,
                        Money.round(group.gross),
                        Money.round(group.taxable),
                        Money.round(group.exempt),
                        null,
                        null,
                        null,
                        null,
                        ItemError.from(ex)
                ));
            }
        }

        calculationRecordRepository.save(CalculationRecord.of(clientId, CalculationKind.SALES_TAX, month.toString(),
                totalTaxDue, "groups=" + groups.size() + " errors=" + errors));
        auditLogger.record("sales_tax", clientId, month.toString(), sales.size(), errors);
        return new SalesTaxResult(clientId, month.toString(), sales.size(), Money.round(totalTaxDue),
                List.copyOf(summaries), List.copyOf(alerts), List.copyOf(filings));
    }

    private Optional<NexusUpdate> recordStateSales(String clientId, String state, Group totals, TaxTables tables,
                                                   Map<String, Optional<NexusUpdate>> recorded, List<NexusAlert> alerts) {
        if (recorded.containsKey(state)) {
            return recorded.get(state);
        }
        Optional<NexusUpdate> update = nexusTracker.recordSales(clientId, state, totals.gross, totals.count, tables);
        update.flatMap(NexusUpdate::alertIfAny).ifPresent(alerts::add);
        recorded.put(state, update);
        return update;
    }

    private record GroupKey(String state, String jurisdiction) {
    }

    private static final class Group {
        private BigDecimal gross = BigDecimal.ZERO;
        private BigDecimal taxable = BigDecimal.ZERO;
        private BigDecimal exempt = BigDecimal.ZERO;
        private int count;

        void add(SaleRecord sale) {
            gross = gross.add(sale.amount());
            if (sale.taxable()) {
                taxable = taxable.add(sale.amount());
            } else {
                exempt = exempt.add(sale.amount());
            }
            count++;
        }
    }
}
