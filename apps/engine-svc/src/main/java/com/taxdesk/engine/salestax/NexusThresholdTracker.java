package com.taxdesk.engine.salestax;

import com.taxdesk.engine.error.CalculationException;
import com.taxdesk.engine.model.Money;
import com.taxdesk.engine.tables.JurisdictionRule;
import com.taxdesk.engine.tables.TaxTableRegistry;
import com.taxdesk.engine.tables.TaxTables;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Accumulates sales per client and state and tracks the economic-nexus status. The running totals
 * live in the injected {@link NexusRecordStore}, so progress survives across calls and instances.
 *
 * <p>Status moves MONITORING, APPROACHING, EXCEEDED and never back. While the cumulative is at
 * or above the warning ratio every call reports an alert, not only the call that crossed it.
 */
public class NexusThresholdTracker {

    private static final Logger log = LoggerFactory.getLogger(NexusThresholdTracker.class);

    private final NexusRecordStore store;
    private final TaxTableRegistry tableRegistry;
    private final BigDecimal warningRatio;
    private final Clock clock;

    public NexusThresholdTracker(NexusRecordStore store, TaxTableRegistry tableRegistry, BigDecimal warningRatio, Clock clock) {
        this.store = store;
        this.tableRegistry = tableRegistry;
        this.warningRatio = warningRatio;
        this.clock = clock;
    }

    public Optional<NexusUpdate> recordSales(String clientId, String jurisdiction, BigDecimal periodSalesAmount) {
        return recordSales(clientId, jurisdiction, periodSalesAmount, 0, tableRegistry.current());
    }

    public Optional<NexusUpdate> recordSales(String clientId, String jurisdiction, BigDecimal periodSalesAmount, int transactionCount) {
        return recordSales(clientId, jurisdiction, periodSalesAmount, transactionCount, tableRegistry.current());
    }

    /**
     * @return empty when the state levies no sales tax; nothing is stored in that case
     */
    public Optional<NexusUpdate> recordSales(String clientId, String jurisdiction, BigDecimal periodSalesAmount,
                                             int transactionCount, TaxTables tables) {
        if (periodSalesAmount == null || periodSalesAmount.signum() < 0) {
            throw CalculationException.invalidInput("period sales amount must not be negative: " + periodSalesAmount);
        }
        if (transactionCount < 0) {
            throw CalculationException.invalidInput("transaction count must not be negative: " + transactionCount);
        }
        NexusKey key = new NexusKey(clientId, jurisdiction);
        JurisdictionRule rule = tables.requireJurisdiction(key.jurisdiction());
        if (!rule.hasSalesTaxRegime()) {
            return Optional.empty();
        }

        NexusStatus[] previous = new NexusStatus[1];
        NexusRecord updated = store.update(key, current -> {
            previous[0] = current != null ? current.status() : null;
            BigDecimal cumulativeSales = Money.round((current != null ? current.cumulativeSales() : BigDecimal.ZERO).add(periodSalesAmount));
            long cumulativeCount = (current != null ? current.cumulativeTransactionCount() : 0L) + transactionCount;
            NexusStatus computed = evaluate(cumulativeSales, rule.nexusSales())
                    .strongest(evaluateCount(cumulativeCount, rule.nexusTransactions()));
            NexusStatus status = computed.strongest(previous[0]);
            return new NexusRecord(
                    key.clientId(),
                    key.jurisdiction(),
                    rule.nexusSales(),
                    rule.nexusTransactions(),
                    cumulativeSales,
                    cumulativeCount,
                    status,
                    clock.instant()
            );
        });

        if (previous[0] != updated.status()) {
            log.info("nexus_status_changed clientId={} jurisdiction={} from={} to={} cumulativeSales={} transactions={}",
                    updated.clientId(), updated.jurisdiction(), previous[0], updated.status(),
                    updated.cumulativeSales(), updated.cumulativeTransactionCount());
        }
        return Optional.of(new NexusUpdate(updated, alertFor(updated)));
    }

    NexusStatus evaluate(BigDecimal cumulative, BigDecimal threshold) {
        if (cumulative.compareTo(threshold) >= 0) {
            return NexusStatus.EXCEEDED;
        }
        if (cumulative.compareTo(threshold.multiply(warningRatio)) >= 0) {
            return NexusStatus.APPROACHING;
        }
        return NexusStatus.MONITORING;
    }

    private NexusStatus evaluateCount(long cumulativeCount, Integer threshold) {
        if (threshold == null || threshold <= 0) {
            return NexusStatus.MONITORING;
        }
        return evaluate(BigDecimal.valueOf(cumulativeCount), BigDecimal.valueOf(threshold));
    }

    private NexusAlert alertFor(NexusRecord record) {
        if (record.status() == NexusStatus.MONITORING) {
            return null;
        }
        NexusStatus bySales = evaluate(record.cumulativeSales(), record.thresholdSalesAmount());
        boolean salesDriven = bySales == record.status() || record.thresholdTransactionCount() == null;
        NexusAlert.ThresholdType thresholdType = salesDriven ? NexusAlert.ThresholdType.SALES : NexusAlert.ThresholdType.TRANSACTIONS;
        BigDecimal thresholdAmount = salesDriven ? record.thresholdSalesAmount() : BigDecimal.valueOf(record.thresholdTransactionCount());
        BigDecimal currentAmount = salesDriven ? record.cumulativeSales() : BigDecimal.valueOf(record.cumulativeTransactionCount());
        String measure = salesDriven ? "sales" : "transaction";
        if (record.status() == NexusStatus.EXCEEDED) {
            return new NexusAlert(
                    NexusAlert.AlertType.NEXUS_THRESHOLD_EXCEEDED,
                    record.jurisdiction(),
                    thresholdType,
                    thresholdAmount,
                    currentAmount,
                    "Economic nexus " + measure + " threshold exceeded in " + record.jurisdiction(),
                    "Register for sales tax collection"
            );
        }
        return new NexusAlert(
                NexusAlert.AlertType.NEXUS_THRESHOLD_WARNING,
                record.jurisdiction(),
                thresholdType,
                thresholdAmount,
                currentAmount,
                "Approaching " + measure + " threshold in " + record.jurisdiction(),
                "Monitor sales closely"
        );
    }
}
