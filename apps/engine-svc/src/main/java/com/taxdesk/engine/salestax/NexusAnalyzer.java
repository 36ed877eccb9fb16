package com.taxdesk.engine.salestax;

import com.taxdesk.engine.error.CalculationException;
import com.taxdesk.engine.model.Money;
import com.taxdesk.engine.model.Severity;
import com.taxdesk.engine.salestax.NexusAnalysis.NexusRecommendation;
import com.taxdesk.engine.salestax.NexusAnalysis.StateNexus;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Cross-state summary of a client's nexus records.
 */
public class NexusAnalyzer {

    private static final BigDecimal MONITORING_PERCENTAGE = new BigDecimal("50");
    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final NexusRecordStore store;

    public NexusAnalyzer(NexusRecordStore store) {
        this.store = store;
    }

    public NexusAnalysis analyze(String clientId) {
        if (clientId == null || clientId.isBlank()) {
            throw CalculationException.invalidInput("clientId must be provided");
        }
        List<NexusRecord> records = new ArrayList<>(store.findByClientId(clientId));
        records.sort(Comparator.comparing(NexusRecord::cumulativeSales).reversed());

        List<StateNexus> registration = new ArrayList<>();
        List<StateNexus> monitoring = new ArrayList<>();
        int approaching = 0;
        for (NexusRecord record : records) {
            StateNexus info = new StateNexus(
                    record.jurisdiction(),
                    record.cumulativeSales(),
                    record.thresholdSalesAmount(),
                    percentage(record.cumulativeSales(), record.thresholdSalesAmount()),
                    record.status()
            );
            if (record.status() == NexusStatus.EXCEEDED) {
                registration.add(info);
            } else {
                if (record.status() == NexusStatus.APPROACHING) {
                    approaching++;
                }
                monitoring.add(info);
            }
        }

        List<NexusRecommendation> recommendations = new ArrayList<>();
        for (StateNexus state : registration) {
            recommendations.add(new NexusRecommendation(
                    "registration_required",
                    Severity.HIGH,
                    state.state(),
                    "Sales Tax Registration Required - " + state.state(),
                    String.format(Locale.US, "Sales of $%,.0f exceed threshold of $%,.0f", state.currentSales(), state.thresholdAmount()),
                    "Register for sales tax collection immediately",
                    "ASAP - may have retroactive obligations"
            ));
        }
        for (StateNexus state : monitoring) {
            if (state.thresholdPercentage().compareTo(MONITORING_PERCENTAGE) > 0) {
                recommendations.add(new NexusRecommendation(
                        "nexus_monitoring",
                        Severity.MEDIUM,
                        state.state(),
                        "Monitor Sales Activity - " + state.state(),
                        "Sales at " + state.thresholdPercentage().setScale(0, RoundingMode.HALF_UP).toPlainString() + "% of nexus threshold",
                        "Continue monitoring sales activity",
                        "Ongoing"
                ));
            }
        }
        if (!registration.isEmpty()) {
            recommendations.add(new NexusRecommendation(
                    "compliance_system",
                    Severity.HIGH,
                    null,
                    "Implement Sales Tax Compliance System",
                    "Active nexus in " + registration.size() + " states requires systematic compliance",
                    "Set up automated sales tax calculation and filing system",
                    "Within 30 days"
            ));
        }

        return new NexusAnalysis(clientId, records.size(), registration.size(), approaching,
                List.copyOf(registration), List.copyOf(monitoring), List.copyOf(recommendations));
    }

    private static BigDecimal percentage(BigDecimal current, BigDecimal threshold) {
        return Money.round(Money.divide(current, threshold).multiply(HUNDRED));
    }
}
