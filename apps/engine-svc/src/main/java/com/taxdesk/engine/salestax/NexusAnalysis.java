package com.taxdesk.engine.salestax;

import com.taxdesk.engine.model.Severity;
import java.math.BigDecimal;
import java.util.List;

public record NexusAnalysis(
        String clientId,
        int totalStatesMonitored,
        int statesWithNexus,
        int statesApproachingNexus,
        List<StateNexus> registrationRequired,
        List<StateNexus> monitoringStates,
        List<NexusRecommendation> recommendations
) {

    public record StateNexus(
            String state,
            BigDecimal currentSales,
            BigDecimal thresholdAmount,
            BigDecimal thresholdPercentage,
            NexusStatus status
    ) {
    }

    public record NexusRecommendation(
            String type,
            Severity priority,
            String state,
            String title,
            String description,
            String action,
            String deadline
    ) {
    }
}
