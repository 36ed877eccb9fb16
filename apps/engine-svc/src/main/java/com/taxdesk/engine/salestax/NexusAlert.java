package com.taxdesk.engine.salestax;

import java.math.BigDecimal;

public record NexusAlert(
        AlertType type,
        String jurisdiction,
        ThresholdType thresholdType,
        BigDecimal thresholdAmount,
        BigDecimal currentAmount,
        String message,
        String actionRequired
) {

    public enum AlertType {
        NEXUS_THRESHOLD_EXCEEDED,
        NEXUS_THRESHOLD_WARNING
    }

    public enum ThresholdType {
        SALES,
        TRANSACTIONS
    }
}
