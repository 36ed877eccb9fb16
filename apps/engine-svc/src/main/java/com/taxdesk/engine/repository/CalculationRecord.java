package com.taxdesk.engine.repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Summary row kept for every completed calculation run.
 */
public record CalculationRecord(
        UUID id,
        String clientId,
        CalculationKind kind,
        String period,
        BigDecimal totalAmount,
        Instant calculatedAt,
        String notes
) {

    public static CalculationRecord of(String clientId, CalculationKind kind, String period, BigDecimal totalAmount, String notes) {
        return new CalculationRecord(UUID.randomUUID(), clientId, kind, period, totalAmount, Instant.now(), notes);
    }
}
