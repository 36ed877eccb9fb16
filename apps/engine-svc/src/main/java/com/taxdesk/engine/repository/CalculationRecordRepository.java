package com.taxdesk.engine.repository;

import java.util.List;

public interface CalculationRecordRepository {

    CalculationRecord save(CalculationRecord record);

    List<CalculationRecord> findByClientId(String clientId);

    List<CalculationRecord> findByClientIdAndKind(String clientId, CalculationKind kind);
}
