package com.taxdesk.engine.repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryCalculationRecordRepository implements CalculationRecordRepository {

    private final Map<UUID, CalculationRecord> storage = new ConcurrentHashMap<>();

    @Override
    public CalculationRecord save(CalculationRecord record) {
        storage.put(record.id(), record);
        return record;
    }

    @Override
    public List<CalculationRecord> findByClientId(String clientId) {
        return storage.values().stream()
                .filter(r -> r.clientId().equals(clientId))
                .sorted(Comparator.comparing(CalculationRecord::calculatedAt).reversed())
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public List<CalculationRecord> findByClientIdAndKind(String clientId, CalculationKind kind) {
        return findByClientId(clientId).stream()
                .filter(r -> r.kind() == kind)
                .collect(Collectors.toCollection(ArrayList::new));
    }
}
