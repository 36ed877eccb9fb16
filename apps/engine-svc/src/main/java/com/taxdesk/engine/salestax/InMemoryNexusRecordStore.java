package com.taxdesk.engine.salestax;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

public class InMemoryNexusRecordStore implements NexusRecordStore {

    private final ConcurrentMap<NexusKey, NexusRecord> storage = new ConcurrentHashMap<>();

    @Override
    public Optional<NexusRecord> find(NexusKey key) {
        return Optional.ofNullable(storage.get(key));
    }

    @Override
    public NexusRecord update(NexusKey key, UnaryOperator<NexusRecord> updater) {
        // compute holds the bin lock for this key while the updater runs
        return storage.compute(key, (k, current) -> updater.apply(current));
    }

    @Override
    public List<NexusRecord> findByClientId(String clientId) {
        return storage.values().stream()
                .filter(record -> record.clientId().equals(clientId))
                .collect(Collectors.toCollection(ArrayList::new));
    }
}
