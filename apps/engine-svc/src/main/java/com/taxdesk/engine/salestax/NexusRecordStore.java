package com.taxdesk.engine.salestax;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Keyed storage of nexus records shared by every tracker call.
 */
public interface NexusRecordStore {

    Optional<NexusRecord> find(NexusKey key);

    /**
     * Applies {@code updater} to the current record (null when absent) and stores the result.
     * Implementations serialize concurrent updates of the same key; distinct keys do not block each other.
     */
    NexusRecord update(NexusKey key, UnaryOperator<NexusRecord> updater);

    List<NexusRecord> findByClientId(String clientId);
}
