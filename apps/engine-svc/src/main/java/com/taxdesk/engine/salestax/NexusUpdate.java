package com.taxdesk.engine.salestax;

import java.util.Optional;

/**
 * Record after applying one period's sales, with the alert raised for it, if any.
 */
public record NexusUpdate(NexusRecord record, NexusAlert alert) {

    public Optional<NexusAlert> alertIfAny() {
        return Optional.ofNullable(alert);
    }
}
