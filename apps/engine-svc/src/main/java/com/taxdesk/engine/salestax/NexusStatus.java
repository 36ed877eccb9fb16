package com.taxdesk.engine.salestax;

/**
 * Ordered from weakest to strongest. A record only ever moves forward along this order.
 */
public enum NexusStatus {
    MONITORING,
    APPROACHING,
    EXCEEDED;

    public NexusStatus strongest(NexusStatus other) {
        if (other == null) {
            return this;
        }
        return compareTo(other) >= 0 ? this : other;
    }
}
