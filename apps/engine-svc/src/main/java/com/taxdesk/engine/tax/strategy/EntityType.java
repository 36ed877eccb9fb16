package com.taxdesk.engine.tax.strategy;

import com.taxdesk.engine.error.CalculationException;
import java.util.Locale;
import java.util.Set;

/**
 * Closed set of business entity forms the engine can tax. Tags not listed here are rejected
 * rather than routed to a default strategy.
 */
public enum EntityType {
    SOLE_PROPRIETORSHIP(Set.of("sole_proprietorship", "single_member_llc")),
    S_CORP(Set.of("s_corp", "s_corporation")),
    C_CORP(Set.of("c_corp", "corporation")),
    PARTNERSHIP(Set.of("partnership", "multi_member_llc"));

    private final Set<String> tags;

    EntityType(Set<String> tags) {
        this.tags = tags;
    }

    public static EntityType fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            throw CalculationException.unsupportedEntityType(String.valueOf(tag));
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (EntityType type : values()) {
            if (type.tags.contains(normalized) || type.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return type;
            }
        }
        throw CalculationException.unsupportedEntityType(tag);
    }
}
