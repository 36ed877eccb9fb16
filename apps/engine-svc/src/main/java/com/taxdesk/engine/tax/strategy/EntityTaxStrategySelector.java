package com.taxdesk.engine.tax.strategy;

import com.taxdesk.engine.error.CalculationException;
import com.taxdesk.engine.tax.FinancialProjection;
import com.taxdesk.engine.tax.TaxCalculationResult;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Routes a calculation to the strategy registered for the declared entity type.
 */
public class EntityTaxStrategySelector {

    private final Map<EntityType, EntityTaxStrategy> strategies = new EnumMap<>(EntityType.class);

    public EntityTaxStrategySelector(Collection<EntityTaxStrategy> registered) {
        for (EntityTaxStrategy strategy : registered) {
            EntityTaxStrategy previous = strategies.put(strategy.entityType(), strategy);
            if (previous != null) {
                throw CalculationException.configuration("Duplicate tax strategy for " + strategy.entityType());
            }
        }
        for (EntityType type : EntityType.values()) {
            if (!strategies.containsKey(type)) {
                throw CalculationException.configuration("No tax strategy registered for " + type);
            }
        }
    }

    public EntityTaxStrategy select(EntityType entityType) {
        return strategies.get(entityType);
    }

    public TaxCalculationResult computeTax(String entityTypeTag, FinancialProjection projection, TaxContext context) {
        return computeTax(EntityType.fromTag(entityTypeTag), projection, context);
    }

    public TaxCalculationResult computeTax(EntityType entityType, FinancialProjection projection, TaxContext context) {
        return select(entityType).computeTax(projection, context);
    }
}
