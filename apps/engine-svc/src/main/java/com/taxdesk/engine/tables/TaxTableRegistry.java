package com.taxdesk.engine.tables;

import com.taxdesk.engine.error.CalculationException;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the loaded table set per year. A calculation run resolves its tables once and keeps that
 * reference, so {@link #install(TaxTables)} between runs never affects a run already in flight.
 */
public class TaxTableRegistry {

    private static final Logger log = LoggerFactory.getLogger(TaxTableRegistry.class);

    private volatile Map<Integer, TaxTables> byYear;
    private final int defaultYear;

    public TaxTableRegistry(Collection<TaxTables> tables, int defaultYear) {
        Map<Integer, TaxTables> initial = new HashMap<>();
        for (TaxTables t : tables) {
            initial.put(t.year(), t);
        }
        if (!initial.containsKey(defaultYear)) {
            throw CalculationException.configuration("Default tax year " + defaultYear + " has no tables loaded");
        }
        this.byYear = Map.copyOf(initial);
        this.defaultYear = defaultYear;
    }

    public TaxTables forYear(Integer year) {
        int effective = year == null ? defaultYear : year;
        TaxTables tables = byYear.get(effective);
        if (tables == null) {
            throw CalculationException.configuration("No tax tables loaded for " + effective);
        }
        return tables;
    }

    public TaxTables current() {
        return forYear(defaultYear);
    }

    public int defaultYear() {
        return defaultYear;
    }

    public synchronized void install(TaxTables tables) {
        Map<Integer, TaxTables> next = new HashMap<>(byYear);
        next.put(tables.year(), tables);
        byYear = Map.copyOf(next);
        log.info("tax_tables_installed year={}", tables.year());
    }
}
