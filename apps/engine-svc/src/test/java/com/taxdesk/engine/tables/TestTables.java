package com.taxdesk.engine.tables;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;

/**
 * Shared fixture: the bundled 2024 tables, loaded once per JVM.
 */
public final class TestTables {

    private static final TaxTables TABLES_2024 = new TaxTableLoader(new ObjectMapper(), "tax-tables/").load(2024);

    private TestTables() {
    }

    public static TaxTables tables2024() {
        return TABLES_2024;
    }

    public static TaxTableRegistry registry2024() {
        return new TaxTableRegistry(List.of(TABLES_2024), 2024);
    }
}
