package com.taxdesk.engine.tax.strategy;

import com.taxdesk.engine.model.FilingStatus;
import com.taxdesk.engine.tables.TaxTables;

/**
 * Inputs shared by every strategy for a single calculation: the table set resolved for the run,
 * the client's home state and the owner's filing status.
 */
public record TaxContext(TaxTables tables, String state, FilingStatus filingStatus) {

    public TaxContext {
        if (filingStatus == null) {
            filingStatus = FilingStatus.SINGLE;
        }
    }
}
