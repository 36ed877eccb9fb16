package com.taxdesk.engine.repository;

import com.taxdesk.engine.bookkeeping.ClassifiedTransaction;
import java.time.LocalDate;
import java.util.List;

public interface ClassifiedTransactionRepository {

    List<ClassifiedTransaction> saveAll(String clientId, String account, List<ClassifiedTransaction> transactions);

    /**
     * Transactions of every account of the client dated within {@code [from, to]} (both inclusive), oldest first.
     */
    List<ClassifiedTransaction> findByClientAndRange(String clientId, LocalDate from, LocalDate to);

    List<ClassifiedTransaction> findByClientAndAccountAndRange(String clientId, String account, LocalDate from, LocalDate to);

    void deleteByClientId(String clientId);
}
