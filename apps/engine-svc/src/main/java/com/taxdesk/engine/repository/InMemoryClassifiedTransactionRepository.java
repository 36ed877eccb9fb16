package com.taxdesk.engine.repository;

import com.taxdesk.engine.bookkeeping.ClassifiedTransaction;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryClassifiedTransactionRepository implements ClassifiedTransactionRepository {

    private final Map<UUID, StoredTransaction> storage = new ConcurrentHashMap<>();

    @Override
    public List<ClassifiedTransaction> saveAll(String clientId, String account, List<ClassifiedTransaction> transactions) {
        for (ClassifiedTransaction tx : transactions) {
            storage.put(tx.id(), new StoredTransaction(clientId, account, tx));
        }
        return transactions;
    }

    @Override
    public List<ClassifiedTransaction> findByClientAndRange(String clientId, LocalDate from, LocalDate to) {
        return storage.values().stream()
                .filter(stored -> stored.clientId().equals(clientId))
                .map(StoredTransaction::transaction)
                .filter(tx -> !tx.date().isBefore(from) && !tx.date().isAfter(to))
                .sorted(Comparator.comparing(ClassifiedTransaction::date))
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public List<ClassifiedTransaction> findByClientAndAccountAndRange(String clientId, String account, LocalDate from, LocalDate to) {
        return storage.values().stream()
                .filter(stored -> stored.clientId().equals(clientId) && stored.account().equals(account))
                .map(StoredTransaction::transaction)
                .filter(tx -> !tx.date().isBefore(from) && !tx.date().isAfter(to))
                .sorted(Comparator.comparing(ClassifiedTransaction::date))
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public void deleteByClientId(String clientId) {
        storage.entrySet().removeIf(entry -> entry.getValue().clientId().equals(clientId));
    }

    private record StoredTransaction(String clientId, String account, ClassifiedTransaction transaction) {
    }
}
