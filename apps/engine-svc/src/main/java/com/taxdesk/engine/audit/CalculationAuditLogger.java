package com.taxdesk.engine.audit;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class CalculationAuditLogger {

    private static final Logger log = LoggerFactory.getLogger(CalculationAuditLogger.class);

    private final ConcurrentMap<String, AtomicInteger> runCounts = new ConcurrentHashMap<>();

    public int incrementRuns(String clientId) {
        return runCounts.computeIfAbsent(clientId, k -> new AtomicInteger()).incrementAndGet();
    }

    public void record(String operation, String clientId, String period, int items, int errors) {
        int runs = incrementRuns(clientId);
        log.info("calc_audit operation={} clientId={} period={} runs={} items={} errors={}",
                operation, clientId, period, runs, items, errors);
    }
}
