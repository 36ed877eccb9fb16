package com.taxdesk.engine.salestax;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.transaction.support.TransactionTemplate;

class JdbcNexusRecordStoreTest {

    private static final Instant NOW = Instant.parse("2024-04-01T12:00:00Z");

    private JdbcNexusRecordStore store;

    @BeforeEach
    void setUp() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
                "jdbc:h2:mem:nexus-" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1", "sa", "");
        new ResourceDatabasePopulator(new ClassPathResource("db/nexus-schema.sql")).execute(dataSource);
        store = new JdbcNexusRecordStore(new JdbcTemplate(dataSource),
                new TransactionTemplate(new DataSourceTransactionManager(dataSource)));
    }

    @Test
    void insertsThenUpdatesRow() {
        NexusKey key = new NexusKey("client-1", "AZ");

        store.update(key, current -> {
            assertThat(current).isNull();
            return record("60000.00", 12, NexusStatus.MONITORING);
        });
        NexusRecord updated = store.update(key, current -> {
            assertThat(current.cumulativeSales()).isEqualByComparingTo("60000.00");
            return record("105000.00", 20, NexusStatus.EXCEEDED);
        });

        assertThat(updated.status()).isEqualTo(NexusStatus.EXCEEDED);
        NexusRecord stored = store.find(key).orElseThrow();
        assertThat(stored.cumulativeSales()).isEqualByComparingTo("105000.00");
        assertThat(stored.cumulativeTransactionCount()).isEqualTo(20L);
        assertThat(stored.thresholdTransactionCount()).isEqualTo(200);
        assertThat(stored.status()).isEqualTo(NexusStatus.EXCEEDED);
        assertThat(stored.lastUpdated()).isEqualTo(NOW);
    }

    @Test
    void nullTransactionThresholdSurvivesRoundTrip() {
        NexusKey key = new NexusKey("client-1", "CA");
        store.update(key, current -> new NexusRecord("client-1", "CA", new BigDecimal("500000"), null,
                new BigDecimal("10.00"), 1L, NexusStatus.MONITORING, NOW));

        assertThat(store.find(key).orElseThrow().thresholdTransactionCount()).isNull();
    }

    @Test
    void listsClientRecordsLargestFirst() {
        store.update(new NexusKey("client-1", "AZ"), current -> record("500.00", 1, NexusStatus.MONITORING));
        store.update(new NexusKey("client-1", "FL"), current -> new NexusRecord("client-1", "FL",
                new BigDecimal("100000"), null, new BigDecimal("90000.00"), 3L, NexusStatus.APPROACHING, NOW));
        store.update(new NexusKey("client-2", "AZ"), current -> new NexusRecord("client-2", "AZ",
                new BigDecimal("100000"), 200, new BigDecimal("1.00"), 1L, NexusStatus.MONITORING, NOW));

        assertThat(store.findByClientId("client-1"))
                .extracting(NexusRecord::jurisdiction)
                .containsExactly("FL", "AZ");
        assertThat(store.find(new NexusKey("client-3", "AZ"))).isEmpty();
    }

    private static NexusRecord record(String cumulative, long count, NexusStatus status) {
        return new NexusRecord("client-1", "AZ", new BigDecimal("100000"), 200,
                new BigDecimal(cumulative), count, status, NOW);
    }
}
