package com.taxdesk.engine.salestax;

import static org.assertj.core.api.Assertions.assertThat;

import com.taxdesk.engine.model.Severity;
import java.math.BigDecimal;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class NexusAnalyzerTest {

    private InMemoryNexusRecordStore store;
    private NexusAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        store = new InMemoryNexusRecordStore();
        analyzer = new NexusAnalyzer(store);
    }

    @Test
    void summarizesClientNexusPosition() {
        seed("FL", "100000", "120000.00", NexusStatus.EXCEEDED);
        seed("AZ", "100000", "60000.00", NexusStatus.MONITORING);
        seed("CA", "500000", "100000.00", NexusStatus.MONITORING);
        seed("WA", "100000", "85000.00", NexusStatus.APPROACHING);

        NexusAnalysis analysis = analyzer.analyze("client-1");

        assertThat(analysis.totalStatesMonitored()).isEqualTo(4);
        assertThat(analysis.statesWithNexus()).isEqualTo(1);
        assertThat(analysis.statesApproachingNexus()).isEqualTo(1);
        assertThat(analysis.registrationRequired()).singleElement().satisfies(state -> {
            assertThat(state.state()).isEqualTo("FL");
            assertThat(state.thresholdPercentage()).isEqualByComparingTo("120.00");
        });
        assertThat(analysis.monitoringStates()).extracting(NexusAnalysis.StateNexus::state)
                .containsExactly("CA", "WA", "AZ");
        assertThat(analysis.recommendations()).extracting(NexusAnalysis.NexusRecommendation::type)
                .containsExactly("registration_required", "nexus_monitoring", "nexus_monitoring", "compliance_system");
        NexusAnalysis.NexusRecommendation registration = analysis.recommendations().get(0);
        assertThat(registration.priority()).isEqualTo(Severity.HIGH);
        assertThat(registration.description()).isEqualTo("Sales of $120,000 exceed threshold of $100,000");
        assertThat(analysis.recommendations().get(1).description()).isEqualTo("Sales at 85% of nexus threshold");
        assertThat(analysis.recommendations().get(2).state()).isEqualTo("AZ");
    }

    @Test
    void clientWithoutRecordsHasEmptyAnalysis() {
        NexusAnalysis analysis = analyzer.analyze("client-empty");

        assertThat(analysis.totalStatesMonitored()).isZero();
        assertThat(analysis.recommendations()).isEmpty();
    }

    private void seed(String state, String threshold, String cumulative, NexusStatus status) {
        store.update(new NexusKey("client-1", state), current -> new NexusRecord("client-1", state,
                new BigDecimal(threshold), null, new BigDecimal(cumulative), 1L, status, Instant.EPOCH));
    }
}
