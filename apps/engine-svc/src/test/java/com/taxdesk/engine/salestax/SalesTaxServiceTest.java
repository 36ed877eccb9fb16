package com.taxdesk.engine.salestax;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import com.taxdesk.engine.audit.CalculationAuditLogger;
import com.taxdesk.engine.error.CalculationException;
import com.taxdesk.engine.error.ErrorKind;
import com.taxdesk.engine.filing.FilingFrequency;
import com.taxdesk.engine.filing.FilingRequirementDeriver;
import com.taxdesk.engine.filing.FilingThresholds;
import com.taxdesk.engine.repository.CalculationKind;
import com.taxdesk.engine.repository.InMemoryCalculationRecordRepository;
import com.taxdesk.engine.tables.TaxTableRegistry;
import com.taxdesk.engine.tables.TestTables;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SalesTaxServiceTest {

    private InMemoryNexusRecordStore nexusStore;
    private InMemoryCalculationRecordRepository calculationRecords;
    private SalesTaxService service;

    @BeforeEach
    void setUp() {
        TaxTableRegistry registry = TestTables.registry2024();
        nexusStore = new InMemoryNexusRecordStore();
        calculationRecords = new InMemoryCalculationRecordRepository();
        NexusThresholdTracker tracker = new NexusThresholdTracker(nexusStore, registry, new BigDecimal("0.8"), Clock.systemUTC());
        service = new SalesTaxService(registry, tracker, new FilingRequirementDeriver(), FilingThresholds.defaults(),
                calculationRecords, new CalculationAuditLogger());
    }

    @Test
    void pricesEachStateAndJurisdictionGroup() {
        List<SaleRecord> sales = List.of(
                new SaleRecord("AZ", "State", new BigDecimal("1000.00"), true),
                new SaleRecord("AZ", "State", new BigDecimal("500.00"), false),
                new SaleRecord("AZ", "Phoenix", new BigDecimal("2000.00"), true),
                new SaleRecord("CA", null, new BigDecimal("30000.00"), true),
                new SaleRecord("DE", "State", new BigDecimal("700.00"), true),
                new SaleRecord("fl", "State", new BigDecimal("85000.00"), true)
        );

        SalesTaxResult result = service.calculate("client-1", "2024-03", sales);

        assertThat(result.totalTransactions()).isEqualTo(6);
        assertThat(result.totalTaxDue()).isEqualByComparingTo("7497.00");
        List<JurisdictionTaxSummary> groups = result.calculationsByJurisdiction();
        assertThat(groups).extracting(JurisdictionTaxSummary::state, JurisdictionTaxSummary::jurisdiction)
                .containsExactly(
                        tuple("AZ", "State"),
                        tuple("AZ", "Phoenix"),
                        tuple("CA", "State"),
                        tuple("DE", "State"),
                        tuple("FL", "State"));

        JurisdictionTaxSummary azState = groups.get(0);
        assertThat(azState.transactionCount()).isEqualTo(2);
        assertThat(azState.grossSales()).isEqualByComparingTo("1500.00");
        assertThat(azState.taxableSales()).isEqualByComparingTo("1000.00");
        assertThat(azState.exemptSales()).isEqualByComparingTo("500.00");
        assertThat(azState.taxDue()).isEqualByComparingTo("56.00");
        assertThat(azState.filingRequirement().frequency()).isEqualTo(FilingFrequency.ANNUAL);
        assertThat(azState.filingRequirement().dueDate()).isEqualTo(LocalDate.of(2025, 1, 31));

        assertThat(groups.get(1).taxRate()).isEqualByComparingTo("0.083");
        assertThat(groups.get(1).taxDue()).isEqualByComparingTo("166.00");
        assertThat(groups.get(1).nexus().record().cumulativeSales()).isEqualByComparingTo("3500.00");
        assertThat(groups.get(0).nexus()).isSameAs(groups.get(1).nexus());

        JurisdictionTaxSummary ca = groups.get(2);
        assertThat(ca.taxDue()).isEqualByComparingTo("2175.00");
        assertThat(ca.filingRequirement().frequency()).isEqualTo(FilingFrequency.QUARTERLY);
        assertThat(ca.filingRequirement().dueDate()).isEqualTo(LocalDate.of(2024, 4, 20));

        JurisdictionTaxSummary de = groups.get(3);
        assertThat(de.taxDue()).isEqualByComparingTo("0.00");
        assertThat(de.nexus()).isNull();
        assertThat(de.filingRequirement()).isNull();
        assertThat(de.error()).isNull();

        assertThat(result.nexusAlerts()).singleElement().satisfies(alert -> {
            assertThat(alert.jurisdiction()).isEqualTo("FL");
            assertThat(alert.type()).isEqualTo(NexusAlert.AlertType.NEXUS_THRESHOLD_WARNING);
        });
        assertThat(result.filingRequirements()).hasSize(4);
        assertThat(calculationRecords.findByClientIdAndKind("client-1", CalculationKind.SALES_TAX)).hasSize(1);
    }

    @Test
    void unpricedGroupsCarryTheirOwnError() {
        List<SaleRecord> sales = List.of(
                new SaleRecord("ZZ", "State", new BigDecimal("100.00"), true),
                new SaleRecord(null, "State", new BigDecimal("50.00"), true),
                new SaleRecord("CA", "State", new BigDecimal("300000.00"), true)
        );

        SalesTaxResult result = service.calculate("client-2", "2024-05", sales);

        assertThat(result.calculationsByJurisdiction().get(0).error().errorKind()).isEqualTo(ErrorKind.UNSUPPORTED_JURISDICTION);
        assertThat(result.calculationsByJurisdiction().get(0).grossSales()).isEqualByComparingTo("100.00");
        assertThat(result.calculationsByJurisdiction().get(1).state()).isEqualTo("UNKNOWN");
        assertThat(result.calculationsByJurisdiction().get(1).error()).isNotNull();
        JurisdictionTaxSummary ca = result.calculationsByJurisdiction().get(2);
        assertThat(ca.taxDue()).isEqualByComparingTo("21750.00");
        assertThat(ca.filingRequirement().frequency()).isEqualTo(FilingFrequency.MONTHLY);
        assertThat(ca.filingRequirement().dueDate()).isEqualTo(LocalDate.of(2024, 6, 20));
        assertThat(result.totalTaxDue()).isEqualByComparingTo("21750.00");
    }

    @Test
    void stateWithSeveralJurisdictionsReportsOneNexusUpdate() {
        List<SaleRecord> sales = List.of(
                new SaleRecord("FL", "State", new BigDecimal("50000.00"), true),
                new SaleRecord("FL", "Miami", new BigDecimal("35000.00"), true)
        );

        SalesTaxResult result = service.calculate("client-4", "2024-03", sales);

        assertThat(result.nexusAlerts()).singleElement().satisfies(alert -> {
            assertThat(alert.jurisdiction()).isEqualTo("FL");
            assertThat(alert.type()).isEqualTo(NexusAlert.AlertType.NEXUS_THRESHOLD_WARNING);
        });
        NexusRecord record = nexusStore.find(new NexusKey("client-4", "FL")).orElseThrow();
        assertThat(record.cumulativeSales()).isEqualByComparingTo("85000.00");
        assertThat(record.cumulativeTransactionCount()).isEqualTo(2);
        assertThat(record.status()).isEqualTo(NexusStatus.APPROACHING);
    }

    @Test
    void nexusAccumulatesAcrossRuns() {
        service.calculate("client-3", "2024-01", List.of(new SaleRecord("WA", "State", new BigDecimal("60000"), true)));
        SalesTaxResult second = service.calculate("client-3", "2024-02",
                List.of(new SaleRecord("WA", "State", new BigDecimal("45000"), true)));

        assertThat(second.nexusAlerts()).singleElement()
                .satisfies(alert -> assertThat(alert.type()).isEqualTo(NexusAlert.AlertType.NEXUS_THRESHOLD_EXCEEDED));
        assertThat(nexusStore.find(new NexusKey("client-3", "WA")).orElseThrow().status()).isEqualTo(NexusStatus.EXCEEDED);
    }

    @Test
    void rejectsMalformedRuns() {
        List<SaleRecord> sales = List.of(new SaleRecord("CA", "State", BigDecimal.TEN, true));

        assertThatThrownBy(() -> service.calculate("client-1", "March", sales))
                .isInstanceOf(CalculationException.class)
                .extracting(ex -> ((CalculationException) ex).kind())
                .isEqualTo(ErrorKind.INVALID_INPUT);
        assertThatThrownBy(() -> service.calculate("client-1", "2024-03", List.of()))
                .isInstanceOf(CalculationException.class);
        assertThatThrownBy(() -> service.calculate("client-1", "2031-03", sales))
                .isInstanceOf(CalculationException.class)
                .extracting(ex -> ((CalculationException) ex).kind())
                .isEqualTo(ErrorKind.CONFIGURATION_ERROR);
    }
}
