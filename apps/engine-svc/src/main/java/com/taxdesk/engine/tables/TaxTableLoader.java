package com.taxdesk.engine.tables;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taxdesk.engine.error.CalculationException;
import com.taxdesk.engine.model.FilingStatus;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;

/**
 * Reads a year's tax tables from a JSON document ({@code tax-tables/<year>.json} on the classpath).
 */
public class TaxTableLoader {

    private static final Logger log = LoggerFactory.getLogger(TaxTableLoader.class);

    private final ObjectMapper objectMapper;
    private final String location;

    public TaxTableLoader(ObjectMapper objectMapper, String location) {
        this.objectMapper = objectMapper;
        this.location = location.endsWith("/") ? location : location + "/";
    }

    public TaxTables load(int year) {
        Resource resource = new ClassPathResource(location + year + ".json");
        if (!resource.exists()) {
            throw CalculationException.configuration("Tax tables for " + year + " not found at " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            TaxTables tables = toTables(objectMapper.readValue(in, TableDocument.class), year);
            log.info("tax_tables_loaded year={} incomeTables={} withholdingTables={} jurisdictions={}",
                    tables.year(), tables.incomeTax().size(), tables.withholding().tables().size(), tables.jurisdictions().size());
            return tables;
        } catch (IOException ex) {
            throw CalculationException.configuration("Failed to read tax tables for " + year + ": " + ex.getMessage(), ex);
        }
    }

    TaxTables toTables(TableDocument doc, int expectedYear) {
        if (doc.year() == null || doc.year() != expectedYear) {
            throw CalculationException.configuration("Tax table document declares year " + doc.year() + ", expected " + expectedYear);
        }
        if (doc.withholding() == null || doc.fica() == null || doc.selfEmployment() == null) {
            throw CalculationException.configuration("Tax table document for " + expectedYear + " is missing a section");
        }
        Map<FilingStatus, RateTable> incomeTax = rateTables("income", expectedYear, doc.incomeTax());
        Map<FilingStatus, BigDecimal> deductions = byStatus(doc.standardDeductions());
        WithholdingDocument w = doc.withholding();
        WithholdingSchedule withholding = new WithholdingSchedule(
                require(w.perAllowanceAmount(), "withholding.perAllowanceAmount"),
                byStatus(w.standardDeductions()),
                rateTables("withholding", expectedYear, w.tables())
        );
        FicaDocument f = doc.fica();
        FicaRates fica = new FicaRates(
                require(f.socialSecurityRate(), "fica.socialSecurityRate"),
                require(f.socialSecurityWageBase(), "fica.socialSecurityWageBase"),
                require(f.medicareRate(), "fica.medicareRate"),
                require(f.additionalMedicareRate(), "fica.additionalMedicareRate"),
                require(f.additionalMedicareThreshold(), "fica.additionalMedicareThreshold")
        );
        SelfEmploymentDocument s = doc.selfEmployment();
        SelfEmploymentRates selfEmployment = new SelfEmploymentRates(
                require(s.netEarningsFactor(), "selfEmployment.netEarningsFactor"),
                require(s.socialSecurityRate(), "selfEmployment.socialSecurityRate"),
                require(s.socialSecurityWageBase(), "selfEmployment.socialSecurityWageBase"),
                require(s.medicareRate(), "selfEmployment.medicareRate"),
                require(s.additionalMedicareRate(), "selfEmployment.additionalMedicareRate"),
                require(s.additionalMedicareThreshold(), "selfEmployment.additionalMedicareThreshold")
        );
        Map<String, JurisdictionRule> jurisdictions = new LinkedHashMap<>();
        if (doc.jurisdictions() != null) {
            doc.jurisdictions().forEach((code, j) -> {
                String key = code.trim().toUpperCase(Locale.ROOT);
                jurisdictions.put(key, new JurisdictionRule(
                        key,
                        require(j.stateRate(), "jurisdictions." + key + ".stateRate"),
                        j.combinedRate(),
                        j.nexusSales(),
                        j.nexusTransactions()
                ));
            });
        }
        return new TaxTables(expectedYear, incomeTax, deductions, withholding, fica, selfEmployment, jurisdictions);
    }

    private Map<FilingStatus, RateTable> rateTables(String kind, int year, Map<String, List<BandDocument>> raw) {
        if (raw == null || raw.isEmpty()) {
            throw CalculationException.configuration("No " + kind + " tables in " + year + " document");
        }
        Map<FilingStatus, RateTable> tables = new EnumMap<>(FilingStatus.class);
        raw.forEach((code, bands) -> {
            FilingStatus status = statusOf(code);
            List<RateTable.Band> converted = bands == null ? List.of() : bands.stream()
                    .map(b -> new RateTable.Band(b.min(), b.max(), b.rate()))
                    .toList();
            tables.put(status, RateTable.of(kind + "-" + year + "-" + status.code(), converted));
        });
        return tables;
    }

    private Map<FilingStatus, BigDecimal> byStatus(Map<String, BigDecimal> raw) {
        Map<FilingStatus, BigDecimal> values = new EnumMap<>(FilingStatus.class);
        if (raw != null) {
            raw.forEach((code, amount) -> values.put(statusOf(code), amount));
        }
        return values;
    }

    private static FilingStatus statusOf(String code) {
        try {
            return FilingStatus.fromCode(code);
        } catch (CalculationException ex) {
            throw CalculationException.configuration("Unknown filing status key in tax tables: " + code, ex);
        }
    }

    private static BigDecimal require(BigDecimal value, String field) {
        if (value == null) {
            throw CalculationException.configuration("Tax table field " + field + " is missing");
        }
        return value;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TableDocument(
            Integer year,
            Map<String, List<BandDocument>> incomeTax,
            Map<String, BigDecimal> standardDeductions,
            WithholdingDocument withholding,
            FicaDocument fica,
            SelfEmploymentDocument selfEmployment,
            Map<String, JurisdictionDocument> jurisdictions
    ) {
    }

    record BandDocument(BigDecimal min, BigDecimal max, BigDecimal rate) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record WithholdingDocument(
            BigDecimal perAllowanceAmount,
            Map<String, BigDecimal> standardDeductions,
            Map<String, List<BandDocument>> tables
    ) {
    }

    record FicaDocument(
            BigDecimal socialSecurityRate,
            BigDecimal socialSecurityWageBase,
            BigDecimal medicareRate,
            BigDecimal additionalMedicareRate,
            BigDecimal additionalMedicareThreshold
    ) {
    }

    record SelfEmploymentDocument(
            BigDecimal netEarningsFactor,
            BigDecimal socialSecurityRate,
            BigDecimal socialSecurityWageBase,
            BigDecimal medicareRate,
            BigDecimal additionalMedicareRate,
            BigDecimal additionalMedicareThreshold
    ) {
    }

    record JurisdictionDocument(BigDecimal stateRate, BigDecimal combinedRate, BigDecimal nexusSales, Integer nexusTransactions) {
    }
}
