package com.taxdesk.engine.config;

import java.math.BigDecimal;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "taxdesk")
public record EngineProperties(
        Tables tables,
        Policy policy,
        Payroll payroll,
        Filing filing,
        Nexus nexus,
        Advisory advisory
) {

    @ConstructorBinding
    public EngineProperties {
        // every section is optional in yml; absent sections fall back to the illustrative defaults
        if (tables == null) {
            tables = new Tables(null, null);
        }
        if (policy == null) {
            policy = new Policy(null, null, null, null, null, null, null);
        }
        if (payroll == null) {
            payroll = new Payroll(null, null, null, null, null, null, null);
        }
        if (filing == null) {
            filing = new Filing(null, null);
        }
        if (nexus == null) {
            nexus = new Nexus(null, null, null);
        }
        if (advisory == null) {
            advisory = new Advisory(null, null, null, null, null);
        }
    }

    public static EngineProperties defaults() {
        return new EngineProperties(null, null, null, null, null, null);
    }

    public record Tables(Integer year, String location) {
        public Tables {
            if (year == null) {
                year = 2024;
            }
            if (year < 1900 || year > 2999) {
                throw new IllegalArgumentException("tables.year out of range: " + year);
            }
            if (location == null || location.isBlank()) {
                location = "tax-tables/";
            }
        }
    }

    public record Policy(
            BigDecimal stateIncomeTaxRate,
            List<String> noIncomeTaxStates,
            BigDecimal corporateRate,
            BigDecimal corporateStateRate,
            BigDecimal sCorpSalaryRatio,
            BigDecimal sCorpSalaryCeiling,
            BigDecimal combinedPayrollRate
    ) {
        public Policy {
            stateIncomeTaxRate = rate(stateIncomeTaxRate, "0.05", "policy.stateIncomeTaxRate");
            if (noIncomeTaxStates == null) {
                noIncomeTaxStates = List.of("TX");
            }
            noIncomeTaxStates = List.copyOf(noIncomeTaxStates);
            corporateRate = rate(corporateRate, "0.21", "policy.corporateRate");
            corporateStateRate = rate(corporateStateRate, "0.06", "policy.corporateStateRate");
            sCorpSalaryRatio = rate(sCorpSalaryRatio, "0.40", "policy.sCorpSalaryRatio");
            sCorpSalaryCeiling = amount(sCorpSalaryCeiling, "100000", "policy.sCorpSalaryCeiling");
            combinedPayrollRate = rate(combinedPayrollRate, "0.153", "policy.combinedPayrollRate");
        }
    }

    public record Payroll(
            Integer periodsPerYear,
            BigDecimal overtimeMultiplier,
            BigDecimal stateWithholdingRate,
            BigDecimal minimumWage,
            BigDecimal overtimeHoursThreshold,
            BigDecimal highWithholdingRatio,
            Integer payDateOffsetDays
    ) {
        public Payroll {
            if (periodsPerYear == null) {
                periodsPerYear = 26;
            }
            if (periodsPerYear <= 0) {
                throw new IllegalArgumentException("payroll.periodsPerYear must be positive");
            }
            overtimeMultiplier = amount(overtimeMultiplier, "1.5", "payroll.overtimeMultiplier");
            stateWithholdingRate = rate(stateWithholdingRate, "0.05", "payroll.stateWithholdingRate");
            minimumWage = amount(minimumWage, "7.25", "payroll.minimumWage");
            overtimeHoursThreshold = amount(overtimeHoursThreshold, "40", "payroll.overtimeHoursThreshold");
            highWithholdingRatio = rate(highWithholdingRatio, "0.5", "payroll.highWithholdingRatio");
            if (payDateOffsetDays == null) {
                payDateOffsetDays = 3;
            }
            if (payDateOffsetDays < 0) {
                throw new IllegalArgumentException("payroll.payDateOffsetDays must not be negative");
            }
        }
    }

    public record Filing(BigDecimal monthlyThreshold, BigDecimal quarterlyThreshold) {
        public Filing {
            monthlyThreshold = amount(monthlyThreshold, "20000", "filing.monthlyThreshold");
            quarterlyThreshold = amount(quarterlyThreshold, "1200", "filing.quarterlyThreshold");
            if (quarterlyThreshold.compareTo(monthlyThreshold) > 0) {
                throw new IllegalArgumentException("filing.quarterlyThreshold must not exceed filing.monthlyThreshold");
            }
        }
    }

    public record Nexus(BigDecimal warningRatio, String store, Boolean bootstrapSchema) {
        public Nexus {
            warningRatio = rate(warningRatio, "0.8", "nexus.warningRatio");
            if (store == null || store.isBlank()) {
                store = "memory";
            }
            if (!store.equals("memory") && !store.equals("jdbc")) {
                throw new IllegalArgumentException("nexus.store must be memory or jdbc: " + store);
            }
            if (bootstrapSchema == null) {
                bootstrapSchema = false;
            }
        }

        public boolean jdbcStore() {
            return "jdbc".equals(store);
        }
    }

    public record Advisory(
            BigDecimal effectiveRateThreshold,
            BigDecimal entityElectionIncome,
            BigDecimal retirementIncome,
            BigDecimal retirementContributionCap,
            BigDecimal lowConfidence
    ) {
        public Advisory {
            effectiveRateThreshold = rate(effectiveRateThreshold, "0.25", "advisory.effectiveRateThreshold");
            entityElectionIncome = amount(entityElectionIncome, "100000", "advisory.entityElectionIncome");
            retirementIncome = amount(retirementIncome, "50000", "advisory.retirementIncome");
            retirementContributionCap = amount(retirementContributionCap, "66000", "advisory.retirementContributionCap");
            lowConfidence = rate(lowConfidence, "0.7", "advisory.lowConfidence");
        }
    }

    private static BigDecimal rate(BigDecimal value, String fallback, String name) {
        BigDecimal resolved = value != null ? value : new BigDecimal(fallback);
        if (resolved.signum() < 0 || resolved.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException(name + " must be between 0 and 1");
        }
        return resolved;
    }

    private static BigDecimal amount(BigDecimal value, String fallback, String name) {
        BigDecimal resolved = value != null ? value : new BigDecimal(fallback);
        if (resolved.signum() < 0) {
            throw new IllegalArgumentException(name + " must not be negative");
        }
        return resolved;
    }
}
