package com.taxdesk.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taxdesk.engine.audit.CalculationAuditLogger;
import com.taxdesk.engine.bookkeeping.BookkeepingService;
import com.taxdesk.engine.bookkeeping.ClassificationRuleLoader;
import com.taxdesk.engine.bookkeeping.ClassificationRuleSet;
import com.taxdesk.engine.bookkeeping.ReconciliationAnalyzer;
import com.taxdesk.engine.bookkeeping.TransactionClassifier;
import com.taxdesk.engine.filing.FilingRequirementDeriver;
import com.taxdesk.engine.filing.FilingThresholds;
import com.taxdesk.engine.payroll.DepositScheduleCalculator;
import com.taxdesk.engine.payroll.GrossPayCalculator;
import com.taxdesk.engine.payroll.PayrollComplianceChecker;
import com.taxdesk.engine.payroll.PayrollService;
import com.taxdesk.engine.payroll.WithholdingComposer;
import com.taxdesk.engine.repository.CalculationRecordRepository;
import com.taxdesk.engine.repository.ClassifiedTransactionRepository;
import com.taxdesk.engine.salestax.InMemoryNexusRecordStore;
import com.taxdesk.engine.salestax.JdbcNexusRecordStore;
import com.taxdesk.engine.salestax.NexusAnalyzer;
import com.taxdesk.engine.salestax.NexusRecordStore;
import com.taxdesk.engine.salestax.NexusThresholdTracker;
import com.taxdesk.engine.salestax.SalesTaxService;
import com.taxdesk.engine.tables.TaxTableLoader;
import com.taxdesk.engine.tables.TaxTableRegistry;
import com.taxdesk.engine.tax.BracketCalculator;
import com.taxdesk.engine.tax.DeductionAnalyzer;
import com.taxdesk.engine.tax.FinancialProjector;
import com.taxdesk.engine.tax.TaxLiabilityService;
import com.taxdesk.engine.tax.TaxPlanningAdvisor;
import com.taxdesk.engine.tax.strategy.CCorpTaxStrategy;
import com.taxdesk.engine.tax.strategy.EntityTaxStrategy;
import com.taxdesk.engine.tax.strategy.EntityTaxStrategySelector;
import com.taxdesk.engine.tax.strategy.PartnershipTaxStrategy;
import com.taxdesk.engine.tax.strategy.SCorpTaxStrategy;
import com.taxdesk.engine.tax.strategy.SelfEmploymentTaxCalculator;
import com.taxdesk.engine.tax.strategy.SoleProprietorTaxStrategy;
import com.taxdesk.engine.tax.strategy.TaxPolicy;
import java.time.Clock;
import java.util.HashSet;
import java.util.List;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Wires the calculation components with the loaded tables and the configured policy values.
 */
@Configuration
public class EngineConfiguration {

    static final String CLASSIFICATION_RULES = "classification-rules.json";

    @Bean
    public Clock engineClock() {
        return Clock.systemUTC();
    }

    @Bean
    public TaxTableRegistry taxTableRegistry(ObjectMapper objectMapper, EngineProperties properties) {
        TaxTableLoader loader = new TaxTableLoader(objectMapper, properties.tables().location());
        int year = properties.tables().year();
        return new TaxTableRegistry(List.of(loader.load(year)), year);
    }

    @Bean
    public TaxPolicy taxPolicy(EngineProperties properties) {
        EngineProperties.Policy policy = properties.policy();
        return new TaxPolicy(
                policy.stateIncomeTaxRate(),
                new HashSet<>(policy.noIncomeTaxStates()),
                policy.corporateRate(),
                policy.corporateStateRate(),
                policy.sCorpSalaryRatio(),
                policy.sCorpSalaryCeiling(),
                policy.combinedPayrollRate()
        );
    }

    // --- entity strategies ---

    @Bean
    public SoleProprietorTaxStrategy soleProprietorTaxStrategy(BracketCalculator bracketCalculator,
                                                               SelfEmploymentTaxCalculator selfEmploymentTaxCalculator,
                                                               TaxPolicy taxPolicy) {
        return new SoleProprietorTaxStrategy(bracketCalculator, selfEmploymentTaxCalculator, taxPolicy);
    }

    @Bean
    public SCorpTaxStrategy sCorpTaxStrategy(BracketCalculator bracketCalculator, TaxPolicy taxPolicy) {
        return new SCorpTaxStrategy(bracketCalculator, taxPolicy);
    }

    @Bean
    public CCorpTaxStrategy cCorpTaxStrategy(TaxPolicy taxPolicy) {
        return new CCorpTaxStrategy(taxPolicy);
    }

    @Bean
    public PartnershipTaxStrategy partnershipTaxStrategy(BracketCalculator bracketCalculator,
                                                         SelfEmploymentTaxCalculator selfEmploymentTaxCalculator,
                                                         TaxPolicy taxPolicy) {
        return new PartnershipTaxStrategy(bracketCalculator, selfEmploymentTaxCalculator, taxPolicy);
    }

    @Bean
    public EntityTaxStrategySelector entityTaxStrategySelector(List<EntityTaxStrategy> strategies) {
        return new EntityTaxStrategySelector(strategies);
    }

    // --- tax liability and deductions ---

    @Bean
    public FinancialProjector financialProjector(ClassifiedTransactionRepository transactionRepository, Clock engineClock) {
        return new FinancialProjector(transactionRepository, engineClock);
    }

    @Bean
    public TaxPlanningAdvisor taxPlanningAdvisor(EngineProperties properties) {
        return new TaxPlanningAdvisor(properties.advisory());
    }

    @Bean
    public TaxLiabilityService taxLiabilityService(TaxTableRegistry taxTableRegistry,
                                                   FinancialProjector financialProjector,
                                                   EntityTaxStrategySelector entityTaxStrategySelector,
                                                   TaxPlanningAdvisor taxPlanningAdvisor,
                                                   CalculationRecordRepository calculationRecordRepository,
                                                   CalculationAuditLogger auditLogger) {
        return new TaxLiabilityService(taxTableRegistry, financialProjector, entityTaxStrategySelector,
                taxPlanningAdvisor, calculationRecordRepository, auditLogger);
    }

    @Bean
    public DeductionAnalyzer deductionAnalyzer(ClassifiedTransactionRepository transactionRepository) {
        return new DeductionAnalyzer(transactionRepository);
    }

    // --- bookkeeping ---

    @Bean
    public ClassificationRuleSet classificationRuleSet(ObjectMapper objectMapper) {
        return new ClassificationRuleLoader(objectMapper).load(CLASSIFICATION_RULES);
    }

    @Bean
    public TransactionClassifier transactionClassifier(ClassificationRuleSet classificationRuleSet) {
        return new TransactionClassifier(classificationRuleSet);
    }

    @Bean
    public BookkeepingService bookkeepingService(TransactionClassifier transactionClassifier,
                                                 ClassifiedTransactionRepository transactionRepository,
                                                 CalculationRecordRepository calculationRecordRepository,
                                                 CalculationAuditLogger auditLogger,
                                                 EngineProperties properties) {
        return new BookkeepingService(transactionClassifier, transactionRepository, calculationRecordRepository,
                auditLogger, properties.advisory().lowConfidence());
    }

    @Bean
    public ReconciliationAnalyzer reconciliationAnalyzer(ClassifiedTransactionRepository transactionRepository,
                                                         CalculationRecordRepository calculationRecordRepository,
                                                         CalculationAuditLogger auditLogger) {
        return new ReconciliationAnalyzer(transactionRepository, calculationRecordRepository, auditLogger);
    }

    // --- payroll ---

    @Bean
    public GrossPayCalculator grossPayCalculator(EngineProperties properties) {
        return new GrossPayCalculator(properties.payroll().overtimeMultiplier(), properties.payroll().periodsPerYear());
    }

    @Bean
    public WithholdingComposer withholdingComposer(BracketCalculator bracketCalculator,
                                                   TaxTableRegistry taxTableRegistry,
                                                   EngineProperties properties) {
        return new WithholdingComposer(bracketCalculator, taxTableRegistry,
                properties.payroll().periodsPerYear(), properties.payroll().stateWithholdingRate());
    }

    @Bean
    public DepositScheduleCalculator depositScheduleCalculator() {
        return new DepositScheduleCalculator();
    }

    @Bean
    public PayrollComplianceChecker payrollComplianceChecker(EngineProperties properties) {
        return new PayrollComplianceChecker(properties.payroll());
    }

    @Bean
    public PayrollService payrollService(TaxTableRegistry taxTableRegistry,
                                         GrossPayCalculator grossPayCalculator,
                                         WithholdingComposer withholdingComposer,
                                         DepositScheduleCalculator depositScheduleCalculator,
                                         PayrollComplianceChecker payrollComplianceChecker,
                                         CalculationRecordRepository calculationRecordRepository,
                                         CalculationAuditLogger auditLogger,
                                         EngineProperties properties) {
        return new PayrollService(taxTableRegistry, grossPayCalculator, withholdingComposer, depositScheduleCalculator,
                payrollComplianceChecker, calculationRecordRepository, auditLogger, properties.payroll().payDateOffsetDays());
    }

    // --- sales tax and nexus ---

    @Bean
    @ConditionalOnProperty(prefix = "taxdesk.nexus", name = "store", havingValue = "memory", matchIfMissing = true)
    public NexusRecordStore inMemoryNexusRecordStore() {
        return new InMemoryNexusRecordStore();
    }

    @Bean
    @ConditionalOnProperty(prefix = "taxdesk.nexus", name = "store", havingValue = "jdbc")
    public NexusRecordStore jdbcNexusRecordStore(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager) {
        return new JdbcNexusRecordStore(jdbcTemplate, new TransactionTemplate(transactionManager));
    }

    @Bean
    public NexusThresholdTracker nexusThresholdTracker(NexusRecordStore nexusRecordStore,
                                                       TaxTableRegistry taxTableRegistry,
                                                       EngineProperties properties,
                                                       Clock engineClock) {
        return new NexusThresholdTracker(nexusRecordStore, taxTableRegistry, properties.nexus().warningRatio(), engineClock);
    }

    @Bean
    public NexusAnalyzer nexusAnalyzer(NexusRecordStore nexusRecordStore) {
        return new NexusAnalyzer(nexusRecordStore);
    }

    @Bean
    public SalesTaxService salesTaxService(TaxTableRegistry taxTableRegistry,
                                           NexusThresholdTracker nexusThresholdTracker,
                                           FilingRequirementDeriver filingRequirementDeriver,
                                           CalculationRecordRepository calculationRecordRepository,
                                           CalculationAuditLogger auditLogger,
                                           EngineProperties properties) {
        return new SalesTaxService(taxTableRegistry, nexusThresholdTracker, filingRequirementDeriver,
                FilingThresholds.from(properties.filing()), calculationRecordRepository, auditLogger);
    }
}
