package com.example.conservation.etl.quality;

import com.example.conservation.etl.config.EtlProperties;
import com.example.conservation.etl.conform.DimensionLookups;
import com.example.conservation.etl.load.TableDefinitions;
import com.example.conservation.etl.model.CampaignDimension;
import com.example.conservation.etl.model.ConformedRecord;
import com.example.conservation.etl.model.DonationFact;
import com.example.conservation.etl.model.DonorDimension;
import com.example.conservation.etl.model.ElkPopulationFact;
import com.example.conservation.etl.model.EntityType;
import com.example.conservation.etl.model.FinancialFilingFact;
import com.example.conservation.etl.model.HabitatDimension;
import com.example.conservation.etl.model.ProgramServiceLineFact;
import com.example.conservation.etl.model.ProjectDimension;
import com.example.conservation.etl.model.ProjectMetricFact;
import com.example.conservation.etl.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Classifies conformed records against completeness, uniqueness, referential-integrity and
 * business rules. Only reports; the caller drops records with blocking results.
 */
@Component
public class DataQualityValidator {
    private static final Logger log = LoggerFactory.getLogger(DataQualityValidator.class);
    private static final Pattern STATE_CODE = Pattern.compile("[A-Za-z]{2}");

    private final Map<EntityType, EntityRules<?>> rules = new EnumMap<>(EntityType.class);

    @Autowired
    public DataQualityValidator(EtlProperties properties) {
        this(properties.getRevenueTolerance(), properties.getQuality());
    }

    public DataQualityValidator(BigDecimal revenueTolerance) {
        this(revenueTolerance, new EtlProperties.Quality());
    }

    public DataQualityValidator(BigDecimal revenueTolerance, EtlProperties.Quality quality) {
        register(EntityType.DONOR, DonorDimension.class, donorRules(quality));
        register(EntityType.CAMPAIGN, CampaignDimension.class, campaignRules(quality));
        register(EntityType.HABITAT, HabitatDimension.class, habitatRules());
        register(EntityType.PROJECT, ProjectDimension.class, projectRules(quality));
        register(EntityType.DONATION, DonationFact.class, donationRules(quality));
        register(EntityType.ELK_POPULATION, ElkPopulationFact.class, elkPopulationRules());
        register(EntityType.PROJECT_METRIC, ProjectMetricFact.class, projectMetricRules());
        register(EntityType.FINANCIAL_FILING, FinancialFilingFact.class, financialFilingRules(revenueTolerance));
        register(EntityType.PROGRAM_SERVICE_LINE, ProgramServiceLineFact.class, programServiceLineRules());
    }

    private <T extends ConformedRecord> void register(EntityType entityType, Class<T> recordType, List<ValidationRule<T>> entityRules) {
        // Every entity is also checked against the sizes of its store columns.
        entityRules.add(new ColumnFitRule<>(TableDefinitions.forEntity(entityType)));
        rules.put(entityType, new EntityRules<>(recordType, entityRules));
    }

    public List<ValidationResult> validate(EntityType entityType, List<? extends ConformedRecord> batch, DimensionLookups lookups) {
        for (ConformedRecord record : batch) {
            if (record.getEntityType() != entityType) {
                throw new IllegalArgumentException("Batch for " + entityType + " contains a " + record.getEntityType() + " record");
            }
        }
        EntityRules<?> entityRules = rules.get(entityType);
        List<ValidationResult> results = entityRules == null ? new ArrayList<>() : entityRules.evaluate(batch, lookups);
        long blocking = results.stream().filter(ValidationResult::isBlocking).count();
        log.info("Validated {} {} records: {} blocking, {} warning", batch.size(), entityType, blocking, results.size() - blocking);
        return results;
    }

    public static Set<String> blockedRecordRefs(Collection<ValidationResult> results) {
        return results.stream()
                .filter(ValidationResult::isBlocking)
                .map(ValidationResult::getRecordRef)
                .collect(Collectors.toSet());
    }

    /**
     * Records of the batch without a blocking result, in batch order.
     */
    public static <T extends ConformedRecord> List<T> accepted(List<T> batch, Collection<ValidationResult> results) {
        Set<String> blocked = blockedRecordRefs(results);
        return batch.stream().filter(r -> !blocked.contains(r.getRecordRef())).collect(Collectors.toList());
    }

    private static <T extends ConformedRecord> void allowedValues(List<ValidationRule<T>> list, EtlProperties.Quality quality,
                                                                  EntityType entityType, String field, Function<T, String> value) {
        List<String> allowed = quality.allowedValues(entityType, field);
        if (allowed.isEmpty()) {
            return;
        }
        list.add(new WarningRule<>("allowed-" + field,
                r -> value.apply(r) != null && !allowed.contains(value.apply(r)),
                r -> field + " '" + value.apply(r) + "' is not one of " + allowed));
    }

    private static <T extends ConformedRecord> WarningRule<T> stateCode(Function<T, String> state) {
        return new WarningRule<>("state-code",
                r -> state.apply(r) != null && !STATE_CODE.matcher(state.apply(r)).matches(),
                r -> "State '" + state.apply(r) + "' is not a two-letter code");
    }

    private static List<ValidationRule<DonorDimension>> donorRules(EtlProperties.Quality quality) {
        List<ValidationRule<DonorDimension>> list = new ArrayList<>();
        list.add(new CompletenessRule<>("donor_id", DonorDimension::getDonorId));
        list.add(new UniquenessRule<>());
        list.add(new WarningRule<>("email-format",
                d -> d.getEmail() != null && !d.getEmail().contains("@"),
                d -> "Email '" + d.getEmail() + "' has no @"));
        list.add(stateCode(DonorDimension::getState));
        allowedValues(list, quality, EntityType.DONOR, "membership-level", DonorDimension::getMembershipLevel);
        allowedValues(list, quality, EntityType.DONOR, "donor-type", DonorDimension::getDonorType);
        return list;
    }

    private static List<ValidationRule<CampaignDimension>> campaignRules(EtlProperties.Quality quality) {
        List<ValidationRule<CampaignDimension>> list = new ArrayList<>();
        list.add(new CompletenessRule<>("campaign_id", CampaignDimension::getCampaignId));
        list.add(new CompletenessRule<>("campaign_name", CampaignDimension::getCampaignName));
        list.add(new UniquenessRule<>());
        list.add(new DateOrderRule<>(CampaignDimension::getStartDate, CampaignDimension::getEndDate));
        list.add(AmountRule.positive("goal_amount", CampaignDimension::getGoalAmount));
        allowedValues(list, quality, EntityType.CAMPAIGN, "status", CampaignDimension::getStatus);
        return list;
    }

    private static List<ValidationRule<HabitatDimension>> habitatRules() {
        List<ValidationRule<HabitatDimension>> list = new ArrayList<>();
        list.add(new CompletenessRule<>("habitat_id", HabitatDimension::getHabitatId));
        list.add(new CompletenessRule<>("habitat_name", HabitatDimension::getHabitatName));
        list.add(new UniquenessRule<>());
        list.add(AmountRule.nonNegative("total_acres", HabitatDimension::getTotalAcres));
        list.add(new WarningRule<>("quality-score-range",
                h -> h.getHabitatQualityScore() != null
                        && (h.getHabitatQualityScore() < 0 || h.getHabitatQualityScore() > 100),
                h -> "habitat_quality_score " + h.getHabitatQualityScore() + " is outside 0-100"));
        list.add(stateCode(HabitatDimension::getState));
        return list;
    }

    private static List<ValidationRule<ProjectDimension>> projectRules(EtlProperties.Quality quality) {
        List<ValidationRule<ProjectDimension>> list = new ArrayList<>();
        list.add(new CompletenessRule<>("project_id", ProjectDimension::getProjectId));
        list.add(new CompletenessRule<>("project_name", ProjectDimension::getProjectName));
        list.add(new UniquenessRule<>());
        list.add(new DateOrderRule<>(ProjectDimension::getStartDate, ProjectDimension::getEndDate));
        list.add(stateCode(ProjectDimension::getState));
        allowedValues(list, quality, EntityType.PROJECT, "status", ProjectDimension::getStatus);
        return list;
    }

    private static List<ValidationRule<DonationFact>> donationRules(EtlProperties.Quality quality) {
        List<ValidationRule<DonationFact>> list = new ArrayList<>();
        list.add(new CompletenessRule<>("donation_id", DonationFact::getDonationId));
        list.add(new CompletenessRule<>("donor_id", DonationFact::getDonorId));
        list.add(new CompletenessRule<>("campaign_id", DonationFact::getCampaignId));
        list.add(new CompletenessRule<>("donation_date", DonationFact::getBusinessDate));
        list.add(new CompletenessRule<>("amount", DonationFact::getAmount));
        list.add(new UniquenessRule<>());
        list.add(new ReferentialIntegrityRule<>());
        list.add(AmountRule.positive("amount", DonationFact::getAmount));
        allowedValues(list, quality, EntityType.DONATION, "payment-method", DonationFact::getPaymentMethod);
        return list;
    }

    private static List<ValidationRule<ElkPopulationFact>> elkPopulationRules() {
        List<ValidationRule<ElkPopulationFact>> list = new ArrayList<>();
        list.add(new CompletenessRule<>("habitat_id", ElkPopulationFact::getHabitatId));
        list.add(new CompletenessRule<>("year", ElkPopulationFact::getObservationYear));
        list.add(new CompletenessRule<>("elk_count", ElkPopulationFact::getElkCount));
        list.add(new UniquenessRule<>());
        list.add(new ReferentialIntegrityRule<>());
        list.add(AmountRule.nonNegative("elk_count", ElkPopulationFact::getElkCount));
        return list;
    }

    private static List<ValidationRule<ProjectMetricFact>> projectMetricRules() {
        List<ValidationRule<ProjectMetricFact>> list = new ArrayList<>();
        list.add(new CompletenessRule<>("project_id", ProjectMetricFact::getProjectId));
        list.add(new UniquenessRule<>());
        list.add(new ReferentialIntegrityRule<>());
        list.add(AmountRule.nonNegative("budget", ProjectMetricFact::getBudget));
        list.add(AmountRule.nonNegative("spent_to_date", ProjectMetricFact::getSpentToDate));
        list.add(AmountRule.nonNegative("acres_protected", ProjectMetricFact::getAcresProtected));
        list.add(AmountRule.nonNegative("elk_population_impacted", ProjectMetricFact::getElkPopulationImpacted));
        return list;
    }

    private static List<ValidationRule<FinancialFilingFact>> financialFilingRules(BigDecimal revenueTolerance) {
        List<ValidationRule<FinancialFilingFact>> list = new ArrayList<>();
        list.add(new CompletenessRule<>("fiscal_year", FinancialFilingFact::getFiscalYear));
        list.add(new UniquenessRule<>());
        list.add(AmountRule.nonNegative("employees_count", FinancialFilingFact::getEmployeesCount));
        list.add(AmountRule.nonNegative("volunteers_count", FinancialFilingFact::getVolunteersCount));
        list.add(new RevenueReconciliationRule(revenueTolerance));
        return list;
    }

    private static List<ValidationRule<ProgramServiceLineFact>> programServiceLineRules() {
        List<ValidationRule<ProgramServiceLineFact>> list = new ArrayList<>();
        list.add(new CompletenessRule<>("fiscal_year", ProgramServiceLineFact::getFiscalYear));
        list.add(new CompletenessRule<>("program_name", ProgramServiceLineFact::getProgramName));
        list.add(new UniquenessRule<>());
        list.add(AmountRule.nonNegative("expenses", ProgramServiceLineFact::getExpenses));
        list.add(AmountRule.nonNegative("grants", ProgramServiceLineFact::getGrants));
        list.add(AmountRule.nonNegative("revenue", ProgramServiceLineFact::getRevenue));
        return list;
    }

    /**
     * The rules of one entity, applied to a batch viewed as that entity's record type.
     */
    private static final class EntityRules<T extends ConformedRecord> {
        private final Class<T> recordType;
        private final List<ValidationRule<T>> rules;

        private EntityRules(Class<T> recordType, List<ValidationRule<T>> rules) {
            this.recordType = recordType;
            this.rules = List.copyOf(rules);
        }

        private List<ValidationResult> evaluate(List<? extends ConformedRecord> batch, DimensionLookups lookups) {
            List<T> records = new ArrayList<>(batch.size());
            for (ConformedRecord record : batch) {
                records.add(recordType.cast(record));
            }
            List<ValidationResult> results = new ArrayList<>();
            for (ValidationRule<T> rule : rules) {
                results.addAll(rule.evaluate(records, lookups));
            }
            return results;
        }
    }
}
