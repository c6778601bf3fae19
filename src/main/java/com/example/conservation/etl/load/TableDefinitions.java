package com.example.conservation.etl.load;

import com.example.conservation.etl.model.AnomalyFlag;
import com.example.conservation.etl.model.CampaignDimension;
import com.example.conservation.etl.model.DateDimension;
import com.example.conservation.etl.model.DonationFact;
import com.example.conservation.etl.model.DonorDimension;
import com.example.conservation.etl.model.ElkPopulationFact;
import com.example.conservation.etl.model.EntityType;
import com.example.conservation.etl.model.FinancialFilingFact;
import com.example.conservation.etl.model.HabitatDimension;
import com.example.conservation.etl.model.ProgramServiceLineFact;
import com.example.conservation.etl.model.ProjectDimension;
import com.example.conservation.etl.model.ProjectMetricFact;

import java.sql.Types;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Column mappings for every table of the conservation schema ({@code db/conservation-schema.sql}).
 */
public final class TableDefinitions {

    public static final String ANOMALY_FLAG_TABLE = "anomaly_flag";

    public static final List<ColumnDefinition<AnomalyFlag>> ANOMALY_FLAG_COLUMNS = List.of(
            new ColumnDefinition<AnomalyFlag>("entity_type", Types.VARCHAR, 32, false, f -> f.getEntityType().name()),
            new ColumnDefinition<AnomalyFlag>("record_key", Types.VARCHAR, 255, false, AnomalyFlag::getRecordKey),
            new ColumnDefinition<AnomalyFlag>("rule_name", Types.VARCHAR, 64, false, AnomalyFlag::getRuleName),
            new ColumnDefinition<AnomalyFlag>("severity", Types.VARCHAR, 16, false, f -> f.getSeverity().name()),
            new ColumnDefinition<AnomalyFlag>("observed_value", Types.DECIMAL, 18, 2, true, AnomalyFlag::getObservedValue),
            new ColumnDefinition<AnomalyFlag>("threshold_value", Types.DECIMAL, 18, 2, true, AnomalyFlag::getThreshold),
            new ColumnDefinition<AnomalyFlag>("detail", Types.VARCHAR, 2000, true, AnomalyFlag::getDetail));

    private static final Map<EntityType, TableDefinition<?>> TABLES;

    static {
        Map<EntityType, TableDefinition<?>> tables = new EnumMap<>(EntityType.class);
        tables.put(EntityType.DONOR, TableDefinition.builder(EntityType.DONOR, "dim_donor", DonorDimension.class)
                .key("donor_key", Types.BIGINT, DonorDimension::getSurrogateKey)
                .naturalKey("donor_id", 64, DonorDimension::getDonorId)
                .column("first_name", Types.VARCHAR, 255, DonorDimension::getFirstName)
                .column("last_name", Types.VARCHAR, 255, DonorDimension::getLastName)
                .column("email", Types.VARCHAR, 255, DonorDimension::getEmail)
                .column("phone", Types.VARCHAR, 64, DonorDimension::getPhone)
                .column("address", Types.VARCHAR, 512, DonorDimension::getAddress)
                .column("city", Types.VARCHAR, 255, DonorDimension::getCity)
                .column("state", Types.VARCHAR, 32, DonorDimension::getState)
                .column("zip_code", Types.VARCHAR, 32, DonorDimension::getZipCode)
                .column("donor_type", Types.VARCHAR, 64, DonorDimension::getDonorType)
                .column("join_date", Types.DATE, DonorDimension::getJoinDate)
                .column("membership_level", Types.VARCHAR, 64, DonorDimension::getMembershipLevel)
                .build());
        tables.put(EntityType.CAMPAIGN, TableDefinition.builder(EntityType.CAMPAIGN, "dim_campaign", CampaignDimension.class)
                .key("campaign_key", Types.BIGINT, CampaignDimension::getSurrogateKey)
                .naturalKey("campaign_id", 64, CampaignDimension::getCampaignId)
                .required("campaign_name", Types.VARCHAR, 255, CampaignDimension::getCampaignName)
                .column("campaign_type", Types.VARCHAR, 64, CampaignDimension::getCampaignType)
                .column("start_date", Types.DATE, CampaignDimension::getStartDate)
                .column("end_date", Types.DATE, CampaignDimension::getEndDate)
                .column("goal_amount", Types.DECIMAL, 18, 2, CampaignDimension::getGoalAmount)
                .column("description", Types.VARCHAR, 2000, CampaignDimension::getDescription)
                .column("target_region", Types.VARCHAR, 255, CampaignDimension::getTargetRegion)
                .column("status", Types.VARCHAR, 64, CampaignDimension::getStatus)
                .build());
        tables.put(EntityType.HABITAT, TableDefinition.builder(EntityType.HABITAT, "dim_habitat", HabitatDimension.class)
                .key("habitat_key", Types.BIGINT, HabitatDimension::getSurrogateKey)
                .naturalKey("habitat_id", 64, HabitatDimension::getHabitatId)
                .required("habitat_name", Types.VARCHAR, 255, HabitatDimension::getHabitatName)
                .column("state", Types.VARCHAR, 32, HabitatDimension::getState)
                .column("region", Types.VARCHAR, 255, HabitatDimension::getRegion)
                .column("total_acres", Types.BIGINT, HabitatDimension::getTotalAcres)
                .column("habitat_quality_score", Types.INTEGER, HabitatDimension::getHabitatQualityScore)
                .column("conservation_status", Types.VARCHAR, 64, HabitatDimension::getConservationStatus)
                .column("primary_threats", Types.VARCHAR, 2000, HabitatDimension::getPrimaryThreats)
                .build());
        tables.put(EntityType.PROJECT, TableDefinition.builder(EntityType.PROJECT, "dim_project", ProjectDimension.class)
                .key("project_key", Types.BIGINT, ProjectDimension::getSurrogateKey)
                .naturalKey("project_id", 64, ProjectDimension::getProjectId)
                .required("project_name", Types.VARCHAR, 255, ProjectDimension::getProjectName)
                .column("project_type", Types.VARCHAR, 64, ProjectDimension::getProjectType)
                .column("state", Types.VARCHAR, 32, ProjectDimension::getState)
                .column("county", Types.VARCHAR, 255, ProjectDimension::getCounty)
                .column("status", Types.VARCHAR, 64, ProjectDimension::getStatus)
                .column("partner_organizations", Types.VARCHAR, 2000, ProjectDimension::getPartnerOrganizations)
                .column("description", Types.VARCHAR, 2000, ProjectDimension::getDescription)
                .column("start_date", Types.DATE, ProjectDimension::getStartDate)
                .column("end_date", Types.DATE, ProjectDimension::getEndDate)
                .build());
        tables.put(EntityType.DATE, TableDefinition.builder(EntityType.DATE, "dim_date", DateDimension.class)
                .key("date_key", Types.INTEGER, DateDimension::getDateKey)
                .required("full_date", Types.DATE, DateDimension::getFullDate)
                .required("calendar_year", Types.INTEGER, DateDimension::getCalendarYear)
                .required("calendar_quarter", Types.INTEGER, DateDimension::getCalendarQuarter)
                .required("calendar_month", Types.INTEGER, DateDimension::getCalendarMonth)
                .required("month_name", Types.VARCHAR, 16, DateDimension::getMonthName)
                .required("iso_week", Types.INTEGER, DateDimension::getIsoWeek)
                .required("day_of_month", Types.INTEGER, DateDimension::getDayOfMonth)
                .required("day_of_week", Types.INTEGER, DateDimension::getDayOfWeek)
                .required("day_name", Types.VARCHAR, 16, DateDimension::getDayName)
                .required("is_weekend", Types.BOOLEAN, DateDimension::isWeekend)
                .required("fiscal_year", Types.INTEGER, DateDimension::getFiscalYear)
                .required("fiscal_quarter", Types.INTEGER, DateDimension::getFiscalQuarter)
                .build());
        tables.put(EntityType.DONATION, TableDefinition.builder(EntityType.DONATION, "fact_donation", DonationFact.class)
                .key("row_id", Types.BIGINT, DonationFact::getRowId)
                .required("donation_id", Types.VARCHAR, 64, DonationFact::getDonationId)
                .required("donor_key", Types.BIGINT, DonationFact::getDonorKey)
                .required("campaign_key", Types.BIGINT, DonationFact::getCampaignKey)
                .required("date_key", Types.INTEGER, DonationFact::getDateKey)
                .required("amount", Types.DECIMAL, 18, 2, DonationFact::getAmount)
                .column("payment_method", Types.VARCHAR, 64, DonationFact::getPaymentMethod)
                .column("is_recurring", Types.BOOLEAN, DonationFact::getRecurring)
                .column("notes", Types.VARCHAR, 2000, DonationFact::getNotes)
                .build());
        tables.put(EntityType.ELK_POPULATION, TableDefinition.builder(EntityType.ELK_POPULATION, "fact_elk_population", ElkPopulationFact.class)
                .key("row_id", Types.BIGINT, ElkPopulationFact::getRowId)
                .required("habitat_key", Types.BIGINT, ElkPopulationFact::getHabitatKey)
                .required("habitat_id", Types.VARCHAR, 64, ElkPopulationFact::getHabitatId)
                .required("observation_year", Types.INTEGER, ElkPopulationFact::getObservationYear)
                .required("date_key", Types.INTEGER, ElkPopulationFact::getDateKey)
                .required("elk_count", Types.INTEGER, ElkPopulationFact::getElkCount)
                .column("population_change", Types.INTEGER, ElkPopulationFact::getPopulationChange)
                .column("population_change_pct", Types.DECIMAL, 18, 2, ElkPopulationFact::getPopulationChangePct)
                .build());
        tables.put(EntityType.PROJECT_METRIC, TableDefinition.builder(EntityType.PROJECT_METRIC, "fact_conservation", ProjectMetricFact.class)
                .key("row_id", Types.BIGINT, ProjectMetricFact::getRowId)
                .required("project_key", Types.BIGINT, ProjectMetricFact::getProjectKey)
                .required("project_id", Types.VARCHAR, 64, ProjectMetricFact::getProjectId)
                .column("habitat_key", Types.BIGINT, ProjectMetricFact::getHabitatKey)
                .column("habitat_id", Types.VARCHAR, 64, ProjectMetricFact::getHabitatId)
                .column("date_key", Types.INTEGER, ProjectMetricFact::getDateKey)
                .column("budget", Types.DECIMAL, 18, 2, ProjectMetricFact::getBudget)
                .column("spent_to_date", Types.DECIMAL, 18, 2, ProjectMetricFact::getSpentToDate)
                .column("acres_protected", Types.BIGINT, ProjectMetricFact::getAcresProtected)
                .column("elk_population_impacted", Types.INTEGER, ProjectMetricFact::getElkPopulationImpacted)
                .build());
        tables.put(EntityType.FINANCIAL_FILING, TableDefinition.builder(EntityType.FINANCIAL_FILING, "fact_990_financial", FinancialFilingFact.class)
                .key("row_id", Types.BIGINT, FinancialFilingFact::getRowId)
                .required("fiscal_year", Types.INTEGER, FinancialFilingFact::getFiscalYear)
                .column("tax_year", Types.INTEGER, FinancialFilingFact::getTaxYear)
                .column("date_key", Types.INTEGER, FinancialFilingFact::getDateKey)
                .column("ein", Types.VARCHAR, 16, FinancialFilingFact::getEin)
                .column("organization_name", Types.VARCHAR, 255, FinancialFilingFact::getOrganizationName)
                .column("contributions_and_grants", Types.DECIMAL, 18, 2, FinancialFilingFact::getContributionsAndGrants)
                .column("program_service_revenue", Types.DECIMAL, 18, 2, FinancialFilingFact::getProgramServiceRevenue)
                .column("investment_income", Types.DECIMAL, 18, 2, FinancialFilingFact::getInvestmentIncome)
                .column("other_revenue", Types.DECIMAL, 18, 2, FinancialFilingFact::getOtherRevenue)
                .column("total_revenue", Types.DECIMAL, 18, 2, FinancialFilingFact::getTotalRevenue)
                .column("grants_and_similar_paid", Types.DECIMAL, 18, 2, FinancialFilingFact::getGrantsAndSimilarPaid)
                .column("salaries_and_wages", Types.DECIMAL, 18, 2, FinancialFilingFact::getSalariesAndWages)
                .column("total_expenses", Types.DECIMAL, 18, 2, FinancialFilingFact::getTotalExpenses)
                .column("revenue_less_expenses", Types.DECIMAL, 18, 2, FinancialFilingFact::getRevenueLessExpenses)
                .column("program_services_expenses", Types.DECIMAL, 18, 2, FinancialFilingFact::getProgramServicesExpenses)
                .column("total_assets", Types.DECIMAL, 18, 2, FinancialFilingFact::getTotalAssets)
                .column("total_liabilities", Types.DECIMAL, 18, 2, FinancialFilingFact::getTotalLiabilities)
                .column("net_assets", Types.DECIMAL, 18, 2, FinancialFilingFact::getNetAssets)
                .column("employees_count", Types.INTEGER, FinancialFilingFact::getEmployeesCount)
                .column("volunteers_count", Types.INTEGER, FinancialFilingFact::getVolunteersCount)
                .build());
        tables.put(EntityType.PROGRAM_SERVICE_LINE, TableDefinition.builder(EntityType.PROGRAM_SERVICE_LINE, "fact_990_program_service", ProgramServiceLineFact.class)
                .key("row_id", Types.BIGINT, ProgramServiceLineFact::getRowId)
                .required("fiscal_year", Types.INTEGER, ProgramServiceLineFact::getFiscalYear)
                .column("program_code", Types.VARCHAR, 16, ProgramServiceLineFact::getProgramCode)
                .required("program_name", Types.VARCHAR, 255, ProgramServiceLineFact::getProgramName)
                .column("date_key", Types.INTEGER, ProgramServiceLineFact::getDateKey)
                .column("expenses", Types.DECIMAL, 18, 2, ProgramServiceLineFact::getExpenses)
                .column("grants", Types.DECIMAL, 18, 2, ProgramServiceLineFact::getGrants)
                .column("revenue", Types.DECIMAL, 18, 2, ProgramServiceLineFact::getRevenue)
                .build());
        TABLES = Collections.unmodifiableMap(tables);
    }

    private TableDefinitions() {
    }

    public static TableDefinition<?> forEntity(EntityType entityType) {
        TableDefinition<?> table = TABLES.get(entityType);
        if (table == null) {
            throw new IllegalArgumentException("No table mapped for " + entityType);
        }
        return table;
    }

    public static Collection<TableDefinition<?>> all() {
        return TABLES.values();
    }

    public static List<String> tableNames() {
        List<String> names = TABLES.values().stream().map(TableDefinition::getTableName)
                .collect(Collectors.toCollection(ArrayList::new));
        names.add(ANOMALY_FLAG_TABLE);
        return names;
    }
}
