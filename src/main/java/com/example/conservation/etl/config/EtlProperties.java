package com.example.conservation.etl.config;

import com.example.conservation.etl.model.EntityType;
import com.example.conservation.etl.model.SourceDefinition;
import com.example.conservation.etl.model.SourceType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Run configuration bound from {@code conservation.etl.*}.
 */
@Data
@ConfigurationProperties("conservation.etl")
public class EtlProperties {
    private Map<EntityType, SourceConfig> sources = new EnumMap<>(EntityType.class);
    private Anomaly anomaly = new Anomaly();
    private Filing filing = new Filing();
    private Quality quality = new Quality();
    private Store store = new Store();

    private Duration readTimeout = Duration.ofMinutes(5);
    private Duration loadTimeout = Duration.ofMinutes(5);
    private Duration runTimeout = Duration.ofMinutes(30);
    private int parallelReads = 4;

    private String runLockFile = "./conservation-etl.lock";
    private String reportPath = "./run-report.json";

    private int fiscalYearStartMonth = 10;
    private int reportViolationSampleSize = 50;
    private BigDecimal revenueTolerance = BigDecimal.ONE;

    public SourceDefinition sourceFor(EntityType entityType) {
        SourceConfig config = sources.get(entityType);
        return config == null ? null : config.toDefinition(entityType);
    }

    @Data
    public static class SourceConfig {
        private SourceType type;
        private String location;
        /** Nested array to flatten into repeated records. */
        private String flatten;
        private boolean keepEmptyFlatten = true;
        private List<String> requiredColumns = new ArrayList<>();
        private String delimiter = ",";
        private String encoding = "UTF-8";
        private String filePattern = "*990*.txt";

        public SourceDefinition toDefinition(EntityType entityType) {
            return SourceDefinition.builder()
                    .entityType(entityType)
                    .sourceType(type)
                    .location(location == null ? null : Path.of(location))
                    .flattenField(flatten)
                    .keepEmptyFlatten(keepEmptyFlatten)
                    .requiredColumns(requiredColumns)
                    .delimiter(delimiter)
                    .encoding(encoding)
                    .filePattern(filePattern)
                    .build();
        }
    }

    @Data
    public static class Anomaly {
        private BigDecimal largeDonationAmount = new BigDecimal("10000");
        /** Year-over-year decline, in percent, beyond which a habitat's population is flagged. */
        private BigDecimal populationDeclinePercent = BigDecimal.TEN;
        private List<String> atRiskStatuses = new ArrayList<>(List.of("At Risk"));
    }

    @Data
    public static class Filing {
        /** Numeric field name to the labels that may precede its value, tried in order. */
        private Map<String, List<String>> labels = defaultLabels();
        /** Text field name to its labels. */
        private Map<String, List<String>> textLabels = new LinkedHashMap<>(Map.of(
                "organization_name", List.of("Name of organization")));
        /** Fields whose label must be present; a miss is reported for review. */
        private List<String> requiredLabels = new ArrayList<>(List.of(
                "total_revenue", "total_expenses", "contributions_and_grants"));
        /** Part III program line code to program name. */
        private Map<String, String> programServices = defaultProgramServices();

        private static Map<String, List<String>> defaultLabels() {
            Map<String, List<String>> labels = new LinkedHashMap<>();
            labels.put("contributions_and_grants", List.of("Contributions and grants", "Contributions, gifts, grants"));
            labels.put("program_service_revenue", List.of("Program service revenue"));
            labels.put("investment_income", List.of("Investment income"));
            labels.put("other_revenue", List.of("Other revenue"));
            labels.put("total_revenue", List.of("Total revenue"));
            labels.put("grants_and_similar_paid", List.of("Grants and similar amounts paid"));
            labels.put("salaries_and_wages", List.of("Salaries, other compensation", "Salaries and wages"));
            labels.put("total_expenses", List.of("Total expenses"));
            labels.put("revenue_less_expenses", List.of("Revenue less expenses"));
            labels.put("total_assets", List.of("Total assets"));
            labels.put("total_liabilities", List.of("Total liabilities"));
            labels.put("net_assets", List.of("Net assets or fund balances", "Net assets"));
            labels.put("employees_count", List.of("Total number of individuals employed"));
            labels.put("volunteers_count", List.of("Total number of volunteers"));
            return labels;
        }

        private static Map<String, String> defaultProgramServices() {
            Map<String, String> programs = new LinkedHashMap<>();
            programs.put("4a", "Land Protection & Access");
            programs.put("4b", "Hunting Heritage");
            programs.put("4c", "Habitat Stewardship");
            return programs;
        }
    }

    @Data
    public static class Quality {
        /**
         * Entity to field (hyphenated, as in {@code membership-level}) to the values it may take.
         * A value outside the list is reported as a warning; an empty list turns the check off.
         */
        private Map<EntityType, Map<String, List<String>>> allowedValues = defaultAllowedValues();

        public List<String> allowedValues(EntityType entityType, String field) {
            Map<String, List<String>> fields = allowedValues.get(entityType);
            if (fields == null || fields.get(field) == null) {
                return List.of();
            }
            return fields.get(field);
        }

        private static Map<EntityType, Map<String, List<String>>> defaultAllowedValues() {
            Map<EntityType, Map<String, List<String>>> allowed = new EnumMap<>(EntityType.class);
            Map<String, List<String>> donor = new LinkedHashMap<>();
            donor.put("membership-level", List.of("Bronze", "Silver", "Gold", "Platinum"));
            donor.put("donor-type", List.of("Individual", "Corporate", "Foundation"));
            allowed.put(EntityType.DONOR, donor);
            allowed.put(EntityType.CAMPAIGN, new LinkedHashMap<>(Map.of(
                    "status", List.of("Active", "Completed", "Cancelled", "Planned"))));
            allowed.put(EntityType.DONATION, new LinkedHashMap<>(Map.of(
                    "payment-method", List.of("Credit Card", "Check", "Wire Transfer", "Cash", "ACH"))));
            allowed.put(EntityType.PROJECT, new LinkedHashMap<>(Map.of(
                    "status", List.of("In Progress", "Completed", "Planned", "On Hold"))));
            return allowed;
        }
    }

    @Data
    public static class Store {
        /** Run the bundled schema script (CREATE TABLE IF NOT EXISTS) before verification. */
        private boolean initializeSchema = true;
        private String schemaLocation = "classpath:db/conservation-schema.sql";
    }
}
