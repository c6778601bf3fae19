package com.example.conservation.etl.service;

import com.example.conservation.etl.config.EtlProperties;
import com.example.conservation.etl.exception.FatalConfigurationException;
import com.example.conservation.etl.load.TableDefinition;
import com.example.conservation.etl.load.TableDefinitions;
import com.example.conservation.etl.model.EntityType;
import com.example.conservation.etl.model.SourceDefinition;
import com.example.conservation.etl.reader.SourceReaderFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks everything a run needs before any entity is touched: every sourced entity has a usable
 * source definition, the store is reachable and every mapped table and column exists.
 * Optionally creates the schema first.
 */
@Component
public class StoreConfigurationVerifier {
    private static final Logger log = LoggerFactory.getLogger(StoreConfigurationVerifier.class);

    private final DataSource dataSource;
    private final JdbcTemplate jdbcTemplate;
    private final EtlProperties properties;
    private final SourceReaderFactory readerFactory;

    public StoreConfigurationVerifier(DataSource dataSource, JdbcTemplate jdbcTemplate, EtlProperties properties,
                                      SourceReaderFactory readerFactory) {
        this.dataSource = dataSource;
        this.jdbcTemplate = jdbcTemplate;
        this.properties = properties;
        this.readerFactory = readerFactory;
    }

    /**
     * @throws FatalConfigurationException listing every problem found.
     */
    public void verify() {
        List<String> problems = new ArrayList<>(checkSources());
        if (properties.getStore().isInitializeSchema()) {
            initializeSchema();
        }
        problems.addAll(checkTables());
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Configuration problem: {}", problem));
            throw new FatalConfigurationException("Invalid configuration: " + String.join("; ", problems));
        }
        log.info("Configuration verified: {} sources, {} tables", properties.getSources().size(), TableDefinitions.tableNames().size());
    }

    List<String> checkSources() {
        List<String> problems = new ArrayList<>();
        for (EntityType entity : EntityType.values()) {
            if (!entity.isSourced()) {
                continue;
            }
            SourceDefinition source = properties.sourceFor(entity);
            if (source == null) {
                problems.add("no source configured for " + entity);
            } else if (source.getSourceType() == null) {
                problems.add("no source type configured for " + entity);
            } else if (source.getLocation() == null) {
                problems.add("no source location configured for " + entity);
            } else if (!readerFactory.supports(source.getSourceType())) {
                problems.add("no reader for source type " + source.getSourceType() + " of " + entity);
            }
        }
        return problems;
    }

    private void initializeSchema() {
        Resource script = new DefaultResourceLoader().getResource(properties.getStore().getSchemaLocation());
        if (!script.exists()) {
            throw new FatalConfigurationException("Schema script not found: " + properties.getStore().getSchemaLocation());
        }
        try {
            new ResourceDatabasePopulator(script).execute(dataSource);
            log.info("Applied schema script {}", properties.getStore().getSchemaLocation());
        } catch (DataAccessException e) {
            throw new FatalConfigurationException("Cannot apply schema script " + properties.getStore().getSchemaLocation()
                    + ": " + e.getMessage(), e);
        }
    }

    private List<String> checkTables() {
        List<String> problems = new ArrayList<>();
        try {
            jdbcTemplate.execute("SELECT 1");
        } catch (DataAccessException e) {
            throw new FatalConfigurationException("Store is not reachable: " + e.getMostSpecificCause().getMessage(), e);
        }
        for (TableDefinition<?> table : TableDefinitions.all()) {
            probe(table.getTableName(), table.probeSql(), problems);
        }
        probe(TableDefinitions.ANOMALY_FLAG_TABLE, "SELECT entity_type, record_key, rule_name, severity, observed_value, "
                + "threshold_value, detail FROM " + TableDefinitions.ANOMALY_FLAG_TABLE + " WHERE 1 = 0", problems);
        return problems;
    }

    private void probe(String tableName, String sql, List<String> problems) {
        try {
            jdbcTemplate.queryForList(sql);
        } catch (DataAccessException e) {
            problems.add("table " + tableName + " is missing or incomplete: " + e.getMostSpecificCause().getMessage());
        }
    }
}
