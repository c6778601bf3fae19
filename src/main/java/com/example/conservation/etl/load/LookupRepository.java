package com.example.conservation.etl.load;

import com.example.conservation.etl.conform.DimensionLookups;
import com.example.conservation.etl.model.EntityType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Read side of the store: dimension key lookups and the reference data the pipeline
 * consults between stages.
 */
@Repository
public class LookupRepository {
    private static final Logger log = LoggerFactory.getLogger(LookupRepository.class);

    private static final List<EntityType> LOOKUP_DIMENSIONS =
            List.of(EntityType.DONOR, EntityType.CAMPAIGN, EntityType.HABITAT, EntityType.PROJECT);

    private final JdbcTemplate jdbcTemplate;

    public LookupRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Natural key to surrogate key for every stored dimension row.
     */
    public DimensionLookups loadLookups() {
        Map<EntityType, Map<String, Long>> keys = new EnumMap<>(EntityType.class);
        for (EntityType dimension : LOOKUP_DIMENSIONS) {
            keys.put(dimension, loadKeys(dimension));
        }
        DimensionLookups lookups = DimensionLookups.of(keys);
        log.debug("Loaded dimension lookups: {}", lookups);
        return lookups;
    }

    public Map<String, Long> loadKeys(EntityType dimension) {
        TableDefinition<?> table = TableDefinitions.forEntity(dimension);
        String sql = "SELECT " + table.getNaturalKeyColumn().getName() + ", " + table.getKeyColumn().getName()
                + " FROM " + table.getTableName();
        Map<String, Long> keys = new HashMap<>();
        jdbcTemplate.query(sql, rs -> {
            keys.put(rs.getString(1), rs.getLong(2));
        });
        return keys;
    }

    /**
     * habitat_id to conservation_status as currently stored.
     */
    public Map<String, String> habitatStatuses() {
        Map<String, String> statuses = new HashMap<>();
        jdbcTemplate.query("SELECT habitat_id, conservation_status FROM dim_habitat WHERE conservation_status IS NOT NULL",
                rs -> {
                    statuses.put(rs.getString(1), rs.getString(2));
                });
        return statuses;
    }

    /**
     * Every business date currently referenced by a stored fact table, so a regenerated date
     * dimension still covers facts that were not reloaded in this run.
     */
    public List<LocalDate> referencedDates() {
        List<LocalDate> dates = new ArrayList<>();
        for (EntityType entity : EntityType.values()) {
            if (!entity.isFact()) {
                continue;
            }
            String table = TableDefinitions.forEntity(entity).getTableName();
            jdbcTemplate.query("SELECT DISTINCT date_key FROM " + table + " WHERE date_key IS NOT NULL",
                    rs -> {
                        dates.add(LocalDate.parse(Integer.toString(rs.getInt(1)), DateTimeFormatter.BASIC_ISO_DATE));
                    });
        }
        return dates;
    }

    public long countRows(String tableName) {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + tableName, Long.class);
        return count == null ? 0 : count;
    }
}
