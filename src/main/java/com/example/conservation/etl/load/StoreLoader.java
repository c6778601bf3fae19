package com.example.conservation.etl.load;

import com.example.conservation.etl.exception.LoadException;
import com.example.conservation.etl.exception.RunCancelledException;
import com.example.conservation.etl.model.AnomalyFlag;
import com.example.conservation.etl.model.DateDimension;
import com.example.conservation.etl.model.DimensionRecord;
import com.example.conservation.etl.model.EntityType;
import com.example.conservation.etl.model.FactRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

/**
 * Writes conformed batches to the store, one transaction per entity.
 * <ul>
 *   <li>Dimensions are upserted by natural key: existing rows get their attributes updated and keep
 *       their surrogate key, new natural keys are inserted.</li>
 *   <li>Facts and the date dimension are fully replaced: all rows (and, for facts, the entity's
 *       anomaly flags) are deleted and the new batch inserted.</li>
 * </ul>
 * Any failure rolls the transaction back, so readers see either the previous or the new state.
 */
public class StoreLoader {
    private static final Logger log = LoggerFactory.getLogger(StoreLoader.class);

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final JdbcTypeHandler typeHandler;
    private final int batchSize;

    public StoreLoader(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager,
                       JdbcTypeHandler typeHandler, Duration loadTimeout, int batchSize) {
        this.jdbcTemplate = jdbcTemplate;
        this.typeHandler = typeHandler;
        this.batchSize = batchSize;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setTimeout((int) Math.max(1, loadTimeout.toSeconds()));
    }

    /**
     * @return Number of rows inserted or updated.
     */
    public int upsertDimension(EntityType entityType, List<? extends DimensionRecord> records, BooleanSupplier cancelled) {
        return upsert(TableDefinitions.forEntity(entityType), records, cancelled);
    }

    /**
     * Replaces the fact table and the entity's anomaly flags.
     *
     * @return Number of fact rows inserted.
     */
    public int replaceFacts(EntityType entityType, List<? extends FactRecord> records, List<AnomalyFlag> flags,
                            BooleanSupplier cancelled) {
        TableDefinition<?> table = TableDefinitions.forEntity(entityType);
        return inTransaction(entityType, cancelled, () -> {
            int flagsDeleted = jdbcTemplate.update("DELETE FROM " + TableDefinitions.ANOMALY_FLAG_TABLE + " WHERE entity_type = ?",
                    entityType.name());
            int deleted = jdbcTemplate.update(table.deleteAllSql());
            insert(table, records);
            write(anomalyInsertSql(), TableDefinitions.ANOMALY_FLAG_COLUMNS, flags);
            log.info("Replaced {}: {} rows deleted, {} inserted; {} anomaly flags replaced by {}",
                    table.getTableName(), deleted, records.size(), flagsDeleted, flags.size());
            return records.size();
        });
    }

    public int replaceDateDimension(List<DateDimension> rows, BooleanSupplier cancelled) {
        TableDefinition<?> table = TableDefinitions.forEntity(EntityType.DATE);
        return inTransaction(EntityType.DATE, cancelled, () -> {
            int deleted = jdbcTemplate.update(table.deleteAllSql());
            insert(table, rows);
            log.info("Replaced {}: {} rows deleted, {} inserted", table.getTableName(), deleted, rows.size());
            return rows.size();
        });
    }

    private <T> int upsert(TableDefinition<T> table, List<? extends DimensionRecord> records, BooleanSupplier cancelled) {
        EntityType entityType = table.getEntityType();
        return inTransaction(entityType, cancelled, () -> {
            ColumnDefinition<T> naturalKey = table.getNaturalKeyColumn();
            Set<String> existing = new HashSet<>(jdbcTemplate.queryForList(
                    "SELECT " + naturalKey.getName() + " FROM " + table.getTableName(), String.class));

            List<DimensionRecord> updates = new ArrayList<>();
            List<DimensionRecord> inserts = new ArrayList<>();
            for (DimensionRecord record : records) {
                (existing.contains(record.getNaturalKey()) ? updates : inserts).add(record);
            }
            write(table.updateSql(), table.getUpdateColumns(), table.typed(updates));
            write(table.insertSql(), table.getInsertColumns(), table.typed(inserts));
            log.info("Upserted {} into {}: {} updated, {} inserted", entityType, table.getTableName(), updates.size(), inserts.size());
            return updates.size() + inserts.size();
        });
    }

    private <T> void insert(TableDefinition<T> table, List<?> records) {
        write(table.insertSql(), table.getInsertColumns(), table.typed(records));
    }

    private interface LoadWork {
        int run();
    }

    private int inTransaction(EntityType entityType, BooleanSupplier cancelled, LoadWork work) {
        try {
            Integer loaded = transactionTemplate.execute(status -> {
                checkCancelled(entityType, cancelled);
                int count = work.run();
                // Last chance to abandon the entity before its rows become visible.
                checkCancelled(entityType, cancelled);
                return count;
            });
            return loaded == null ? 0 : loaded;
        } catch (RunCancelledException e) {
            log.warn("Load of {} rolled back: {}", entityType, e.getMessage());
            throw e;
        } catch (DataAccessException | TransactionException e) {
            log.error("Load of {} failed and was rolled back: {}", entityType, e.getMessage(), e);
            throw new LoadException(entityType, e.getMostSpecificCause().getMessage(), e);
        }
    }

    private static void checkCancelled(EntityType entityType, BooleanSupplier cancelled) {
        if (cancelled.getAsBoolean()) {
            throw new RunCancelledException("Run cancelled during load of " + entityType);
        }
    }

    private <T> void write(String sql, List<ColumnDefinition<T>> columns, List<T> records) {
        if (records.isEmpty()) {
            return;
        }
        jdbcTemplate.batchUpdate(sql, records, batchSize, (PreparedStatement ps, T record) -> bind(ps, columns, record));
    }

    private <T> void bind(PreparedStatement ps, List<ColumnDefinition<T>> columns, T record) throws SQLException {
        for (int i = 0; i < columns.size(); i++) {
            ColumnDefinition<T> column = columns.get(i);
            typeHandler.writeField(ps, i + 1, column, column.valueOf(record));
        }
    }

    private static String anomalyInsertSql() {
        List<ColumnDefinition<AnomalyFlag>> columns = TableDefinitions.ANOMALY_FLAG_COLUMNS;
        return "INSERT INTO " + TableDefinitions.ANOMALY_FLAG_TABLE + " ("
                + columns.stream().map(ColumnDefinition::getName).collect(Collectors.joining(", "))
                + ") VALUES (" + columns.stream().map(c -> "?").collect(Collectors.joining(", ")) + ")";
    }
}
