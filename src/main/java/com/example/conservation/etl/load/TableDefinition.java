package com.example.conservation.etl.load;

import com.example.conservation.etl.model.EntityType;

import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Maps one entity onto its store table. Dimensions name a natural-key column for upsert
 * matching; facts and the date dimension are replaced wholesale and need none.
 */
public class TableDefinition<T> {
    private final EntityType entityType;
    private final String tableName;
    private final Class<T> recordType;
    private final ColumnDefinition<T> keyColumn;
    private final ColumnDefinition<T> naturalKeyColumn;
    private final List<ColumnDefinition<T>> attributeColumns;

    private TableDefinition(Builder<T> builder) {
        this.entityType = builder.entityType;
        this.tableName = builder.tableName;
        this.recordType = builder.recordType;
        this.keyColumn = builder.keyColumn;
        this.naturalKeyColumn = builder.naturalKeyColumn;
        this.attributeColumns = List.copyOf(builder.attributeColumns);
    }

    public static <T> Builder<T> builder(EntityType entityType, String tableName, Class<T> recordType) {
        return new Builder<>(entityType, tableName, recordType);
    }

    public EntityType getEntityType() {
        return entityType;
    }

    public String getTableName() {
        return tableName;
    }

    public Class<T> getRecordType() {
        return recordType;
    }

    /**
     * Views a batch as this table's record type; fails on a record of another type.
     */
    public List<T> typed(List<?> records) {
        List<T> typed = new ArrayList<>(records.size());
        for (Object record : records) {
            typed.add(recordType.cast(record));
        }
        return typed;
    }

    /**
     * Every mapped column whose declared size the record's value exceeds, as messages.
     */
    public List<String> misfits(Object record) {
        T typed = recordType.cast(record);
        List<String> misfits = new ArrayList<>();
        for (ColumnDefinition<T> column : getInsertColumns()) {
            String misfit = column.describeMisfit(typed);
            if (misfit != null) {
                misfits.add(misfit);
            }
        }
        return misfits;
    }

    public ColumnDefinition<T> getKeyColumn() {
        return keyColumn;
    }

    public ColumnDefinition<T> getNaturalKeyColumn() {
        return naturalKeyColumn;
    }

    /**
     * Key first, then natural key (if any), then attributes: the order used for inserts.
     */
    public List<ColumnDefinition<T>> getInsertColumns() {
        List<ColumnDefinition<T>> columns = new ArrayList<>();
        columns.add(keyColumn);
        if (naturalKeyColumn != null) {
            columns.add(naturalKeyColumn);
        }
        columns.addAll(attributeColumns);
        return columns;
    }

    /**
     * Attributes, then the natural key for the WHERE clause. The surrogate key is never updated.
     */
    public List<ColumnDefinition<T>> getUpdateColumns() {
        List<ColumnDefinition<T>> columns = new ArrayList<>(attributeColumns);
        columns.add(naturalKeyColumn);
        return columns;
    }

    public String insertSql() {
        List<ColumnDefinition<T>> columns = getInsertColumns();
        return "INSERT INTO " + tableName + " ("
                + columns.stream().map(ColumnDefinition::getName).collect(Collectors.joining(", "))
                + ") VALUES (" + columns.stream().map(c -> "?").collect(Collectors.joining(", ")) + ")";
    }

    public String updateSql() {
        if (naturalKeyColumn == null) {
            throw new IllegalStateException(tableName + " has no natural key column and cannot be upserted");
        }
        return "UPDATE " + tableName + " SET "
                + attributeColumns.stream().map(c -> c.getName() + " = ?").collect(Collectors.joining(", "))
                + " WHERE " + naturalKeyColumn.getName() + " = ?";
    }

    public String deleteAllSql() {
        return "DELETE FROM " + tableName;
    }

    /**
     * Selects every mapped column from no rows; fails when the table or a column is missing.
     */
    public String probeSql() {
        return "SELECT " + getInsertColumns().stream().map(ColumnDefinition::getName).collect(Collectors.joining(", "))
                + " FROM " + tableName + " WHERE 1 = 0";
    }

    public static class Builder<T> {
        private final EntityType entityType;
        private final String tableName;
        private final Class<T> recordType;
        private ColumnDefinition<T> keyColumn;
        private ColumnDefinition<T> naturalKeyColumn;
        private final List<ColumnDefinition<T>> attributeColumns = new ArrayList<>();

        private Builder(EntityType entityType, String tableName, Class<T> recordType) {
            this.entityType = entityType;
            this.tableName = tableName;
            this.recordType = recordType;
        }

        public Builder<T> key(String name, int sqlType, Function<T, ?> extractor) {
            this.keyColumn = new ColumnDefinition<>(name, sqlType, false, extractor);
            return this;
        }

        public Builder<T> naturalKey(String name, int length, Function<T, ?> extractor) {
            this.naturalKeyColumn = new ColumnDefinition<>(name, Types.VARCHAR, length, false, extractor);
            return this;
        }

        public Builder<T> column(String name, int sqlType, Function<T, ?> extractor) {
            return column(name, sqlType, 0, 0, extractor);
        }

        public Builder<T> column(String name, int sqlType, int length, Function<T, ?> extractor) {
            return column(name, sqlType, length, 0, extractor);
        }

        public Builder<T> column(String name, int sqlType, int precision, int scale, Function<T, ?> extractor) {
            attributeColumns.add(new ColumnDefinition<>(name, sqlType, precision, scale, true, extractor));
            return this;
        }

        public Builder<T> required(String name, int sqlType, Function<T, ?> extractor) {
            return required(name, sqlType, 0, 0, extractor);
        }

        public Builder<T> required(String name, int sqlType, int length, Function<T, ?> extractor) {
            return required(name, sqlType, length, 0, extractor);
        }

        public Builder<T> required(String name, int sqlType, int precision, int scale, Function<T, ?> extractor) {
            attributeColumns.add(new ColumnDefinition<>(name, sqlType, precision, scale, false, extractor));
            return this;
        }

        public TableDefinition<T> build() {
            if (keyColumn == null) {
                throw new IllegalStateException("Key column is required for " + tableName);
            }
            return new TableDefinition<>(this);
        }
    }
}
