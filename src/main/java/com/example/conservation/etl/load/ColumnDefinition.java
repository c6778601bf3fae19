package com.example.conservation.etl.load;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.function.Function;

/**
 * One store column: its name, {@link java.sql.Types} code, nullability, declared size and how to
 * read the value from a record. The size is the maximum length for text columns and the precision
 * for decimal columns; 0 means the column has no declared size.
 */
public class ColumnDefinition<T> {
    private final String name;
    private final int sqlType;
    private final int size;
    private final int scale;
    private final boolean nullable;
    private final Function<T, ?> extractor;

    public ColumnDefinition(String name, int sqlType, boolean nullable, Function<T, ?> extractor) {
        this(name, sqlType, 0, 0, nullable, extractor);
    }

    public ColumnDefinition(String name, int sqlType, int length, boolean nullable, Function<T, ?> extractor) {
        this(name, sqlType, length, 0, nullable, extractor);
    }

    public ColumnDefinition(String name, int sqlType, int precision, int scale, boolean nullable, Function<T, ?> extractor) {
        this.name = name;
        this.sqlType = sqlType;
        this.size = precision;
        this.scale = scale;
        this.nullable = nullable;
        this.extractor = extractor;
    }

    public String getName() {
        return name;
    }

    public int getSqlType() {
        return sqlType;
    }

    public int getSize() {
        return size;
    }

    public int getScale() {
        return scale;
    }

    public boolean isNullable() {
        return nullable;
    }

    public Object valueOf(T record) {
        return extractor.apply(record);
    }

    /**
     * Checks the record's value against the declared size. Decimals are compared after rounding
     * to the column scale, as the store does on insert.
     *
     * @return Why the value does not fit, or null when it fits.
     */
    public String describeMisfit(T record) {
        Object value = valueOf(record);
        if (value == null || size <= 0) {
            return null;
        }
        if (value instanceof BigDecimal) {
            BigDecimal rounded = ((BigDecimal) value).setScale(scale, RoundingMode.HALF_UP);
            if (rounded.precision() > size) {
                return name + " value " + ((BigDecimal) value).toPlainString() + " exceeds DECIMAL(" + size + ", " + scale + ")";
            }
        } else if (value instanceof String) {
            int length = ((String) value).length();
            if (length > size) {
                return name + " is " + length + " characters long; the column holds " + size;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return name;
    }
}
