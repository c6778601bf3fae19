package com.example.conservation.etl.load;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.time.LocalDate;

/**
 * Binds record values to statement parameters by the column's {@link Types} code.
 * Stateless; one instance is shared by all loads.
 */
public class JdbcTypeHandler {

    private static final Logger log = LoggerFactory.getLogger(JdbcTypeHandler.class);

    /**
     * Writes a value to the PreparedStatement at the specified index.
     *
     * @param ps     The PreparedStatement to update.
     * @param index  The 1-based index of the parameter to set.
     * @param column Destination column: name, SQL type and nullability.
     * @param value  The value to write.
     * @throws SQLException If a database access error occurs or the value does not fit the column type.
     */
    public void writeField(PreparedStatement ps, int index, ColumnDefinition<?> column, Object value) throws SQLException {
        int sqlType = column.getSqlType();

        try {
            if (value == null) {
                if (!column.isNullable()) {
                    // The store's NOT NULL constraint rejects it; the entity's transaction rolls back.
                    log.warn("Writing NULL to non-nullable column '{}' (index {})", column.getName(), index);
                }
                ps.setNull(index, sqlType);
                return;
            }

            switch (sqlType) {
                case Types.VARCHAR:
                    ps.setString(index, value.toString());
                    break;

                case Types.BOOLEAN:
                    if (value instanceof Boolean) {
                        ps.setBoolean(index, (Boolean) value);
                    } else if (value instanceof Number) {
                        ps.setBoolean(index, ((Number) value).intValue() != 0);
                    } else {
                        ps.setBoolean(index, Boolean.parseBoolean(value.toString()));
                    }
                    break;

                case Types.INTEGER:
                    if (value instanceof Number) ps.setInt(index, ((Number) value).intValue());
                    else ps.setInt(index, Integer.parseInt(value.toString()));
                    break;
                case Types.BIGINT:
                    if (value instanceof Number) ps.setLong(index, ((Number) value).longValue());
                    else ps.setLong(index, Long.parseLong(value.toString()));
                    break;

                case Types.DECIMAL:
                    if (value instanceof BigDecimal) ps.setBigDecimal(index, (BigDecimal) value);
                    else ps.setBigDecimal(index, new BigDecimal(value.toString()));
                    break;

                case Types.DATE:
                    if (value instanceof LocalDate) ps.setDate(index, java.sql.Date.valueOf((LocalDate) value));
                    else if (value instanceof java.sql.Date) ps.setDate(index, (java.sql.Date) value);
                    else ps.setObject(index, value, Types.DATE);
                    break;

                default:
                    log.trace("Using setObject() for SQL type ({}) of column '{}' (index {})", sqlType, column.getName(), index);
                    ps.setObject(index, value, sqlType);
                    break;
            }

        } catch (SQLException e) {
            log.error("Error setting column '{}' (index {}) to '{}': {}", column.getName(), index, value, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Cannot convert {} '{}' for column '{}' (index {}, type {})",
                    value.getClass().getName(), value, column.getName(), index, sqlType);
            throw new SQLException("Type conversion failed for column " + column.getName() + ": " + e.getMessage(), e);
        }
    }
}
