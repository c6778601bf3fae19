package com.example.conservation.etl.conform;

import com.example.conservation.etl.exception.ConformanceException;
import com.example.conservation.etl.model.StagedRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Coerces raw staged values into schema types. Blank values become null; anything else that
 * cannot be converted raises {@link ConformanceException} naming the field and the offending value.
 */
public class TypeCoercer {

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("M/d/yyyy"),
            DateTimeFormatter.ofPattern("yyyy/MM/dd"));
    private static final Pattern AMOUNT_NOISE = Pattern.compile("[,$\\s]");
    private static final Pattern NUMERIC_FALSE = Pattern.compile("-?0(\\.0*)?");
    private static final Pattern NUMERIC_TRUE = Pattern.compile("1(\\.0*)?");

    private final ObjectMapper objectMapper;

    public TypeCoercer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String toText(StagedRecord record, String field) {
        Object value = record.getValue(field);
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    /**
     * Accepts plain numbers and filing-style amounts: {@code $1,250}, {@code 52,185,551.}, {@code (3,400)}.
     */
    public BigDecimal toDecimal(StagedRecord record, String field) {
        Object value = record.getValue(field);
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof Number) {
            return new BigDecimal(value.toString());
        }
        String cleaned = AMOUNT_NOISE.matcher(value.toString()).replaceAll("");
        if (cleaned.isEmpty()) {
            return null;
        }
        boolean negative = cleaned.startsWith("(") && cleaned.endsWith(")");
        if (negative) {
            cleaned = cleaned.substring(1, cleaned.length() - 1);
        }
        if (cleaned.endsWith(".")) {
            cleaned = cleaned.substring(0, cleaned.length() - 1);
        }
        try {
            BigDecimal parsed = new BigDecimal(cleaned);
            return negative ? parsed.negate() : parsed;
        } catch (NumberFormatException e) {
            throw new ConformanceException(field, value, "decimal");
        }
    }

    public Long toLong(StagedRecord record, String field) {
        BigDecimal decimal = toDecimalAs(record, field, "whole number");
        if (decimal == null) {
            return null;
        }
        try {
            return decimal.stripTrailingZeros().longValueExact();
        } catch (ArithmeticException e) {
            throw new ConformanceException(field, record.getValue(field), "whole number");
        }
    }

    public Integer toInteger(StagedRecord record, String field) {
        Long value = toLong(record, field);
        if (value == null) {
            return null;
        }
        if (value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
            throw new ConformanceException(field, record.getValue(field), "integer");
        }
        return value.intValue();
    }

    public Boolean toBoolean(StagedRecord record, String field) {
        Object value = record.getValue(field);
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            // Only 0 and 1 are flags; any other number is a data error.
            String number = value.toString();
            if (NUMERIC_FALSE.matcher(number).matches()) {
                return Boolean.FALSE;
            }
            if (NUMERIC_TRUE.matcher(number).matches()) {
                return Boolean.TRUE;
            }
            throw new ConformanceException(field, value, "boolean");
        }
        switch (value.toString().trim().toLowerCase(Locale.ROOT)) {
            case "":
                return null;
            case "true":
            case "t":
            case "yes":
            case "y":
            case "1":
                return Boolean.TRUE;
            case "false":
            case "f":
            case "no":
            case "n":
            case "0":
                return Boolean.FALSE;
            default:
                throw new ConformanceException(field, value, "boolean");
        }
    }

    public LocalDate toDate(StagedRecord record, String field) {
        String text = toText(record, field);
        if (text == null) {
            return null;
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDate.parse(text, format);
            } catch (DateTimeParseException ignored) {
                // try the next format
            }
        }
        try {
            return LocalDateTime.parse(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME).toLocalDate();
        } catch (DateTimeParseException e) {
            throw new ConformanceException(field, text, "date");
        }
    }

    /**
     * Lists and objects are stored as JSON text; scalars as their string form.
     */
    public String toJsonText(StagedRecord record, String field) {
        Object value = record.getValue(field);
        if (value == null || value instanceof String) {
            return toText(record, field);
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ConformanceException(field, value, "JSON value");
        }
    }

    private BigDecimal toDecimalAs(StagedRecord record, String field, String expectedType) {
        try {
            return toDecimal(record, field);
        } catch (ConformanceException e) {
            throw new ConformanceException(field, record.getValue(field), expectedType);
        }
    }
}
