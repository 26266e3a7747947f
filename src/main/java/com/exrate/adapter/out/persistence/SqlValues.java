package com.exrate.adapter.out.persistence;

import io.vertx.sqlclient.Row;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Column readers tolerant of the temporal and numeric types the JDBC driver hands back
 */
final class SqlValues {

    private SqlValues() {
    }

    static LocalDateTime localDateTime(Row row, String column) {
        Object value = row.getValue(column);
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDateTime) {
            return (LocalDateTime) value;
        }
        if (value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay();
        }
        if (value instanceof java.sql.Timestamp) {
            return ((java.sql.Timestamp) value).toLocalDateTime();
        }
        if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate().atStartOfDay();
        }
        return LocalDateTime.parse(value.toString());
    }

    static LocalDate localDate(Row row, String column) {
        LocalDateTime dateTime = localDateTime(row, column);
        return dateTime != null ? dateTime.toLocalDate() : null;
    }

    static Double nullableDouble(Row row, String column) {
        Object value = row.getValue(column);
        return value instanceof Number ? ((Number) value).doubleValue() : null;
    }
}
