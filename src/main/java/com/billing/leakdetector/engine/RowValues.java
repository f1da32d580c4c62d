package com.billing.leakdetector.engine;

import com.billing.leakdetector.exception.InvalidRowException;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Typed access to the loosely typed cells of a dataset row. Cells arrive either as JSON
 * numbers or as the strings a CSV export produces.
 */
public final class RowValues {

    private static final DateTimeFormatter SPACE_SEPARATED = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final List<Function<String, Instant>> TIMESTAMP_PARSERS = List.of(
            Instant::parse,
            s -> OffsetDateTime.parse(s).toInstant(),
            s -> LocalDateTime.parse(s).toInstant(ZoneOffset.UTC),
            s -> LocalDateTime.parse(s, SPACE_SEPARATED).toInstant(ZoneOffset.UTC),
            s -> LocalDate.parse(s).atStartOfDay(ZoneOffset.UTC).toInstant()
    );

    private RowValues() {
    }

    /**
     * @return the numeric value of the column, or null when it is absent or blank
     * @throws InvalidRowException when the cell holds something that is not a number
     */
    public static Double number(Map<String, Object> row, String column) {
        Object value = row.get(column);
        if (value == null) return null;
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String s) {
            if (s.isBlank()) return null;
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw new InvalidRowException("Column " + column + " is not numeric: " + s);
            }
        }
        throw new InvalidRowException("Column " + column + " is not numeric: " + value);
    }

    /** Epoch milliseconds of the column, or null when absent or unparseable. */
    public static Long timestamp(Map<String, Object> row, String column) {
        return timestamp(row.get(column));
    }

    public static Long timestamp(Object value) {
        if (value == null) return null;
        if (value instanceof Number n) {
            return n.longValue();
        }
        String text = value.toString().trim();
        if (text.isEmpty()) return null;
        for (Function<String, Instant> parser : TIMESTAMP_PARSERS) {
            try {
                return parser.apply(text).toEpochMilli();
            } catch (DateTimeParseException ignored) {
                // try the next format
            }
        }
        return null;
    }
}
