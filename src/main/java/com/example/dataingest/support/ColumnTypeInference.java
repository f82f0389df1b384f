package com.example.dataingest.support;

import com.example.dataingest.model.ColumnType;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public final class ColumnTypeInference {

    private ColumnTypeInference() {
    }

    /**
     * Infers one type per column from sampled rows; rows shorter than the header leave those cells empty.
     */
    public static Map<String, ColumnType> inferColumnTypes(List<String> columnNames, List<String[]> sampleRows) {
        Map<String, ColumnType> types = new LinkedHashMap<>();
        for (int column = 0; column < columnNames.size(); column++) {
            ColumnType type = ColumnType.EMPTY;
            for (String[] row : sampleRows) {
                String value = row != null && column < row.length ? row[column] : null;
                type = type.widen(inferValueType(value));
            }
            types.put(columnNames.get(column), type);
        }
        return types;
    }

    public static ColumnType inferValueType(String raw) {
        if (raw == null || raw.isBlank()) {
            return ColumnType.EMPTY;
        }
        String value = raw.trim();
        if (isInteger(value)) {
            return ColumnType.INTEGER;
        }
        if (isDecimal(value)) {
            return ColumnType.DECIMAL;
        }
        String lower = value.toLowerCase(Locale.ROOT);
        if ("true".equals(lower) || "false".equals(lower)) {
            return ColumnType.BOOLEAN;
        }
        if (parses(() -> LocalDate.parse(value))) {
            return ColumnType.DATE;
        }
        if (parses(() -> LocalDateTime.parse(value)) || parses(() -> OffsetDateTime.parse(value))) {
            return ColumnType.TIMESTAMP;
        }
        return ColumnType.STRING;
    }

    private static boolean isInteger(String value) {
        try {
            Long.parseLong(value);
            return true;
        } catch (NumberFormatException ex) {
            return false;
        }
    }

    private static boolean isDecimal(String value) {
        try {
            new BigDecimal(value);
            return true;
        } catch (NumberFormatException ex) {
            return false;
        }
    }

    private static boolean parses(Runnable parse) {
        try {
            parse.run();
            return true;
        } catch (DateTimeParseException ex) {
            return false;
        }
    }
}
