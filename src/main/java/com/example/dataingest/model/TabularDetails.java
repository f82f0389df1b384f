package com.example.dataingest.model;

import java.util.List;
import java.util.Map;

/**
 * Shape of a delimited or columnar file, and of each spreadsheet sheet. {@code rowCount} excludes the header.
 */
public record TabularDetails(
        long rowCount,
        int columnCount,
        List<String> columnNames,
        Map<String, String> columnTypes) implements FormatDetails {
}
