package com.example.dataingest.model;

import java.util.List;
import java.util.Map;

public record SpreadsheetDetails(
        int sheetCount,
        List<String> sheetNames,
        Map<String, TabularDetails> sheets) implements FormatDetails {
}
