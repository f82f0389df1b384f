package com.example.dataingest.extractor;

import com.example.dataingest.config.IngestionProperties;
import com.example.dataingest.model.ColumnType;
import com.example.dataingest.model.FormatDetails;
import com.example.dataingest.model.SpreadsheetDetails;
import com.example.dataingest.model.TabularDetails;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

/**
 * Excel workbooks ({@code xlsx} and {@code xls}). The first non-empty row of each sheet is its header.
 */
@Slf4j
@Component
public class SpreadsheetFormatExtractor implements FormatExtractor {

    private static final Set<String> EXTENSIONS = Set.of("xlsx", "xls");

    private final int sampleRows;

    public SpreadsheetFormatExtractor(IngestionProperties properties) {
        this.sampleRows = Math.max(1, properties.getSampleRows());
    }

    @Override
    public boolean supports(String extension) {
        return EXTENSIONS.contains(extension);
    }

    @Override
    public String branch() {
        return "excel";
    }

    @Override
    public FormatDetails extract(Path file, String extension) throws IOException {
        try (Workbook workbook = WorkbookFactory.create(file.toFile(), null, true)) {
            DataFormatter formatter = new DataFormatter();
            List<String> sheetNames = new ArrayList<>(workbook.getNumberOfSheets());
            Map<String, TabularDetails> sheets = new LinkedHashMap<>();
            for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
                Sheet sheet = workbook.getSheetAt(i);
                sheetNames.add(sheet.getSheetName());
                sheets.put(sheet.getSheetName(), describeSheet(sheet, formatter));
            }
            log.debug("Workbook file={} sheets={}", file.getFileName(), sheetNames);
            return new SpreadsheetDetails(sheetNames.size(), sheetNames, sheets);
        }
    }

    private TabularDetails describeSheet(Sheet sheet, DataFormatter formatter) {
        int headerIndex = firstNonBlankRow(sheet);
        if (headerIndex < 0) {
            return new TabularDetails(0, 0, List.of(), Map.of());
        }

        Row header = sheet.getRow(headerIndex);
        List<String> columnNames = columnNames(header, formatter);
        ColumnType[] types = new ColumnType[columnNames.size()];
        Arrays.fill(types, ColumnType.EMPTY);

        long rowCount = 0;
        for (int r = headerIndex + 1; r <= sheet.getLastRowNum(); r++) {
            Row row = sheet.getRow(r);
            if (isBlank(row)) {
                continue;
            }
            if (rowCount < sampleRows) {
                for (int c = 0; c < types.length; c++) {
                    types[c] = types[c].widen(cellType(row.getCell(c)));
                }
            }
            rowCount++;
        }

        Map<String, String> columnTypes = new LinkedHashMap<>();
        for (int c = 0; c < types.length; c++) {
            columnTypes.put(columnNames.get(c), types[c].typeName());
        }
        return new TabularDetails(rowCount, columnNames.size(), columnNames, columnTypes);
    }

    private static int firstNonBlankRow(Sheet sheet) {
        if (sheet.getPhysicalNumberOfRows() == 0) {
            return -1;
        }
        for (int r = sheet.getFirstRowNum(); r <= sheet.getLastRowNum(); r++) {
            if (!isBlank(sheet.getRow(r))) {
                return r;
            }
        }
        return -1;
    }

    private static List<String> columnNames(Row header, DataFormatter formatter) {
        int width = Math.max(0, header.getLastCellNum());
        List<String> names = new ArrayList<>(width);
        Set<String> seen = new HashSet<>();
        for (int c = 0; c < width; c++) {
            Cell cell = header.getCell(c);
            String value = cell == null ? "" : formatter.formatCellValue(cell).trim();
            String base = value.isEmpty() ? "Unnamed: " + c : value;
            String name = base;
            int suffix = 1;
            while (!seen.add(name)) {
                name = base + "." + suffix++;
            }
            names.add(name);
        }
        return names;
    }

    private static boolean isBlank(Row row) {
        if (row == null) {
            return true;
        }
        for (Cell cell : row) {
            if (cell.getCellType() != CellType.BLANK
                    && !(cell.getCellType() == CellType.STRING && cell.getStringCellValue().isBlank())) {
                return false;
            }
        }
        return true;
    }

    private static ColumnType cellType(Cell cell) {
        if (cell == null) {
            return ColumnType.EMPTY;
        }
        CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
        switch (type) {
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return ColumnType.TIMESTAMP;
                }
                double value = cell.getNumericCellValue();
                return value == Math.rint(value) && !Double.isInfinite(value) ? ColumnType.INTEGER : ColumnType.DECIMAL;
            case BOOLEAN:
                return ColumnType.BOOLEAN;
            case STRING:
                return cell.getStringCellValue().isBlank() ? ColumnType.EMPTY : ColumnType.STRING;
            case BLANK:
                return ColumnType.EMPTY;
            default:
                return ColumnType.STRING;
        }
    }
}
