package com.example.dataingest.extractor;

import com.example.dataingest.model.FormatDetails;
import com.example.dataingest.model.TabularDetails;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.hadoop.metadata.BlockMetaData;
import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.PrimitiveType;
import org.apache.parquet.schema.Type;
import org.springframework.stereotype.Component;

/**
 * Parquet files, described from the footer alone: row counts come from row-group metadata and
 * columns from the embedded schema, so no data pages are read.
 */
@Slf4j
@Component
public class ParquetFormatExtractor implements FormatExtractor {

    @Override
    public boolean supports(String extension) {
        return "parquet".equals(extension);
    }

    @Override
    public String branch() {
        return "parquet";
    }

    @Override
    public FormatDetails extract(Path file, String extension) throws IOException {
        try (ParquetFileReader reader = ParquetFileReader.open(new LocalParquetInputFile(file))) {
            long rowCount = 0L;
            for (BlockMetaData rowGroup : reader.getFooter().getBlocks()) {
                rowCount += rowGroup.getRowCount();
            }

            MessageType schema = reader.getFooter().getFileMetaData().getSchema();
            List<String> columnNames = new ArrayList<>(schema.getFieldCount());
            Map<String, String> columnTypes = new LinkedHashMap<>();
            for (Type field : schema.getFields()) {
                columnNames.add(field.getName());
                columnTypes.put(field.getName(), describe(field));
            }
            log.debug("Parquet file={} rows={} columns={}", file.getFileName(), rowCount, columnNames.size());
            return new TabularDetails(rowCount, columnNames.size(), columnNames, columnTypes);
        }
    }

    private static String describe(Type field) {
        LogicalTypeAnnotation logical = field.getLogicalTypeAnnotation();
        if (!field.isPrimitive()) {
            return logical == null ? "group" : logical.toString().toLowerCase(Locale.ROOT);
        }
        PrimitiveType primitive = field.asPrimitiveType();
        String physical = primitive.getPrimitiveTypeName().name().toLowerCase(Locale.ROOT);
        return logical == null ? physical : physical + " (" + logical + ")";
    }
}
