package com.example.dataingest.extractor;

import com.example.dataingest.model.FormatDetails;
import com.example.dataingest.model.JsonDetails;
import com.example.dataingest.support.FileProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class JsonFormatExtractor implements FormatExtractor {

    private final ObjectMapper objectMapper;

    @Override
    public boolean supports(String extension) {
        return "json".equals(extension);
    }

    @Override
    public String branch() {
        return "json";
    }

    @Override
    public FormatDetails extract(Path file, String extension) throws IOException {
        JsonNode root = objectMapper.readTree(file.toFile());
        if (root == null || root.isMissingNode()) {
            throw new FileProcessingException("No JSON content in %s".formatted(file.getFileName()));
        }

        if (root.isArray()) {
            JsonNode first = root.size() > 0 ? root.get(0) : null;
            List<String> sampleKeys = first != null && first.isObject() ? fieldNames(first) : null;
            log.debug("JSON array file={} records={}", file.getFileName(), root.size());
            return JsonDetails.array(root.size(), sampleKeys);
        }
        if (root.isObject()) {
            return JsonDetails.object(fieldNames(root));
        }
        return JsonDetails.scalar(root.getNodeType().name().toLowerCase(Locale.ROOT));
    }

    private static List<String> fieldNames(JsonNode node) {
        List<String> names = new ArrayList<>(node.size());
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }
}
