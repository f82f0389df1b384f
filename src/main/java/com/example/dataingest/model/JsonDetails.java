package com.example.dataingest.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Root-level description of a JSON document. Only the fields of the matching {@code kind} are set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JsonDetails(
        String kind,
        Integer recordCount,
        List<String> sampleKeys,
        List<String> topLevelKeys,
        String typeName) implements FormatDetails {

    public static final String ARRAY = "array";
    public static final String OBJECT = "object";

    public static JsonDetails array(int recordCount, List<String> sampleKeys) {
        return new JsonDetails(ARRAY, recordCount, sampleKeys, null, null);
    }

    public static JsonDetails object(List<String> topLevelKeys) {
        return new JsonDetails(OBJECT, null, null, topLevelKeys, null);
    }

    public static JsonDetails scalar(String typeName) {
        return new JsonDetails(typeName, null, null, null, typeName);
    }
}
