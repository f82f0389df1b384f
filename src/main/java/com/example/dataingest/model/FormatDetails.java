package com.example.dataingest.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Structural facts specific to one file format.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "layout")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TabularDetails.class, name = "tabular"),
        @JsonSubTypes.Type(value = SpreadsheetDetails.class, name = "spreadsheet"),
        @JsonSubTypes.Type(value = JsonDetails.class, name = "json")
})
public interface FormatDetails {
}
