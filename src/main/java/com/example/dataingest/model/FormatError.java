package com.example.dataingest.model;

/**
 * Failure of a single format branch ({@code csv}, {@code excel}, {@code json}, {@code parquet}).
 * The owning record keeps its filesystem facts and still counts as processed.
 */
public record FormatError(String branch, String message) {
}
