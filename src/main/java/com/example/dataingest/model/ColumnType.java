package com.example.dataingest.model;

import java.util.Locale;

/**
 * Coarse column type inferred from sampled values.
 */
public enum ColumnType {
    EMPTY,
    INTEGER,
    DECIMAL,
    BOOLEAN,
    DATE,
    TIMESTAMP,
    STRING;

    /**
     * Smallest type able to hold values of both this and {@code other}.
     */
    public ColumnType widen(ColumnType other) {
        if (other == null || other == this || other == EMPTY) {
            return this;
        }
        if (this == EMPTY) {
            return other;
        }
        if (isNumeric() && other.isNumeric()) {
            return DECIMAL;
        }
        if (isTemporal() && other.isTemporal()) {
            return TIMESTAMP;
        }
        return STRING;
    }

    private boolean isNumeric() {
        return this == INTEGER || this == DECIMAL;
    }

    private boolean isTemporal() {
        return this == DATE || this == TIMESTAMP;
    }

    public String typeName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
