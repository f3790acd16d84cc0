package com.example.codeintel.model.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Estados del job de analisis. COMPLETED y FAILED son terminales.
 */
public enum AnalysisState {
    PENDING,
    FETCHING,
    CHUNKING,
    EMBEDDING,
    ANALYZING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
