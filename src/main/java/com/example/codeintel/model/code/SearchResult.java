package com.example.codeintel.model.code;

public record SearchResult(CodeChunk chunk, double score) {
}
