package com.example.codeintel.model.dto;

public record SearchHit(String content, String filePath, int startLine, int endLine, double score) {
}
