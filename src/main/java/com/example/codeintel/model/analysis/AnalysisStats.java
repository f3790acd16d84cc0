package com.example.codeintel.model.analysis;

public record AnalysisStats(
        int totalFiles,
        int totalChunks,
        long embeddingsGenerated,
        int analysisScore,
        long averageChunkSize
) {
}
