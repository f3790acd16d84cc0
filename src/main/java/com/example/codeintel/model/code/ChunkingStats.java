package com.example.codeintel.model.code;

import java.util.Map;

public record ChunkingStats(
        int totalChunks,
        long averageSize,
        Map<String, Integer> languageDistribution,
        Map<String, Integer> fileTypeDistribution
) {
}
