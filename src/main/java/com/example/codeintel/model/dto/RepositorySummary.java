package com.example.codeintel.model.dto;

import com.example.codeintel.model.analysis.DevOpsAnalysis;
import com.example.codeintel.model.code.CollectionStats;
import com.example.codeintel.model.code.RepoMetadata;

public record RepositorySummary(RepoMetadata metadata, DevOpsAnalysis devopsAnalysis, CollectionStats vectorStats) {
}
