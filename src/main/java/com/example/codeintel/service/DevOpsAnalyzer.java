package com.example.codeintel.service;

import com.example.codeintel.model.analysis.DevOpsAnalysis;
import com.example.codeintel.model.code.RepoFile;
import com.example.codeintel.model.code.RepoMetadata;

import java.util.List;

public interface DevOpsAnalyzer {

    DevOpsAnalysis analyze(String repoId, RepoMetadata metadata, List<RepoFile> files);
}
