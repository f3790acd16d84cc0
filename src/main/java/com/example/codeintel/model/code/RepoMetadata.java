package com.example.codeintel.model.code;

import java.util.List;
import java.util.Map;

public record RepoMetadata(
        String owner,
        String name,
        String fullName,
        String description,
        String language,
        Map<String, Long> languages,
        List<String> topics,
        boolean hasDockerfile,
        boolean hasKubernetes,
        boolean hasCI,
        List<String> packageManagers,
        List<String> frameworks,
        int totalFiles,
        long totalSize
) {
    public RepoMetadata {
        languages = languages == null ? Map.of() : Map.copyOf(languages);
        topics = topics == null ? List.of() : List.copyOf(topics);
        packageManagers = packageManagers == null ? List.of() : List.copyOf(packageManagers);
        frameworks = frameworks == null ? List.of() : List.copyOf(frameworks);
    }
}
