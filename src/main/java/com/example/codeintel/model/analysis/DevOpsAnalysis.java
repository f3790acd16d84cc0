package com.example.codeintel.model.analysis;

import java.util.List;

/**
 * Resultado del analizador DevOps. {@code overallScore} y {@code deploymentReadiness} van de 0 a 100.
 */
public record DevOpsAnalysis(
        String repoId,
        List<DevOpsChecklistItem> checklist,
        int overallScore,
        List<String> recommendations,
        String estimatedComplexity,
        int deploymentReadiness
) {
    public DevOpsAnalysis {
        checklist = checklist == null ? List.of() : List.copyOf(checklist);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}
