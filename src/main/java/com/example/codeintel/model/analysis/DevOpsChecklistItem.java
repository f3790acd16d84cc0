package com.example.codeintel.model.analysis;

import java.util.List;

public record DevOpsChecklistItem(
        String id,
        String category,
        String title,
        String detected,
        double confidence,
        String reasoning,
        List<String> recommendations
) {
    public DevOpsChecklistItem {
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}
