package com.example.codeintel.model.dto;

import java.time.Instant;
import java.util.List;

public record ApiError(
        String errorId,
        int status,
        String error,
        String message,
        String method,
        String path,
        Instant timestamp,
        List<String> details
) {
}
