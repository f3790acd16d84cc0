package com.example.codeintel.model.dto;

import java.util.List;

public record RepositorySearchResponse(List<SearchHit> results, int totalResults) {
}
