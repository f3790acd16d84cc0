package com.example.codeintel.model.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

public class SearchRequest {

    @NotBlank
    private String repoId;

    @NotBlank
    private String query;

    @Min(1)
    @Max(50)
    private int limit = 10;

    public String getRepoId() { return repoId; }
    public void setRepoId(String repoId) { this.repoId = repoId; }

    public String getQuery() { return query; }
    public void setQuery(String query) { this.query = query; }

    public int getLimit() { return limit; }
    public void setLimit(int limit) { this.limit = limit; }
}
