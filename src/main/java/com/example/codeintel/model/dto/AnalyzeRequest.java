package com.example.codeintel.model.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public class AnalyzeRequest {

    /**
     * URL de GitHub o forma corta "owner/repo".
     */
    @NotBlank
    @Size(max = 500)
    private String repoUrl;

    @NotBlank
    private String userId;

    /**
     * Id del analisis; si viene vacio se genera uno.
     */
    private String analysisId;

    /**
     * Proyecto del que se toma el token de GitHub (opcional).
     */
    private String projectId;

    public String getRepoUrl() { return repoUrl; }
    public void setRepoUrl(String repoUrl) { this.repoUrl = repoUrl; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public String getAnalysisId() { return analysisId; }
    public void setAnalysisId(String analysisId) { this.analysisId = analysisId; }

    public String getProjectId() { return projectId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }
}
