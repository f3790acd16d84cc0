package com.example.codeintel.model.analysis;

import com.example.codeintel.model.code.RepoMetadata;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.UUID;

/**
 * Estado observable de un analisis.
 *
 * Solo el job dueño del analysisId lo modifica; los lectores reciben siempre una copia
 * publicada con {@link #copy()}, nunca la instancia que el job esta mutando.
 * {@code runId} distingue ejecuciones que reutilizan el mismo analysisId.
 */
public class AnalysisStatus {

    private String analysisId;
    private String runId;
    private String repoId;
    private AnalysisState status;
    private int progress;
    private String currentStep;
    private String error;
    private Instant startedAt;
    private Instant completedAt;
    private RepoMetadata metadata;
    private DevOpsAnalysis devopsAnalysis;
    private AnalysisStats stats;

    public AnalysisStatus() {
    }

    public AnalysisStatus(String analysisId, String repoId, Instant startedAt) {
        this.analysisId = analysisId;
        this.runId = UUID.randomUUID().toString();
        this.repoId = repoId;
        this.status = AnalysisState.PENDING;
        this.progress = 0;
        this.currentStep = "Initializing analysis";
        this.startedAt = startedAt;
    }

    public AnalysisStatus copy() {
        AnalysisStatus c = new AnalysisStatus();
        c.analysisId = analysisId;
        c.runId = runId;
        c.repoId = repoId;
        c.status = status;
        c.progress = progress;
        c.currentStep = currentStep;
        c.error = error;
        c.startedAt = startedAt;
        c.completedAt = completedAt;
        // Los records anidados son inmutables: basta con compartir la referencia.
        c.metadata = metadata;
        c.devopsAnalysis = devopsAnalysis;
        c.stats = stats;
        return c;
    }

    public boolean isSameRun(AnalysisStatus other) {
        return other != null && runId != null && runId.equals(other.runId);
    }

    public void advance(AnalysisState state, int progress, String currentStep) {
        this.status = state;
        this.progress = progress;
        this.currentStep = currentStep;
    }

    public String getAnalysisId() { return analysisId; }
    public void setAnalysisId(String analysisId) { this.analysisId = analysisId; }

    @JsonIgnore
    public String getRunId() { return runId; }

    public String getRepoId() { return repoId; }
    public void setRepoId(String repoId) { this.repoId = repoId; }

    public AnalysisState getStatus() { return status; }
    public void setStatus(AnalysisState status) { this.status = status; }

    public int getProgress() { return progress; }
    public void setProgress(int progress) { this.progress = progress; }

    public String getCurrentStep() { return currentStep; }
    public void setCurrentStep(String currentStep) { this.currentStep = currentStep; }

    public String getError() { return error; }
    public void setError(String error) { this.error = error; }

    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }

    public Instant getCompletedAt() { return completedAt; }
    public void setCompletedAt(Instant completedAt) { this.completedAt = completedAt; }

    public RepoMetadata getMetadata() { return metadata; }
    public void setMetadata(RepoMetadata metadata) { this.metadata = metadata; }

    public DevOpsAnalysis getDevopsAnalysis() { return devopsAnalysis; }
    public void setDevopsAnalysis(DevOpsAnalysis devopsAnalysis) { this.devopsAnalysis = devopsAnalysis; }

    public AnalysisStats getStats() { return stats; }
    public void setStats(AnalysisStats stats) { this.stats = stats; }
}
