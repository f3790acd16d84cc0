package com.example.codeintel.controller;

import com.example.codeintel.model.analysis.AnalysisStatus;
import com.example.codeintel.model.dto.AnalyzeRequest;
import com.example.codeintel.model.dto.RepositorySearchResponse;
import com.example.codeintel.model.dto.RepositorySummary;
import com.example.codeintel.model.dto.SearchRequest;
import com.example.codeintel.service.RepositoryAnalyzerService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.UUID;

@RestController
@RequestMapping("/api/repositories")
public class RepositoryAnalysisController {

    private final RepositoryAnalyzerService analyzerService;

    public RepositoryAnalysisController(RepositoryAnalyzerService analyzerService) {
        this.analyzerService = analyzerService;
    }

    @PostMapping("/analyze")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public AnalysisStatus analyze(@Valid @RequestBody AnalyzeRequest req) {
        String analysisId = (req.getAnalysisId() == null || req.getAnalysisId().isBlank())
                ? UUID.randomUUID().toString()
                : req.getAnalysisId().trim();
        return analyzerService.startAnalysis(req.getRepoUrl(), req.getUserId(), analysisId, req.getProjectId());
    }

    @GetMapping("/analysis/{analysisId}")
    public AnalysisStatus status(@PathVariable String analysisId) {
        return analyzerService.getAnalysisStatus(analysisId)
                .orElseThrow(() -> new NoSuchElementException("Analisis no encontrado: " + analysisId));
    }

    @GetMapping("/analyses")
    public List<AnalysisStatus> list() {
        return analyzerService.getAllAnalyses();
    }

    @DeleteMapping("/analysis/{analysisId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable String analysisId) {
        analyzerService.deleteAnalysis(analysisId);
    }

    @PostMapping("/search")
    public RepositorySearchResponse search(@Valid @RequestBody SearchRequest req) {
        return analyzerService.searchRepository(req.getRepoId(), req.getQuery(), req.getLimit());
    }

    @GetMapping("/summary")
    public RepositorySummary summary(@RequestParam String repoId) {
        return analyzerService.getRepositorySummary(repoId)
                .orElseThrow(() -> new NoSuchElementException("No hay analisis completado para " + repoId));
    }
}
