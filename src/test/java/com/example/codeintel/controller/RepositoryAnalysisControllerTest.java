package com.example.codeintel.controller;

import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.codeintel.model.analysis.AnalysisStatus;
import com.example.codeintel.model.dto.RepositorySearchResponse;
import com.example.codeintel.model.dto.SearchHit;
import com.example.codeintel.service.RepositoryAnalyzerService;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(RepositoryAnalysisController.class)
@AutoConfigureMockMvc(addFilters = false)
class RepositoryAnalysisControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RepositoryAnalyzerService analyzerService;

    @Test
    void analyzeReturnsAcceptedWithPendingStatus() throws Exception {
        when(analyzerService.startAnalysis(eq("https://github.com/acme/widgets"), eq("user-1"), eq("a-1"), isNull()))
                .thenReturn(new AnalysisStatus("a-1", "acme/widgets", Instant.parse("2026-03-01T10:00:00Z")));

        mockMvc.perform(post("/api/repositories/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"repoUrl":"https://github.com/acme/widgets","userId":"user-1","analysisId":"a-1"}
                                """))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.analysisId").value("a-1"))
                .andExpect(jsonPath("$.repoId").value("acme/widgets"))
                .andExpect(jsonPath("$.status").value("pending"))
                .andExpect(jsonPath("$.progress").value(0));
    }

    @Test
    void analyzeGeneratesIdWhenMissing() throws Exception {
        when(analyzerService.startAnalysis(eq("acme/widgets"), eq("user-1"), anyString(), eq("p-9")))
                .thenAnswer(inv -> new AnalysisStatus(inv.getArgument(2), "acme/widgets", Instant.now()));

        mockMvc.perform(post("/api/repositories/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"repoUrl":"acme/widgets","userId":"user-1","projectId":"p-9"}
                                """))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.analysisId").isNotEmpty());
    }

    @Test
    void analyzeWithInvalidUrlIsBadRequest() throws Exception {
        when(analyzerService.startAnalysis(eq("not a url"), eq("user-1"), anyString(), any()))
                .thenThrow(new IllegalArgumentException("URL de repositorio no valida: not a url"));

        mockMvc.perform(post("/api/repositories/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"repoUrl":"not a url","userId":"user-1"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("URL de repositorio no valida: not a url"));
    }

    @Test
    void analyzeWithoutRepoUrlFailsValidation() throws Exception {
        mockMvc.perform(post("/api/repositories/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"userId":"user-1"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details[0]").value(startsWith("repoUrl")));
    }

    @Test
    void unknownAnalysisIsNotFound() throws Exception {
        when(analyzerService.getAnalysisStatus("missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/repositories/analysis/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404));
    }

    @Test
    void deleteAlwaysReturnsNoContent() throws Exception {
        mockMvc.perform(delete("/api/repositories/analysis/whatever"))
                .andExpect(status().isNoContent());

        verify(analyzerService).deleteAnalysis("whatever");
    }

    @Test
    void listReturnsAllAnalyses() throws Exception {
        when(analyzerService.getAllAnalyses()).thenReturn(List.of(
                new AnalysisStatus("a-1", "acme/one", Instant.now()),
                new AnalysisStatus("a-2", "acme/two", Instant.now())));

        mockMvc.perform(get("/api/repositories/analyses"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[1].repoId").value("acme/two"));
    }

    @Test
    void searchUsesDefaultLimit() throws Exception {
        when(analyzerService.searchRepository("acme/widgets", "http server", 10))
                .thenReturn(new RepositorySearchResponse(
                        List.of(new SearchHit("File: src/server.js\n...", "src/server.js", 1, 20, 0.91)), 1));

        mockMvc.perform(post("/api/repositories/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"repoId":"acme/widgets","query":"http server"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalResults").value(1))
                .andExpect(jsonPath("$.results[0].filePath").value("src/server.js"))
                .andExpect(jsonPath("$.results[0].score").value(0.91));
    }

    @Test
    void searchRejectsLimitOutOfRange() throws Exception {
        mockMvc.perform(post("/api/repositories/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"repoId":"acme/widgets","query":"x","limit":500}
                                """))
                .andExpect(status().isBadRequest());
    }

    @Test
    void summaryWithoutCompletedAnalysisIsNotFound() throws Exception {
        when(analyzerService.getRepositorySummary("acme/widgets")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/repositories/summary").param("repoId", "acme/widgets"))
                .andExpect(status().isNotFound());
    }
}
