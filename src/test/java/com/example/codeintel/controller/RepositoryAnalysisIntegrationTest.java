package com.example.codeintel.controller;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.codeintel.model.analysis.AnalysisState;
import com.example.codeintel.model.analysis.AnalysisStatus;
import com.example.codeintel.model.code.FetchedRepository;
import com.example.codeintel.model.code.RepoFile;
import com.example.codeintel.service.EmbeddingModel;
import com.example.codeintel.service.RepositoryAnalyzerService;
import com.example.codeintel.service.RepositoryFetcher;
import com.example.codeintel.service.RepositoryFileClassifier;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Flujo completo sobre H2: arranque por HTTP, job en el executor real, busqueda, resumen y borrado.
 */
@SpringBootTest
@AutoConfigureMockMvc
class RepositoryAnalysisIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private RepositoryAnalyzerService analyzerService;

    @MockBean
    private RepositoryFetcher fetcher;

    @MockBean
    private EmbeddingModel embeddingModel;

    @Test
    void analysisRunsToCompletionAndFeedsSearchAndSummary() throws Exception {
        StringBuilder guide = new StringBuilder("# Guide\n");
        for (int i = 1; i <= 30; i++) {
            guide.append("## Step ").append(i).append("\nRun the server with npm start and check the logs.\n");
        }
        List<RepoFile> files = List.of(
                new RepoFile("src/server.js", "const express = require('express');\nconst app = express();\napp.listen(8080);", "javascript"),
                new RepoFile("Dockerfile", "FROM node:20-alpine\nCOPY . .\nCMD [\"node\", \"src/server.js\"]", "text"),
                new RepoFile("docs/guide.md", guide.toString(), "markdown")
        );
        when(fetcher.fetch(eq("acme"), eq("shop"), isNull())).thenReturn(new FetchedRepository(files,
                RepositoryFileClassifier.buildMetadata("acme", "shop", "demo", "JavaScript",
                        Map.of("JavaScript", 900L), List.of(), files)));
        when(embeddingModel.embed(anyList())).thenAnswer(inv -> {
            List<String> texts = inv.getArgument(0);
            return texts.stream().map(t -> new double[] {t.length(), t.hashCode() % 97, 1}).toList();
        });

        mockMvc.perform(post("/api/repositories/analyze")
                        .header("X-Request-Id", "req-e2e")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"repoUrl":"https://github.com/acme/shop","userId":"user-1","analysisId":"e2e-1"}
                                """))
                .andExpect(status().isAccepted())
                .andExpect(header().string("X-Request-Id", "req-e2e"))
                .andExpect(jsonPath("$.repoId").value("acme/shop"));

        AnalysisStatus finished = awaitTerminal("e2e-1");
        assertEquals(AnalysisState.COMPLETED, finished.getStatus(), () -> "error: " + finished.getError());
        int chunks = finished.getStats().totalChunks();
        assertTrue(chunks > files.size(), "the markdown guide should be split");

        mockMvc.perform(get("/api/repositories/summary").param("repoId", "acme/shop"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.vectorStats.count").value(chunks))
                .andExpect(jsonPath("$.metadata.hasDockerfile").value(true))
                .andExpect(jsonPath("$.devopsAnalysis.checklist.length()").value(17));

        mockMvc.perform(post("/api/repositories/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"repoId":"acme/shop","query":"express server","limit":2}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalResults").value(2));

        mockMvc.perform(delete("/api/repositories/analysis/e2e-1"))
                .andExpect(status().isNoContent());
        mockMvc.perform(get("/api/repositories/analysis/e2e-1"))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/repositories/summary").param("repoId", "acme/shop"))
                .andExpect(status().isNotFound());
    }

    private AnalysisStatus awaitTerminal(String analysisId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (System.currentTimeMillis() < deadline) {
            AnalysisStatus status = analyzerService.getAnalysisStatus(analysisId).orElseThrow();
            if (status.getStatus().isTerminal()) {
                return status;
            }
            Thread.sleep(50);
        }
        throw new AssertionError("Analysis " + analysisId + " did not finish in time");
    }
}
