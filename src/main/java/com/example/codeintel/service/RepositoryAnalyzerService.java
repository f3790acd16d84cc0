package com.example.codeintel.service;

import com.example.codeintel.config.AnalysisProperties;
import com.example.codeintel.model.analysis.AnalysisState;
import com.example.codeintel.model.analysis.AnalysisStats;
import com.example.codeintel.model.analysis.AnalysisStatus;
import com.example.codeintel.model.analysis.DevOpsAnalysis;
import com.example.codeintel.model.code.ChunkingStats;
import com.example.codeintel.model.code.CodeChunk;
import com.example.codeintel.model.code.CollectionStats;
import com.example.codeintel.model.code.FetchedRepository;
import com.example.codeintel.model.code.RepoFile;
import com.example.codeintel.model.dto.RepositorySearchResponse;
import com.example.codeintel.model.dto.RepositorySummary;
import com.example.codeintel.model.dto.SearchHit;
import com.example.codeintel.util.RepositoryUrlParser;
import com.example.codeintel.util.RequestIdHolder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Orquesta el analisis de un repositorio: descarga, troceado, embeddings y analisis DevOps.
 *
 * Cada analisis corre como un job en el executor de analisis y publica su progreso en un
 * registro en memoria. Los lectores solo ven copias publicadas; si el analisis se borra
 * mientras el job sigue vivo, las publicaciones posteriores se descartan.
 */
@Service
public class RepositoryAnalyzerService {

    private static final Logger log = LoggerFactory.getLogger(RepositoryAnalyzerService.class);

    private final CodeChunker chunker;
    private final VectorStoreService vectorStore;
    private final RepositoryFetcher fetcher;
    private final DevOpsAnalyzer devOpsAnalyzer;
    private final TokenDecryptor tokenDecryptor;
    private final ProjectTokenStore tokenStore;
    private final AnalysisProperties props;
    private final TaskExecutor executor;

    private final Map<String, AnalysisStatus> statuses = new ConcurrentHashMap<>();

    public RepositoryAnalyzerService(CodeChunker chunker,
                                     VectorStoreService vectorStore,
                                     RepositoryFetcher fetcher,
                                     DevOpsAnalyzer devOpsAnalyzer,
                                     TokenDecryptor tokenDecryptor,
                                     ProjectTokenStore tokenStore,
                                     AnalysisProperties props,
                                     @Qualifier("analysisTaskExecutor") TaskExecutor executor) {
        this.chunker = chunker;
        this.vectorStore = vectorStore;
        this.fetcher = fetcher;
        this.devOpsAnalyzer = devOpsAnalyzer;
        this.tokenDecryptor = tokenDecryptor;
        this.tokenStore = tokenStore;
        this.props = props;
        this.executor = executor;
    }

    // ----------------- ARRANQUE -----------------

    /**
     * Registra el analisis como {@code pending} y lanza el job en segundo plano.
     *
     * @throws IllegalArgumentException si la URL no es de un repositorio reconocible o faltan datos
     */
    public AnalysisStatus startAnalysis(String repoUrl, String userId, String analysisId, String projectId) {
        if (analysisId == null || analysisId.isBlank()) {
            throw new IllegalArgumentException("analysisId es obligatorio");
        }
        if (repoUrl == null || repoUrl.isBlank()) {
            throw new IllegalArgumentException("repoUrl es obligatorio");
        }
        String repoId = RepositoryUrlParser.parseRepoId(repoUrl)
                .orElseThrow(() -> new IllegalArgumentException("URL de repositorio no valida: " + repoUrl));

        AnalysisStatus status = new AnalysisStatus(analysisId, repoId, Instant.now());
        // Comprobar y sustituir en una sola operacion: un id nunca tiene dos jobs vivos.
        AnalysisStatus registered = statuses.compute(analysisId, (id, current) ->
                current == null || current.getStatus().isTerminal() ? status.copy() : current);
        if (!status.isSameRun(registered)) {
            throw new IllegalArgumentException("Ya hay un analisis en curso con id " + analysisId);
        }

        log.info("Analisis {} registrado para {} (user={} project={})", analysisId, repoId, userId, projectId);

        AnalysisStatus pending = status.copy();
        try {
            executor.execute(RequestIdHolder.propagate(() -> runAnalysis(status, projectId), analysisId));
        } catch (TaskRejectedException e) {
            statuses.computeIfPresent(analysisId, (id, current) -> status.isSameRun(current) ? null : current);
            throw new IllegalStateException("No hay capacidad para lanzar el analisis " + analysisId, e);
        }
        return pending;
    }

    // ----------------- JOB -----------------

    private void runAnalysis(AnalysisStatus status, String projectId) {
        String repoId = status.getRepoId();
        long startNanos = System.nanoTime();
        try {
            int slash = repoId.indexOf('/');
            String owner = repoId.substring(0, slash);
            String repo = repoId.substring(slash + 1);

            status.advance(AnalysisState.FETCHING, 10, "Fetching repository from GitHub");
            publish(status);

            FetchedRepository fetched = fetcher.fetch(owner, repo, resolveToken(projectId));
            List<RepoFile> files = fetched.files();
            status.setMetadata(fetched.metadata());
            status.advance(AnalysisState.FETCHING, 25, "Fetched " + files.size() + " files");
            publish(status);

            status.advance(AnalysisState.FETCHING, 30, "Initializing vector store");
            publish(status);
            vectorStore.initializeCollection(repoId);

            status.advance(AnalysisState.CHUNKING, 35, "Chunking code files");
            publish(status);
            List<CodeChunk> chunks = chunker.chunkFiles(files, repoId);
            ChunkingStats chunkingStats = chunker.getChunkingStats(chunks);
            status.advance(AnalysisState.CHUNKING, 50, "Generated " + chunks.size() + " code chunks");
            publish(status);

            status.advance(AnalysisState.EMBEDDING, 55, "Generating embeddings");
            publish(status);
            embedInBatches(status, chunks);

            status.advance(AnalysisState.ANALYZING, 80, "Running DevOps analysis");
            publish(status);
            DevOpsAnalysis devops = devOpsAnalyzer.analyze(repoId, fetched.metadata(), files);
            status.setDevopsAnalysis(devops);
            status.advance(AnalysisState.ANALYZING, 95, "Finalizing analysis");
            publish(status);

            CollectionStats vectorStats = vectorStore.getCollectionStats(repoId);
            status.setStats(new AnalysisStats(
                    files.size(),
                    chunks.size(),
                    vectorStats.count(),
                    devops == null ? 0 : devops.overallScore(),
                    chunkingStats.averageSize()
            ));
            status.setCompletedAt(Instant.now());
            status.advance(AnalysisState.COMPLETED, 100, "Analysis completed");
            publish(status);

            log.info("Analisis {} de {} completado: ficheros={} chunks={} elapsedMs={}",
                    status.getAnalysisId(), repoId, files.size(), chunks.size(),
                    (System.nanoTime() - startNanos) / 1_000_000);

        } catch (RuntimeException e) {
            markFailed(status, e);
        } catch (Error e) {
            markFailed(status, e);
            throw e;
        }
    }

    private void markFailed(AnalysisStatus status, Throwable e) {
        log.error("Analisis {} de {} fallido en paso '{}'",
                status.getAnalysisId(), status.getRepoId(), status.getCurrentStep(), e);
        status.setStatus(AnalysisState.FAILED);
        status.setError(e.getMessage() == null || e.getMessage().isBlank()
                ? e.getClass().getSimpleName()
                : e.getMessage());
        status.setProgress(0);
        publish(status);
    }

    private void embedInBatches(AnalysisStatus status, List<CodeChunk> chunks) {
        int batchSize = Math.max(1, props.getEmbeddingBatchSize());
        int totalBatches = (chunks.size() + batchSize - 1) / batchSize;

        for (int i = 0; i < chunks.size(); i += batchSize) {
            int batchNumber = i / batchSize + 1;
            vectorStore.addChunks(status.getRepoId(), chunks.subList(i, Math.min(i + batchSize, chunks.size())));

            int progress = 55 + (int) Math.round(batchNumber / (double) totalBatches * 20);
            status.advance(AnalysisState.EMBEDDING, progress,
                    "Generated embeddings for batch " + batchNumber + "/" + totalBatches);
            publish(status);

            if (i + batchSize < chunks.size()) {
                pause(props.getEmbeddingBatchDelayMs());
            }
        }
    }

    /**
     * Token de GitHub del proyecto, si lo hay. Un fallo aqui no aborta el analisis:
     * se sigue sin token de proyecto.
     */
    private String resolveToken(String projectId) {
        if (projectId == null || projectId.isBlank()) {
            return null;
        }
        try {
            return tokenStore.findEncryptedToken(projectId)
                    .map(tokenDecryptor::decrypt)
                    .orElse(null);
        } catch (RuntimeException e) {
            log.warn("No se pudo obtener el token del proyecto {}, se continua sin el: {}", projectId, e.getMessage());
            return null;
        }
    }

    /**
     * Publica una copia solo si el registro sigue siendo de esta ejecucion. Si el analisis se borro
     * (o se relanzo con el mismo id) la escritura se pierde.
     */
    private void publish(AnalysisStatus status) {
        AnalysisStatus snapshot = status.copy();
        statuses.computeIfPresent(status.getAnalysisId(),
                (id, current) -> status.isSameRun(current) ? snapshot : current);
    }

    private void pause(long delayMs) {
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Analisis interrumpido", e);
        }
    }

    // ----------------- CONSULTAS -----------------

    public Optional<AnalysisStatus> getAnalysisStatus(String analysisId) {
        if (analysisId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(statuses.get(analysisId)).map(AnalysisStatus::copy);
    }

    public List<AnalysisStatus> getAllAnalyses() {
        return statuses.values().stream()
                .map(AnalysisStatus::copy)
                .sorted(Comparator.comparing(AnalysisStatus::getStartedAt, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    /**
     * Borra la coleccion del repositorio y el registro del analisis. Un id desconocido no hace nada.
     */
    public void deleteAnalysis(String analysisId) {
        AnalysisStatus status = analysisId == null ? null : statuses.get(analysisId);
        if (status == null) {
            log.info("Borrado de analisis desconocido {}: nada que hacer", analysisId);
            return;
        }
        vectorStore.deleteCollection(status.getRepoId());
        statuses.remove(analysisId, status);
        log.info("Analisis {} borrado (repo={})", analysisId, status.getRepoId());
    }

    public RepositorySearchResponse searchRepository(String repoId, String query, int limit) {
        if (repoId == null || repoId.isBlank()) {
            throw new IllegalArgumentException("repoId es obligatorio");
        }
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query es obligatoria");
        }
        List<SearchHit> hits = vectorStore.searchSimilar(repoId, query, limit).stream()
                .map(r -> new SearchHit(
                        r.chunk().content(),
                        r.chunk().metadata().filePath(),
                        r.chunk().metadata().startLine(),
                        r.chunk().metadata().endLine(),
                        r.score()))
                .toList();
        return new RepositorySearchResponse(hits, hits.size());
    }

    /**
     * Resumen del analisis completado mas reciente del repositorio.
     */
    public Optional<RepositorySummary> getRepositorySummary(String repoId) {
        if (repoId == null || repoId.isBlank()) {
            return Optional.empty();
        }
        return statuses.values().stream()
                .filter(s -> repoId.equals(s.getRepoId()) && s.getStatus() == AnalysisState.COMPLETED)
                .max(Comparator.comparing(AnalysisStatus::getCompletedAt, Comparator.nullsFirst(Comparator.naturalOrder())))
                .map(s -> new RepositorySummary(s.getMetadata(), s.getDevopsAnalysis(),
                        vectorStore.getCollectionStats(repoId)));
    }
}
