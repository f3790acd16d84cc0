package com.example.codeintel.service;

import com.example.codeintel.config.VectorStoreProperties;
import com.example.codeintel.model.code.ChunkMetadata;
import com.example.codeintel.model.code.CodeChunk;
import com.example.codeintel.model.code.CollectionStats;
import com.example.codeintel.model.code.SearchResult;
import com.example.codeintel.model.entity.StoredChunk;
import com.example.codeintel.model.entity.VectorCollection;
import com.example.codeintel.repository.StoredChunkRepository;
import com.example.codeintel.repository.VectorCollectionRepository;
import com.example.codeintel.util.RepositoryUrlParser;
import com.example.codeintel.util.VectorMath;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Almacen de embeddings por repositorio con busqueda por similitud coseno.
 *
 * La busqueda es un recorrido lineal de la coleccion: el corpus de un repositorio es pequeño
 * y no compensa un indice aproximado. Una busqueda durante la ingesta ve solo los lotes ya guardados.
 */
@Service
public class VectorStoreService {

    private static final Logger log = LoggerFactory.getLogger(VectorStoreService.class);

    private final StoredChunkRepository chunkRepo;
    private final VectorCollectionRepository collectionRepo;
    private final EmbeddingModel embeddingModel;
    private final VectorStoreProperties props;
    private final ObjectMapper mapper = new ObjectMapper();

    public VectorStoreService(StoredChunkRepository chunkRepo,
                              VectorCollectionRepository collectionRepo,
                              EmbeddingModel embeddingModel,
                              VectorStoreProperties props) {
        this.chunkRepo = chunkRepo;
        this.collectionRepo = collectionRepo;
        this.embeddingModel = embeddingModel;
        this.props = props;
    }

    // ----------------- COLECCIONES -----------------

    /**
     * Crea la coleccion del repositorio si no existe. Llamarlo de nuevo no tiene efecto.
     */
    public void initializeCollection(String repoId) {
        String name = RepositoryUrlParser.collectionName(repoId);
        if (collectionRepo.existsByName(name)) {
            log.info("Coleccion {} ya existe", name);
            return;
        }
        try {
            collectionRepo.save(new VectorCollection(name, repoId, Instant.now()));
            log.info("Coleccion creada: {}", name);
        } catch (DataIntegrityViolationException e) {
            // Otro job del mismo repositorio la creo entre la comprobacion y el insert.
            log.info("Coleccion {} creada en paralelo por otro analisis", name);
        }
    }

    /**
     * Borra de forma irreversible todos los chunks de la coleccion y la propia coleccion.
     */
    @Transactional
    public void deleteCollection(String repoId) {
        String name = RepositoryUrlParser.collectionName(repoId);
        int chunks = chunkRepo.deleteByCollectionName(name);
        int collections = collectionRepo.deleteByName(name);
        log.info("Coleccion borrada: {} (chunks={} existia={})", name, chunks, collections > 0);
    }

    /**
     * Numero de chunks guardados. Es best-effort: ante un error de almacenamiento devuelve 0.
     */
    public CollectionStats getCollectionStats(String repoId) {
        String name = RepositoryUrlParser.collectionName(repoId);
        try {
            return new CollectionStats(chunkRepo.countByCollectionName(name));
        } catch (RuntimeException e) {
            log.error("No se pudieron obtener estadisticas de la coleccion {}", name, e);
            return new CollectionStats(0);
        }
    }

    // ----------------- INGESTA -----------------

    /**
     * Genera embeddings por lotes (una llamada al modelo por lote) y guarda cada lote.
     *
     * Si un lote falla se propaga el error; los lotes anteriores quedan guardados.
     */
    public void addChunks(String repoId, List<CodeChunk> chunks) {
        if (chunks == null || chunks.isEmpty()) {
            return;
        }
        String name = RepositoryUrlParser.collectionName(repoId);
        int batchSize = Math.max(1, props.getBatchSize());
        int totalBatches = (chunks.size() + batchSize - 1) / batchSize;

        for (int i = 0; i < chunks.size(); i += batchSize) {
            List<CodeChunk> batch = chunks.subList(i, Math.min(i + batchSize, chunks.size()));
            int batchNumber = i / batchSize + 1;

            List<double[]> embeddings = embeddingModel.embed(batch.stream().map(CodeChunk::content).toList());
            if (embeddings == null || embeddings.size() != batch.size()) {
                throw new IllegalStateException("El modelo devolvio " + (embeddings == null ? 0 : embeddings.size())
                        + " embeddings para un lote de " + batch.size() + " chunks");
            }

            Instant now = Instant.now();
            List<StoredChunk> toPersist = new ArrayList<>(batch.size());
            for (int j = 0; j < batch.size(); j++) {
                toPersist.add(toEntity(name, batch.get(j), embeddings.get(j), now));
            }
            chunkRepo.saveAll(toPersist);

            log.info("Lote {}/{} ({} chunks) guardado en {}", batchNumber, totalBatches, toPersist.size(), name);

            if (i + batchSize < chunks.size()) {
                pause(props.getBatchDelayMs());
            }
        }

        log.info("Guardados {} chunks en {}", chunks.size(), name);
    }

    // ----------------- BUSQUEDA -----------------

    /**
     * Los {@code limit} chunks mas parecidos a la consulta, ordenados por similitud descendente.
     */
    public List<SearchResult> searchSimilar(String repoId, String query, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        String name = RepositoryUrlParser.collectionName(repoId);

        List<double[]> queryEmbeddings = embeddingModel.embed(List.of(query == null ? "" : query));
        if (queryEmbeddings == null || queryEmbeddings.isEmpty()) {
            throw new IllegalStateException("El modelo no devolvio embedding para la consulta");
        }
        double[] queryEmbedding = queryEmbeddings.get(0);

        long startNanos = System.nanoTime();
        List<StoredChunk> stored = chunkRepo.findByCollectionName(name);
        List<SearchResult> results = new ArrayList<>(stored.size());
        for (StoredChunk sc : stored) {
            double score = VectorMath.cosine(queryEmbedding, fromJson(sc.getEmbeddingJson()));
            results.add(new SearchResult(toChunk(sc), score));
        }
        results.sort(Comparator.comparingDouble(SearchResult::score).reversed());

        List<SearchResult> top = results.size() > limit ? List.copyOf(results.subList(0, limit)) : results;
        if (log.isDebugEnabled()) {
            log.debug("Busqueda en {} candidatos={} devueltos={} elapsedMs={}",
                    name, stored.size(), top.size(), (System.nanoTime() - startNanos) / 1_000_000);
        }
        return top;
    }

    private StoredChunk toEntity(String collectionName, CodeChunk chunk, double[] embedding, Instant createdAt) {
        ChunkMetadata md = chunk.metadata();
        StoredChunk sc = new StoredChunk();
        sc.setCollectionName(collectionName);
        sc.setChunkId(chunk.id());
        sc.setRepoId(md.repoId());
        sc.setFilePath(md.filePath());
        sc.setStartLine(md.startLine());
        sc.setEndLine(md.endLine());
        sc.setLanguage(md.language());
        sc.setContent(chunk.content());
        sc.setEmbeddingJson(toJson(embedding));
        sc.setCreatedAt(createdAt);
        return sc;
    }

    private CodeChunk toChunk(StoredChunk sc) {
        ChunkMetadata md = new ChunkMetadata(sc.getFilePath(), sc.getStartLine(), sc.getEndLine(),
                sc.getLanguage(), sc.getRepoId());
        return new CodeChunk(sc.getChunkId(), sc.getContent(), md);
    }

    private String toJson(double[] v) {
        try {
            return mapper.writeValueAsString(v);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("No se pudo serializar embedding", e);
        }
    }

    private double[] fromJson(String json) {
        try {
            return mapper.readValue(json, double[].class);
        } catch (JsonProcessingException e) {
            log.warn("Embedding ilegible, se puntua como 0: {}", e.getOriginalMessage());
            return new double[0];
        }
    }

    private void pause(long delayMs) {
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Ingesta de embeddings interrumpida", e);
        }
    }
}
