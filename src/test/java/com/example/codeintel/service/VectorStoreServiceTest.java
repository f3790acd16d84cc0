package com.example.codeintel.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.codeintel.config.VectorStoreProperties;
import com.example.codeintel.model.code.ChunkMetadata;
import com.example.codeintel.model.code.CodeChunk;
import com.example.codeintel.model.code.SearchResult;
import com.example.codeintel.model.entity.StoredChunk;
import com.example.codeintel.model.entity.VectorCollection;
import com.example.codeintel.repository.StoredChunkRepository;
import com.example.codeintel.repository.VectorCollectionRepository;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class VectorStoreServiceTest {

    private static final String REPO = "acme/widgets";
    private static final String COLLECTION = "repo_acme_widgets";

    @Mock
    private StoredChunkRepository chunkRepo;

    @Mock
    private VectorCollectionRepository collectionRepo;

    @Mock
    private EmbeddingModel embeddingModel;

    private VectorStoreService service;

    @BeforeEach
    void setUp() {
        VectorStoreProperties props = new VectorStoreProperties();
        props.setBatchSize(2);
        props.setBatchDelayMs(0);
        service = new VectorStoreService(chunkRepo, collectionRepo, embeddingModel, props);
    }

    @Test
    @SuppressWarnings("unchecked")
    void addChunksEmbedsOncePerBatchAndKeepsOrder() {
        List<CodeChunk> chunks = chunks(5);
        List<Integer> batchSizes = new ArrayList<>();
        List<StoredChunk> saved = new ArrayList<>();
        when(embeddingModel.embed(anyList())).thenAnswer(inv -> {
            List<String> texts = inv.getArgument(0);
            batchSizes.add(texts.size());
            return texts.stream().map(t -> new double[] {t.length(), 1}).toList();
        });
        when(chunkRepo.saveAll(anyList())).thenAnswer(inv -> {
            saved.addAll((List<StoredChunk>) inv.getArgument(0));
            return inv.getArgument(0);
        });

        service.addChunks(REPO, chunks);

        assertThat(batchSizes).containsExactly(2, 2, 1);
        assertThat(saved).extracting(StoredChunk::getChunkId)
                .containsExactly("c0", "c1", "c2", "c3", "c4");
        assertThat(saved).allSatisfy(sc -> assertThat(sc.getCollectionName()).isEqualTo(COLLECTION));
        assertThat(saved.get(3).getEmbeddingJson()).isEqualTo("[" + chunks.get(3).content().length() + ".0,1.0]");
    }

    @Test
    void failingBatchKeepsEarlierBatchesAndPropagates() {
        when(embeddingModel.embed(anyList()))
                .thenReturn(List.of(new double[] {1, 0}, new double[] {0, 1}))
                .thenThrow(new IllegalStateException("Ollama caido"));

        assertThatThrownBy(() -> service.addChunks(REPO, chunks(4)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Ollama caido");

        verify(chunkRepo, times(1)).saveAll(anyList());
    }

    @Test
    void embeddingCountMismatchIsRejected() {
        when(embeddingModel.embed(anyList())).thenReturn(List.of(new double[] {1, 0}));

        assertThatThrownBy(() -> service.addChunks(REPO, chunks(2)))
                .isInstanceOf(IllegalStateException.class);

        verify(chunkRepo, never()).saveAll(anyList());
    }

    @Test
    void searchReturnsTopResultsByDescendingSimilarity() {
        when(embeddingModel.embed(List.of("find me"))).thenReturn(List.of(new double[] {1, 0}));
        when(chunkRepo.findByCollectionName(COLLECTION)).thenReturn(List.of(
                stored("far", "[0.0,1.0]"),
                stored("near", "[1.0,0.0]"),
                stored("mid", "[0.7,0.7]")
        ));

        List<SearchResult> results = service.searchSimilar(REPO, "find me", 2);

        assertThat(results).extracting(r -> r.chunk().id()).containsExactly("near", "mid");
        assertThat(results.get(0).score()).isCloseTo(1.0, within(1e-9));
        assertThat(results.get(0).chunk().metadata().filePath()).isEqualTo("src/near.js");
    }

    @Test
    void searchWithNonPositiveLimitReturnsNothing() {
        assertThat(service.searchSimilar(REPO, "anything", 0)).isEmpty();

        verify(embeddingModel, never()).embed(anyList());
    }

    @Test
    void collectionStatsFallBackToZeroOnStorageError() {
        when(chunkRepo.countByCollectionName(COLLECTION)).thenThrow(new RuntimeException("db down"));

        assertThat(service.getCollectionStats(REPO).count()).isZero();
    }

    @Test
    void initializeCollectionIsIdempotent() {
        when(collectionRepo.existsByName(COLLECTION)).thenReturn(false, true);

        service.initializeCollection(REPO);
        service.initializeCollection(REPO);

        verify(collectionRepo, times(1)).save(any(VectorCollection.class));
    }

    private static List<CodeChunk> chunks(int n) {
        return IntStream.range(0, n)
                .mapToObj(i -> new CodeChunk("c" + i, "File: src/f" + i + ".js\n" + "x".repeat(i + 1),
                        new ChunkMetadata("src/f" + i + ".js", 1, 1, "javascript", REPO)))
                .toList();
    }

    private static StoredChunk stored(String id, String embeddingJson) {
        StoredChunk sc = new StoredChunk();
        sc.setCollectionName(COLLECTION);
        sc.setChunkId(id);
        sc.setRepoId(REPO);
        sc.setFilePath("src/" + id + ".js");
        sc.setStartLine(1);
        sc.setEndLine(3);
        sc.setLanguage("javascript");
        sc.setContent("content of " + id);
        sc.setEmbeddingJson(embeddingJson);
        return sc;
    }
}
