package com.example.codeintel.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.example.codeintel.model.code.ChunkMetadata;
import com.example.codeintel.model.code.CodeChunk;
import com.example.codeintel.model.code.SearchResult;
import com.example.codeintel.repository.StoredChunkRepository;
import com.example.codeintel.repository.VectorCollectionRepository;
import java.util.List;
import java.util.Locale;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

@DataJpaTest
@Import({VectorStoreService.class, VectorStoreServiceJpaTest.TestConfig.class})
class VectorStoreServiceJpaTest {

    private static final String REPO = "acme/widgets";

    @Autowired
    private VectorStoreService vectorStore;

    @Autowired
    private StoredChunkRepository chunkRepo;

    @Autowired
    private VectorCollectionRepository collectionRepo;

    @Test
    void searchWithChunkContentReturnsThatChunkWithScoreOne() {
        vectorStore.initializeCollection(REPO);
        List<CodeChunk> chunks = List.of(
                chunk("a", "function parseConfig(path) { return yaml.load(path); }"),
                chunk("b", "class HttpServer { listen(port) {} }"),
                chunk("c", "SELECT id, name FROM users WHERE active = 1")
        );
        vectorStore.addChunks(REPO, chunks);

        List<SearchResult> results = vectorStore.searchSimilar(REPO, chunks.get(1).content(), 3);

        assertThat(results).hasSize(3);
        assertThat(results.get(0).chunk().id()).isEqualTo("b");
        assertThat(results.get(0).score()).isCloseTo(1.0, within(1e-9));
        assertThat(results.get(0).chunk().metadata().repoId()).isEqualTo(REPO);
        assertThat(results).extracting(SearchResult::score).isSortedAccordingTo((x, y) -> Double.compare(y, x));
    }

    @Test
    void initializeCollectionTwiceCreatesOneCollection() {
        vectorStore.initializeCollection(REPO);
        vectorStore.initializeCollection(REPO);

        assertThat(collectionRepo.count()).isEqualTo(1);
        assertThat(collectionRepo.existsByName("repo_acme_widgets")).isTrue();
    }

    @Test
    void statsCountStoredChunksAndDeleteRemovesEverything() {
        vectorStore.initializeCollection(REPO);
        vectorStore.addChunks(REPO, List.of(chunk("a", "alpha"), chunk("b", "beta")));
        vectorStore.addChunks("other/repo", List.of(chunk("z", "zeta")));

        assertThat(vectorStore.getCollectionStats(REPO).count()).isEqualTo(2);

        vectorStore.deleteCollection(REPO);

        assertThat(vectorStore.getCollectionStats(REPO).count()).isZero();
        assertThat(collectionRepo.existsByName("repo_acme_widgets")).isFalse();
        assertThat(vectorStore.getCollectionStats("other/repo").count()).isEqualTo(1);
        assertThat(vectorStore.searchSimilar(REPO, "alpha", 5)).isEmpty();
    }

    @Test
    void deletingUnknownCollectionDoesNothing() {
        vectorStore.deleteCollection("ghost/repo");

        assertThat(chunkRepo.count()).isZero();
    }

    private static CodeChunk chunk(String id, String content) {
        return new CodeChunk(id, content, new ChunkMetadata("src/" + id + ".txt", 1, 1, "text", REPO));
    }

    @TestConfiguration
    static class TestConfig {

        // Bag of letters: deterministic and enough to tell texts apart.
        @Bean
        EmbeddingModel embeddingModel() {
            return texts -> texts.stream().map(text -> {
                double[] v = new double[27];
                for (char ch : text.toLowerCase(Locale.ROOT).toCharArray()) {
                    if (ch >= 'a' && ch <= 'z') {
                        v[ch - 'a']++;
                    } else {
                        v[26]++;
                    }
                }
                return v;
            }).toList();
        }
    }
}
