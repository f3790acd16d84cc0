package com.example.codeintel.service;

import com.example.codeintel.config.GitHubProperties;
import com.example.codeintel.model.code.FetchedRepository;
import com.example.codeintel.model.code.RepoFile;
import com.example.codeintel.model.code.RepoMetadata;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Descarga un repositorio con la API REST de GitHub: metadatos, lenguajes, arbol recursivo
 * de la rama por defecto y contenido de los blobs de codigo por lotes.
 */
@Component
public class GitHubRestFetcher implements RepositoryFetcher {

    private static final Logger log = LoggerFactory.getLogger(GitHubRestFetcher.class);

    private static final ParameterizedTypeReference<LinkedHashMap<String, Long>> LANGUAGES_TYPE =
            new ParameterizedTypeReference<>() {};

    private final RestClient github;
    private final GitHubProperties props;

    public GitHubRestFetcher(RestClient githubRestClient, GitHubProperties props) {
        this.github = githubRestClient;
        this.props = props;
    }

    @Override
    public FetchedRepository fetch(String owner, String repo, String token) {
        String fullName = owner + "/" + repo;
        String auth = (token != null && !token.isBlank()) ? token : props.getToken();
        log.info("Descargando repositorio {} (token={})", fullName, token != null && !token.isBlank() ? "proyecto" : "sistema");

        try {
            RepoResponse info = get(auth, "/repos/{owner}/{repo}", RepoResponse.class, owner, repo);
            if (info == null) {
                throw new IllegalStateException("GitHub devolvio una respuesta vacia para " + fullName);
            }
            Map<String, Long> languages = github.get()
                    .uri("/repos/{owner}/{repo}/languages", owner, repo)
                    .headers(h -> authorize(h, auth))
                    .retrieve()
                    .body(LANGUAGES_TYPE);

            String branch = (info.defaultBranch() == null || info.defaultBranch().isBlank()) ? "main" : info.defaultBranch();
            TreeResponse tree = get(auth, "/repos/{owner}/{repo}/git/trees/{branch}?recursive=1",
                    TreeResponse.class, owner, repo, branch);
            if (tree != null && tree.truncated()) {
                log.warn("Arbol de {} truncado por GitHub; se indexa solo lo recibido", fullName);
            }

            List<TreeItem> codeItems = (tree == null || tree.tree() == null ? List.<TreeItem>of() : tree.tree()).stream()
                    .filter(item -> "blob".equals(item.type()))
                    .filter(item -> RepositoryFileClassifier.isCodeFile(item.path()))
                    .filter(item -> item.size() < props.getMaxFileSize())
                    .toList();

            List<RepoFile> files = fetchContents(owner, repo, auth, codeItems);
            RepoMetadata metadata = RepositoryFileClassifier.buildMetadata(owner, repo, info.description(),
                    info.language(), languages, info.topics(), files);

            log.info("Repositorio {} descargado: {} ficheros de codigo ({} candidatos)", fullName, files.size(), codeItems.size());
            return new FetchedRepository(files, metadata);

        } catch (HttpClientErrorException | HttpServerErrorException e) {
            throw new IllegalStateException(
                    "No se pudo acceder al repositorio " + fullName + ". Status=" + e.getStatusCode()
                            + " Body=" + e.getResponseBodyAsString(),
                    e
            );
        } catch (ResourceAccessException e) {
            throw new IllegalStateException("GitHub no accesible en " + props.getBaseUrl() + ": " + e.getMessage(), e);
        }
    }

    private List<RepoFile> fetchContents(String owner, String repo, String auth, List<TreeItem> items) {
        List<RepoFile> files = new ArrayList<>(items.size());
        int batchSize = Math.max(1, props.getFetchBatchSize());

        for (int i = 0; i < items.size(); i += batchSize) {
            for (TreeItem item : items.subList(i, Math.min(i + batchSize, items.size()))) {
                try {
                    BlobResponse blob = get(auth, "/repos/{owner}/{repo}/git/blobs/{sha}", BlobResponse.class,
                            owner, repo, item.sha());
                    if (blob == null || blob.content() == null) {
                        continue;
                    }
                    files.add(new RepoFile(item.path(), decode(blob), item.size(),
                            RepositoryFileClassifier.detectLanguage(item.path()), item.sha()));
                } catch (RestClientException | IllegalArgumentException e) {
                    // Un blob ilegible no invalida el resto del repositorio.
                    log.warn("No se pudo descargar {} de {}/{}: {}", item.path(), owner, repo, e.getMessage());
                }
            }
            if (i + batchSize < items.size()) {
                pause(props.getFetchBatchDelayMs());
            }
        }
        return files;
    }

    private static String decode(BlobResponse blob) {
        if (blob.encoding() != null && !"base64".equalsIgnoreCase(blob.encoding())) {
            return blob.content();
        }
        // GitHub parte el base64 en lineas de 60 caracteres.
        return new String(Base64.getMimeDecoder().decode(blob.content()), StandardCharsets.UTF_8);
    }

    private <T> T get(String auth, String uri, Class<T> type, Object... vars) {
        return github.get()
                .uri(uri, vars)
                .headers(h -> authorize(h, auth))
                .retrieve()
                .body(type);
    }

    private static void authorize(HttpHeaders headers, String token) {
        if (token != null && !token.isBlank()) {
            headers.setBearerAuth(token.trim());
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
            throw new IllegalStateException("Descarga del repositorio interrumpida", e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RepoResponse(String description,
                               String language,
                               @JsonProperty("default_branch") String defaultBranch,
                               List<String> topics) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TreeResponse(List<TreeItem> tree, boolean truncated) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TreeItem(String path, String type, String sha, long size) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BlobResponse(String content, String encoding) {}
}
