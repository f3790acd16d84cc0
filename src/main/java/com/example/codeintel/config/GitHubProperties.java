package com.example.codeintel.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "github")
public class GitHubProperties {

    private String baseUrl = "https://api.github.com";

    /**
     * Token de sistema; se usa cuando el analisis no trae token de proyecto.
     */
    private String token;

    /**
     * Ficheros de mayor tamaño (bytes) se ignoran.
     */
    private long maxFileSize = 1_000_000;

    /**
     * Blobs descargados por lote y pausa entre lotes para no agotar el rate limit.
     */
    private int fetchBatchSize = 10;
    private long fetchBatchDelayMs = 1000;

    /**
     * Tokens cifrados por proyecto (projectId -> token cifrado).
     */
    private Map<String, String> projectTokens = new HashMap<>();

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

    public String getToken() { return token; }
    public void setToken(String token) { this.token = token; }

    public long getMaxFileSize() { return maxFileSize; }
    public void setMaxFileSize(long maxFileSize) { this.maxFileSize = maxFileSize; }

    public int getFetchBatchSize() { return fetchBatchSize; }
    public void setFetchBatchSize(int fetchBatchSize) { this.fetchBatchSize = fetchBatchSize; }

    public long getFetchBatchDelayMs() { return fetchBatchDelayMs; }
    public void setFetchBatchDelayMs(long fetchBatchDelayMs) { this.fetchBatchDelayMs = fetchBatchDelayMs; }

    public Map<String, String> getProjectTokens() { return projectTokens; }
    public void setProjectTokens(Map<String, String> projectTokens) { this.projectTokens = projectTokens; }
}
