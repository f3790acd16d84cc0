package com.example.codeintel.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "codeintel.vector-store")
public class VectorStoreProperties {

    /**
     * Chunks por llamada al modelo de embeddings.
     */
    private int batchSize = 10;

    /**
     * Pausa entre lotes (no tras el ultimo) para respetar el rate limit del modelo.
     */
    private long batchDelayMs = 1000;

    public int getBatchSize() { return batchSize; }
    public void setBatchSize(int batchSize) { this.batchSize = batchSize; }

    public long getBatchDelayMs() { return batchDelayMs; }
    public void setBatchDelayMs(long batchDelayMs) { this.batchDelayMs = batchDelayMs; }
}
