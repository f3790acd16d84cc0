package com.example.codeintel.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "codeintel.analysis")
public class AnalysisProperties {

    private int embeddingBatchSize = 50;
    private long embeddingBatchDelayMs = 1000;
    private final Executor executor = new Executor();

    public int getEmbeddingBatchSize() { return embeddingBatchSize; }
    public void setEmbeddingBatchSize(int embeddingBatchSize) { this.embeddingBatchSize = embeddingBatchSize; }

    public long getEmbeddingBatchDelayMs() { return embeddingBatchDelayMs; }
    public void setEmbeddingBatchDelayMs(long embeddingBatchDelayMs) { this.embeddingBatchDelayMs = embeddingBatchDelayMs; }

    public Executor getExecutor() { return executor; }

    /**
     * Pool de hilos de los jobs de analisis.
     */
    public static class Executor {
        private int corePoolSize = 2;
        private int maxPoolSize = 4;
        private int queueCapacity = 50;

        public int getCorePoolSize() { return corePoolSize; }
        public void setCorePoolSize(int corePoolSize) { this.corePoolSize = corePoolSize; }

        public int getMaxPoolSize() { return maxPoolSize; }
        public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }

        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
    }
}
