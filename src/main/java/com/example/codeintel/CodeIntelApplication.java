package com.example.codeintel;

import com.example.codeintel.config.AnalysisProperties;
import com.example.codeintel.config.ChunkerProperties;
import com.example.codeintel.config.GitHubProperties;
import com.example.codeintel.config.OllamaProperties;
import com.example.codeintel.config.TokenCryptoProperties;
import com.example.codeintel.config.VectorStoreProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        OllamaProperties.class,
        GitHubProperties.class,
        ChunkerProperties.class,
        VectorStoreProperties.class,
        AnalysisProperties.class,
        TokenCryptoProperties.class
})
public class CodeIntelApplication {
    public static void main(String[] args) {
        SpringApplication.run(CodeIntelApplication.class, args);
    }
}
