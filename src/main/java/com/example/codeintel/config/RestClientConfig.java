package com.example.codeintel.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestClient;

@Configuration
public class RestClientConfig {

    @Bean
    public RestClient ollamaRestClient(RestClient.Builder builder, OllamaProperties props) {
        // Ollama API base: http://localhost:11434/api
        return builder.clone()
                .baseUrl(props.getBaseUrl())
                .build();
    }

    @Bean
    public RestClient githubRestClient(RestClient.Builder builder, GitHubProperties props) {
        return builder.clone()
                .baseUrl(props.getBaseUrl())
                .defaultHeader(HttpHeaders.ACCEPT, "application/vnd.github+json")
                .defaultHeader("X-GitHub-Api-Version", "2022-11-28")
                .build();
    }
}
