package com.example.codeintel.service;

import com.example.codeintel.config.OllamaProperties;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.util.List;

/**
 * Embeddings via Ollama ({@code POST /embed}): una peticion por lote de textos.
 */
@Component
public class OllamaClient implements EmbeddingModel {

    private static final Logger log = LoggerFactory.getLogger(OllamaClient.class);

    private final RestClient ollama;
    private final OllamaProperties props;

    public OllamaClient(RestClient ollamaRestClient, OllamaProperties props) {
        this.ollama = ollamaRestClient;
        this.props = props;
    }

    @Override
    public List<double[]> embed(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }
        String model = props.getEmbedModel() == null ? "" : props.getEmbedModel().trim();
        if (model.isBlank()) {
            throw new IllegalStateException("No hay modelo de embeddings configurado (ollama.embed-model).");
        }

        try {
            EmbedResponse res = ollama.post()
                    .uri("/embed")
                    .body(new EmbedRequest(model, texts))
                    .retrieve()
                    .body(EmbedResponse.class);

            if (res == null || res.embeddings() == null) {
                throw new IllegalStateException("Ollama devolvio una respuesta de embeddings vacia.");
            }
            log.debug("Ollama embed model={} textos={} vectores={}", model, texts.size(), res.embeddings().size());
            return res.embeddings().stream().map(this::toPrimitive).toList();

        } catch (HttpClientErrorException | HttpServerErrorException e) {
            throw new IllegalStateException(
                    "Ollama embeddings fallo. Status=" + e.getStatusCode() +
                            " Body=" + e.getResponseBodyAsString(),
                    e
            );
        } catch (ResourceAccessException e) {
            throw new IllegalStateException("Ollama no accesible en " + props.getBaseUrl() + ": " + e.getMessage(), e);
        }
    }

    private double[] toPrimitive(List<Double> list) {
        double[] out = new double[list.size()];
        for (int i = 0; i < list.size(); i++) out[i] = list.get(i);
        return out;
    }

    public record EmbedRequest(String model, List<String> input) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record EmbedResponse(String model, List<List<Double>> embeddings) {}
}
