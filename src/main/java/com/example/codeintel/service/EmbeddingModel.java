package com.example.codeintel.service;

import java.util.List;

/**
 * Modelo de embeddings externo.
 * Devuelve un vector por texto y en el mismo orden de entrada; no hay otra correlacion.
 */
public interface EmbeddingModel {

    List<double[]> embed(List<String> texts);
}
