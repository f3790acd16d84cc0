package com.example.codeintel.service;

import com.example.codeintel.model.code.FetchedRepository;

/**
 * Descarga los ficheros de codigo y los metadatos de un repositorio.
 * Falla con un mensaje descriptivo si el repositorio no es accesible.
 */
public interface RepositoryFetcher {

    /**
     * @param token token de acceso; {@code null} para usar las credenciales por defecto
     */
    FetchedRepository fetch(String owner, String repo, String token);
}
