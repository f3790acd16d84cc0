package com.example.codeintel.service;

import java.util.Optional;

/**
 * Origen de los tokens de GitHub cifrados asociados a un proyecto.
 */
public interface ProjectTokenStore {

    Optional<String> findEncryptedToken(String projectId);
}
