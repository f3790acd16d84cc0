package com.example.codeintel.service;

import java.util.Locale;
import java.util.Optional;

/**
 * Clasificacion gruesa del fichero a partir de su ruta; se añade a la cabecera de cada chunk.
 */
public enum FileType {
    TEST("Test file"),
    CONFIG("Configuration file"),
    DOCKER("Docker configuration"),
    KUBERNETES("Kubernetes configuration"),
    CI_WORKFLOW("GitHub Actions workflow");

    private final String label;

    FileType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    // El orden de las comprobaciones importa: gana la primera.
    public static Optional<FileType> classify(String path) {
        if (path == null || path.isBlank()) {
            return Optional.empty();
        }
        if (path.contains("test") || path.contains("spec")) {
            return Optional.of(TEST);
        }
        if (path.contains("config")) {
            return Optional.of(CONFIG);
        }
        if (path.contains("docker") || path.toLowerCase(Locale.ROOT).contains("dockerfile")) {
            return Optional.of(DOCKER);
        }
        if (path.contains("k8s") || path.contains("kubernetes")) {
            return Optional.of(KUBERNETES);
        }
        if (path.contains(".github/workflows")) {
            return Optional.of(CI_WORKFLOW);
        }
        return Optional.empty();
    }
}
