package com.example.codeintel.model.code;

/**
 * Origen de un chunk: fichero, rango de lineas (1-based, inclusivo), lenguaje y repositorio.
 */
public record ChunkMetadata(String filePath, int startLine, int endLine, String language, String repoId) {

    public ChunkMetadata {
        if (startLine < 1 || endLine < startLine) {
            throw new IllegalArgumentException(
                    "Rango de lineas invalido para " + filePath + ": " + startLine + ".." + endLine);
        }
    }
}
