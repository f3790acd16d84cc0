package com.example.codeintel.model.code;

/**
 * Fichero de codigo tal como lo entrega el fetcher del repositorio.
 */
public record RepoFile(String path, String content, long size, String language, String sha) {

    public RepoFile {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path requerido");
        }
        content = content == null ? "" : content;
        language = language == null || language.isBlank() ? "text" : language;
    }

    public RepoFile(String path, String content, String language) {
        this(path, content, content == null ? 0 : content.length(), language, null);
    }
}
