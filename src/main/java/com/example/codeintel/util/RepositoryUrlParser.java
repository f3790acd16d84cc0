package com.example.codeintel.util;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extrae el identificador {@code owner/repo} de una URL de GitHub o de la forma corta.
 *
 * Formatos soportados (se prueba en orden, gana el primero):
 * - https://github.com/owner/repo
 * - https://github.com/owner/repo.git
 * - https://github.com/owner/repo/tree/branch/path
 * - owner/repo
 */
public final class RepositoryUrlParser {

    private static final List<Pattern> PATTERNS = List.of(
            Pattern.compile("github\\.com/([^/]+)/([^/]+?)(?:\\.git)?(?:/.*)?$"),
            Pattern.compile("^([^/]+)/([^/]+)$")
    );

    private RepositoryUrlParser() {
    }

    public static Optional<String> parseRepoId(String repoUrl) {
        if (repoUrl == null || repoUrl.isBlank()) {
            return Optional.empty();
        }
        String clean = repoUrl.trim();
        for (Pattern pattern : PATTERNS) {
            Matcher m = pattern.matcher(clean);
            if (m.find()) {
                String owner = m.group(1);
                String repo = stripGitSuffix(m.group(2));
                if (owner.isBlank() || repo.isBlank() || containsWhitespace(owner) || containsWhitespace(repo)) {
                    continue;
                }
                return Optional.of(owner + "/" + repo);
            }
        }
        return Optional.empty();
    }

    /**
     * Nombre de coleccion seguro: todo caracter no alfanumerico pasa a '_'.
     */
    public static String collectionName(String repoId) {
        return "repo_" + repoId.replaceAll("[^a-zA-Z0-9]", "_");
    }

    private static String stripGitSuffix(String repo) {
        return repo.endsWith(".git") ? repo.substring(0, repo.length() - 4) : repo;
    }

    private static boolean containsWhitespace(String s) {
        return s.chars().anyMatch(Character::isWhitespace);
    }
}
