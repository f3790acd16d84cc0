package com.example.codeintel.service;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Perfil de troceado por lenguaje. Los lenguajes sin perfil propio usan {@link #DEFAULT}.
 */
public enum ChunkingProfile {

    JAVASCRIPT("javascript", 1000, 100, true,
            "function ", "class ", "const ", "let ", "var ", "export ", "import "),
    TYPESCRIPT("typescript", 1000, 100, true,
            "function ", "class ", "interface ", "type ", "const ", "let ", "export ", "import "),
    PYTHON("python", 1000, 100, true,
            "def ", "class ", "import ", "from ", "if __name__"),
    JAVA("java", 1200, 120, true,
            "public class ", "private class ", "public interface ", "public void ", "private void "),
    GO("go", 1000, 100, true,
            "func ", "type ", "var ", "const ", "package ", "import "),
    YAML("yaml", 800, 80, true,
            "apiVersion:", "kind:", "metadata:", "spec:", "data:"),
    JSON("json", 800, 80, false,
            "{", "}"),
    MARKDOWN("markdown", 1500, 150, true,
            "# ", "## ", "### ", "#### "),
    DEFAULT("default", 1000, 100, false,
            "\n\n", "\n");

    private static final Map<String, ChunkingProfile> BY_LANGUAGE = Arrays.stream(values())
            .filter(p -> p != DEFAULT)
            .collect(Collectors.toUnmodifiableMap(ChunkingProfile::language, Function.identity()));

    private final String language;
    private final int maxChunkSize;
    private final int overlapSize;
    private final boolean preserveStructure;
    private final List<String> markers;

    ChunkingProfile(String language, int maxChunkSize, int overlapSize, boolean preserveStructure, String... markers) {
        this.language = language;
        this.maxChunkSize = maxChunkSize;
        this.overlapSize = overlapSize;
        this.preserveStructure = preserveStructure;
        this.markers = List.of(markers);
    }

    public static ChunkingProfile forLanguage(String language) {
        if (language == null) {
            return DEFAULT;
        }
        return BY_LANGUAGE.getOrDefault(language.trim().toLowerCase(Locale.ROOT), DEFAULT);
    }

    /**
     * Primer marcador con el que empieza la linea (ya recortada); una linea casa como mucho con uno.
     */
    public Optional<String> matchMarker(String line) {
        if (line == null) {
            return Optional.empty();
        }
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        for (String marker : markers) {
            if (trimmed.startsWith(marker)) {
                return Optional.of(marker);
            }
        }
        return Optional.empty();
    }

    public String language() { return language; }
    public int maxChunkSize() { return maxChunkSize; }
    public int overlapSize() { return overlapSize; }
    public boolean preserveStructure() { return preserveStructure; }
    public List<String> markers() { return markers; }
}
