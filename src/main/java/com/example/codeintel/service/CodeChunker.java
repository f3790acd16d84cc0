package com.example.codeintel.service;

import com.example.codeintel.config.ChunkerProperties;
import com.example.codeintel.model.code.ChunkMetadata;
import com.example.codeintel.model.code.ChunkingStats;
import com.example.codeintel.model.code.CodeChunk;
import com.example.codeintel.model.code.RepoFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Trocea ficheros de codigo en chunks acotados con cabecera de contexto (ruta, lenguaje, tipo).
 *
 * Tres caminos segun el perfil del lenguaje:
 * - fichero pequeño: un unico chunk con todo el fichero;
 * - perfil con estructura: se corta en lineas frontera (funciones, clases, titulos...) y
 *   cada chunk nuevo arranca con las ultimas lineas del anterior;
 * - sin estructura: ventana deslizante de caracteres con solapamiento.
 */
@Service
public class CodeChunker {

    private static final Logger log = LoggerFactory.getLogger(CodeChunker.class);

    private final ChunkerProperties props;

    public CodeChunker(ChunkerProperties props) {
        this.props = props;
    }

    /**
     * Trocea todos los ficheros. Un fichero que falla se registra y se salta; nunca tumba el lote.
     */
    public List<CodeChunk> chunkFiles(List<RepoFile> files, String repoId) {
        List<CodeChunk> chunks = new ArrayList<>();
        if (files == null || files.isEmpty()) {
            log.info("Chunking sin ficheros para repo={}", repoId);
            return chunks;
        }

        for (RepoFile file : files) {
            try {
                chunks.addAll(chunkFile(file, repoId));
            } catch (RuntimeException e) {
                String path = file == null ? "<null>" : file.path();
                log.warn("No se pudo trocear el fichero {} de repo={}: {}", path, repoId, e.getMessage(), e);
            }
        }

        log.info("Generados {} chunks a partir de {} ficheros (repo={})", chunks.size(), files.size(), repoId);
        return chunks;
    }

    List<CodeChunk> chunkFile(RepoFile file, String repoId) {
        ChunkingProfile profile = ChunkingProfile.forLanguage(file.language());
        String content = file.content();

        if (content.length() <= profile.maxChunkSize()) {
            return List.of(newChunk(file, content, 1, lineCount(content), repoId));
        }

        return profile.preserveStructure()
                ? structureAwareChunking(file, profile, repoId)
                : slidingWindowChunking(file, profile, repoId);
    }

    private List<CodeChunk> structureAwareChunking(RepoFile file, ChunkingProfile profile, String repoId) {
        String[] lines = file.content().split("\n", -1);
        List<Integer> boundaries = findStructuralBoundaries(lines, profile);
        int overlapLines = overlapLines(profile);

        List<CodeChunk> out = new ArrayList<>();
        StringBuilder buffer = new StringBuilder();
        boolean bufferHasLines = false;
        int chunkStart = 1;
        int chunkEnd = 1;

        for (int i = 0; i < boundaries.size(); i++) {
            int sectionStart = boundaries.get(i);
            int sectionEnd = (i + 1 < boundaries.size()) ? boundaries.get(i + 1) - 1 : lines.length;
            String section = joinLines(lines, sectionStart, sectionEnd);

            if (buffer.length() > 0 && buffer.length() + section.length() > profile.maxChunkSize()) {
                out.add(newChunk(file, buffer.toString(), chunkStart, chunkEnd, repoId));

                buffer.setLength(0);
                bufferHasLines = false;
                if (overlapLines > 0) {
                    // Nunca antes del inicio del chunk que se acaba de cerrar.
                    int overlapStart = Math.max(chunkStart, chunkEnd - overlapLines + 1);
                    buffer.append(joinLines(lines, overlapStart, chunkEnd));
                    bufferHasLines = true;
                    chunkStart = overlapStart;
                } else {
                    chunkStart = sectionStart;
                }
            }

            if (bufferHasLines) {
                buffer.append('\n');
            }
            buffer.append(section);
            bufferHasLines = true;
            chunkEnd = sectionEnd;
        }

        if (buffer.length() > 0) {
            out.add(newChunk(file, buffer.toString(), chunkStart, chunkEnd, repoId));
        }
        return out;
    }

    private List<CodeChunk> slidingWindowChunking(RepoFile file, ChunkingProfile profile, String repoId) {
        String content = file.content();
        int window = profile.maxChunkSize();
        int stride = Math.max(1, window - profile.overlapSize());

        List<CodeChunk> out = new ArrayList<>();
        int newlinesBefore = 0;
        int counted = 0;

        for (int start = 0; start < content.length(); start += stride) {
            newlinesBefore += countNewlines(content, counted, start);
            counted = start;

            int end = Math.min(content.length(), start + window);
            String piece = content.substring(start, end);
            int startLine = newlinesBefore + 1;
            int endLine = startLine + countNewlines(content, start, end);
            out.add(newChunk(file, piece, startLine, endLine, repoId));

            if (end == content.length()) break;
        }
        return out;
    }

    /**
     * Lineas (1-based) donde empieza una seccion. La linea 1 siempre es frontera para no perder contenido.
     */
    private List<Integer> findStructuralBoundaries(String[] lines, ChunkingProfile profile) {
        List<Integer> boundaries = new ArrayList<>();
        boundaries.add(1);
        for (int i = 1; i < lines.length; i++) {
            if (profile.matchMarker(lines[i]).isPresent()) {
                boundaries.add(i + 1);
            }
        }
        return boundaries;
    }

    private int overlapLines(ChunkingProfile profile) {
        int charsPerLine = Math.max(1, props.getOverlapCharsPerLine());
        int lines = Math.min(profile.overlapSize() / charsPerLine, props.getMaxOverlapLines());
        return Math.max(0, lines);
    }

    private CodeChunk newChunk(RepoFile file, String body, int startLine, int endLine, String repoId) {
        ChunkMetadata metadata = new ChunkMetadata(file.path(), startLine, endLine, file.language(), repoId);
        return new CodeChunk(UUID.randomUUID().toString(), withContextHeader(file, body), metadata);
    }

    // La cabecera da al modelo de embeddings contexto a nivel de fichero.
    private String withContextHeader(RepoFile file, String body) {
        StringBuilder sb = new StringBuilder(body.length() + 80);
        sb.append("File: ").append(file.path()).append('\n');
        sb.append("Language: ").append(file.language()).append("\n\n");
        FileType.classify(file.path()).ifPresent(type -> sb.append("Type: ").append(type.label()).append('\n'));
        sb.append(body);
        return sb.toString();
    }

    /**
     * Estadisticas de un conjunto de chunks: total, tamaño medio y reparto por lenguaje y extension.
     */
    public ChunkingStats getChunkingStats(List<CodeChunk> chunks) {
        if (chunks == null || chunks.isEmpty()) {
            return new ChunkingStats(0, 0, Map.of(), Map.of());
        }

        Map<String, Integer> byLanguage = new TreeMap<>();
        Map<String, Integer> byExtension = new TreeMap<>();
        long totalSize = 0;

        for (CodeChunk chunk : chunks) {
            byLanguage.merge(chunk.metadata().language(), 1, Integer::sum);
            byExtension.merge(extensionOf(chunk.metadata().filePath()), 1, Integer::sum);
            totalSize += chunk.content().length();
        }

        long average = Math.round(totalSize / (double) chunks.size());
        return new ChunkingStats(chunks.size(), average, byLanguage, byExtension);
    }

    private static String extensionOf(String path) {
        int slash = path.lastIndexOf('/');
        String name = path.substring(slash + 1);
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return "unknown";
        }
        return name.substring(dot + 1);
    }

    private static int lineCount(String content) {
        return countNewlines(content, 0, content.length()) + 1;
    }

    private static int countNewlines(String s, int from, int to) {
        int n = 0;
        for (int i = from; i < to; i++) {
            if (s.charAt(i) == '\n') n++;
        }
        return n;
    }

    private static String joinLines(String[] lines, int fromLine, int toLine) {
        return String.join("\n", Arrays.asList(lines).subList(fromLine - 1, toLine));
    }
}
