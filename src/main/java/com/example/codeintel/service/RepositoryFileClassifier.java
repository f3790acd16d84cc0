package com.example.codeintel.service;

import com.example.codeintel.model.code.RepoFile;
import com.example.codeintel.model.code.RepoMetadata;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Heuristicas sobre rutas y contenido: que ficheros indexar, lenguaje de cada uno y
 * gestores de paquetes / frameworks del repositorio.
 */
public final class RepositoryFileClassifier {

    private static final Set<String> CODE_EXTENSIONS = Set.of(
            ".js", ".ts", ".jsx", ".tsx", ".py", ".java", ".go", ".rs", ".cpp", ".c", ".h",
            ".cs", ".php", ".rb", ".swift", ".kt", ".scala", ".clj", ".hs", ".ml", ".fs",
            ".sh", ".bash", ".zsh", ".ps1", ".bat", ".cmd",
            ".yaml", ".yml", ".json", ".toml", ".ini", ".cfg", ".conf",
            ".sql", ".graphql", ".proto", ".thrift",
            ".html", ".css", ".scss", ".sass", ".less",
            ".md", ".rst", ".txt", ".dockerfile",
            ".tf", ".hcl", ".nomad"
    );

    private static final List<String> EXCLUDED_PATHS = List.of(
            "node_modules/", "vendor/", ".git/", "dist/", "build/", "target/",
            ".next/", ".nuxt/", "coverage/", "__pycache__/", ".pytest_cache/",
            "venv/", "env/", ".env/", "logs/", "tmp/", "temp/"
    );

    private static final Map<String, String> LANGUAGE_BY_EXTENSION = Map.ofEntries(
            Map.entry(".js", "javascript"),
            Map.entry(".jsx", "javascript"),
            Map.entry(".ts", "typescript"),
            Map.entry(".tsx", "typescript"),
            Map.entry(".py", "python"),
            Map.entry(".java", "java"),
            Map.entry(".go", "go"),
            Map.entry(".rs", "rust"),
            Map.entry(".cpp", "cpp"),
            Map.entry(".c", "c"),
            Map.entry(".h", "c"),
            Map.entry(".cs", "csharp"),
            Map.entry(".php", "php"),
            Map.entry(".rb", "ruby"),
            Map.entry(".swift", "swift"),
            Map.entry(".kt", "kotlin"),
            Map.entry(".scala", "scala"),
            Map.entry(".yaml", "yaml"),
            Map.entry(".yml", "yaml"),
            Map.entry(".json", "json"),
            Map.entry(".sql", "sql"),
            Map.entry(".html", "html"),
            Map.entry(".css", "css"),
            Map.entry(".scss", "scss"),
            Map.entry(".md", "markdown"),
            Map.entry(".sh", "bash"),
            Map.entry(".bash", "bash"),
            Map.entry(".tf", "terraform"),
            Map.entry(".hcl", "hcl")
    );

    private static final List<String> BACKEND = List.of("Express", "NestJS", "FastAPI", "Django", "Flask", "Spring");
    private static final List<String> FRONTEND = List.of("React", "Vue", "Angular", "Next.js", "Nuxt.js");
    private static final List<String> DATABASES = List.of("MongoDB", "PostgreSQL", "MySQL", "Redis");

    private RepositoryFileClassifier() {
    }

    public static boolean isCodeFile(String path) {
        if (path == null || path.isBlank()) {
            return false;
        }
        for (String excluded : EXCLUDED_PATHS) {
            if (path.contains(excluded)) {
                return false;
            }
        }
        return CODE_EXTENSIONS.contains(extension(path)) || path.endsWith("Dockerfile") || path.endsWith("Makefile");
    }

    public static String detectLanguage(String path) {
        return LANGUAGE_BY_EXTENSION.getOrDefault(extension(path), "text");
    }

    public static List<String> detectPackageManagers(List<RepoFile> files) {
        Set<String> paths = files.stream().map(RepoFile::path).collect(Collectors.toSet());
        List<String> managers = new ArrayList<>();
        if (paths.contains("package.json")) managers.add("npm");
        if (paths.contains("yarn.lock")) managers.add("yarn");
        if (paths.contains("pnpm-lock.yaml")) managers.add("pnpm");
        if (paths.contains("requirements.txt") || paths.contains("pyproject.toml")) managers.add("pip");
        if (paths.contains("Pipfile")) managers.add("pipenv");
        if (paths.contains("poetry.lock")) managers.add("poetry");
        if (paths.contains("go.mod")) managers.add("go");
        if (paths.contains("Cargo.toml")) managers.add("cargo");
        if (paths.contains("pom.xml")) managers.add("maven");
        if (paths.contains("build.gradle")) managers.add("gradle");
        return managers;
    }

    public static List<String> detectFrameworks(List<RepoFile> files) {
        StringBuilder sb = new StringBuilder();
        List<String> lowerPaths = new ArrayList<>(files.size());
        for (RepoFile f : files) {
            sb.append(f.content().toLowerCase(Locale.ROOT)).append(' ');
            lowerPaths.add(f.path().toLowerCase(Locale.ROOT));
        }
        String content = sb.toString();

        List<String> frameworks = new ArrayList<>();
        addIf(frameworks, "React", content.contains("react") || anyPathContains(lowerPaths, "react"));
        addIf(frameworks, "Vue", content.contains("vue") || anyPathContains(lowerPaths, "vue"));
        addIf(frameworks, "Angular", content.contains("angular") || anyPathContains(lowerPaths, "angular"));
        addIf(frameworks, "Next.js", content.contains("next") || anyPathContains(lowerPaths, "next"));
        addIf(frameworks, "Nuxt.js", content.contains("nuxt") || anyPathContains(lowerPaths, "nuxt"));

        addIf(frameworks, "Express", content.contains("express") || content.contains("fastify"));
        addIf(frameworks, "NestJS", content.contains("nestjs"));
        addIf(frameworks, "FastAPI", content.contains("fastapi") || content.contains("uvicorn"));
        addIf(frameworks, "Django", content.contains("django"));
        addIf(frameworks, "Flask", content.contains("flask"));
        addIf(frameworks, "Spring", content.contains("spring"));

        addIf(frameworks, "MongoDB", content.contains("mongodb") || content.contains("mongoose"));
        addIf(frameworks, "PostgreSQL", content.contains("postgres"));
        addIf(frameworks, "MySQL", content.contains("mysql"));
        addIf(frameworks, "Redis", content.contains("redis"));
        return frameworks;
    }

    public static RepoMetadata buildMetadata(String owner,
                                             String repo,
                                             String description,
                                             String language,
                                             Map<String, Long> languages,
                                             List<String> topics,
                                             List<RepoFile> files) {
        boolean hasDockerfile = files.stream().anyMatch(f -> f.path().toLowerCase(Locale.ROOT).contains("dockerfile"));
        boolean hasKubernetes = files.stream().anyMatch(f -> f.path().contains("k8s/")
                || f.path().contains("kubernetes/") || f.path().contains(".yaml"));
        boolean hasCI = files.stream().anyMatch(f -> f.path().contains(".github/workflows/")
                || f.path().contains(".gitlab-ci.yml") || f.path().contains("Jenkinsfile"));
        long totalSize = files.stream().mapToLong(RepoFile::size).sum();

        return new RepoMetadata(
                owner,
                repo,
                owner + "/" + repo,
                description == null ? "" : description,
                language == null ? "" : language,
                languages,
                topics,
                hasDockerfile,
                hasKubernetes,
                hasCI,
                detectPackageManagers(files),
                detectFrameworks(files),
                files.size(),
                totalSize
        );
    }

    public static boolean isBackend(String framework) { return BACKEND.contains(framework); }
    public static boolean isFrontend(String framework) { return FRONTEND.contains(framework); }
    public static boolean isDatabase(String framework) { return DATABASES.contains(framework); }

    private static String extension(String path) {
        int dot = path.lastIndexOf('.');
        int slash = path.lastIndexOf('/');
        if (dot < 0 || dot < slash) {
            return "";
        }
        return path.substring(dot).toLowerCase(Locale.ROOT);
    }

    private static boolean anyPathContains(List<String> paths, String token) {
        return paths.stream().anyMatch(p -> p.contains(token));
    }

    private static void addIf(List<String> out, String value, boolean condition) {
        if (condition) out.add(value);
    }
}
