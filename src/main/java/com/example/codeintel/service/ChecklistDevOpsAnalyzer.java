package com.example.codeintel.service;

import com.example.codeintel.model.analysis.DevOpsAnalysis;
import com.example.codeintel.model.analysis.DevOpsChecklistItem;
import com.example.codeintel.model.code.RepoFile;
import com.example.codeintel.model.code.RepoMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Analizador DevOps basado en reglas: puntua una checklist fija a partir de los metadatos
 * y del contenido de los ficheros, sin llamar a ningun modelo.
 */
@Component
public class ChecklistDevOpsAnalyzer implements DevOpsAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ChecklistDevOpsAnalyzer.class);

    private static final Set<String> READINESS_ITEMS = Set.of("secrets_mgmt", "ssl_tls", "observability");

    enum Check {
        APP_TYPE("app_type", "Application Architecture", "Application Type & Scale",
                "Identify application architecture", "Determine scaling requirements"),
        TRAFFIC_SCALE("traffic_scale", "Application Architecture", "Expected Traffic & Scaling",
                "Configure auto-scaling", "Set resource limits"),
        DATABASE_REQ("database_req", "Application Architecture", "Database Requirements",
                "Setup database connections", "Configure backup strategies"),
        SECURITY_POSTURE("security_posture", "Security & Compliance", "Security Posture",
                "Implement security policies", "Configure RBAC"),
        SECRETS_MGMT("secrets_mgmt", "Security & Compliance", "Secrets Management",
                "Setup secrets management", "Configure rotation policies"),
        SSL_TLS("ssl_tls", "Security & Compliance", "SSL/TLS Configuration",
                "Configure certificate management", "Setup TLS termination"),
        CLUSTER_ARCH("cluster_arch", "Infrastructure & Networking", "Cluster Architecture",
                "Design cluster topology", "Configure networking"),
        NETWORKING_REQ("networking_req", "Infrastructure & Networking", "Networking Requirements",
                "Setup ingress controllers", "Configure load balancing"),
        STORAGE_REQ("storage_req", "Infrastructure & Networking", "Storage Requirements",
                "Configure persistent volumes", "Setup backup strategies"),
        OBSERVABILITY("observability", "Monitoring & Operations", "Observability Level",
                "Setup monitoring stack", "Configure alerting"),
        LOGGING("logging", "Monitoring & Operations", "Logging Strategy",
                "Configure log aggregation", "Setup log retention"),
        BACKUP_DR("backup_dr", "Monitoring & Operations", "Backup & Disaster Recovery",
                "Setup backup schedules", "Configure DR procedures"),
        CICD("cicd", "Development & Deployment", "CI/CD Integration",
                "Setup CI/CD pipelines", "Configure automated testing"),
        GITOPS("gitops", "Development & Deployment", "GitOps Configuration",
                "Setup GitOps workflows", "Configure sync policies"),
        ENVIRONMENTS("environments", "Development & Deployment", "Environment Strategy",
                "Setup environment separation", "Configure promotion workflows"),
        COST_OPTIMIZATION("cost_optimization", "Cost & Resource Management", "Cost Optimization",
                "Configure resource limits", "Setup cost monitoring"),
        RESOURCE_MGMT("resource_mgmt", "Cost & Resource Management", "Resource Management",
                "Setup resource quotas", "Configure auto-scaling");

        private final String id;
        private final String category;
        private final String title;
        private final List<String> recommendations;

        Check(String id, String category, String title, String... recommendations) {
            this.id = id;
            this.category = category;
            this.title = title;
            this.recommendations = List.of(recommendations);
        }

        String id() { return id; }
    }

    private record Finding(String detected, double confidence, String reasoning) {
    }

    @Override
    public DevOpsAnalysis analyze(String repoId, RepoMetadata metadata, List<RepoFile> files) {
        log.info("Analisis DevOps de {} ({} ficheros)", repoId, files == null ? 0 : files.size());
        List<RepoFile> safeFiles = files == null ? List.of() : files;

        List<DevOpsChecklistItem> checklist = new ArrayList<>(Check.values().length);
        for (Check check : Check.values()) {
            Finding finding;
            try {
                finding = evaluate(check, metadata, safeFiles);
            } catch (RuntimeException e) {
                log.error("Error evaluando {} en {}", check.id(), repoId, e);
                finding = new Finding(null, 0, "Analysis failed due to error");
            }
            checklist.add(new DevOpsChecklistItem(check.id, check.category, check.title,
                    finding.detected(), finding.confidence(), finding.reasoning(), check.recommendations));
        }

        DevOpsAnalysis analysis = new DevOpsAnalysis(
                repoId,
                checklist,
                overallScore(checklist),
                overallRecommendations(metadata),
                estimateComplexity(metadata),
                deploymentReadiness(checklist, metadata)
        );
        log.info("Analisis DevOps de {} terminado: score={} readiness={}",
                repoId, analysis.overallScore(), analysis.deploymentReadiness());
        return analysis;
    }

    private Finding evaluate(Check check, RepoMetadata md, List<RepoFile> files) {
        return switch (check) {
            case APP_TYPE -> applicationType(md);
            case TRAFFIC_SCALE -> trafficScale(md);
            case DATABASE_REQ -> databaseRequirements(md);
            case SECURITY_POSTURE -> anyFile(files, f -> f.path().contains("security") || f.path().contains("auth")
                    || f.path().contains("rbac") || f.content().contains("helmet") || f.content().contains("cors"))
                    ? new Finding("Enhanced Security", 0.7, "Detected security-related files and configurations")
                    : new Finding("Basic Security", 0.6, "No specific security configurations detected, basic security recommended");
            case SECRETS_MGMT -> secretsManagement(files);
            case SSL_TLS -> anyContent(files, "https", "ssl", "tls")
                    ? new Finding("HTTPS Configured", 0.7, "Detected HTTPS/SSL/TLS references in codebase")
                    : new Finding("HTTP Only", 0.6, "No HTTPS configuration detected, SSL/TLS setup needed");
            case CLUSTER_ARCH -> clusterArchitecture(md);
            case NETWORKING_REQ -> anyContent(files, "ingress", "nginx", "loadbalancer", "alb")
                    ? new Finding("Advanced Networking", 0.8, "Detected ingress controllers or load balancer configurations")
                    : new Finding("Basic Networking", 0.6, "Standard networking requirements detected");
            case STORAGE_REQ -> storageRequirements(md, files);
            case OBSERVABILITY -> anyContent(files, "prometheus", "grafana", "monitoring")
                    ? new Finding("Advanced Monitoring", 0.8, "Detected monitoring and observability tools")
                    : new Finding("Basic Monitoring", 0.6, "No advanced monitoring detected, basic setup recommended");
            case LOGGING -> anyContent(files, "winston", "logger", "log")
                    ? new Finding("Structured Logging", 0.8, "Detected logging frameworks and structured logging")
                    : new Finding("Basic Logging", 0.6, "No structured logging detected, basic setup recommended");
            case BACKUP_DR -> hasPersistentDatabase(md)
                    ? new Finding("Database Backups", 0.7, "Database detected, backup strategy required")
                    : new Finding("Stateless Application", 0.8, "No persistent data detected, minimal backup requirements");
            case CICD -> md.hasCI()
                    ? new Finding("CI/CD Configured", 0.9, "CI/CD pipeline configurations detected")
                    : new Finding("No CI/CD", 0.8, "No CI/CD configurations detected, setup required");
            case GITOPS -> anyFile(files, f -> f.content().contains("argocd") || f.content().contains("flux")
                    || f.path().contains("gitops"))
                    ? new Finding("GitOps Ready", 0.9, "GitOps tools and configurations detected")
                    : new Finding("Manual Deployment", 0.7, "No GitOps configurations detected");
            case ENVIRONMENTS -> anyFile(files, f -> f.path().contains("env") || f.path().contains("config")
                    || f.path().contains("staging") || f.path().contains("prod"))
                    ? new Finding("Multi-Environment", 0.8, "Multiple environment configurations detected")
                    : new Finding("Single Environment", 0.7, "No multi-environment setup detected");
            case COST_OPTIMIZATION -> sizeScore(md) > 200
                    ? new Finding("Performance-First", 0.7, "Large application requires performance optimization")
                    : new Finding("Cost-Aware", 0.7, "Standard application, cost optimization recommended");
            case RESOURCE_MGMT -> anyContent(files, "resources:", "limits:", "requests:")
                    ? new Finding("Resource Limits Configured", 0.9, "Resource limits and requests detected in configurations")
                    : new Finding("Basic Resources", 0.6, "No resource management configurations detected");
        };
    }

    private Finding applicationType(RepoMetadata md) {
        List<String> backend = md.frameworks().stream().filter(RepositoryFileClassifier::isBackend).toList();
        List<String> frontend = md.frameworks().stream().filter(RepositoryFileClassifier::isFrontend).toList();

        if (!frontend.isEmpty() && !backend.isEmpty()) {
            return new Finding("Full-Stack Application", 0.9, "Detected both frontend (" + String.join(", ", frontend)
                    + ") and backend (" + String.join(", ", backend) + ") frameworks");
        }
        if (!backend.isEmpty()) {
            return new Finding("API Service", 0.8, "Detected backend frameworks: " + String.join(", ", backend));
        }
        if (!frontend.isEmpty()) {
            return new Finding("Frontend Application", 0.8, "Detected frontend frameworks: " + String.join(", ", frontend));
        }
        return new Finding("Unknown", 0.3, "Could not determine application type from detected frameworks");
    }

    private Finding trafficScale(RepoMetadata md) {
        int score = sizeScore(md);
        if (score > 200) {
            return new Finding("High Traffic", 0.7, "Large codebase (" + md.totalFiles()
                    + " files) with multiple frameworks suggests high-scale application");
        }
        if (score > 50) {
            return new Finding("Medium Traffic", 0.6, "Moderate codebase size (" + md.totalFiles()
                    + " files) suggests medium-scale application");
        }
        return new Finding("Low Traffic", 0.6, "Small codebase (" + md.totalFiles()
                + " files) suggests low-scale application");
    }

    private Finding databaseRequirements(RepoMetadata md) {
        List<String> databases = md.frameworks().stream().filter(RepositoryFileClassifier::isDatabase).toList();
        if (databases.isEmpty()) {
            return new Finding("No Database", 0.7, "No database frameworks detected in codebase");
        }
        String joined = String.join(", ", databases);
        if (databases.contains("Redis") && databases.size() > 1) {
            return new Finding("SQL + Cache", 0.9, "Detected databases: " + joined + " - includes caching layer");
        }
        if (databases.contains("MongoDB")) {
            return new Finding("NoSQL Database", 0.9, "Detected NoSQL database: " + joined);
        }
        return new Finding("SQL Database", 0.9, "Detected SQL database: " + joined);
    }

    private Finding secretsManagement(List<RepoFile> files) {
        if (anyContent(files, "vault", "secret")) {
            return new Finding("External Secrets", 0.8, "Detected external secrets management references");
        }
        if (anyFile(files, f -> f.path().contains(".env") || f.path().contains("secrets"))) {
            return new Finding("Environment Variables", 0.7, "Detected environment variable usage for secrets");
        }
        return new Finding("Basic Secrets", 0.5, "No specific secrets management detected");
    }

    private Finding clusterArchitecture(RepoMetadata md) {
        if (md.hasKubernetes()) {
            return new Finding("Kubernetes Ready", 0.9, "Kubernetes configurations detected in repository");
        }
        if (md.hasDockerfile()) {
            return new Finding("Container Ready", 0.8, "Docker configuration detected, ready for containerization");
        }
        return new Finding("Traditional Deployment", 0.6, "No container or Kubernetes configurations detected");
    }

    private Finding storageRequirements(RepoMetadata md, List<RepoFile> files) {
        boolean database = hasPersistentDatabase(md);
        boolean fileStorage = anyContent(files, "upload", "storage");
        if (database && fileStorage) {
            return new Finding("Database + File Storage", 0.9, "Detected both database and file storage requirements");
        }
        if (database) {
            return new Finding("Database Storage", 0.8, "Detected database storage requirements");
        }
        if (fileStorage) {
            return new Finding("File Storage", 0.7, "Detected file storage requirements");
        }
        return new Finding("No Persistent Storage", 0.7, "No persistent storage requirements detected");
    }

    // ----------------- AGREGADOS -----------------

    static int overallScore(List<DevOpsChecklistItem> checklist) {
        if (checklist.isEmpty()) {
            return 0;
        }
        double total = checklist.stream().mapToDouble(DevOpsChecklistItem::confidence).sum();
        return (int) Math.round(total / checklist.size() * 100);
    }

    static List<String> overallRecommendations(RepoMetadata md) {
        List<String> out = new ArrayList<>(3);
        out.add(md.hasDockerfile()
                ? "Application is containerized and ready for Kubernetes deployment"
                : "Add Dockerfile for containerization");
        out.add(md.hasCI() ? "CI/CD pipeline detected" : "Setup CI/CD pipeline for automated deployments");
        out.add(md.hasKubernetes() ? "Kubernetes configurations found" : "Add Kubernetes manifests for deployment");
        return out;
    }

    static String estimateComplexity(RepoMetadata md) {
        int score = sizeScore(md) + md.languages().size() * 5;
        if (score > 200) return "high";
        if (score > 50) return "medium";
        return "low";
    }

    static int deploymentReadiness(List<DevOpsChecklistItem> checklist, RepoMetadata md) {
        double score = 0;
        if (md.hasDockerfile()) score += 30;
        if (md.hasCI()) score += 25;
        if (md.hasKubernetes()) score += 25;

        long configured = checklist.stream()
                .filter(item -> READINESS_ITEMS.contains(item.id()) && item.confidence() > 0.7)
                .count();
        score += configured / 3.0 * 20;
        return (int) Math.min(100, Math.round(score));
    }

    private static int sizeScore(RepoMetadata md) {
        return md.totalFiles() + md.frameworks().size() * 10;
    }

    private static boolean hasPersistentDatabase(RepoMetadata md) {
        return md.frameworks().stream().anyMatch(f -> f.equals("MongoDB") || f.equals("PostgreSQL") || f.equals("MySQL"));
    }

    private static boolean anyFile(List<RepoFile> files, Predicate<RepoFile> predicate) {
        return files.stream().anyMatch(predicate);
    }

    private static boolean anyContent(List<RepoFile> files, String... needles) {
        return files.stream().anyMatch(f -> {
            for (String needle : needles) {
                if (f.content().contains(needle)) return true;
            }
            return false;
        });
    }
}
