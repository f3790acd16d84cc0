package com.example.codeintel.service;

import com.example.codeintel.config.GitHubProperties;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Lee los tokens cifrados de {@code github.project-tokens.<projectId>}.
 */
@Component
public class PropertiesProjectTokenStore implements ProjectTokenStore {

    private final GitHubProperties props;

    public PropertiesProjectTokenStore(GitHubProperties props) {
        this.props = props;
    }

    @Override
    public Optional<String> findEncryptedToken(String projectId) {
        if (projectId == null || projectId.isBlank() || props.getProjectTokens() == null) {
            return Optional.empty();
        }
        String token = props.getProjectTokens().get(projectId);
        return (token == null || token.isBlank()) ? Optional.empty() : Optional.of(token);
    }
}
