package com.example.codeintel.model.code;

import java.util.List;

public record FetchedRepository(List<RepoFile> files, RepoMetadata metadata) {

    public FetchedRepository {
        files = files == null ? List.of() : List.copyOf(files);
    }
}
