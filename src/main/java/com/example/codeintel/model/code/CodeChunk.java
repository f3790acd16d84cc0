package com.example.codeintel.model.code;

public record CodeChunk(String id, String content, ChunkMetadata metadata) {
}
