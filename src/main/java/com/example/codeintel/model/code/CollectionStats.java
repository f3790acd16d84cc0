package com.example.codeintel.model.code;

public record CollectionStats(long count) {
}
