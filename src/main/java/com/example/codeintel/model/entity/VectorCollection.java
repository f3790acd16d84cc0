package com.example.codeintel.model.entity;

import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(name = "vector_collection", uniqueConstraints = {
        @UniqueConstraint(name = "uk_vector_collection_name", columnNames = "name")
})
public class VectorCollection {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(name = "repo_id", nullable = false, length = 200)
    private String repoId;

    @Column(nullable = false)
    private Instant createdAt;

    public VectorCollection() {}

    public VectorCollection(String name, String repoId, Instant createdAt) {
        this.name = name;
        this.repoId = repoId;
        this.createdAt = createdAt;
    }

    public Long getId() { return id; }

    public String getName() { return name; }
    public String getRepoId() { return repoId; }
    public Instant getCreatedAt() { return createdAt; }
}
