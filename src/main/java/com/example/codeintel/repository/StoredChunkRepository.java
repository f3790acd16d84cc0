package com.example.codeintel.repository;

import com.example.codeintel.model.entity.StoredChunk;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface StoredChunkRepository extends JpaRepository<StoredChunk, Long> {

    List<StoredChunk> findByCollectionName(String collectionName);

    long countByCollectionName(String collectionName);

    // Borrado en bloque: no carga las entidades antes de eliminarlas
    @Modifying
    @Query("delete from StoredChunk c where c.collectionName = :name")
    int deleteByCollectionName(@Param("name") String collectionName);
}
