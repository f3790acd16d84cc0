package com.example.codeintel.repository;

import com.example.codeintel.model.entity.VectorCollection;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface VectorCollectionRepository extends JpaRepository<VectorCollection, Long> {

    boolean existsByName(String name);

    @Modifying
    @Query("delete from VectorCollection c where c.name = :name")
    int deleteByName(@Param("name") String name);
}
