package com.chicu.aiforecast.ai.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface ModelArtifactRepository extends JpaRepository<ModelArtifactEntity, Long> {

    Optional<ModelArtifactEntity> findFirstByPromotedTrueOrderByPromotedAtDesc();

    List<ModelArtifactEntity> findByPromotedTrue();

    Optional<ModelArtifactEntity> findByVersion(String version);

    List<ModelArtifactEntity> findTop30ByOrderByCreatedAtDesc();

    boolean existsByVersion(String version);
}
