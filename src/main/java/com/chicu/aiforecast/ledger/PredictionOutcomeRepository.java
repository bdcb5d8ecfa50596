package com.chicu.aiforecast.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.Collection;
import java.util.List;

public interface PredictionOutcomeRepository extends JpaRepository<PredictionOutcome, String> {

    boolean existsByPredictionIdAndHorizon(String predictionId, String horizon);

    List<PredictionOutcome> findByPredictionIdOrderByEvaluationTimestampAsc(String predictionId);

    List<PredictionOutcome> findByPredictionIdIn(Collection<String> predictionIds);

    /**
     * Исходы без прогноза. При живом внешнем ключе пусто; проверка нужна для импортов и ручных правок.
     */
    @Query("""
            select o from PredictionOutcome o
            where not exists (select p.predictionId from PredictionRecord p where p.predictionId = o.predictionId)
            """)
    List<PredictionOutcome> findOrphans();
}
