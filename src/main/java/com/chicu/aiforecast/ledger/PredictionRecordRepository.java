package com.chicu.aiforecast.ledger;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface PredictionRecordRepository extends JpaRepository<PredictionRecord, String> {

    Optional<PredictionRecord> findBySymbolAndBucketStart(String symbol, Instant bucketStart);

    List<PredictionRecord> findBySymbolOrderByPredictionTimestampDesc(String symbol, Pageable pageable);

    List<PredictionRecord> findByPredictionIdIn(Collection<String> ids);

    @Query("""
            select p from PredictionRecord p
            where p.predictionTimestamp >= :from and p.predictionTimestamp < :to
            order by p.predictionTimestamp asc
            """)
    List<PredictionRecord> findInWindow(@Param("from") Instant from, @Param("to") Instant to);
}
