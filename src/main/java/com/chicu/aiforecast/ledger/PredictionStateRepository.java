package com.chicu.aiforecast.ledger;

import com.chicu.aiforecast.common.enums.PredictionStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface PredictionStateRepository extends JpaRepository<PredictionState, String> {

    List<PredictionState> findByStatusAndPredictionTimestampLessThanEqualOrderByPredictionTimestampAsc(
            PredictionStatus status, Instant dueBefore, Pageable pageable);

    List<PredictionState> findByPredictionIdIn(Collection<String> ids);

    long countByStatus(PredictionStatus status);
}
