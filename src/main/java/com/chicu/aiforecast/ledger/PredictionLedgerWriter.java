package com.chicu.aiforecast.ledger;

import com.chicu.aiforecast.common.enums.PredictionStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

/**
 * Транзакционные вставки леджера. Каждый метод: отдельная транзакция,
 * чтобы нарушение уникального ключа откатывало только свою запись
 * и ловилось снаружи, в {@link PredictionLedger}.
 */
@Component
@RequiredArgsConstructor
public class PredictionLedgerWriter {

    private final PredictionRecordRepository predictionRepo;
    private final PredictionOutcomeRepository outcomeRepo;
    private final PredictionStateRepository stateRepo;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public PredictionRecord insertPrediction(PredictionRecord record, Instant now) {
        PredictionRecord saved = predictionRepo.saveAndFlush(record);
        stateRepo.saveAndFlush(PredictionState.pending(saved, now));
        return saved;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public PredictionOutcome insertOutcome(PredictionOutcome outcome) {
        return outcomeRepo.saveAndFlush(outcome);
    }

    /**
     * @return true, если статус сменился; false, если прогноз уже был в next или состояния нет
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean transition(String predictionId, PredictionStatus next, Instant now) {
        return stateRepo.findById(predictionId)
                .map(s -> s.transitionTo(next, now))
                .orElse(false);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<PredictionState> recordFailure(String predictionId, String error, Instant now) {
        Optional<PredictionState> st = stateRepo.findById(predictionId);
        st.ifPresent(s -> s.recordFailure(error, now));
        return st;
    }
}
