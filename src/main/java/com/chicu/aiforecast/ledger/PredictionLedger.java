package com.chicu.aiforecast.ledger;

import com.chicu.aiforecast.common.enums.PredictionStatus;
import com.chicu.aiforecast.common.exception.DuplicatePredictionException;
import com.chicu.aiforecast.common.exception.TemporalIntegrityViolationException;
import com.chicu.aiforecast.common.time.TimeBucket;
import com.chicu.aiforecast.common.time.Timeframe;
import com.chicu.aiforecast.ai.outcome.EvaluationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Append-only леджер прогнозов и исходов.
 * Уникальность (symbol, bucket) и (prediction, horizon) держит база, а не блокировки в приложении:
 * вставка либо проходит, либо падает на ключе.
 */
@Slf4j
@Service
public class PredictionLedger {

    private final PredictionLedgerWriter writer;
    private final PredictionRecordRepository predictionRepo;
    private final PredictionOutcomeRepository outcomeRepo;
    private final PredictionStateRepository stateRepo;
    private final LedgerProperties props;
    private final EvaluationProperties evalProps;
    private final Clock clock;

    private final Timeframe bucket;
    private final ZoneId bucketZone;

    public PredictionLedger(PredictionLedgerWriter writer,
                            PredictionRecordRepository predictionRepo,
                            PredictionOutcomeRepository outcomeRepo,
                            PredictionStateRepository stateRepo,
                            LedgerProperties props,
                            EvaluationProperties evalProps,
                            Clock clock) {
        this.writer = writer;
        this.predictionRepo = predictionRepo;
        this.outcomeRepo = outcomeRepo;
        this.stateRepo = stateRepo;
        this.props = props;
        this.evalProps = evalProps;
        this.clock = clock;
        this.bucket = Timeframe.from(props.getBucket());
        this.bucketZone = ZoneId.of(props.getBucketZone());

        log.info("📒 Ledger bucket={} zone={} creationTolerance={}",
                bucket.getCode(), bucketZone, props.getCreationTolerance());
    }

    public Instant bucketOf(Instant predictionTimestamp) {
        return TimeBucket.startOf(predictionTimestamp, bucket, bucketZone);
    }

    // =========================================================
    // predictions
    // =========================================================

    /**
     * Добавляет прогноз и его состояние PENDING одной транзакцией.
     *
     * @throws DuplicatePredictionException прогноз для (symbol, bucket) или тот же id уже есть
     */
    public PredictionRecord append(PredictionRecord record) {
        if (record == null) throw new IllegalArgumentException("record=null");

        Instant expectedBucket = bucketOf(record.getPredictionTimestamp());
        if (!expectedBucket.equals(record.getBucketStart())) {
            throw new IllegalArgumentException("bucket_start " + record.getBucketStart()
                    + " does not match prediction_timestamp " + record.getPredictionTimestamp()
                    + " (expected " + expectedBucket + ")");
        }

        requireFits(record);

        Duration gap = Duration.between(record.getPredictionTimestamp(), record.getCreatedAt()).abs();
        if (gap.compareTo(props.getCreationTolerance()) > 0) {
            log.error("❌ LEDGER backdated prediction refused id={} symbol={} gap={}",
                    record.getPredictionId(), record.getSymbol(), gap);
            throw new TemporalIntegrityViolationException("prediction_timestamp differs from created_at by "
                    + gap + " (tolerance " + props.getCreationTolerance() + ")", null);
        }

        try {
            PredictionRecord saved = writer.insertPrediction(record, clock.instant());
            log.info("📒 LEDGER append id={} symbol={} bucket={} action={} conf={} model={}",
                    saved.getPredictionId(), saved.getSymbol(), saved.getBucketStart(),
                    saved.getPredictedAction(), String.format(Locale.ROOT, "%.4f", saved.getActionConfidence()),
                    saved.getModelVersion());
            return saved;
        } catch (DataIntegrityViolationException e) {
            if (!isDuplicate(record)) {
                log.error("❌ LEDGER insert failed id={} symbol={}: {}",
                        record.getPredictionId(), record.getSymbol(), e.getMostSpecificCause().getMessage());
                throw e;
            }
            log.warn("⚠️ LEDGER duplicate symbol={} bucket={} id={}",
                    record.getSymbol(), record.getBucketStart(), record.getPredictionId());
            throw new DuplicatePredictionException(record.getSymbol(), record.getBucketStart(), e);
        }
    }

    /**
     * Нарушение ключа считается дубликатом, только если конфликтующая строка действительно есть.
     */
    private boolean isDuplicate(PredictionRecord record) {
        if (record.getPredictionId() != null && predictionRepo.existsById(record.getPredictionId().trim())) {
            return true;
        }
        String symbol = record.getSymbol() == null ? null : record.getSymbol().trim().toUpperCase(Locale.ROOT);
        return symbol != null
                && predictionRepo.findBySymbolAndBucketStart(symbol, record.getBucketStart()).isPresent();
    }

    private static void requireFits(PredictionRecord record) {
        String symbol = record.getSymbol();
        if (symbol == null || symbol.isBlank() || symbol.trim().length() > PredictionRecord.SYMBOL_MAX_LENGTH) {
            throw new IllegalArgumentException("symbol must be 1.." + PredictionRecord.SYMBOL_MAX_LENGTH
                    + " chars: " + symbol);
        }
        String json = record.getFeaturesJson();
        if (json != null && json.length() > PredictionRecord.FEATURES_JSON_MAX_LENGTH) {
            throw new IllegalArgumentException("feature snapshot is " + json.length() + " chars, max "
                    + PredictionRecord.FEATURES_JSON_MAX_LENGTH);
        }
    }

    public Optional<PredictionRecord> find(String predictionId) {
        if (predictionId == null || predictionId.isBlank()) return Optional.empty();
        return predictionRepo.findById(predictionId.trim());
    }

    public List<PredictionRecord> findBySymbol(String symbol, int limit) {
        if (symbol == null || symbol.isBlank()) return List.of();
        int size = Math.max(1, Math.min(limit, 1000));
        return predictionRepo.findBySymbolOrderByPredictionTimestampDesc(
                symbol.trim().toUpperCase(Locale.ROOT), PageRequest.of(0, size));
    }

    // =========================================================
    // outcomes
    // =========================================================

    public boolean hasOutcome(String predictionId, String horizon) {
        return outcomeRepo.existsByPredictionIdAndHorizon(predictionId, horizon);
    }

    /**
     * Записывает исход. Сам прогноз не трогается.
     *
     * @return false, если исход для (prediction, horizon) уже существует
     * @throws TemporalIntegrityViolationException исход раньше MIN_EVAL_DELAY или выход не позже прогноза
     */
    public boolean appendOutcome(PredictionOutcome outcome) {
        if (outcome == null) throw new IllegalArgumentException("outcome=null");

        PredictionRecord prediction = predictionRepo.findById(outcome.getPredictionId())
                .orElseThrow(() -> new TemporalIntegrityViolationException(
                        "outcome references unknown prediction " + outcome.getPredictionId(), null));

        Duration age = Duration.between(prediction.getPredictionTimestamp(), outcome.getEvaluationTimestamp());
        if (age.compareTo(evalProps.getMinDelay()) < 0) {
            log.error("❌ LEDGER outcome too early prediction={} age={} minDelay={}",
                    prediction.getPredictionId(), age, evalProps.getMinDelay());
            throw new TemporalIntegrityViolationException("outcome evaluated " + age
                    + " after prediction, minimum is " + evalProps.getMinDelay(), null);
        }
        if (!outcome.getExitAt().isAfter(prediction.getPredictionTimestamp())) {
            throw new TemporalIntegrityViolationException("outcome exit " + outcome.getExitAt()
                    + " is not after prediction " + prediction.getPredictionTimestamp(), null);
        }
        if (outcome.getExitAt().isAfter(outcome.getEvaluationTimestamp())) {
            throw new TemporalIntegrityViolationException("outcome exit " + outcome.getExitAt()
                    + " is after its evaluation timestamp " + outcome.getEvaluationTimestamp(), null);
        }

        if (outcomeRepo.existsByPredictionIdAndHorizon(outcome.getPredictionId(), outcome.getHorizon())) {
            return false;
        }

        try {
            writer.insertOutcome(outcome);
            log.debug("🧩 OUTCOME saved prediction={} horizon={} ret={} dir={}",
                    outcome.getPredictionId(), outcome.getHorizon(),
                    outcome.getActualReturnPct(), outcome.getActualDirection());
            return true;
        } catch (DataIntegrityViolationException e) {
            // параллельный оценщик успел раньше
            if (outcomeRepo.existsByPredictionIdAndHorizon(outcome.getPredictionId(), outcome.getHorizon())) {
                return false;
            }
            throw e;
        }
    }

    public List<PredictionOutcome> outcomesOf(String predictionId) {
        return outcomeRepo.findByPredictionIdOrderByEvaluationTimestampAsc(predictionId);
    }

    // =========================================================
    // lifecycle
    // =========================================================

    public List<PredictionState> pendingDue(Instant dueBefore, int limit) {
        return stateRepo.findByStatusAndPredictionTimestampLessThanEqualOrderByPredictionTimestampAsc(
                PredictionStatus.PENDING, dueBefore, PageRequest.of(0, Math.max(1, limit)));
    }

    public Optional<PredictionState> stateOf(String predictionId) {
        return stateRepo.findById(predictionId);
    }

    /**
     * @return false, если прогноз уже EVALUATED (в том числе параллельным оценщиком)
     */
    public boolean markEvaluated(String predictionId) {
        return moveTo(predictionId, PredictionStatus.EVALUATED);
    }

    public boolean markExpired(String predictionId) {
        return moveTo(predictionId, PredictionStatus.EXPIRED);
    }

    private boolean moveTo(String predictionId, PredictionStatus next) {
        try {
            return writer.transition(predictionId, next, clock.instant());
        } catch (OptimisticLockingFailureException e) {
            // строку успел сменить другой оценщик: ок, если он пришёл туда же
            PredictionStatus now = stateRepo.findById(predictionId)
                    .map(PredictionState::getStatus)
                    .orElse(null);
            if (now == next) {
                log.debug("📒 LEDGER state id={} already {} (concurrent)", predictionId, next);
                return false;
            }
            throw e;
        }
    }

    public Optional<PredictionState> recordFailure(String predictionId, String error) {
        return writer.recordFailure(predictionId, error, clock.instant());
    }
}
