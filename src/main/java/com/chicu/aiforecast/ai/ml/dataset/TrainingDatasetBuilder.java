package com.chicu.aiforecast.ai.ml.dataset;

import com.chicu.aiforecast.ai.guard.AuditReport;
import com.chicu.aiforecast.ai.ml.features.FeatureSchema;
import com.chicu.aiforecast.ai.ml.features.FeatureSnapshot;
import com.chicu.aiforecast.ai.ml.features.FeatureSnapshotCodec;
import com.chicu.aiforecast.ai.ml.training.TrainingProperties;
import com.chicu.aiforecast.common.enums.PredictionStatus;
import com.chicu.aiforecast.common.enums.TradeAction;
import com.chicu.aiforecast.common.time.Timeframe;
import com.chicu.aiforecast.common.util.Chunks;
import com.chicu.aiforecast.ledger.PredictionOutcome;
import com.chicu.aiforecast.ledger.PredictionOutcomeRepository;
import com.chicu.aiforecast.ledger.PredictionRecord;
import com.chicu.aiforecast.ledger.PredictionRecordRepository;
import com.chicu.aiforecast.ledger.PredictionState;
import com.chicu.aiforecast.ledger.PredictionStateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;

/**
 * TrainingDatasetBuilder
 * ======================
 * Собирает пары (прогноз, исход) за окно [from, to) по prediction_timestamp:
 * - только EVALUATED прогнозы (EXPIRED и PENDING не попадают);
 * - только исход горизонта разметки;
 * - без строк из карантина аудита;
 * - фичи: слепок из самого прогноза, в порядке схемы.
 *
 * Окно проверяется дважды: в запросе и ещё раз в памяти.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrainingDatasetBuilder {

    private final PredictionRecordRepository predictionRepo;
    private final PredictionOutcomeRepository outcomeRepo;
    private final PredictionStateRepository stateRepo;
    private final FeatureSnapshotCodec snapshotCodec;
    private final ActionLabeler labeler;
    private final TrainingProperties props;

    /**
     * Одна обучающая строка.
     *
     * @param direction +1 / -1, null при нулевой доходности (в модель направления не идёт)
     */
    public record Row(
            String predictionId,
            Instant predictionTimestamp,
            double[] x,
            TradeAction action,
            Integer direction,
            double returnPct
    ) {}

    /**
     * Готовый датасет.
     */
    public record Dataset(
            String datasetId,
            FeatureSchema schema,
            Instant from,
            Instant to,
            List<Row> rows,
            int skippedSchema,
            int skippedQuarantine
    ) {
        public Dataset {
            rows = List.copyOf(rows);
        }

        public int size() {
            return rows.size();
        }

        public Map<TradeAction, Integer> actionCounts() {
            Map<TradeAction, Integer> m = new EnumMap<>(TradeAction.class);
            for (Row r : rows) m.merge(r.action(), 1, Integer::sum);
            return m;
        }

        /** Ключи: +1 / -1 */
        public Map<Integer, Integer> directionCounts() {
            Map<Integer, Integer> m = new TreeMap<>();
            m.put(1, 0);
            m.put(-1, 0);
            for (Row r : rows) {
                if (r.direction() != null) m.merge(r.direction(), 1, Integer::sum);
            }
            return m;
        }

        public Instant earliest() {
            return rows.stream().map(Row::predictionTimestamp).min(Instant::compareTo).orElse(null);
        }

        public Instant latest() {
            return rows.stream().map(Row::predictionTimestamp).max(Instant::compareTo).orElse(null);
        }
    }

    @Transactional(readOnly = true)
    public Dataset build(FeatureSchema schema, Instant from, Instant to, AuditReport audit) {
        List<PredictionRecord> predictions = predictionRepo.findInWindow(from, to);
        List<String> ids = predictions.stream().map(PredictionRecord::getPredictionId).toList();

        Set<String> evaluated = new HashSet<>();
        for (PredictionState st : Chunks.query(ids, stateRepo::findByPredictionIdIn)) {
            if (st.getStatus() == PredictionStatus.EVALUATED) evaluated.add(st.getPredictionId());
        }

        String horizon = Timeframe.from(props.getLabelHorizon()).getCode();
        Map<String, PredictionOutcome> outcomes = new HashMap<>();
        for (PredictionOutcome o : Chunks.query(ids, outcomeRepo::findByPredictionIdIn)) {
            if (horizon.equals(o.getHorizon())) outcomes.put(o.getPredictionId(), o);
        }

        Set<String> quarantinedPredictions = audit != null ? audit.quarantinedPredictionIds() : Set.of();
        Set<String> quarantinedOutcomes = audit != null ? audit.quarantinedOutcomeIds() : Set.of();

        return assemble(schema, from, to, predictions, outcomes, evaluated, quarantinedPredictions, quarantinedOutcomes);
    }

    /**
     * Чистая сборка без обращения к БД.
     */
    public Dataset assemble(FeatureSchema schema,
                            Instant from,
                            Instant to,
                            List<PredictionRecord> predictions,
                            Map<String, PredictionOutcome> outcomesByPrediction,
                            Set<String> evaluatedIds,
                            Set<String> quarantinedPredictions,
                            Set<String> quarantinedOutcomes) {
        if (schema == null) throw new IllegalArgumentException("schema=null");
        if (from == null || to == null || !from.isBefore(to)) {
            throw new IllegalArgumentException("bad window from=" + from + " to=" + to);
        }

        List<Row> rows = new ArrayList<>();
        int skippedSchema = 0;
        int skippedQuarantine = 0;

        for (PredictionRecord p : predictions) {
            Instant ts = p.getPredictionTimestamp();
            if (ts.isBefore(from) || !ts.isBefore(to)) continue;
            if (!evaluatedIds.contains(p.getPredictionId())) continue;

            PredictionOutcome o = outcomesByPrediction.get(p.getPredictionId());
            if (o == null) continue;

            if (quarantinedPredictions.contains(p.getPredictionId()) || quarantinedOutcomes.contains(o.getOutcomeId())) {
                skippedQuarantine++;
                continue;
            }

            double[] x;
            try {
                FeatureSnapshot snap = snapshotCodec.decode(p.getFeaturesJson());
                if (!schema.matches(snap.values())) {
                    skippedSchema++;
                    continue;
                }
                x = schema.toVector(snap.values());
            } catch (RuntimeException e) {
                skippedSchema++;
                continue;
            }

            double ret = o.getActualReturnPct();
            TradeAction action = labeler.label(ret, p.getActionConfidence());
            Integer direction = o.getActualDirection() == 0 ? null : o.getActualDirection();

            rows.add(new Row(p.getPredictionId(), ts, x, action, direction, ret));
        }

        Dataset ds = new Dataset(UUID.randomUUID().toString(), schema, from, to, rows, skippedSchema, skippedQuarantine);

        log.info("📦 Dataset built: id={} window=[{}, {}) rows={} features={} skippedSchema={} skippedQuarantine={} actions={}",
                ds.datasetId(), from, to, ds.size(), schema.size(), skippedSchema, skippedQuarantine, ds.actionCounts());
        return ds;
    }
}
