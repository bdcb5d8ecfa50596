package com.chicu.aiforecast.ai.ml;

import com.chicu.aiforecast.ai.guard.AuditReport;
import com.chicu.aiforecast.ai.guard.AuditWindow;
import com.chicu.aiforecast.ai.guard.Violation;
import com.chicu.aiforecast.ai.guard.ViolationType;
import com.chicu.aiforecast.ai.ml.features.FeatureSchema;
import com.chicu.aiforecast.ai.ml.features.FeatureSnapshot;
import com.chicu.aiforecast.ai.ml.features.FeatureSnapshotCodec;
import com.chicu.aiforecast.ai.ml.features.FeatureVector;
import com.chicu.aiforecast.ai.ml.model.ClassScore;
import com.chicu.aiforecast.ai.ml.model.DirectionLabels;
import com.chicu.aiforecast.ai.ml.model.ModelBundle;
import com.chicu.aiforecast.ai.ml.training.TrainingProperties;
import com.chicu.aiforecast.ai.persistence.ModelRegistry;
import com.chicu.aiforecast.common.enums.TradeAction;
import com.chicu.aiforecast.common.exception.FeatureSchemaException;
import com.chicu.aiforecast.common.exception.TemporalIntegrityViolationException;
import com.chicu.aiforecast.ledger.LedgerProperties;
import com.chicu.aiforecast.ledger.PredictionLedger;
import com.chicu.aiforecast.ledger.PredictionRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Инференс: вектор фич -> неизменяемый прогноз в леджере.
 * Все три оценщика берутся из одного и того же продвинутого бандла.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PredictionEngine {

    private final ModelRegistry registry;
    private final PredictionLedger ledger;
    private final FeatureSnapshotCodec snapshotCodec;
    private final LedgerProperties ledgerProps;
    private final TrainingProperties trainingProps;
    private final Clock clock;

    public PredictionRecord predict(FeatureVector features) {
        if (features == null) throw new FeatureSchemaException("feature vector is null");
        return predict(features.symbol(), features);
    }

    /**
     * @throws FeatureSchemaException               вектор не совпадает со схемой бандла (ничего не записано)
     * @throws TemporalIntegrityViolationException фичи собраны не "сейчас" (ничего не записано)
     * @throws com.chicu.aiforecast.common.exception.DuplicatePredictionException прогноз для бакета уже есть
     */
    public PredictionRecord predict(String symbol, FeatureVector features) {
        if (symbol == null || symbol.isBlank()) throw new FeatureSchemaException("symbol is blank");
        if (features == null) throw new FeatureSchemaException("feature vector is null");
        String sym = symbol.trim().toUpperCase(Locale.ROOT);
        if (sym.length() > PredictionRecord.SYMBOL_MAX_LENGTH) {
            throw new FeatureSchemaException("symbol longer than " + PredictionRecord.SYMBOL_MAX_LENGTH + " chars");
        }
        if (features.symbol() != null && !features.symbol().trim().equalsIgnoreCase(sym)) {
            throw new FeatureSchemaException("feature vector symbol " + features.symbol() + " != " + sym);
        }
        Instant collectedAt = features.collectedAt();
        if (collectedAt == null) throw new FeatureSchemaException("collection timestamp is missing");

        // одно чтение ссылки: дальше работаем только с этим бандлом
        ModelBundle bundle = registry.requireCurrent();
        FeatureSchema schema = bundle.getSchema();

        double[] x = schema.toVector(features.values());
        checkObservationTimes(features, schema);

        Instant now = clock.instant();
        Duration gap = Duration.between(collectedAt, now).abs();
        if (gap.compareTo(ledgerProps.getCreationTolerance()) > 0) {
            log.error("❌ PREDICT refused symbol={} collectedAt={} now={} gap={}", sym, collectedAt, now, gap);
            AuditReport report = AuditReport.builder()
                    .auditedAt(now)
                    .window(AuditWindow.all())
                    .violations(List.of(Violation.of(ViolationType.BACKDATED_PREDICTION, null, null,
                            "features collected " + gap + " away from now for " + sym)))
                    .build();
            throw new TemporalIntegrityViolationException("prediction for " + sym + " collected at " + collectedAt
                    + " is " + gap + " away from now (tolerance " + ledgerProps.getCreationTolerance() + ")", report);
        }

        ClassScore action = bundle.getActionModel().top(x);
        TradeAction predictedAction = TradeAction.parse(action.label());

        ClassScore dir = bundle.getDirectionModel().top(x);
        Integer predictedDirection = dir.probability() >= trainingProps.getDirectionAbstainBelow()
                ? DirectionLabels.toDirection(dir.label())
                : null;

        double magnitude = bundle.getMagnitudeModel().predict(x);
        if (!Double.isFinite(magnitude)) {
            throw new IllegalStateException("magnitude model returned " + magnitude + " version=" + bundle.getVersion());
        }

        String snapshotJson = snapshotCodec.encode(FeatureSnapshot.of(features, schema));
        if (snapshotJson.length() > PredictionRecord.FEATURES_JSON_MAX_LENGTH) {
            throw new FeatureSchemaException("feature snapshot is " + snapshotJson.length() + " chars, max "
                    + PredictionRecord.FEATURES_JSON_MAX_LENGTH);
        }

        PredictionRecord record = PredictionRecord.builder()
                .predictionId(UUID.randomUUID().toString())
                .symbol(sym)
                .bucketStart(ledger.bucketOf(collectedAt))
                .predictionTimestamp(collectedAt)
                .predictedAction(predictedAction)
                .actionConfidence(action.probability())
                .predictedDirection(predictedDirection)
                .predictedMagnitude(magnitude)
                .featuresJson(snapshotJson)
                .schemaHash(schema.schemaHash())
                .modelVersion(bundle.getVersion())
                .createdAt(now)
                .build();

        PredictionRecord saved = ledger.append(record);

        log.debug("🧠 PREDICT OK symbol={} action={} conf={} dir={} mag={} ver={}",
                sym, predictedAction, action.probability(), predictedDirection, magnitude, bundle.getVersion());
        return saved;
    }

    private static void checkObservationTimes(FeatureVector features, FeatureSchema schema) {
        Set<String> known = Set.of(schema.featureNames());
        for (Map.Entry<String, Instant> e : features.observedAt().entrySet()) {
            if (!known.contains(e.getKey())) {
                throw new FeatureSchemaException("observation time for unknown feature '" + e.getKey() + "'");
            }
            if (e.getValue() != null && e.getValue().isAfter(features.collectedAt())) {
                throw new FeatureSchemaException("feature '" + e.getKey() + "' observed at " + e.getValue()
                        + " after collection " + features.collectedAt());
            }
        }
    }
}
