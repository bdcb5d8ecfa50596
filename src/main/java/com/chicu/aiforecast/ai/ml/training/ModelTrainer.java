package com.chicu.aiforecast.ai.ml.training;

import com.chicu.aiforecast.ai.guard.AuditReport;
import com.chicu.aiforecast.ai.guard.TemporalIntegrityGuard;
import com.chicu.aiforecast.ai.ml.dataset.TrainingDatasetBuilder;
import com.chicu.aiforecast.ai.ml.features.FeatureSchema;
import com.chicu.aiforecast.ai.ml.model.ModelBundle;
import com.chicu.aiforecast.ai.persistence.ModelRegistry;
import com.chicu.aiforecast.common.enums.TradeAction;
import com.chicu.aiforecast.common.exception.ForecastException;
import com.chicu.aiforecast.common.exception.InsufficientTrainingDataException;
import com.chicu.aiforecast.common.exception.TemporalIntegrityViolationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Обучение на парах (прогноз, исход) строго старше cutoff и продвижение только после проверки на отложенной выборке.
 * Один запуск одновременно; любой выход до promote оставляет текущий бандл как был.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModelTrainer {

    private final TemporalIntegrityGuard guard;
    private final TrainingDatasetBuilder datasetBuilder;
    private final BundleFitter fitter;
    private final HoldoutEvaluator holdoutEvaluator;
    private final ModelRegistry registry;
    private final TrainingProperties props;
    private final Clock clock;

    /**
     * ✅ Защита от параллельного обучения: второй вызов сразу получает ALREADY_RUNNING.
     */
    private final AtomicBoolean running = new AtomicBoolean(false);

    public TrainingReport train() {
        return train(clock.instant().minus(props.getHoldoutWindow()));
    }

    public TrainingReport train(Instant cutoff) {
        if (cutoff == null || cutoff.isAfter(clock.instant())) {
            throw new IllegalArgumentException("cutoff must not be in the future: " + cutoff);
        }
        if (!running.compareAndSet(false, true)) {
            log.info("🧠 TRAIN SKIP: already running");
            return TrainingReport.builder()
                    .status(TrainingStatus.ALREADY_RUNNING)
                    .reason("training is already running")
                    .cutoff(cutoff)
                    .build();
        }

        Instant startedAt = clock.instant();
        try {
            return doTrain(cutoff, startedAt);
        } catch (ForecastException e) {
            throw e;
        } catch (Exception e) {
            log.error("❌ TRAIN FAILED cutoff={} : {}", cutoff, e.getMessage(), e);
            return TrainingReport.builder()
                    .status(TrainingStatus.FAILED)
                    .reason("training failed: " + e.getMessage())
                    .cutoff(cutoff)
                    .startedAt(startedAt)
                    .finishedAt(clock.instant())
                    .previousVersion(registry.current().map(ModelBundle::getVersion).orElse(null))
                    .build();
        } finally {
            running.set(false);
        }
    }

    /**
     * То же, что {@link #train(Instant)}, но нехватка данных: исключение (для API).
     */
    public TrainingReport trainOrThrow() {
        return trainOrThrow(clock.instant().minus(props.getHoldoutWindow()));
    }

    public TrainingReport trainOrThrow(Instant cutoff) {
        TrainingReport report = train(cutoff);
        if (report.status() == TrainingStatus.ABORTED_INSUFFICIENT_DATA) {
            throw new InsufficientTrainingDataException(report.reason());
        }
        return report;
    }

    public boolean isRunning() {
        return running.get();
    }

    // =========================================================

    private TrainingReport doTrain(Instant cutoff, Instant startedAt) {
        Instant now = clock.instant();

        AuditReport audit = guard.requireNoCritical("training");

        Optional<ModelBundle> current = registry.current();
        FeatureSchema schema = current.map(ModelBundle::getSchema)
                .orElseGet(() -> new FeatureSchema(props.getFeatureNames()));
        String previousVersion = current.map(ModelBundle::getVersion).orElse(null);

        TrainingReport.TrainingReportBuilder report = TrainingReport.builder()
                .cutoff(cutoff)
                .startedAt(startedAt)
                .previousVersion(previousVersion);

        log.info("🧠 TRAIN START cutoff={} lookback={} schema={} current={}",
                cutoff, props.getLookback(), schema.schemaHash(), previousVersion);

        TrainingDatasetBuilder.Dataset train =
                datasetBuilder.build(schema, cutoff.minus(props.getLookback()), cutoff, audit);
        requireBeforeCutoff(train, cutoff);

        report.trainingRows(train.size())
                .actionCounts(train.actionCounts())
                .directionCounts(train.directionCounts());

        String insufficient = insufficiency(train);
        if (insufficient != null) {
            log.warn("⚠️ TRAIN ABORTED insufficient data: {}", insufficient);
            return report.status(TrainingStatus.ABORTED_INSUFFICIENT_DATA)
                    .reason(insufficient)
                    .finishedAt(clock.instant())
                    .build();
        }

        TrainingDatasetBuilder.Dataset holdout = cutoff.isBefore(now)
                ? datasetBuilder.build(schema, cutoff, now, audit)
                : null;
        int holdoutRows = holdout != null ? holdout.size() : 0;
        report.holdoutRows(holdoutRows);
        if (holdoutRows < props.getMinHoldoutRows()) {
            String reason = "holdout too small: " + holdoutRows + " < " + props.getMinHoldoutRows();
            log.warn("⚠️ TRAIN REJECTED {}", reason);
            return report.status(TrainingStatus.REJECTED).reason(reason).finishedAt(clock.instant()).build();
        }

        if (cancelled()) return cancelled(report);

        FittedModels fitted = fitter.fit(train);

        if (cancelled()) return cancelled(report);

        String version = registry.nextVersion();
        ModelBundle candidate = ModelBundle.builder()
                .version(version)
                .schema(schema)
                .actionModel(fitted.action())
                .directionModel(fitted.direction())
                .magnitudeModel(fitted.magnitude())
                .trainedFrom(train.earliest())
                .trainedTo(train.latest())
                .createdAt(clock.instant())
                .build();

        HoldoutReport candidateScore = holdoutEvaluator.evaluate(candidate, holdout);
        HoldoutReport currentScore = current.map(b -> holdoutEvaluator.evaluate(b, holdout)).orElse(null);
        report.modelVersion(version).candidate(candidateScore).current(currentScore);

        String regression = regression(candidateScore, currentScore);
        if (regression != null) {
            log.warn("⚠️ TRAIN REJECTED version={} {}", version, regression);
            return report.status(TrainingStatus.REJECTED).reason(regression).finishedAt(clock.instant()).build();
        }

        if (cancelled()) return cancelled(report);

        registry.promote(candidate.withHoldout(candidateScore));

        log.info("✅ TRAIN DONE promoted={} previous={} rows={} holdout={} candidate={} current={}",
                version, previousVersion, train.size(), holdout.size(), candidateScore, currentScore);

        return report.status(TrainingStatus.PROMOTED)
                .reason("holdout floors hold")
                .finishedAt(clock.instant())
                .build();
    }

    private static void requireBeforeCutoff(TrainingDatasetBuilder.Dataset ds, Instant cutoff) {
        for (TrainingDatasetBuilder.Row r : ds.rows()) {
            if (!r.predictionTimestamp().isBefore(cutoff)) {
                throw new TemporalIntegrityViolationException("training row " + r.predictionId()
                        + " at " + r.predictionTimestamp() + " is not before cutoff " + cutoff, null);
            }
        }
    }

    /**
     * @return причина нехватки данных или null
     */
    String insufficiency(TrainingDatasetBuilder.Dataset ds) {
        int floor = props.getMinSamplesPerClass();
        if (ds.size() < props.getMinTrainingRows()) {
            return "training rows " + ds.size() + " < " + props.getMinTrainingRows();
        }

        Map<Integer, Integer> dirs = ds.directionCounts();
        if (dirs.get(1) < floor || dirs.get(-1) < floor) {
            return "direction classes below " + floor + ": " + dirs;
        }

        Map<TradeAction, Integer> actions = ds.actionCounts();
        long usable = actions.values().stream().filter(c -> c >= floor).count();
        if (usable < 2) {
            return "fewer than two action classes with " + floor + "+ rows: " + actions;
        }
        return null;
    }

    /**
     * @return описание регресса или null, если кандидат не хуже текущего в пределах допусков
     */
    String regression(HoldoutReport candidate, HoldoutReport current) {
        if (current == null) return null;

        if (candidate.actionAccuracy() < current.actionAccuracy() - props.getMaxAccuracyDrop()) {
            return String.format(Locale.ROOT, "action accuracy %.4f < current %.4f - %.4f",
                    candidate.actionAccuracy(), current.actionAccuracy(), props.getMaxAccuracyDrop());
        }
        if (current.directionCoverage() > 0.0 && candidate.directionCoverage() > 0.0
                && candidate.directionAccuracy() < current.directionAccuracy() - props.getMaxAccuracyDrop()) {
            return String.format(Locale.ROOT, "direction accuracy %.4f < current %.4f - %.4f",
                    candidate.directionAccuracy(), current.directionAccuracy(), props.getMaxAccuracyDrop());
        }
        if (candidate.magnitudeMae() > current.magnitudeMae() + props.getMaxMaeIncrease()) {
            return String.format(Locale.ROOT, "magnitude MAE %.4f > current %.4f + %.4f",
                    candidate.magnitudeMae(), current.magnitudeMae(), props.getMaxMaeIncrease());
        }
        return null;
    }

    private static boolean cancelled() {
        return Thread.currentThread().isInterrupted();
    }

    private TrainingReport cancelled(TrainingReport.TrainingReportBuilder report) {
        log.warn("⚠️ TRAIN CANCELLED, promoted bundle unchanged");
        return report.status(TrainingStatus.CANCELLED)
                .reason("interrupted before promotion")
                .finishedAt(clock.instant())
                .build();
    }
}
