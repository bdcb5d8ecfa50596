package com.chicu.aiforecast.ai.guard;

import com.chicu.aiforecast.ai.ml.features.FeatureSnapshot;
import com.chicu.aiforecast.ai.ml.features.FeatureSnapshotCodec;
import com.chicu.aiforecast.ai.outcome.EvaluationProperties;
import com.chicu.aiforecast.ai.outcome.ReturnCalculator;
import com.chicu.aiforecast.common.enums.PredictionStatus;
import com.chicu.aiforecast.common.enums.TradeAction;
import com.chicu.aiforecast.common.exception.TemporalIntegrityViolationException;
import com.chicu.aiforecast.common.util.Chunks;
import com.chicu.aiforecast.ledger.LedgerProperties;
import com.chicu.aiforecast.ledger.PredictionLedger;
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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Аудит леджера и таблицы исходов на утечки, дубли и ссылочную целостность.
 * Только читает: ничего не правит и не удаляет, карантин: это список id в отчёте.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TemporalIntegrityGuard {

    private final PredictionRecordRepository predictionRepo;
    private final PredictionOutcomeRepository outcomeRepo;
    private final PredictionStateRepository stateRepo;
    private final PredictionLedger ledger;
    private final FeatureSnapshotCodec snapshotCodec;
    private final GuardProperties props;
    private final LedgerProperties ledgerProps;
    private final EvaluationProperties evalProps;
    private final Clock clock;

    @Transactional(readOnly = true)
    public AuditReport audit(AuditWindow window) {
        AuditWindow w = window != null ? window : AuditWindow.all();
        Instant now = clock.instant();

        List<PredictionRecord> predictions = predictionRepo.findInWindow(w.effectiveFrom(), w.effectiveTo());
        Map<String, PredictionRecord> byId = new LinkedHashMap<>();
        for (PredictionRecord p : predictions) byId.put(p.getPredictionId(), p);

        List<PredictionOutcome> outcomes = Chunks.query(byId.keySet(), outcomeRepo::findByPredictionIdIn);

        List<Violation> out = new ArrayList<>();

        for (PredictionRecord p : predictions) {
            checkPrediction(p, now, out);
        }
        checkDuplicatePredictions(predictions, out);

        for (PredictionOutcome o : outcomes) {
            checkOutcome(o, byId.get(o.getPredictionId()), now, out);
        }
        checkDuplicateOutcomes(outcomes, out);

        for (PredictionOutcome orphan : outcomeRepo.findOrphans()) {
            out.add(Violation.of(ViolationType.ORPHAN_OUTCOME, orphan.getPredictionId(), orphan.getOutcomeId(),
                    "outcome references missing prediction " + orphan.getPredictionId()));
        }

        checkEvaluationBacklog(predictions, now, out);
        checkModelHealth(predictions, now, out);

        AuditReport report = AuditReport.builder()
                .auditedAt(now)
                .window(w)
                .predictionsChecked(predictions.size())
                .outcomesChecked(outcomes.size())
                .violations(out)
                .build();

        Map<Severity, Long> counts = report.countsBySeverity();
        if (report.hasCritical()) {
            log.error("🛡 AUDIT FAILED predictions={} outcomes={} critical={} high={} warn={}",
                    report.predictionsChecked(), report.outcomesChecked(),
                    counts.get(Severity.CRITICAL), counts.get(Severity.HIGH), counts.get(Severity.WARNING));
        } else if (!report.passed()) {
            log.warn("🛡 AUDIT quarantine predictions={} outcomes={} high={} warn={} quarantinedPredictions={}",
                    report.predictionsChecked(), report.outcomesChecked(),
                    counts.get(Severity.HIGH), counts.get(Severity.WARNING), report.quarantinedPredictionIds().size());
        } else {
            log.info("🛡 AUDIT OK predictions={} outcomes={} warn={}",
                    report.predictionsChecked(), report.outcomesChecked(), counts.get(Severity.WARNING));
        }
        return report;
    }

    /**
     * Аудит перед оценкой/обучением за окно preRunLookback.
     *
     * @throws TemporalIntegrityViolationException при любой критичной находке
     */
    public AuditReport requireNoCritical(String stage) {
        AuditReport report = audit(AuditWindow.since(clock.instant().minus(props.getPreRunLookback())));
        if (report.hasCritical()) {
            List<Violation> critical = report.critical();
            log.error("🛡 {} halted: {} critical violation(s), first={}", stage, critical.size(), critical.get(0));
            throw new TemporalIntegrityViolationException(stage + " halted: " + critical.size()
                    + " critical temporal violation(s), first: " + critical.get(0).message(), report);
        }
        return report;
    }

    // =========================================================
    // predictions
    // =========================================================

    private void checkPrediction(PredictionRecord p, Instant now, List<Violation> out) {
        Instant ts = p.getPredictionTimestamp();

        if (ts.isAfter(now.plus(props.getClockSkew()))) {
            out.add(Violation.of(ViolationType.FUTURE_TIMESTAMP, p.getPredictionId(), null,
                    "prediction_timestamp " + ts + " is in the future (now " + now + ")"));
        }

        Duration gap = Duration.between(ts, p.getCreatedAt()).abs();
        if (gap.compareTo(ledgerProps.getCreationTolerance()) > 0) {
            out.add(Violation.of(ViolationType.BACKDATED_PREDICTION, p.getPredictionId(), null,
                    "created_at differs from prediction_timestamp by " + gap));
        }

        FeatureSnapshot snapshot;
        try {
            snapshot = snapshotCodec.decode(p.getFeaturesJson());
        } catch (RuntimeException e) {
            out.add(Violation.of(ViolationType.MALFORMED_SNAPSHOT, p.getPredictionId(), null,
                    "feature snapshot unreadable: " + e.getMessage()));
            return;
        }

        Instant limit = ts.plus(props.getFeatureLeakageTolerance());
        if (snapshot.collectedAt() != null && snapshot.collectedAt().isAfter(limit)) {
            out.add(Violation.of(ViolationType.LEAKAGE, p.getPredictionId(), null,
                    "features collected at " + snapshot.collectedAt() + " after prediction " + ts));
        }
        if (snapshot.observedAt() != null) {
            for (Map.Entry<String, Instant> e : snapshot.observedAt().entrySet()) {
                Instant seen = e.getValue();
                if (seen != null && seen.isAfter(limit)) {
                    out.add(Violation.of(ViolationType.LEAKAGE, p.getPredictionId(), null,
                            "feature '" + e.getKey() + "' observed at " + seen + " after prediction " + ts));
                }
            }
        }

        TradeAction a = p.getPredictedAction();
        Integer dir = p.getPredictedDirection();
        if (dir != null && ((a.isBuy() && dir < 0) || (a.isSell() && dir > 0))) {
            out.add(Violation.of(ViolationType.SIGNAL_CONTRADICTION, p.getPredictionId(), null,
                    "action " + a + " contradicts direction " + dir));
        }
    }

    private void checkDuplicatePredictions(List<PredictionRecord> predictions, List<Violation> out) {
        Map<String, List<PredictionRecord>> groups = new LinkedHashMap<>();
        for (PredictionRecord p : predictions) {
            String key = p.getSymbol() + "|" + ledger.bucketOf(p.getPredictionTimestamp());
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(p);
        }
        for (Map.Entry<String, List<PredictionRecord>> g : groups.entrySet()) {
            if (g.getValue().size() < 2) continue;
            for (PredictionRecord p : g.getValue()) {
                out.add(Violation.of(ViolationType.DUPLICATE, p.getPredictionId(), null,
                        g.getValue().size() + " predictions share symbol/bucket " + g.getKey()));
            }
        }
    }

    // =========================================================
    // outcomes
    // =========================================================

    private void checkOutcome(PredictionOutcome o, PredictionRecord p, Instant now, List<Violation> out) {
        if (p == null) {
            // вне окна аудита, ссылочную целостность проверяет findOrphans
            return;
        }
        String pid = p.getPredictionId();
        String oid = o.getOutcomeId();

        Duration age = Duration.between(p.getPredictionTimestamp(), o.getEvaluationTimestamp());
        if (age.compareTo(evalProps.getMinDelay()) < 0) {
            out.add(Violation.of(ViolationType.MIN_DELAY, pid, oid,
                    "outcome evaluated " + age + " after prediction, minimum " + evalProps.getMinDelay()));
        }

        if (!o.getExitAt().isAfter(p.getPredictionTimestamp())) {
            out.add(Violation.of(ViolationType.EXIT_BEFORE_ENTRY, pid, oid,
                    "exit " + o.getExitAt() + " is not after prediction " + p.getPredictionTimestamp()));
        }

        if (o.getEvaluationTimestamp().isAfter(now.plus(props.getClockSkew()))
                || o.getExitAt().isAfter(o.getEvaluationTimestamp())) {
            out.add(Violation.of(ViolationType.FUTURE_TIMESTAMP, pid, oid,
                    "outcome uses data not yet observable: exit=" + o.getExitAt()
                            + " evaluated=" + o.getEvaluationTimestamp()));
        }

        try {
            double expected = ReturnCalculator.returnPct(o.getEntryPrice(), o.getExitPrice());
            if (Math.abs(expected - o.getActualReturnPct()) > props.getReturnMismatchPct()
                    || ReturnCalculator.direction(expected) != o.getActualDirection()) {
                out.add(Violation.of(ViolationType.RETURN_MISMATCH, pid, oid, String.format(Locale.ROOT,
                        "stored return %.4f%% dir=%d, prices give %.4f%%",
                        o.getActualReturnPct(), o.getActualDirection(), expected)));
            }
        } catch (IllegalArgumentException e) {
            out.add(Violation.of(ViolationType.RETURN_MISMATCH, pid, oid, e.getMessage()));
        }

        if (Math.abs(o.getActualReturnPct()) > props.getExtremeReturnPct()) {
            out.add(Violation.of(ViolationType.EXTREME_RETURN, pid, oid, String.format(Locale.ROOT,
                    "return %.2f%% above %.0f%%", o.getActualReturnPct(), props.getExtremeReturnPct())));
        }
    }

    private void checkDuplicateOutcomes(List<PredictionOutcome> outcomes, List<Violation> out) {
        Map<String, List<PredictionOutcome>> groups = new HashMap<>();
        for (PredictionOutcome o : outcomes) {
            groups.computeIfAbsent(o.getPredictionId() + "|" + o.getHorizon(), k -> new ArrayList<>()).add(o);
        }
        for (List<PredictionOutcome> g : groups.values()) {
            if (g.size() < 2) continue;
            for (PredictionOutcome o : g) {
                out.add(Violation.of(ViolationType.DUPLICATE, o.getPredictionId(), o.getOutcomeId(),
                        g.size() + " outcomes for prediction/horizon " + o.getPredictionId() + "/" + o.getHorizon()));
            }
        }
    }

    // =========================================================
    // aggregate warnings
    // =========================================================

    private void checkEvaluationBacklog(List<PredictionRecord> predictions, Instant now, List<Violation> out) {
        Instant matured = now.minus(evalProps.longestHorizon()).minus(Duration.ofDays(1));
        List<String> old = predictions.stream()
                .filter(p -> p.getPredictionTimestamp().isBefore(matured))
                .map(PredictionRecord::getPredictionId)
                .toList();
        if (old.isEmpty()) return;

        List<PredictionState> states = Chunks.query(old, stateRepo::findByPredictionIdIn);
        long done = states.stream().filter(s -> s.getStatus() != PredictionStatus.PENDING
                && s.getStatus() != PredictionStatus.CREATED).count();
        double rate = (double) done / old.size();
        if (rate < props.getMinEvaluationRate()) {
            out.add(Violation.aggregate(ViolationType.EVALUATION_BACKLOG, String.format(Locale.ROOT,
                    "only %.1f%% of %d matured predictions left PENDING (floor %.0f%%)",
                    rate * 100.0, old.size(), props.getMinEvaluationRate() * 100.0)));
        }
    }

    private void checkModelHealth(List<PredictionRecord> predictions, Instant now, List<Violation> out) {
        Instant since = now.minus(props.getModelHealthLookback());
        List<PredictionRecord> recent = predictions.stream()
                .filter(p -> !p.getPredictionTimestamp().isBefore(since))
                .toList();
        if (recent.size() <= props.getSameActionLimit()) return;

        long distinctActions = recent.stream().map(PredictionRecord::getPredictedAction).distinct().count();
        if (distinctActions == 1) {
            out.add(Violation.aggregate(ViolationType.MODEL_HEALTH, "all " + recent.size()
                    + " recent predictions are " + recent.get(0).getPredictedAction()));
        }

        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (PredictionRecord p : recent) {
            min = Math.min(min, p.getActionConfidence());
            max = Math.max(max, p.getActionConfidence());
        }
        if (max - min < props.getNarrowConfidenceRange()) {
            out.add(Violation.aggregate(ViolationType.MODEL_HEALTH, String.format(Locale.ROOT,
                    "confidence range %.3f..%.3f narrower than %.2f", min, max, props.getNarrowConfidenceRange())));
        }
    }
}
