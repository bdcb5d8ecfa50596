package com.chicu.aiforecast.ai.ml.dataset;

import com.chicu.aiforecast.ai.ml.features.FeatureSchema;
import com.chicu.aiforecast.ai.ml.training.TrainingProperties;
import com.chicu.aiforecast.common.enums.TradeAction;
import com.chicu.aiforecast.ledger.PredictionOutcome;
import com.chicu.aiforecast.ledger.PredictionRecord;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static com.chicu.aiforecast.support.LedgerFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class TrainingDatasetBuilderTest {

    private static final Instant CUTOFF = Instant.parse("2026-03-01T00:00:00Z");

    private final TrainingProperties props = new TrainingProperties();
    private final TrainingDatasetBuilder builder = new TrainingDatasetBuilder(
            null, null, null, CODEC, new ThresholdActionLabeler(props), props);

    private final List<PredictionRecord> predictions = new ArrayList<>();
    private final Map<String, PredictionOutcome> outcomes = new HashMap<>();
    private final Set<String> evaluated = new HashSet<>();

    private PredictionRecord addEvaluated(String symbol, Instant ts, double exitPrice, double confidence) {
        PredictionRecord p = prediction(symbol, ts).actionConfidence(confidence).build();
        predictions.add(p);
        outcomes.put(p.getPredictionId(), outcome(p, Duration.ofDays(1), 100.0, exitPrice).build());
        evaluated.add(p.getPredictionId());
        return p;
    }

    private TrainingDatasetBuilder.Dataset assemble(Instant from, Instant to,
                                                    Set<String> quarantinedPredictions,
                                                    Set<String> quarantinedOutcomes) {
        return builder.assemble(SCHEMA, from, to, predictions, outcomes, evaluated,
                quarantinedPredictions, quarantinedOutcomes);
    }

    @Test
    void randomTimestampsAroundCutoff_neverLeakIntoTrainingSet() {
        Random rnd = new Random(7);
        int before = 0;
        for (int i = 0; i < 300; i++) {
            long offsetSec = (long) ((rnd.nextDouble() * 20 - 10) * 86400);
            Instant ts = CUTOFF.plusSeconds(offsetSec);
            if (ts.isBefore(CUTOFF)) before++;
            addEvaluated("S" + i, ts, 95.0 + rnd.nextDouble() * 10.0, rnd.nextDouble());
        }
        // ровно на границе: в обучение не идёт
        addEvaluated("EDGE", CUTOFF, 101.0, 0.5);

        TrainingDatasetBuilder.Dataset ds = assemble(CUTOFF.minus(Duration.ofDays(30)), CUTOFF, Set.of(), Set.of());

        assertEquals(before, ds.size());
        assertTrue(ds.rows().stream().allMatch(r -> r.predictionTimestamp().isBefore(CUTOFF)));
        assertTrue(ds.latest().isBefore(CUTOFF));
    }

    @Test
    void rows_areLabeledFromOutcome_andFeaturesComeFromSnapshot() {
        PredictionRecord up = addEvaluated("QBE", CUTOFF.minus(Duration.ofDays(2)), 102.76, 0.9);
        addEvaluated("FLAT", CUTOFF.minus(Duration.ofDays(3)), 100.0, 0.9);
        addEvaluated("DOWN", CUTOFF.minus(Duration.ofDays(4)), 99.0, 0.9);

        TrainingDatasetBuilder.Dataset ds = assemble(CUTOFF.minus(Duration.ofDays(30)), CUTOFF, Set.of(), Set.of());

        TrainingDatasetBuilder.Row row = ds.rows().stream()
                .filter(r -> r.predictionId().equals(up.getPredictionId()))
                .findFirst()
                .orElseThrow();
        assertEquals(TradeAction.STRONG_BUY, row.action());
        assertEquals(1, row.direction());
        assertEquals(2.76, row.returnPct(), 1e-9);
        assertArrayEquals(new double[]{55.0, 0.1, 1.1}, row.x(), 1e-12);

        assertEquals(Map.of(1, 1, -1, 1), ds.directionCounts());
        assertEquals(1, ds.actionCounts().get(TradeAction.HOLD));
        assertEquals(1, ds.actionCounts().get(TradeAction.SELL));
    }

    @Test
    void pendingExpiredAndOutcomeLessPredictions_areExcluded() {
        addEvaluated("OK", CUTOFF.minus(Duration.ofDays(2)), 101.0, 0.5);

        PredictionRecord pending = prediction("PEND", CUTOFF.minus(Duration.ofDays(2))).build();
        predictions.add(pending);
        outcomes.put(pending.getPredictionId(), outcome(pending, Duration.ofDays(1), 100.0, 101.0).build());

        PredictionRecord noOutcome = prediction("NONE", CUTOFF.minus(Duration.ofDays(2))).build();
        predictions.add(noOutcome);
        evaluated.add(noOutcome.getPredictionId());

        TrainingDatasetBuilder.Dataset ds = assemble(CUTOFF.minus(Duration.ofDays(30)), CUTOFF, Set.of(), Set.of());

        assertEquals(1, ds.size());
    }

    @Test
    void quarantinedRows_areSkippedAndCounted() {
        PredictionRecord a = addEvaluated("A", CUTOFF.minus(Duration.ofDays(2)), 101.0, 0.5);
        PredictionRecord b = addEvaluated("B", CUTOFF.minus(Duration.ofDays(2)), 101.0, 0.5);
        addEvaluated("C", CUTOFF.minus(Duration.ofDays(2)), 101.0, 0.5);

        String badOutcome = outcomes.get(b.getPredictionId()).getOutcomeId();
        TrainingDatasetBuilder.Dataset ds = assemble(CUTOFF.minus(Duration.ofDays(30)), CUTOFF,
                Set.of(a.getPredictionId()), Set.of(badOutcome));

        assertEquals(1, ds.size());
        assertEquals(2, ds.skippedQuarantine());
    }

    @Test
    void snapshotFromOtherSchema_isSkipped() {
        Instant ts = CUTOFF.minus(Duration.ofDays(2));
        PredictionRecord foreign = prediction("OLDSCHEMA", ts)
                .featuresJson(snapshotJson(ts, Map.of("rsi_14", 50.0), Map.of()))
                .build();
        predictions.add(foreign);
        outcomes.put(foreign.getPredictionId(), outcome(foreign, Duration.ofDays(1), 100.0, 101.0).build());
        evaluated.add(foreign.getPredictionId());

        PredictionRecord broken = prediction("BROKEN", ts).featuresJson("{not json").build();
        predictions.add(broken);
        outcomes.put(broken.getPredictionId(), outcome(broken, Duration.ofDays(1), 100.0, 101.0).build());
        evaluated.add(broken.getPredictionId());

        TrainingDatasetBuilder.Dataset ds = assemble(CUTOFF.minus(Duration.ofDays(30)), CUTOFF, Set.of(), Set.of());

        assertEquals(0, ds.size());
        assertEquals(2, ds.skippedSchema());
    }

    @Test
    void emptyOrInvertedWindow_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> assemble(CUTOFF, CUTOFF, Set.of(), Set.of()));
        assertThrows(IllegalArgumentException.class,
                () -> builder.assemble(new FeatureSchema(List.of("x")), CUTOFF, CUTOFF.minusSeconds(1),
                        List.of(), Map.of(), Set.of(), Set.of(), Set.of()));
    }
}
