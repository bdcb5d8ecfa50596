package com.chicu.aiforecast.ai.ml;

import com.chicu.aiforecast.ai.guard.ViolationType;
import com.chicu.aiforecast.ai.ml.features.FeatureSnapshot;
import com.chicu.aiforecast.ai.ml.features.FeatureVector;
import com.chicu.aiforecast.ai.ml.model.BaselineModels;
import com.chicu.aiforecast.ai.ml.model.ClassifierModel;
import com.chicu.aiforecast.ai.ml.model.DirectionLabels;
import com.chicu.aiforecast.ai.ml.model.ModelBundle;
import com.chicu.aiforecast.ai.ml.model.RegressionModel;
import com.chicu.aiforecast.ai.ml.training.TrainingProperties;
import com.chicu.aiforecast.ai.persistence.ModelRegistry;
import com.chicu.aiforecast.common.enums.TradeAction;
import com.chicu.aiforecast.common.exception.FeatureSchemaException;
import com.chicu.aiforecast.common.exception.ModelNotAvailableException;
import com.chicu.aiforecast.common.exception.TemporalIntegrityViolationException;
import com.chicu.aiforecast.ledger.LedgerProperties;
import com.chicu.aiforecast.ledger.PredictionLedger;
import com.chicu.aiforecast.ledger.PredictionRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static com.chicu.aiforecast.support.LedgerFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PredictionEngineTest {

    private static final Instant NOW = Instant.parse("2026-03-02T14:00:00Z");
    private static final Instant BUCKET = Instant.parse("2026-03-02T00:00:00Z");

    @Mock private ModelRegistry registry;
    @Mock private PredictionLedger ledger;

    private PredictionEngine engine;

    @BeforeEach
    void setUp() {
        engine = new PredictionEngine(registry, ledger, CODEC, new LedgerProperties(), new TrainingProperties(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static ModelBundle bundle(ClassifierModel direction, RegressionModel magnitude) {
        return ModelBundle.builder()
                .version("forecast-2026-03-01T00-00-00Z")
                .schema(SCHEMA)
                .actionModel(BaselineModels.constant(TradeAction.BUY))
                .directionModel(direction)
                .magnitudeModel(magnitude)
                .createdAt(NOW.minus(Duration.ofDays(1)))
                .build();
    }

    private void givenLedgerAccepts() {
        when(ledger.bucketOf(NOW)).thenReturn(BUCKET);
        when(ledger.append(any(PredictionRecord.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void predict_writesOneRecord_fromOneBundle() {
        ClassifierModel up = x -> Map.of(DirectionLabels.UP, 0.9, DirectionLabels.DOWN, 0.1);
        RegressionModel magnitude = x -> 1.5;
        when(registry.requireCurrent()).thenReturn(bundle(up, magnitude));
        givenLedgerAccepts();

        PredictionRecord r = engine.predict(FeatureVector.of(" qbe ", NOW, features(55.0, 0.1, 1.1)));

        assertEquals("QBE", r.getSymbol());
        assertEquals(BUCKET, r.getBucketStart());
        assertEquals(NOW, r.getPredictionTimestamp());
        assertEquals(NOW, r.getCreatedAt());
        assertEquals(TradeAction.BUY, r.getPredictedAction());
        assertEquals(1.0, r.getActionConfidence(), 1e-12);
        assertEquals(1, r.getPredictedDirection());
        assertEquals(1.5, r.getPredictedMagnitude(), 1e-12);
        assertEquals("forecast-2026-03-01T00-00-00Z", r.getModelVersion());
        assertEquals(SCHEMA.schemaHash(), r.getSchemaHash());
        assertNotNull(r.getPredictionId());

        FeatureSnapshot snap = CODEC.decode(r.getFeaturesJson());
        assertEquals(features(55.0, 0.1, 1.1), snap.values());
        assertEquals(NOW, snap.collectedAt());
        verify(ledger).append(r);
    }

    @Test
    void lowDirectionConfidence_meansAbstain() {
        when(registry.requireCurrent()).thenReturn(bundle(BaselineModels.abstainingDirection(), BaselineModels.zero()));
        givenLedgerAccepts();

        PredictionRecord r = engine.predict("QBE", FeatureVector.of("QBE", NOW, features(55.0, 0.1, 1.1)));

        assertNull(r.getPredictedDirection());
        assertEquals(0.0, r.getPredictedMagnitude(), 1e-12);
    }

    @Test
    void missingFeature_writesNothing() {
        when(registry.requireCurrent()).thenReturn(bundle(BaselineModels.abstainingDirection(), BaselineModels.zero()));

        assertThrows(FeatureSchemaException.class,
                () -> engine.predict(FeatureVector.of("QBE", NOW, Map.of("rsi_14", 55.0))));

        verify(ledger, never()).append(any());
    }

    @Test
    void backdatedFeatures_areRefused() {
        when(registry.requireCurrent()).thenReturn(bundle(BaselineModels.abstainingDirection(), BaselineModels.zero()));
        Instant tenMinutesAgo = NOW.minus(Duration.ofMinutes(10));

        TemporalIntegrityViolationException ex = assertThrows(TemporalIntegrityViolationException.class,
                () -> engine.predict(FeatureVector.of("QBE", tenMinutesAgo, features(55.0, 0.1, 1.1))));

        assertEquals(ViolationType.BACKDATED_PREDICTION, ex.getReport().violations().get(0).type());
        verify(ledger, never()).append(any());
    }

    @Test
    void featureObservedAfterCollection_isRejected() {
        when(registry.requireCurrent()).thenReturn(bundle(BaselineModels.abstainingDirection(), BaselineModels.zero()));
        FeatureVector fv = new FeatureVector("QBE", NOW, features(55.0, 0.1, 1.1),
                Map.of("macd_hist", NOW.plusSeconds(60)));

        assertThrows(FeatureSchemaException.class, () -> engine.predict(fv));
        verify(ledger, never()).append(any());
    }

    @Test
    void symbolMismatchOrMissingTimestamp_isRejected_beforeModelLookup() {
        assertThrows(FeatureSchemaException.class,
                () -> engine.predict("AAA", FeatureVector.of("BBB", NOW, features(55.0, 0.1, 1.1))));
        assertThrows(FeatureSchemaException.class,
                () -> engine.predict("AAA", FeatureVector.of("AAA", null, features(55.0, 0.1, 1.1))));
        assertThrows(FeatureSchemaException.class, () -> engine.predict(null));

        verifyNoInteractions(registry, ledger);
    }

    @Test
    void symbolLongerThanLedgerColumn_isSchemaError_notDuplicate() {
        String longSymbol = "X".repeat(40);

        assertThrows(FeatureSchemaException.class,
                () -> engine.predict(FeatureVector.of(longSymbol, NOW, features(55.0, 0.1, 1.1))));

        verifyNoInteractions(registry, ledger);
    }

    @Test
    void noPromotedBundle_isReported() {
        when(registry.requireCurrent()).thenThrow(new ModelNotAvailableException("no promoted model bundle"));

        assertThrows(ModelNotAvailableException.class,
                () -> engine.predict(FeatureVector.of("QBE", NOW, features(55.0, 0.1, 1.1))));
        verify(ledger, never()).append(any());
    }
}
