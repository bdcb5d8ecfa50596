package com.chicu.aiforecast.pipeline;

import com.chicu.aiforecast.ai.guard.AuditReport;
import com.chicu.aiforecast.ai.guard.AuditWindow;
import com.chicu.aiforecast.ai.guard.TemporalIntegrityGuard;
import com.chicu.aiforecast.ai.guard.ViolationType;
import com.chicu.aiforecast.ai.ml.training.ModelTrainer;
import com.chicu.aiforecast.ai.outcome.OutcomeEvaluator;
import com.chicu.aiforecast.ai.persistence.ModelRegistry;
import com.chicu.aiforecast.common.exception.TemporalIntegrityViolationException;
import com.chicu.aiforecast.ledger.PredictionLedger;
import com.chicu.aiforecast.ledger.PredictionRecord;
import com.chicu.aiforecast.ledger.PredictionRecordRepository;
import com.chicu.aiforecast.support.MutableClock;
import com.chicu.aiforecast.support.PipelineTestConfig;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.annotation.DirtiesContext;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;

import static com.chicu.aiforecast.support.LedgerFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Утечка, записанная мимо движка (импорт, ручная правка), должна остановить и оценку, и обучение.
 * Контекст после теста выбрасывается: отравленная база другим тестам не достаётся.
 */
@SpringBootTest
@Import(PipelineTestConfig.class)
@DirtiesContext
class LeakageHaltIntegrationTest {

    @Autowired private PredictionRecordRepository predictionRepo;
    @Autowired private PredictionLedger ledger;
    @Autowired private OutcomeEvaluator evaluator;
    @Autowired private ModelTrainer trainer;
    @Autowired private TemporalIntegrityGuard guard;
    @Autowired private ModelRegistry registry;
    @Autowired private MutableClock clock;

    @Test
    void leakedFeature_haltsEvaluationAndTraining() {
        Instant now = clock.set(clock.instant().plus(Duration.ofDays(400)).truncatedTo(ChronoUnit.DAYS).plus(Duration.ofHours(12)));
        Instant ts = now.minus(Duration.ofDays(2));

        PredictionRecord leaky = prediction("LEAK", ts)
                .bucketStart(ledger.bucketOf(ts))
                .featuresJson(snapshotJson(ts, features(55.0, 0.1, 1.1),
                        Map.of("volume_ratio", ts.plus(Duration.ofHours(3)))))
                .build();
        predictionRepo.saveAndFlush(leaky);

        AuditReport audit = guard.audit(AuditWindow.all());
        assertTrue(audit.hasCritical());
        assertEquals(ViolationType.LEAKAGE, audit.critical().get(0).type());
        assertEquals(leaky.getPredictionId(), audit.critical().get(0).predictionId());

        String before = registry.requireCurrent().getVersion();

        TemporalIntegrityViolationException evalHalt =
                assertThrows(TemporalIntegrityViolationException.class, () -> evaluator.evaluatePending());
        assertNotNull(evalHalt.getReport());

        assertThrows(TemporalIntegrityViolationException.class, () -> trainer.train());
        assertEquals(before, registry.requireCurrent().getVersion());
        assertTrue(ledger.outcomesOf(leaky.getPredictionId()).isEmpty());
    }
}
