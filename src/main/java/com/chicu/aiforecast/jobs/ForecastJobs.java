package com.chicu.aiforecast.jobs;

import com.chicu.aiforecast.ai.guard.AuditReport;
import com.chicu.aiforecast.ai.guard.AuditWindow;
import com.chicu.aiforecast.ai.guard.Severity;
import com.chicu.aiforecast.ai.guard.TemporalIntegrityGuard;
import com.chicu.aiforecast.ai.ml.training.ModelTrainer;
import com.chicu.aiforecast.ai.ml.training.TrainingReport;
import com.chicu.aiforecast.ai.outcome.EvaluationReport;
import com.chicu.aiforecast.ai.outcome.OutcomeEvaluator;
import com.chicu.aiforecast.common.exception.TemporalIntegrityViolationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Периодические задачи конвейера. Каждая идемпотентна: пропущенный или повторный запуск ничего не ломает.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "forecast.jobs", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ForecastJobs {

    private final OutcomeEvaluator evaluator;
    private final ModelTrainer trainer;
    private final TemporalIntegrityGuard guard;

    @Scheduled(cron = "${forecast.jobs.evaluate-cron:0 5 * * * *}")
    public void evaluatePending() {
        log.debug("⏱ evaluation tick");
        try {
            EvaluationReport r = evaluator.evaluatePending();
            if (r.candidates() > 0) {
                log.info("⏱ evaluation tick: evaluated={} outcomes={} deferred={} expired={}",
                        r.evaluatedPredictions(), r.outcomesWritten(), r.deferred(), r.expired());
            }
        } catch (TemporalIntegrityViolationException e) {
            log.error("⏱ evaluation halted: {}", e.getMessage());
        } catch (Exception e) {
            log.error("⏱ evaluation tick failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(cron = "${forecast.jobs.train-cron:0 30 3 * * *}")
    public void train() {
        log.debug("⏱ training tick");
        try {
            TrainingReport r = trainer.train();
            log.info("⏱ training tick: status={} version={} rows={} holdout={} reason={}",
                    r.status(), r.modelVersion(), r.trainingRows(), r.holdoutRows(), r.reason());
        } catch (TemporalIntegrityViolationException e) {
            log.error("⏱ training halted: {}", e.getMessage());
        } catch (Exception e) {
            log.error("⏱ training tick failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(cron = "${forecast.jobs.audit-cron:0 0 6 * * *}")
    public void audit() {
        try {
            AuditReport r = guard.audit(AuditWindow.all());
            Map<Severity, Long> c = r.countsBySeverity();
            log.info("⏱ audit: passed={} predictions={} outcomes={} critical={} high={} warn={}",
                    r.passed(), r.predictionsChecked(), r.outcomesChecked(),
                    c.get(Severity.CRITICAL), c.get(Severity.HIGH), c.get(Severity.WARNING));
        } catch (Exception e) {
            log.error("⏱ audit failed: {}", e.getMessage(), e);
        }
    }
}
