package com.chicu.aiforecast.web.controller.api;

import com.chicu.aiforecast.ai.guard.AuditReport;
import com.chicu.aiforecast.ai.guard.AuditWindow;
import com.chicu.aiforecast.ai.guard.TemporalIntegrityGuard;
import com.chicu.aiforecast.ai.ml.PredictionEngine;
import com.chicu.aiforecast.ai.ml.features.FeatureVector;
import com.chicu.aiforecast.ai.ml.model.ModelBundle;
import com.chicu.aiforecast.ai.ml.training.ModelTrainer;
import com.chicu.aiforecast.ai.ml.training.TrainingReport;
import com.chicu.aiforecast.ai.outcome.EvaluationReport;
import com.chicu.aiforecast.ai.outcome.OutcomeEvaluator;
import com.chicu.aiforecast.ai.persistence.ModelRegistry;
import com.chicu.aiforecast.ai.persistence.ModelVersionInfo;
import com.chicu.aiforecast.common.enums.PredictionStatus;
import com.chicu.aiforecast.ledger.PredictionLedger;
import com.chicu.aiforecast.ledger.PredictionRecord;
import com.chicu.aiforecast.ledger.PredictionState;
import com.chicu.aiforecast.web.dto.OutcomeView;
import com.chicu.aiforecast.web.dto.PredictRequest;
import com.chicu.aiforecast.web.dto.PredictionView;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Операционная поверхность: predict / evaluate-pending / train и чтение состояния для операторов.
 */
@Slf4j
@RestController
@RequestMapping(value = "/api/forecast", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
public class ForecastApiController {

    private final PredictionEngine engine;
    private final PredictionLedger ledger;
    private final OutcomeEvaluator evaluator;
    private final ModelTrainer trainer;
    private final TemporalIntegrityGuard guard;
    private final ModelRegistry registry;

    // ---------- predictions ----------

    @PostMapping("/predictions")
    public ResponseEntity<PredictionView> predict(@Valid @RequestBody PredictRequest req) {
        FeatureVector fv = new FeatureVector(req.getSymbol(), req.getCollectedAt(), req.getFeatures(), req.getObservedAt());
        PredictionRecord saved = engine.predict(req.getSymbol(), fv);
        return ResponseEntity.status(HttpStatus.CREATED).body(PredictionView.of(saved, PredictionStatus.PENDING));
    }

    @GetMapping("/predictions/{id}")
    public PredictionView prediction(@PathVariable String id) {
        PredictionRecord p = ledger.find(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "prediction not found: " + id));
        return PredictionView.of(p, ledger.stateOf(id).map(PredictionState::getStatus).orElse(null));
    }

    @GetMapping("/predictions")
    public List<PredictionView> predictions(@RequestParam String symbol,
                                            @RequestParam(defaultValue = "50") int limit) {
        return ledger.findBySymbol(symbol, limit).stream()
                .map(p -> PredictionView.of(p, ledger.stateOf(p.getPredictionId())
                        .map(PredictionState::getStatus).orElse(null)))
                .toList();
    }

    @GetMapping("/predictions/{id}/outcomes")
    public List<OutcomeView> outcomes(@PathVariable String id) {
        if (ledger.find(id).isEmpty()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "prediction not found: " + id);
        }
        return ledger.outcomesOf(id).stream().map(OutcomeView::of).toList();
    }

    // ---------- stages ----------

    @PostMapping("/evaluate-pending")
    public EvaluationReport evaluatePending() {
        return evaluator.evaluatePending();
    }

    @PostMapping("/train")
    public TrainingReport train(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant cutoff) {
        return cutoff != null ? trainer.trainOrThrow(cutoff) : trainer.trainOrThrow();
    }

    @GetMapping("/audit")
    public AuditReport audit(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        return guard.audit(new AuditWindow(from, to));
    }

    // ---------- model registry ----------

    @GetMapping("/models")
    public List<ModelVersionInfo> models() {
        return registry.history();
    }

    @GetMapping("/models/current")
    public Map<String, Object> currentModel() {
        ModelBundle b = registry.requireCurrent();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("version", b.getVersion());
        body.put("schemaHash", b.getSchema().schemaHash());
        body.put("featureNames", b.getSchema().featureNames());
        body.put("trainedFrom", b.getTrainedFrom());
        body.put("trainedTo", b.getTrainedTo());
        body.put("holdout", b.getHoldout());
        body.put("createdAt", b.getCreatedAt());
        return body;
    }

    @PostMapping("/models/{version}/promote")
    public Map<String, Object> promote(@PathVariable String version) {
        ModelBundle b = registry.rollback(version);
        log.info("🧠 MODEL manual promote version={}", b.getVersion());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "promoted");
        body.put("version", b.getVersion());
        return body;
    }
}
