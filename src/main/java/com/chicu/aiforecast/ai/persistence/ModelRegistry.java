package com.chicu.aiforecast.ai.persistence;

import com.chicu.aiforecast.ai.ml.features.FeatureSchema;
import com.chicu.aiforecast.ai.ml.model.BaselineModels;
import com.chicu.aiforecast.ai.ml.model.ModelBundle;
import com.chicu.aiforecast.ai.ml.training.TrainingProperties;
import com.chicu.aiforecast.common.enums.TradeAction;
import com.chicu.aiforecast.common.exception.ModelNotAvailableException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Реестр бандлов. Продвинутый бандл в памяти: одна ссылка, которую движок читает без блокировок;
 * подмена ссылки происходит только после коммита записи в БД.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModelRegistry {

    private final ModelArtifactStore store;
    private final ModelVersionFactory versionFactory;
    private final ModelProperties props;
    private final TrainingProperties trainingProps;
    private final Clock clock;

    private final AtomicReference<ModelBundle> promoted = new AtomicReference<>();

    /** promote и rollback: запись в БД и подмена ссылки идут парой, без чередования. */
    private final Object promotionLock = new Object();

    @PostConstruct
    public void init() {
        Optional<ModelArtifactEntity> stored = store.findPromoted();
        if (stored.isPresent()) {
            ModelArtifactEntity e = stored.get();
            try {
                promoted.set(ModelBundleCodec.decode(e.getPayload(), e.getVersion()));
                log.info("🧠 MODEL loaded promoted version={} schema={}", e.getVersion(), e.getSchemaHash());
            } catch (IllegalStateException ex) {
                log.error("❌ MODEL promoted version={} cannot be loaded, inference disabled until promote/rollback",
                        e.getVersion(), ex);
            }
            return;
        }

        if (!props.isBootstrapBaseline()) {
            log.warn("⚠️ MODEL registry is empty and baseline bootstrap is disabled");
            return;
        }
        List<String> names = trainingProps.getFeatureNames();
        if (names == null || names.isEmpty()) {
            log.warn("⚠️ MODEL registry is empty and forecast.training.feature-names is not set, no baseline");
            return;
        }
        promote(baseline(new FeatureSchema(names)));
    }

    /**
     * Текущий продвинутый бандл: одно чтение ссылки.
     */
    public Optional<ModelBundle> current() {
        return Optional.ofNullable(promoted.get());
    }

    public ModelBundle requireCurrent() {
        ModelBundle b = promoted.get();
        if (b == null) throw new ModelNotAvailableException("no promoted model bundle");
        return b;
    }

    public void promote(ModelBundle bundle) {
        ModelBundle prev;
        synchronized (promotionLock) {
            store.saveAndPromote(bundle, clock.instant());
            prev = promoted.getAndSet(bundle);
        }
        log.info("✅ MODEL promoted version={} (previous={}) holdout={}",
                bundle.getVersion(), prev != null ? prev.getVersion() : "none", bundle.getHoldout());
    }

    /**
     * Вернуть ранее зарегистрированную версию. Ничего не удаляется.
     */
    public ModelBundle rollback(String version) {
        ModelArtifactEntity e = store.findByVersion(version)
                .orElseThrow(() -> new IllegalArgumentException("unknown model version: " + version));
        ModelBundle bundle = ModelBundleCodec.decode(e.getPayload(), e.getVersion());
        ModelBundle prev;
        synchronized (promotionLock) {
            store.promoteExisting(version, clock.instant());
            prev = promoted.getAndSet(bundle);
        }
        log.warn("⚠️ MODEL rollback to version={} (previous={})",
                version, prev != null ? prev.getVersion() : "none");
        return bundle;
    }

    public List<ModelVersionInfo> history() {
        return store.history().stream().map(ModelVersionInfo::of).toList();
    }

    public String nextVersion() {
        return versionFactory.build(clock.instant(), store::exists);
    }

    private ModelBundle baseline(FeatureSchema schema) {
        return ModelBundle.builder()
                .version(BaselineModels.BASELINE_VERSION)
                .schema(schema)
                .actionModel(BaselineModels.constant(TradeAction.HOLD))
                .directionModel(BaselineModels.abstainingDirection())
                .magnitudeModel(BaselineModels.zero())
                .createdAt(clock.instant())
                .build();
    }
}
