package com.chicu.aiforecast.ai.persistence;

import com.chicu.aiforecast.ai.ml.model.ModelBundle;
import com.chicu.aiforecast.ai.ml.training.HoldoutReport;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Транзакционная часть реестра: снять флаг с текущей версии и поставить новой: одной транзакцией.
 */
@Component
@RequiredArgsConstructor
public class ModelArtifactStore {

    private final ModelArtifactRepository repo;

    @Transactional
    public ModelArtifactEntity saveAndPromote(ModelBundle bundle, Instant now) {
        if (repo.existsByVersion(bundle.getVersion())) {
            throw new IllegalStateException("model version already registered: " + bundle.getVersion());
        }
        demoteAll();

        HoldoutReport h = bundle.getHoldout();
        ModelArtifactEntity e = ModelArtifactEntity.builder()
                .version(bundle.getVersion())
                .schemaHash(bundle.getSchema().schemaHash())
                .featureNames(String.join(",", bundle.getSchema().featureNames()))
                .trainedFrom(bundle.getTrainedFrom())
                .trainedTo(bundle.getTrainedTo())
                .holdoutRows(h.rows())
                .actionAccuracy(h.actionAccuracy())
                .directionAccuracy(h.directionAccuracy())
                .directionCoverage(h.directionCoverage())
                .magnitudeMae(h.magnitudeMae())
                .promoted(true)
                .promotedAt(now)
                .payload(ModelBundleCodec.encode(bundle))
                .build();
        return repo.saveAndFlush(e);
    }

    @Transactional
    public ModelArtifactEntity promoteExisting(String version, Instant now) {
        ModelArtifactEntity target = repo.findByVersion(version)
                .orElseThrow(() -> new IllegalArgumentException("unknown model version: " + version));
        demoteAll();
        target.setPromoted(true);
        target.setPromotedAt(now);
        return target;
    }

    @Transactional(readOnly = true)
    public Optional<ModelArtifactEntity> findPromoted() {
        return repo.findFirstByPromotedTrueOrderByPromotedAtDesc();
    }

    @Transactional(readOnly = true)
    public Optional<ModelArtifactEntity> findByVersion(String version) {
        return repo.findByVersion(version);
    }

    @Transactional(readOnly = true)
    public List<ModelArtifactEntity> history() {
        return repo.findTop30ByOrderByCreatedAtDesc();
    }

    public boolean exists(String version) {
        return repo.existsByVersion(version);
    }

    private void demoteAll() {
        for (ModelArtifactEntity prev : repo.findByPromotedTrue()) {
            prev.setPromoted(false);
        }
        repo.flush();
    }
}
