package com.chicu.aiforecast.ai.persistence;

import com.chicu.aiforecast.ai.ml.features.FeatureSchema;
import com.chicu.aiforecast.ai.ml.model.BaselineModels;
import com.chicu.aiforecast.ai.ml.model.ModelBundle;
import com.chicu.aiforecast.common.enums.TradeAction;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Реестр на той же БД, что и остальные интеграционные тесты (URL из application.yml).
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import(ModelArtifactStore.class)
class ModelArtifactStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-02T14:00:00Z");
    private static final FeatureSchema SCHEMA = new FeatureSchema(List.of("rsi_14", "macd_hist", "volume_ratio"));

    @Autowired private ModelArtifactStore store;

    private static ModelBundle bundle(String version, TradeAction action) {
        return ModelBundle.builder()
                .version(version)
                .schema(SCHEMA)
                .actionModel(BaselineModels.constant(action))
                .directionModel(BaselineModels.abstainingDirection())
                .magnitudeModel(BaselineModels.zero())
                .createdAt(NOW)
                .build();
    }

    @Test
    void payloadIsStoredAndReadBack() {
        store.saveAndPromote(bundle("forecast-store-a", TradeAction.BUY), NOW);

        ModelArtifactEntity e = store.findPromoted().orElseThrow();
        ModelBundle restored = ModelBundleCodec.decode(e.getPayload(), e.getVersion());

        assertEquals("forecast-store-a", restored.getVersion());
        assertEquals(SCHEMA, restored.getSchema());
        assertEquals("BUY", restored.getActionModel().top(new double[]{1.0, 2.0, 3.0}).label());
    }

    @Test
    void promotionKeepsOneFlag_andNeverDeletes() {
        store.saveAndPromote(bundle("forecast-store-1", TradeAction.BUY), NOW);
        store.saveAndPromote(bundle("forecast-store-2", TradeAction.SELL), NOW.plusSeconds(60));

        assertEquals("forecast-store-2", store.findPromoted().orElseThrow().getVersion());
        assertFalse(store.findByVersion("forecast-store-1").orElseThrow().isPromoted());

        store.promoteExisting("forecast-store-1", NOW.plusSeconds(120));

        assertEquals("forecast-store-1", store.findPromoted().orElseThrow().getVersion());
        assertTrue(store.exists("forecast-store-2"));
        assertThrows(IllegalStateException.class,
                () -> store.saveAndPromote(bundle("forecast-store-2", TradeAction.HOLD), NOW.plusSeconds(180)));
    }
}
