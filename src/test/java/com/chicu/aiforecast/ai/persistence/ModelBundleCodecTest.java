package com.chicu.aiforecast.ai.persistence;

import com.chicu.aiforecast.ai.ml.features.FeatureSchema;
import com.chicu.aiforecast.ai.ml.model.BaselineModels;
import com.chicu.aiforecast.ai.ml.model.ModelBundle;
import com.chicu.aiforecast.common.enums.TradeAction;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ModelBundleCodecTest {

    private static final FeatureSchema SCHEMA = new FeatureSchema(List.of("rsi_14", "macd_hist"));

    @Test
    void storedBundle_predictsLikeOriginal() {
        ModelBundle bundle = ModelBundle.builder()
                .version(BaselineModels.BASELINE_VERSION)
                .schema(SCHEMA)
                .actionModel(BaselineModels.constant(TradeAction.HOLD))
                .directionModel(BaselineModels.abstainingDirection())
                .magnitudeModel(BaselineModels.zero())
                .createdAt(Instant.parse("2026-01-01T00:00:00Z"))
                .build();

        ModelBundle restored = ModelBundleCodec.decode(ModelBundleCodec.encode(bundle), bundle.getVersion());

        assertEquals(bundle.getVersion(), restored.getVersion());
        assertEquals(SCHEMA, restored.getSchema());
        assertTrue(restored.isBaseline());
        assertEquals("HOLD", restored.getActionModel().top(new double[]{1.0, 2.0}).label());
        assertEquals(0.5, restored.getDirectionModel().top(new double[]{1.0, 2.0}).probability(), 1e-12);
    }

    @Test
    void garbagePayload_isReportedWithVersion() {
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> ModelBundleCodec.decode(new byte[]{1, 2, 3}, "forecast-broken"));
        assertTrue(ex.getMessage().contains("forecast-broken"));
        assertThrows(IllegalStateException.class, () -> ModelBundleCodec.decode(new byte[0], "v"));
    }

    @Test
    void versionFactory_addsSuffixOnCollision() {
        ModelVersionFactory factory = new ModelVersionFactory();
        Instant at = Instant.parse("2026-01-03T12:30:00Z");

        assertEquals("forecast-2026-01-03T12-30-00Z", factory.build(at, v -> false));

        Set<String> taken = Set.of("forecast-2026-01-03T12-30-00Z", "forecast-2026-01-03T12-30-00Z-2");
        assertEquals("forecast-2026-01-03T12-30-00Z-3", factory.build(at, taken::contains));
    }
}
