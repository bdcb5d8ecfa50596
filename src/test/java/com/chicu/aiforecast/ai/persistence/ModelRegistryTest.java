package com.chicu.aiforecast.ai.persistence;

import com.chicu.aiforecast.ai.ml.features.FeatureSchema;
import com.chicu.aiforecast.ai.ml.model.BaselineModels;
import com.chicu.aiforecast.ai.ml.model.ModelBundle;
import com.chicu.aiforecast.ai.ml.training.TrainingProperties;
import com.chicu.aiforecast.common.enums.TradeAction;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ModelRegistryTest {

    private static final Instant NOW = Instant.parse("2026-03-02T14:00:00Z");
    private static final FeatureSchema SCHEMA = new FeatureSchema(List.of("rsi_14", "macd_hist"));

    @Mock private ModelArtifactStore store;

    private ModelRegistry registry;
    private final ExecutorService pool = Executors.newFixedThreadPool(2);

    @BeforeEach
    void setUp() {
        registry = new ModelRegistry(store, new ModelVersionFactory(), new ModelProperties(),
                new TrainingProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

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

    private static ModelArtifactEntity stored(ModelBundle b) {
        return ModelArtifactEntity.builder()
                .version(b.getVersion())
                .schemaHash(SCHEMA.schemaHash())
                .featureNames(String.join(",", SCHEMA.featureNames()))
                .payload(ModelBundleCodec.encode(b))
                .build();
    }

    @Test
    void promote_swapsReferenceAfterStoreCommit() {
        ModelBundle b = bundle("forecast-a", TradeAction.BUY);

        registry.promote(b);

        verify(store).saveAndPromote(b, NOW);
        assertSame(b, registry.requireCurrent());
    }

    @Test
    void rollback_restoresStoredVersion() {
        ModelBundle old = bundle("forecast-old", TradeAction.SELL);
        when(store.findByVersion("forecast-old")).thenReturn(Optional.of(stored(old)));

        ModelBundle restored = registry.rollback("forecast-old");

        verify(store).promoteExisting("forecast-old", NOW);
        assertEquals("forecast-old", registry.requireCurrent().getVersion());
        assertEquals("SELL", restored.getActionModel().top(new double[]{1.0, 2.0}).label());
    }

    @Test
    void rollback_unknownVersion_changesNothing() {
        when(store.findByVersion("nope")).thenReturn(Optional.empty());

        assertThrows(IllegalArgumentException.class, () -> registry.rollback("nope"));
        verify(store, never()).promoteExisting(any(), any());
        assertTrue(registry.current().isEmpty());
    }

    @Test
    void rollbackWaitsForPromotionInFlight_soMemoryMatchesStore() throws Exception {
        ModelBundle fresh = bundle("forecast-new", TradeAction.BUY);
        ModelBundle old = bundle("forecast-old", TradeAction.SELL);
        when(store.findByVersion("forecast-old")).thenReturn(Optional.of(stored(old)));

        CountDownLatch inStore = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(store.saveAndPromote(eq(fresh), any())).thenAnswer(inv -> {
            inStore.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            return null;
        });

        Future<?> promoting = pool.submit(() -> registry.promote(fresh));
        assertTrue(inStore.await(5, TimeUnit.SECONDS));
        Future<ModelBundle> rolling = pool.submit(() -> registry.rollback("forecast-old"));

        verify(store, after(200).never()).promoteExisting(any(), any());

        release.countDown();
        promoting.get(5, TimeUnit.SECONDS);
        rolling.get(5, TimeUnit.SECONDS);

        InOrder order = inOrder(store);
        order.verify(store).saveAndPromote(eq(fresh), any());
        order.verify(store).promoteExisting(eq("forecast-old"), any());
        assertEquals("forecast-old", registry.requireCurrent().getVersion());
    }
}
