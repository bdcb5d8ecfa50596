package com.chicu.aiforecast.ai.ml.features;

import com.chicu.aiforecast.common.exception.FeatureSchemaException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FeatureSchemaTest {

    private final FeatureSchema schema = new FeatureSchema(List.of("rsi_14", "macd_hist", "volume_ratio"));

    @Test
    void toVector_followsSchemaOrder_notMapOrder() {
        Map<String, Double> f = new HashMap<>();
        f.put("volume_ratio", 1.2);
        f.put("rsi_14", 55.0);
        f.put("macd_hist", -0.3);

        assertArrayEquals(new double[]{55.0, -0.3, 1.2}, schema.toVector(f), 1e-12);
    }

    @Test
    void missingFeature_isNotZeroFilled() {
        FeatureSchemaException ex = assertThrows(FeatureSchemaException.class,
                () -> schema.toVector(Map.of("rsi_14", 55.0, "macd_hist", -0.3)));
        assertTrue(ex.getMessage().contains("volume_ratio"));
    }

    @Test
    void unexpectedOrNonFiniteFeature_isRejected() {
        assertThrows(FeatureSchemaException.class, () -> schema.toVector(
                Map.of("rsi_14", 55.0, "macd_hist", -0.3, "volume_ratio", 1.0, "extra", 1.0)));
        assertThrows(FeatureSchemaException.class, () -> schema.toVector(
                Map.of("rsi_14", Double.NaN, "macd_hist", -0.3, "volume_ratio", 1.0)));
        assertFalse(schema.matches(Map.of()));
    }

    @Test
    void hash_dependsOnNamesAndOrder() {
        FeatureSchema same = new FeatureSchema(new String[]{"rsi_14", "macd_hist", "volume_ratio"});
        FeatureSchema reordered = new FeatureSchema(new String[]{"macd_hist", "rsi_14", "volume_ratio"});

        assertEquals(schema, same);
        assertEquals(schema.schemaHash(), same.schemaHash());
        assertNotEquals(schema.schemaHash(), reordered.schemaHash());
        assertEquals(64, schema.schemaHash().length());
    }

    @Test
    void duplicateOrBlankNames_areRejected() {
        assertThrows(IllegalArgumentException.class, () -> new FeatureSchema(new String[]{"a", "a"}));
        assertThrows(IllegalArgumentException.class, () -> new FeatureSchema(new String[]{"a", " "}));
        assertThrows(IllegalArgumentException.class, () -> new FeatureSchema(List.of()));
    }

    @Test
    void snapshot_keepsValuesAndObservationTimes() {
        Instant collected = Instant.parse("2026-03-02T14:00:00Z");
        FeatureVector fv = new FeatureVector("QBE", collected,
                Map.of("rsi_14", 55.0, "macd_hist", -0.3, "volume_ratio", 1.2),
                Map.of("rsi_14", collected.minusSeconds(3600)));

        FeatureSnapshotCodec codec = new FeatureSnapshotCodec(new ObjectMapper());
        FeatureSnapshot decoded = codec.decode(codec.encode(FeatureSnapshot.of(fv, schema)));

        assertEquals(schema.schemaHash(), decoded.schemaHash());
        assertEquals(collected, decoded.collectedAt());
        assertEquals(55.0, decoded.values().get("rsi_14"));
        assertEquals(collected.minusSeconds(3600), decoded.observedAt().get("rsi_14"));
        // без явного времени наблюдения фича считается наблюдённой в момент сбора
        assertEquals(collected, decoded.observedAt().get("macd_hist"));
        assertEquals(collected, decoded.latestObservation());
    }
}
