package com.chicu.aiforecast.ai.ml.features;

import com.chicu.aiforecast.common.exception.FeatureSchemaException;

import java.io.Serial;
import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Схема фич, с которой обучен бандл. Порядок имён задаёт порядок колонок вектора.
 * Хэш схемы хранится в каждом прогнозе и в реестре моделей.
 */
public final class FeatureSchema implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    private final String[] names;
    private final String schemaHash;

    public FeatureSchema(String[] names) {
        if (names == null || names.length == 0) {
            throw new IllegalArgumentException("schema names are empty");
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String n : names) {
            if (n == null || n.isBlank()) {
                throw new IllegalArgumentException("schema contains blank feature name");
            }
            if (!unique.add(n.trim())) {
                throw new IllegalArgumentException("duplicate feature name: " + n);
            }
        }
        this.names = unique.toArray(new String[0]);
        this.schemaHash = sha256(String.join("|", this.names));
    }

    public FeatureSchema(List<String> names) {
        this(names != null ? names.toArray(new String[0]) : null);
    }

    public String[] featureNames() {
        return names.clone();
    }

    public int size() {
        return names.length;
    }

    public String schemaHash() {
        return schemaHash;
    }

    /**
     * Строгая проверка: тот же набор имён и только конечные значения.
     * Пропущенная фича НЕ заменяется нулём: это и есть тихий дрейф схемы.
     */
    public void validate(Map<String, Double> features) {
        if (features == null || features.isEmpty()) {
            throw new FeatureSchemaException("feature vector is empty, schema=" + schemaHash);
        }

        Set<String> expected = new TreeSet<>(Arrays.asList(names));
        Set<String> actual = new TreeSet<>(features.keySet());
        if (!expected.equals(actual)) {
            Set<String> missing = new TreeSet<>(expected);
            missing.removeAll(actual);
            Set<String> unexpected = new TreeSet<>(actual);
            unexpected.removeAll(expected);
            throw new FeatureSchemaException("feature set mismatch schema=" + schemaHash
                    + " missing=" + missing + " unexpected=" + unexpected);
        }

        for (String k : names) {
            Double v = features.get(k);
            if (v == null || !Double.isFinite(v)) {
                throw new FeatureSchemaException("feature '" + k + "' is not a finite number: " + v);
            }
        }
    }

    public double[] toVector(Map<String, Double> features) {
        validate(features);
        double[] x = new double[names.length];
        for (int i = 0; i < names.length; i++) {
            x[i] = features.get(names[i]);
        }
        return x;
    }

    public boolean matches(Map<String, Double> features) {
        try {
            validate(features);
            return true;
        } catch (FeatureSchemaException e) {
            return false;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureSchema other)) return false;
        return schemaHash.equals(other.schemaHash);
    }

    @Override
    public int hashCode() {
        return schemaHash.hashCode();
    }

    @Override
    public String toString() {
        return "FeatureSchema" + Arrays.toString(names) + "#" + schemaHash.substring(0, 12);
    }

    private static String sha256(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] dig = md.digest(s.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(dig);
        } catch (Exception e) {
            throw new IllegalStateException("sha256 error: " + e.getMessage(), e);
        }
    }
}
