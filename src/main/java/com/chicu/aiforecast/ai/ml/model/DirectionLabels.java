package com.chicu.aiforecast.ai.ml.model;

/**
 * Метки классификатора направления и их отображение в +1 / -1.
 */
public final class DirectionLabels {

    public static final String UP = "UP";
    public static final String DOWN = "DOWN";

    private DirectionLabels() {
    }

    public static String of(int direction) {
        if (direction > 0) return UP;
        if (direction < 0) return DOWN;
        throw new IllegalArgumentException("flat direction has no label");
    }

    public static int toDirection(String label) {
        if (UP.equals(label)) return 1;
        if (DOWN.equals(label)) return -1;
        throw new IllegalArgumentException("unknown direction label: " + label);
    }
}
