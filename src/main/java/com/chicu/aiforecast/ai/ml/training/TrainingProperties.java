package com.chicu.aiforecast.ai.ml.training;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "forecast.training")
public class TrainingProperties {

    /**
     * HOLDOUT_WINDOW: cutoff = now - holdoutWindow.
     */
    private Duration holdoutWindow = Duration.ofDays(7);

    /**
     * Как далеко в прошлое от cutoff берём строки.
     */
    private Duration lookback = Duration.ofDays(90);

    /**
     * Горизонт исхода, по которому размечаем строки.
     */
    private String labelHorizon = "1d";

    // --- разметка действий (порог в процентах доходности) ---

    private double strongReturnPct = 2.0;
    private double returnPct = 0.5;

    /**
     * STRONG_* ставим только если исходный прогноз был уверенным.
     */
    private double strongMinConfidence = 0.8;

    // --- минимумы ---

    private int minTrainingRows = 20;
    private int minSamplesPerClass = 5;
    private int minHoldoutRows = 5;

    // --- продвижение ---

    private double maxAccuracyDrop = 0.02;
    private double maxMaeIncrease = 0.1;

    // --- оценщики ---

    private int epochs = 20;
    private double learningRate = 0.5;
    private long seed = 42L;

    /**
     * Ниже этой вероятности модель направления воздерживается (direction = null).
     */
    private double directionAbstainBelow = 0.55;

    /**
     * Схема фич для самого первого бандла (пока в реестре пусто).
     */
    private List<String> featureNames = new ArrayList<>();
}
