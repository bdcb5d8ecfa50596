package com.chicu.aiforecast.ai.guard;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "forecast.guard")
public class GuardProperties {

    /**
     * Насколько фича может быть "позже" момента прогноза. По умолчанию ноль: любое опережение: утечка.
     */
    private Duration featureLeakageTolerance = Duration.ZERO;

    /**
     * Допуск на рассинхрон часов при проверке будущих меток времени.
     */
    private Duration clockSkew = Duration.ofMinutes(5);

    /**
     * Окно аудита перед оценкой/обучением.
     */
    private Duration preRunLookback = Duration.ofDays(120);

    // --- предупреждения ---

    private double extremeReturnPct = 50.0;

    /**
     * Расхождение сохранённой доходности с ценами входа/выхода (в п.п.).
     */
    private double returnMismatchPct = 0.01;

    private double minEvaluationRate = 0.8;

    private double narrowConfidenceRange = 0.1;

    private int sameActionLimit = 20;

    private Duration modelHealthLookback = Duration.ofDays(7);
}
