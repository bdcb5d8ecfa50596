package com.chicu.aiforecast.ai.outcome;

import com.chicu.aiforecast.common.time.Timeframe;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "forecast.evaluation")
public class EvaluationProperties {

    /**
     * MIN_EVAL_DELAY: раньше этого возраста прогноз не оценивается никогда.
     */
    private Duration minDelay = Duration.ofHours(1);

    /**
     * Горизонты оценки (коды таймфреймов).
     */
    private List<String> horizons = new ArrayList<>(List.of("1h", "4h", "1d"));

    private int batchSize = 500;

    /**
     * Сколько символов оцениваем параллельно.
     */
    private int parallelism = 4;

    /**
     * Жёсткий таймаут на все запросы одного символа в одном прогоне.
     */
    private Duration symbolTimeout = Duration.ofSeconds(30);

    private int maxAttempts = 3;
    private Duration initialBackoff = Duration.ofMillis(500);

    /**
     * Сколько ждём рыночные данные после наступления горизонта, прежде чем пометить прогноз EXPIRED.
     */
    private Duration expireAfter = Duration.ofDays(3);

    public List<Timeframe> horizonFrames() {
        if (horizons == null || horizons.isEmpty()) {
            throw new IllegalStateException("forecast.evaluation.horizons is empty");
        }
        return horizons.stream().map(Timeframe::from).distinct().toList();
    }

    public Duration longestHorizon() {
        return horizonFrames().stream()
                .map(Timeframe::toDuration)
                .max(Duration::compareTo)
                .orElseThrow();
    }
}
