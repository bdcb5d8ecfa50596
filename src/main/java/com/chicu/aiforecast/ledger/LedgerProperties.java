package com.chicu.aiforecast.ledger;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "forecast.ledger")
public class LedgerProperties {

    /**
     * Размер бакета дедупликации: не больше одного прогноза на символ в бакете.
     */
    private String bucket = "1d";

    /**
     * Зона для границ дневного бакета.
     */
    private String bucketZone = "UTC";

    /**
     * Допустимый разрыв между created_at и prediction_timestamp.
     */
    private Duration creationTolerance = Duration.ofSeconds(5);
}
