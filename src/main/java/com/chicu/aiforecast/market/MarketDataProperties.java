package com.chicu.aiforecast.market;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "forecast.market-data")
public class MarketDataProperties {

    /**
     * Пример: http://127.0.0.1:8090
     */
    private String baseUrl = "http://127.0.0.1:8090";

    private String apiKey = "";

    private long connectTimeoutMs = 1000;
    private long readTimeoutMs = 8000;
}
