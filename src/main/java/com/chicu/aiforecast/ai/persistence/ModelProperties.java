package com.chicu.aiforecast.ai.persistence;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "forecast.model")
public class ModelProperties {

    /**
     * Поднять baseline-v0, если в реестре нет ни одного продвинутого бандла.
     */
    private boolean bootstrapBaseline = true;
}
