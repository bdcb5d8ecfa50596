package com.chicu.aiforecast.jobs;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "forecast.jobs")
public class JobsProperties {

    private boolean enabled = true;

    private String evaluateCron = "0 5 * * * *";
    private String trainCron = "0 30 3 * * *";
    private String auditCron = "0 0 6 * * *";
}
