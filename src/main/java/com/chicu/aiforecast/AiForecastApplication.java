package com.chicu.aiforecast;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication(scanBasePackages = "com.chicu.aiforecast")
public class AiForecastApplication {

    public static void main(String[] args) {
        SpringApplication.run(AiForecastApplication.class, args);
    }
}
