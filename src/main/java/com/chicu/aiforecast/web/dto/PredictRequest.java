package com.chicu.aiforecast.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PredictRequest {

    @NotBlank
    private String symbol;

    /** Момент сбора фич. */
    @NotNull
    private Instant collectedAt;

    @NotEmpty
    private Map<String, Double> features;

    /** Необязательно: когда наблюдалась каждая фича. */
    private Map<String, Instant> observedAt;
}
