package com.chicu.aiforecast.market.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClosePriceDto {

    private String symbol;

    /** Время бара, чья цена закрытия возвращена. */
    private Instant barTime;

    private Double close;
}
