package com.chicu.aiforecast.market;

import java.time.Instant;

/**
 * Цена закрытия бара, в который попадает запрошенный момент.
 */
public record PricePoint(String symbol, Instant at, double close) {
}
