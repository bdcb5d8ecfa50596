package com.chicu.aiforecast.market;

import com.chicu.aiforecast.common.exception.MarketDataUnavailableException;
import com.chicu.aiforecast.market.dto.ClosePriceDto;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;

/**
 * REST-адаптер к сервису исторических цен: GET /close?symbol=..&at=..
 * 404: данных нет, явный сигнал; подстановки соседней цены нет.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HttpMarketDataClient implements MarketDataProvider {

    private final OkHttpClient baseClient;
    private final ObjectMapper objectMapper;
    private final MarketDataProperties props;

    private OkHttpClient clientWithTimeouts() {
        return baseClient.newBuilder()
                .connectTimeout(Duration.ofMillis(Math.max(200, props.getConnectTimeoutMs())))
                .readTimeout(Duration.ofMillis(Math.max(500, props.getReadTimeoutMs())))
                .build();
    }

    @Override
    public PricePoint closeAt(String symbol, Instant at) {
        HttpUrl base = HttpUrl.parse(props.getBaseUrl().replaceAll("/+$", "") + "/close");
        if (base == null) {
            throw new IllegalStateException("bad forecast.market-data.base-url: " + props.getBaseUrl());
        }
        HttpUrl url = base.newBuilder()
                .addQueryParameter("symbol", symbol)
                .addQueryParameter("at", at.toString())
                .build();

        Request.Builder rb = new Request.Builder().url(url).get();
        if (props.getApiKey() != null && !props.getApiKey().isBlank()) {
            rb.header("X-API-KEY", props.getApiKey().trim());
        }

        try (Response resp = clientWithTimeouts().newCall(rb.build()).execute()) {
            String body = resp.body() != null ? resp.body().string() : "";

            if (resp.code() == 404) {
                throw new MarketDataUnavailableException(symbol, at, "no bar");
            }
            if (!resp.isSuccessful()) {
                log.warn("📈 MARKET error: GET /close -> {} body={}", resp.code(), shrink(body));
                throw new MarketDataUnavailableException(symbol, at, "HTTP " + resp.code());
            }
            if (body.isBlank()) {
                throw new MarketDataUnavailableException(symbol, at, "empty response");
            }

            ClosePriceDto dto = objectMapper.readValue(body, ClosePriceDto.class);
            return toPoint(symbol, at, dto);

        } catch (IOException e) {
            throw new MarketDataUnavailableException(symbol, at, "IO error: " + e.getMessage(), e);
        }
    }

    private static PricePoint toPoint(String symbol, Instant at, ClosePriceDto dto) {
        if (dto == null || dto.getClose() == null || !Double.isFinite(dto.getClose()) || dto.getClose() <= 0.0) {
            throw new MarketDataUnavailableException(symbol, at, "no usable close in response");
        }
        Instant barTime = dto.getBarTime() != null ? dto.getBarTime() : at;
        if (barTime.isAfter(at)) {
            // бар из будущего относительно запрошенного момента
            throw new MarketDataUnavailableException(symbol, at, "provider returned later bar " + barTime);
        }
        return new PricePoint(symbol, barTime, dto.getClose());
    }

    private static String shrink(String s) {
        if (s == null) return "null";
        String x = s.trim().replaceAll("\\s+", " ");
        if (x.length() <= 400) return x;
        return x.substring(0, 400) + "...";
    }
}
