package com.kotsin.scanner.data;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kotsin.scanner.config.ScannerConfig;
import com.kotsin.scanner.exception.DataUnavailableException;
import com.kotsin.scanner.exception.InvariantViolationException;
import com.kotsin.scanner.model.Candle;
import com.kotsin.scanner.model.CandleSeries;
import com.kotsin.scanner.model.Timeframe;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;

/**
 * HistoricalApiCandleProvider - HTTP client for the history API's candle endpoint.
 *
 * Rows are normalized before they reach the core:
 * 1. unparseable timestamps and rows with inconsistent OHLC are skipped
 * 2. rows are sorted by time; a duplicate timestamp keeps the last row received
 * 3. a trailing bar that has not closed yet is dropped
 */
@Slf4j
@Service
public class HistoricalApiCandleProvider implements CandleProvider {

    private static final String LOG_PREFIX = "[HISTORY-API]";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final ScannerConfig config;
    private final Clock clock;

    public HistoricalApiCandleProvider(RestTemplate historyApiRestTemplate, ObjectMapper objectMapper,
                                       ScannerConfig config, Clock clock) {
        this.restTemplate = historyApiRestTemplate;
        this.objectMapper = objectMapper;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public CandleSeries getSeries(String symbol, Timeframe timeframe, Instant since) {
        String url = UriComponentsBuilder.fromHttpUrl(config.getHistoryApi().getBaseUrl() + "/candles")
                .queryParam("symbol", symbol)
                .queryParam("interval", timeframe.getInterval())
                .queryParam("start", since.toString())
                .toUriString();

        log.debug("{} Fetching {}", LOG_PREFIX, url);
        long startTime = System.currentTimeMillis();

        String response;
        try {
            response = restTemplate.getForObject(url, String.class);
        } catch (RestClientException e) {
            log.error("{} REST error fetching {} {}: {}", LOG_PREFIX, symbol, timeframe, e.getMessage());
            throw new DataUnavailableException(symbol, timeframe, "history API request failed", e);
        }

        if (response == null || response.isBlank() || response.equals("[]")) {
            log.warn("{} Empty response for {} {}", LOG_PREFIX, symbol, timeframe);
            return CandleSeries.empty(symbol, timeframe);
        }

        List<HistoricalCandle> rows;
        try {
            rows = objectMapper.readValue(response, new TypeReference<List<HistoricalCandle>>() {});
        } catch (JsonProcessingException e) {
            log.error("{} Unreadable response for {} {}: {}", LOG_PREFIX, symbol, timeframe, e.getMessage());
            throw new DataUnavailableException(symbol, timeframe, "history API response unreadable", e);
        }

        CandleSeries series = CandleSeries.of(symbol, timeframe, normalize(symbol, timeframe, rows));
        log.info("{} Fetched {} candles for {} {} in {}ms",
                LOG_PREFIX, series.size(), symbol, timeframe, System.currentTimeMillis() - startTime);
        return series;
    }

    List<Candle> normalize(String symbol, Timeframe timeframe, List<HistoricalCandle> rows) {
        TreeMap<Instant, Candle> byTime = new TreeMap<>();
        int skipped = 0;

        for (HistoricalCandle row : rows) {
            Optional<Instant> openTime = row.getTimestampAsInstant();
            if (openTime.isEmpty()) {
                skipped++;
                continue;
            }
            try {
                byTime.put(openTime.get(), Candle.builder()
                        .openTime(openTime.get())
                        .open(row.getOpen())
                        .high(row.getHigh())
                        .low(row.getLow())
                        .close(row.getClose())
                        .volume(row.getVolume())
                        .build());
            } catch (InvariantViolationException e) {
                log.warn("{} Skipping bad row for {} {}: {}", LOG_PREFIX, symbol, timeframe, e.getMessage());
                skipped++;
            }
        }

        if (skipped > 0) {
            log.warn("{} Skipped {} of {} rows for {} {}", LOG_PREFIX, skipped, rows.size(), symbol, timeframe);
        }

        Instant now = clock.instant();
        if (!byTime.isEmpty() && byTime.lastEntry().getValue().closeTime(timeframe).isAfter(now)) {
            byTime.pollLastEntry();
        }
        return new ArrayList<>(byTime.values());
    }
}
