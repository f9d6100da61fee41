package com.kotsin.scanner.data;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.kotsin.scanner.config.ScannerConfig;
import com.kotsin.scanner.model.CandleSeries;
import com.kotsin.scanner.model.Timeframe;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * CachingCandleProvider - Caffeine-backed decorator in front of the history API.
 *
 * One entry per (symbol, timeframe). An entry lives until the bar after its last cached bar has
 * closed, never shorter than {@code candle-cache.min-ttl}, so a newly closed bar is fetched on the
 * first scan after its close. A request reaching further back than the cached series bypasses the
 * cache and replaces the entry.
 */
@Slf4j
@Primary
@Component
public class CachingCandleProvider implements CandleProvider {

    private final CandleProvider delegate;
    private final Cache<SeriesKey, CachedSeries> cache;

    @Autowired
    public CachingCandleProvider(HistoricalApiCandleProvider delegate, ScannerConfig config, Clock clock) {
        this(delegate, config, clock, Ticker.systemTicker());
    }

    CachingCandleProvider(CandleProvider delegate, ScannerConfig config, Clock clock, Ticker ticker) {
        this.delegate = delegate;
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.getCandleCache().getMaxSize())
                .expireAfter(new NextBarCloseExpiry(clock, config.getCandleCache().getMinTtl()))
                .ticker(ticker)
                .build();
        log.info("[CANDLE_CACHE] Initialized with maxSize={} minTtl={}",
                config.getCandleCache().getMaxSize(), config.getCandleCache().getMinTtl());
    }

    @Override
    public CandleSeries getSeries(String symbol, Timeframe timeframe, Instant since) {
        SeriesKey key = new SeriesKey(symbol, timeframe);
        CachedSeries cached = cache.getIfPresent(key);

        if (cached != null && !since.isBefore(cached.since())) {
            log.debug("[CANDLE_CACHE] Hit {} {}", symbol, timeframe);
            return cached.series().since(since);
        }

        CandleSeries fetched = delegate.getSeries(symbol, timeframe, since);
        cache.put(key, new CachedSeries(since, fetched));
        log.debug("[CANDLE_CACHE] Miss {} {}, cached {} bars", symbol, timeframe, fetched.size());
        return fetched;
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    long estimatedSize() {
        return cache.estimatedSize();
    }

    record SeriesKey(String symbol, Timeframe timeframe) {
    }

    record CachedSeries(Instant since, CandleSeries series) {
    }

    /**
     * Expires an entry when the bar following its newest cached bar closes.
     */
    private static final class NextBarCloseExpiry implements Expiry<SeriesKey, CachedSeries> {

        private final Clock clock;
        private final Duration minTtl;

        NextBarCloseExpiry(Clock clock, Duration minTtl) {
            this.clock = clock;
            this.minTtl = minTtl;
        }

        @Override
        public long expireAfterCreate(SeriesKey key, CachedSeries value, long currentTime) {
            return ttl(key.timeframe(), value.series()).toNanos();
        }

        @Override
        public long expireAfterUpdate(SeriesKey key, CachedSeries value, long currentTime, long currentDuration) {
            return ttl(key.timeframe(), value.series()).toNanos();
        }

        @Override
        public long expireAfterRead(SeriesKey key, CachedSeries value, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private Duration ttl(Timeframe timeframe, CandleSeries series) {
            Instant now = clock.instant();
            Instant nextClose = series.last()
                    .map(last -> last.closeTime(timeframe).plus(timeframe.getBarDuration()))
                    .orElse(now.plus(timeframe.getBarDuration()));
            Duration untilNextClose = Duration.between(now, nextClose);
            return untilNextClose.compareTo(minTtl) > 0 ? untilNextClose : minTtl;
        }
    }
}
