package com.kotsin.scanner.mtf;

import com.kotsin.scanner.data.CandleProvider;
import com.kotsin.scanner.exception.DataInsufficientException;
import com.kotsin.scanner.model.Candle;
import com.kotsin.scanner.model.CandleSeries;
import com.kotsin.scanner.model.Timeframe;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Loads the six timeframes for a symbol and picks the current price from the finest
 * timeframe that returned bars.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MultiTimeframeContextLoader {

    // Finest first
    private static final Timeframe[] PRICE_SOURCES = {
            Timeframe.M1, Timeframe.M5, Timeframe.M15, Timeframe.M30, Timeframe.H1, Timeframe.H4
    };

    private final CandleProvider candleProvider;

    /**
     * @throws com.kotsin.scanner.exception.DataUnavailableException propagated from the provider
     * @throws DataInsufficientException when no timeframe returned a single bar
     */
    public MultiTimeframeContext load(String symbol, String providerSymbol, Instant evaluationTime,
                                      Instant lastSeenH4BarTime) {
        Map<Timeframe, CandleSeries> loaded = new EnumMap<>(Timeframe.class);
        for (Timeframe timeframe : Timeframe.values()) {
            Instant since = evaluationTime.minus(timeframe.getDefaultLookback());
            CandleSeries fetched = candleProvider.getSeries(providerSymbol, timeframe, since);
            loaded.put(timeframe, fetched);
        }

        Optional<Candle> latest = Optional.empty();
        for (Timeframe timeframe : PRICE_SOURCES) {
            latest = loaded.get(timeframe).last();
            if (latest.isPresent()) {
                break;
            }
        }
        if (latest.isEmpty()) {
            throw new DataInsufficientException(symbol, "no bars on any timeframe");
        }

        log.debug("[SCANNER] {} context loaded: H4={} H1={} M30={} M15={} M5={} M1={} price={}",
                symbol, loaded.get(Timeframe.H4).size(), loaded.get(Timeframe.H1).size(),
                loaded.get(Timeframe.M30).size(), loaded.get(Timeframe.M15).size(),
                loaded.get(Timeframe.M5).size(), loaded.get(Timeframe.M1).size(), latest.get().getClose());

        return MultiTimeframeContext.builder()
                .symbol(symbol)
                .evaluationTime(evaluationTime)
                .currentPrice(latest.get().getClose())
                .lastSeenH4BarTime(lastSeenH4BarTime)
                .series(loaded)
                .build();
    }
}
