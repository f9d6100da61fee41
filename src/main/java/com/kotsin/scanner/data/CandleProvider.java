package com.kotsin.scanner.data;

import com.kotsin.scanner.exception.DataUnavailableException;
import com.kotsin.scanner.model.CandleSeries;
import com.kotsin.scanner.model.Timeframe;

import java.time.Instant;

/**
 * Source of closed bars. Implementations may return fewer bars than asked for, but never
 * unsorted or duplicate-timestamp bars.
 */
public interface CandleProvider {

    /**
     * Closed bars for {@code symbol} on {@code timeframe} whose open time is at or after {@code since}.
     *
     * @throws DataUnavailableException when nothing at all can be retrieved
     */
    CandleSeries getSeries(String symbol, Timeframe timeframe, Instant since);
}
