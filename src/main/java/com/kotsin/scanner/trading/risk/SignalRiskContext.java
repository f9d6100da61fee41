package com.kotsin.scanner.trading.risk;

import com.kotsin.scanner.model.CandleSeries;
import com.kotsin.scanner.model.Timeframe;
import com.kotsin.scanner.mtf.MultiTimeframeContext;
import com.kotsin.scanner.trading.strategy.Signal;
import lombok.Builder;
import lombok.Value;

/**
 * Inputs for pricing a new signal: the signal and the H4/H1 series it was produced from.
 */
@Value
@Builder
public class SignalRiskContext {

    Signal signal;
    CandleSeries h4;
    CandleSeries h1;

    public static SignalRiskContext of(Signal signal, MultiTimeframeContext ctx) {
        return SignalRiskContext.builder()
                .signal(signal)
                .h4(ctx.series(Timeframe.H4).orElse(CandleSeries.empty(ctx.getSymbol(), Timeframe.H4)))
                .h1(ctx.series(Timeframe.H1).orElse(CandleSeries.empty(ctx.getSymbol(), Timeframe.H1)))
                .build();
    }
}
