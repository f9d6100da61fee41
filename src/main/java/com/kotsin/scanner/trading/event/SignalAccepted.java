package com.kotsin.scanner.trading.event;

import com.kotsin.scanner.model.Direction;
import com.kotsin.scanner.trading.state.Trade;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class SignalAccepted implements TradeEvent {

    String tradeId;
    String signalId;
    String symbol;
    Direction direction;
    double entryPrice;
    double stopLoss;
    double takeProfit;
    double riskAmount;
    double size;
    double riskReward;
    String strategyName;
    String rationale;
    Instant time;

    public static SignalAccepted of(Trade trade) {
        return SignalAccepted.builder()
                .tradeId(trade.getId())
                .signalId(trade.getSignalId())
                .symbol(trade.getSymbol())
                .direction(trade.getDirection())
                .entryPrice(trade.getEntryPrice())
                .stopLoss(trade.getStopLoss())
                .takeProfit(trade.getTakeProfit())
                .riskAmount(trade.getRiskPlan().getRiskAmount())
                .size(trade.getRiskPlan().getSize())
                .riskReward(trade.getRiskPlan().riskReward())
                .strategyName(trade.getSignal().getStrategyName())
                .rationale(trade.getSignal().getRationale())
                .time(trade.getOpenTime())
                .build();
    }
}
