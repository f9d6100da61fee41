package com.kotsin.scanner.trading.risk;

import com.kotsin.scanner.model.Direction;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * HistoricalOutcomeStats - MAE/MFE/holding aggregates of past closed trades for one
 * (symbol, direction). Derived read-only from closed trades.
 */
@Value
@Builder
public class HistoricalOutcomeStats {

    String symbol;
    Direction direction;
    int sampleCount;
    double medianMae;
    double medianMfe;
    Duration medianWinnerHolding;
    double averageR;

    public Optional<Duration> getMedianWinnerHolding() {
        return Optional.ofNullable(medianWinnerHolding);
    }

    public static HistoricalOutcomeStats from(String symbol, Direction direction, List<ClosedTradeOutcome> outcomes) {
        if (outcomes.isEmpty()) {
            return HistoricalOutcomeStats.builder()
                    .symbol(symbol)
                    .direction(direction)
                    .sampleCount(0)
                    .build();
        }

        double[] maes = outcomes.stream().mapToDouble(ClosedTradeOutcome::getMae).toArray();
        double[] mfes = outcomes.stream().mapToDouble(ClosedTradeOutcome::getMfe).toArray();
        double[] winnerHoldings = outcomes.stream()
                .filter(ClosedTradeOutcome::isWinner)
                .filter(o -> o.getHoldingDuration() != null)
                .mapToDouble(o -> o.getHoldingDuration().toMillis())
                .toArray();

        return HistoricalOutcomeStats.builder()
                .symbol(symbol)
                .direction(direction)
                .sampleCount(outcomes.size())
                .medianMae(median(maes))
                .medianMfe(median(mfes))
                .medianWinnerHolding(winnerHoldings.length == 0
                        ? null
                        : Duration.ofMillis(Math.round(median(winnerHoldings))))
                .averageR(outcomes.stream().mapToDouble(ClosedTradeOutcome::getRMultiple).average().orElse(0))
                .build();
    }

    static double median(double[] values) {
        if (values.length == 0) {
            return Double.NaN;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        return sorted.length % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2.0;
    }
}
