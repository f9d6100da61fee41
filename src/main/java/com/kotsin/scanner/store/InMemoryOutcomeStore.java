package com.kotsin.scanner.store;

import com.kotsin.scanner.exception.InvariantViolationException;
import com.kotsin.scanner.model.Direction;
import com.kotsin.scanner.trading.risk.ClosedTradeOutcome;
import com.kotsin.scanner.trading.state.Trade;
import com.kotsin.scanner.trading.state.TradeState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * InMemoryOutcomeStore - process-local trade store, the default backend.
 *
 * Compare-and-set runs inside {@link ConcurrentHashMap#compute}, so the check and the write are
 * atomic per trade id.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "scanner.store", havingValue = "memory", matchIfMissing = true)
public class InMemoryOutcomeStore implements OutcomeStore {

    static final int HISTORY_LIMIT = 100;

    private final Map<String, Trade> trades = new ConcurrentHashMap<>();
    private final Map<String, String> tradeIdBySignal = new ConcurrentHashMap<>();

    @Override
    public List<ClosedTradeOutcome> queryClosedTrades(String symbol, Direction direction) {
        return trades.values().stream()
                .filter(t -> t.getState().isTerminal())
                .filter(t -> t.getSymbol().equals(symbol) && t.getDirection() == direction)
                .sorted(Comparator.comparing(Trade::getCloseTime).reversed())
                .limit(HISTORY_LIMIT)
                .map(Trade::toOutcome)
                .toList();
    }

    @Override
    public String createTrade(Trade trade) {
        String existing = tradeIdBySignal.putIfAbsent(trade.getSignalId(), trade.getId());
        if (existing != null) {
            throw new InvariantViolationException("Trade",
                    String.format("signal %s already has trade %s", trade.getSignalId(), existing));
        }
        if (trades.putIfAbsent(trade.getId(), trade) != null) {
            tradeIdBySignal.remove(trade.getSignalId());
            throw new InvariantViolationException("Trade", "duplicate trade id " + trade.getId());
        }
        log.debug("[OUTCOME_STORE] Created trade {} for {}", trade.getId(), trade.getSymbol());
        return trade.getId();
    }

    @Override
    public boolean compareAndSetTrade(String tradeId, TradeState expectedState, long expectedVersion, Trade updated) {
        AtomicBoolean swapped = new AtomicBoolean(false);
        trades.computeIfPresent(tradeId, (id, current) -> {
            if (current.getState() != expectedState || current.getVersion() != expectedVersion) {
                return current;
            }
            swapped.set(true);
            return updated;
        });
        if (!swapped.get()) {
            log.debug("[OUTCOME_STORE] CAS miss on {} (expected {} v{})", tradeId, expectedState, expectedVersion);
        }
        return swapped.get();
    }

    @Override
    public Optional<Trade> findTrade(String tradeId) {
        return Optional.ofNullable(trades.get(tradeId));
    }

    @Override
    public List<Trade> findOpenTrades(String symbol) {
        return trades.values().stream()
                .filter(Trade::isOpen)
                .filter(t -> t.getSymbol().equals(symbol))
                .sorted(Comparator.comparing(Trade::getOpenTime))
                .toList();
    }

    @Override
    public List<Trade> findAllOpenTrades() {
        return trades.values().stream()
                .filter(Trade::isOpen)
                .sorted(Comparator.comparing(Trade::getOpenTime))
                .toList();
    }

    @Override
    public List<Trade> findTradesOpenedBetween(Instant from, Instant to) {
        return trades.values().stream()
                .filter(t -> within(t.getOpenTime(), from, to))
                .sorted(Comparator.comparing(Trade::getOpenTime))
                .toList();
    }

    @Override
    public List<Trade> findTradesClosedBetween(Instant from, Instant to) {
        return trades.values().stream()
                .filter(t -> t.getCloseTime() != null && within(t.getCloseTime(), from, to))
                .sorted(Comparator.comparing(Trade::getCloseTime))
                .toList();
    }

    private static boolean within(Instant time, Instant from, Instant to) {
        return !time.isBefore(from) && time.isBefore(to);
    }
}
