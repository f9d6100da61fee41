package com.kotsin.scanner.store;

import com.kotsin.scanner.model.Direction;
import com.kotsin.scanner.trading.risk.ClosedTradeOutcome;
import com.kotsin.scanner.trading.state.Trade;
import com.kotsin.scanner.trading.state.TradeState;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence of trades. {@link #compareAndSetTrade} is the only path that changes a stored trade.
 */
public interface OutcomeStore {

    /**
     * Most recent closed trades for statistics, newest first.
     */
    List<ClosedTradeOutcome> queryClosedTrades(String symbol, Direction direction);

    /**
     * Store a new trade and return its id.
     *
     * @throws com.kotsin.scanner.exception.InvariantViolationException when the id or its signal is already stored
     */
    String createTrade(Trade trade);

    /**
     * Atomically replace the trade only when the stored copy still has {@code expectedState} and
     * {@code expectedVersion}.
     *
     * @return false when another writer got there first
     */
    boolean compareAndSetTrade(String tradeId, TradeState expectedState, long expectedVersion, Trade updated);

    Optional<Trade> findTrade(String tradeId);

    List<Trade> findOpenTrades(String symbol);

    List<Trade> findAllOpenTrades();

    List<Trade> findTradesOpenedBetween(Instant from, Instant to);

    List<Trade> findTradesClosedBetween(Instant from, Instant to);
}
