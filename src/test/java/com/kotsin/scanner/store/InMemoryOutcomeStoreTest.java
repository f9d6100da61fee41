package com.kotsin.scanner.store;

import com.kotsin.scanner.exception.InvariantViolationException;
import com.kotsin.scanner.model.Direction;
import com.kotsin.scanner.support.TestCandles;
import com.kotsin.scanner.trading.risk.ClosedTradeOutcome;
import com.kotsin.scanner.trading.state.Trade;
import com.kotsin.scanner.trading.state.TradeState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryOutcomeStore - CAS, uniqueness, history queries")
class InMemoryOutcomeStoreTest {

    private InMemoryOutcomeStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryOutcomeStore();
    }

    private static Trade openTrade(String id, String symbol, Direction direction, long openHour) {
        double stop = direction == Direction.BUY ? 90 : 110;
        double target = direction == Direction.BUY ? 120 : 80;
        return Trade.builder()
                .id(id).signalId("sig-" + id).symbol(symbol).direction(direction)
                .entryPrice(100).initialStopLoss(stop).stopLoss(stop).takeProfit(target)
                .state(TradeState.OPEN).version(0)
                .openTime(TestCandles.BASE.plus(Duration.ofHours(openHour)))
                .build();
    }

    private static Trade closed(Trade open, TradeState state, double price, long closeHour) {
        return open.toBuilder()
                .state(state).closePrice(price)
                .closeTime(TestCandles.BASE.plus(Duration.ofHours(closeHour)))
                .maxFavorableExcursion(15).maxAdverseExcursion(4)
                .version(open.getVersion() + 1)
                .build();
    }

    @Test
    @DisplayName("Created trade is found and listed as open")
    void testCreateAndFind() {
        Trade trade = openTrade("t1", "US30", Direction.BUY, 0);

        assertEquals("t1", store.createTrade(trade));

        assertEquals(trade, store.findTrade("t1").orElseThrow());
        assertEquals(1, store.findOpenTrades("US30").size());
        assertTrue(store.findOpenTrades("NAS100").isEmpty());
        assertEquals(1, store.findAllOpenTrades().size());
    }

    @Test
    @DisplayName("Second trade for the same signal or id is rejected")
    void testUniqueness() {
        store.createTrade(openTrade("t1", "US30", Direction.BUY, 0));

        Trade sameSignal = openTrade("t2", "US30", Direction.BUY, 0).toBuilder().signalId("sig-t1").build();
        assertThrows(InvariantViolationException.class, () -> store.createTrade(sameSignal));

        Trade sameId = openTrade("t1", "US30", Direction.BUY, 0).toBuilder().signalId("sig-other").build();
        assertThrows(InvariantViolationException.class, () -> store.createTrade(sameId));

        // the rejected id must not keep its signal reserved
        store.createTrade(openTrade("t3", "US30", Direction.BUY, 0).toBuilder().signalId("sig-other").build());
        assertEquals(2, store.findAllOpenTrades().size());
    }

    @Test
    @DisplayName("CAS succeeds only on matching state and version")
    void testCompareAndSet() {
        Trade trade = openTrade("t1", "US30", Direction.BUY, 0);
        store.createTrade(trade);
        Trade v1 = trade.toBuilder().version(1).maxFavorableExcursion(5).build();

        assertFalse(store.compareAndSetTrade("t1", TradeState.OPEN, 3, v1));
        assertFalse(store.compareAndSetTrade("t1", TradeState.CLOSED_BY_TP, 0, v1));
        assertFalse(store.compareAndSetTrade("missing", TradeState.OPEN, 0, v1));
        assertEquals(0, store.findTrade("t1").orElseThrow().getVersion());

        assertTrue(store.compareAndSetTrade("t1", TradeState.OPEN, 0, v1));
        assertEquals(1, store.findTrade("t1").orElseThrow().getVersion());

        // a second writer holding v0 loses
        assertFalse(store.compareAndSetTrade("t1", TradeState.OPEN, 0, v1.toBuilder().version(2).build()));
    }

    @Test
    @DisplayName("Closed-trade history is per symbol and direction, newest first")
    void testQueryClosedTrades() {
        Trade a = openTrade("a", "US30", Direction.BUY, 0);
        Trade b = openTrade("b", "US30", Direction.BUY, 1);
        Trade c = openTrade("c", "US30", Direction.SELL, 1);
        Trade d = openTrade("d", "NAS100", Direction.BUY, 1);
        Trade e = openTrade("e", "US30", Direction.BUY, 2);
        List.of(a, b, c, d, e).forEach(store::createTrade);

        store.compareAndSetTrade("a", TradeState.OPEN, 0, closed(a, TradeState.CLOSED_BY_TP, 120, 5));
        store.compareAndSetTrade("b", TradeState.OPEN, 0, closed(b, TradeState.CLOSED_BY_SL, 90, 8));
        store.compareAndSetTrade("c", TradeState.OPEN, 0, closed(c, TradeState.CLOSED_BY_TP, 80, 6));
        store.compareAndSetTrade("d", TradeState.OPEN, 0, closed(d, TradeState.CLOSED_BY_TP, 120, 6));

        List<ClosedTradeOutcome> history = store.queryClosedTrades("US30", Direction.BUY);

        assertEquals(2, history.size());
        assertEquals("b", history.get(0).getTradeId());
        assertEquals(-1.0, history.get(0).getRMultiple(), 1e-9);
        assertEquals("a", history.get(1).getTradeId());
        assertEquals(2.0, history.get(1).getRMultiple(), 1e-9);
        assertEquals(Duration.ofHours(5), history.get(1).getHoldingDuration());
        assertEquals(15.0, history.get(1).getMfe(), 1e-9);
        assertTrue(history.get(1).isWinner());
    }

    @Test
    @DisplayName("Period queries use [from, to)")
    void testPeriodQueries() {
        Trade a = openTrade("a", "US30", Direction.BUY, 0);
        Trade b = openTrade("b", "US30", Direction.BUY, 2);
        store.createTrade(a);
        store.createTrade(b);
        store.compareAndSetTrade("a", TradeState.OPEN, 0, closed(a, TradeState.CLOSED_BY_TP, 120, 2));

        Instant from = TestCandles.BASE;
        Instant to = TestCandles.BASE.plus(Duration.ofHours(2));

        assertEquals(List.of("a"), store.findTradesOpenedBetween(from, to).stream().map(Trade::getId).toList());
        assertTrue(store.findTradesClosedBetween(from, to).isEmpty());
        assertEquals(1, store.findTradesClosedBetween(to, to.plusSeconds(1)).size());
        assertEquals(List.of("b"), store.findAllOpenTrades().stream().map(Trade::getId).toList());
    }
}
