package com.kotsin.scanner.trading.risk;

import com.kotsin.scanner.config.ScannerConfig;
import com.kotsin.scanner.exception.DataInsufficientException;
import com.kotsin.scanner.exception.InvalidRiskPlanException;
import com.kotsin.scanner.model.CandleSeries;
import com.kotsin.scanner.model.Direction;
import com.kotsin.scanner.model.Timeframe;
import com.kotsin.scanner.smc.detector.SwingStructureAnalyzer;
import com.kotsin.scanner.smc.model.SwingPoint;
import com.kotsin.scanner.store.OutcomeStore;
import com.kotsin.scanner.support.TestCandles;
import com.kotsin.scanner.trading.state.Trade;
import com.kotsin.scanner.trading.state.TradeState;
import com.kotsin.scanner.trading.strategy.AdjustmentRecommendation;
import com.kotsin.scanner.trading.strategy.MarketCondition;
import com.kotsin.scanner.trading.strategy.Signal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("DynamicRiskTargetEstimator - stops, targets, sizing, adjustments")
class DynamicRiskTargetEstimatorTest {

    @Mock
    private SwingStructureAnalyzer structureAnalyzer;

    @Mock
    private OutcomeStore outcomeStore;

    private ScannerConfig config;
    private DynamicRiskTargetEstimator estimator;

    // 20 bars, range 10 each: ATR(14) = 10 on both timeframes
    private final CandleSeries h4 = TestCandles.flat(Timeframe.H4, 20, 1000, 5);
    private final CandleSeries h1 = TestCandles.flat(Timeframe.H1, 20, 1000, 5);

    @BeforeEach
    void setUp() {
        config = new ScannerConfig();
        estimator = new DynamicRiskTargetEstimator(config, structureAnalyzer, outcomeStore);
    }

    private static Signal signal(Direction direction, double entry) {
        return Signal.builder()
                .id("sig-1")
                .symbol(TestCandles.SYMBOL)
                .direction(direction)
                .time(TestCandles.openTime(Timeframe.H4, 20))
                .entryPrice(entry)
                .strategyName("test")
                .rationale("test")
                .build();
    }

    private static SwingPoint swing(SwingPoint.Kind kind, int index, double price) {
        return SwingPoint.builder().kind(kind).index(index).price(price)
                .time(TestCandles.openTime(Timeframe.H4, index)).build();
    }

    private static ClosedTradeOutcome outcome(double mfe, double r, long holdingHours) {
        return ClosedTradeOutcome.builder()
                .tradeId("past")
                .mae(5)
                .mfe(mfe)
                .rMultiple(r)
                .holdingDuration(Duration.ofHours(holdingHours))
                .closedAt(TestCandles.BASE)
                .build();
    }

    private SignalRiskContext context(Signal signal) {
        return SignalRiskContext.builder().signal(signal).h4(h4).h1(h1).build();
    }

    @Test
    @DisplayName("Position size: equity 10000 x 1% over stop distance 50 = 2.0 units")
    void testPositionSize() {
        assertEquals(100.0, estimator.riskAmount(), 1e-9);
        assertEquals(2.0, estimator.positionSize(TestCandles.SYMBOL, 50), 1e-9);
    }

    @Test
    @DisplayName("Position size rejects non-positive distance and non-finite size")
    void testPositionSizeRejects() {
        assertThrows(InvalidRiskPlanException.class, () -> estimator.positionSize(TestCandles.SYMBOL, 0));
        config.getRisk().setPointValue(0);
        assertThrows(InvalidRiskPlanException.class, () -> estimator.positionSize(TestCandles.SYMBOL, 50));
    }

    @Test
    @DisplayName("BUY: stop k x ATR below swing low, fixed-RR target without history")
    void testBuyWithFallbackTarget() {
        when(structureAnalyzer.findSwings(h4)).thenReturn(List.of(swing(SwingPoint.Kind.LOW, 15, 980)));

        RiskPlan plan = estimator.estimateForNewSignal(context(signal(Direction.BUY, 1000)));

        assertEquals(975.0, plan.getStopLoss(), 1e-9);
        assertEquals(25.0, plan.getStopDistance(), 1e-9);
        assertEquals(1050.0, plan.getTakeProfit(), 1e-9);
        assertEquals(TargetSource.FIXED_RR, plan.getTargetSource());
        assertEquals(4.0, plan.getSize(), 1e-9);
        assertEquals(100.0, plan.getRiskAmount(), 1e-9);
        assertEquals(10.0, plan.getAtrH4(), 1e-9);
        assertEquals(10.0, plan.getAtrH1(), 1e-9);
        assertEquals(2.0, plan.riskReward(), 1e-9);
    }

    @Test
    @DisplayName("Enough history: target at median MFE")
    void testHistoricalTarget() {
        when(structureAnalyzer.findSwings(h4)).thenReturn(List.of(swing(SwingPoint.Kind.LOW, 15, 980)));
        List<ClosedTradeOutcome> history = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            history.add(outcome(60, 1.5, 4));
        }
        when(outcomeStore.queryClosedTrades(TestCandles.SYMBOL, Direction.BUY)).thenReturn(history);

        RiskPlan plan = estimator.estimateForNewSignal(context(signal(Direction.BUY, 1000)));

        assertEquals(1060.0, plan.getTakeProfit(), 1e-9);
        assertEquals(TargetSource.HISTORICAL_MFE, plan.getTargetSource());
    }

    @Test
    @DisplayName("Too little history keeps the fixed-RR target")
    void testThinHistory() {
        when(structureAnalyzer.findSwings(h4)).thenReturn(List.of(swing(SwingPoint.Kind.LOW, 15, 980)));
        when(outcomeStore.queryClosedTrades(TestCandles.SYMBOL, Direction.BUY))
                .thenReturn(List.of(outcome(60, 1.5, 4), outcome(60, 1.5, 4)));

        RiskPlan plan = estimator.estimateForNewSignal(context(signal(Direction.BUY, 1000)));

        assertEquals(1050.0, plan.getTakeProfit(), 1e-9);
        assertEquals(TargetSource.FIXED_RR, plan.getTargetSource());
    }

    @Test
    @DisplayName("SELL: stop above swing high, target below entry")
    void testSell() {
        when(structureAnalyzer.findSwings(h4)).thenReturn(List.of(
                swing(SwingPoint.Kind.HIGH, 12, 1020),
                swing(SwingPoint.Kind.LOW, 14, 990)));

        RiskPlan plan = estimator.estimateForNewSignal(context(signal(Direction.SELL, 1000)));

        assertEquals(1025.0, plan.getStopLoss(), 1e-9);
        assertEquals(950.0, plan.getTakeProfit(), 1e-9);
        assertEquals(Direction.SELL, plan.getDirection());
    }

    @Test
    @DisplayName("Nearest swing below entry wins; swings above entry are ignored for a BUY")
    void testNearestSwing() {
        when(structureAnalyzer.findSwings(h4)).thenReturn(List.of(
                swing(SwingPoint.Kind.LOW, 8, 960),
                swing(SwingPoint.Kind.LOW, 12, 985),
                swing(SwingPoint.Kind.LOW, 16, 1005)));

        RiskPlan plan = estimator.estimateForNewSignal(context(signal(Direction.BUY, 1000)));

        assertEquals(980.0, plan.getStopLoss(), 1e-9);
    }

    @Test
    @DisplayName("No swing in the lookback: stop beyond the window's lowest low")
    void testFallbackToWindowExtreme() {
        when(structureAnalyzer.findSwings(h4)).thenReturn(List.of());

        RiskPlan plan = estimator.estimateForNewSignal(context(signal(Direction.BUY, 1000)));

        assertEquals(990.0, plan.getStopLoss(), 1e-9);
        assertEquals(1020.0, plan.getTakeProfit(), 1e-9);
    }

    @Test
    @DisplayName("Too few H1 bars for ATR is reported as insufficient data")
    void testShortH1() {
        CandleSeries shortH1 = TestCandles.flat(Timeframe.H1, 5, 1000, 5);
        SignalRiskContext ctx = SignalRiskContext.builder()
                .signal(signal(Direction.BUY, 1000)).h4(h4).h1(shortH1).build();

        assertThrows(DataInsufficientException.class, () -> estimator.estimateForNewSignal(ctx));
        verifyNoInteractions(outcomeStore);
    }

    @Test
    @DisplayName("Point value 0 makes the size non-finite and the plan is rejected")
    void testNonFiniteSize() {
        config.getRisk().setPointValue(0);
        when(structureAnalyzer.findSwings(any())).thenReturn(List.of(swing(SwingPoint.Kind.LOW, 15, 980)));

        assertThrows(InvalidRiskPlanException.class,
                () -> estimator.estimateForNewSignal(context(signal(Direction.BUY, 1000))));
    }

    // ========== Open trade adjustments ==========

    private static Trade buyTrade(double stopLoss) {
        return Trade.builder()
                .id("t1").symbol(TestCandles.SYMBOL).direction(Direction.BUY)
                .entryPrice(100).initialStopLoss(90).stopLoss(stopLoss).takeProfit(150)
                .state(TradeState.OPEN).openTime(TestCandles.BASE)
                .build();
    }

    private static OpenTradeAnalytics analytics(Trade trade, double price, MarketCondition condition, long hoursIn) {
        return OpenTradeAnalytics.builder()
                .trade(trade)
                .recommendation(AdjustmentRecommendation.builder()
                        .tradeId(trade.getId())
                        .condition(condition)
                        .h4Atr(10)
                        .currentPrice(price)
                        .evaluationTime(TestCandles.BASE.plus(Duration.ofHours(hoursIn)))
                        .build())
                .build();
    }

    @Test
    @DisplayName("At 1R the stop moves to entry")
    void testBreakEven() {
        Optional<SlTpAdjustment> adj = estimator.evaluateAdjustment(
                analytics(buyTrade(90), 112, MarketCondition.NEUTRAL, 2));

        assertTrue(adj.isPresent());
        assertEquals(SlTpAdjustment.Action.MOVE_STOP_TO_BREAK_EVEN, adj.get().getAction());
        assertEquals(100.0, adj.get().getNewStopLoss(), 1e-9);
        assertEquals(150.0, adj.get().getNewTakeProfit(), 1e-9);
    }

    @Test
    @DisplayName("Below 1R nothing changes")
    void testNoAdjustmentBelowThreshold() {
        assertTrue(estimator.evaluateAdjustment(
                analytics(buyTrade(90), 105, MarketCondition.CONTINUATION, 2)).isEmpty());
    }

    @Test
    @DisplayName("Stop already at entry and 2.5R open: trail to price - ATR")
    void testTrail() {
        Optional<SlTpAdjustment> adj = estimator.evaluateAdjustment(
                analytics(buyTrade(100), 125, MarketCondition.CONTINUATION, 2));

        assertTrue(adj.isPresent());
        assertEquals(SlTpAdjustment.Action.TRAIL_STOP, adj.get().getAction());
        assertEquals(115.0, adj.get().getNewStopLoss(), 1e-9);
    }

    @Test
    @DisplayName("Trail never loosens a stop that is already tighter")
    void testTrailNeverLoosens() {
        assertTrue(estimator.evaluateAdjustment(
                analytics(buyTrade(120), 125, MarketCondition.CONTINUATION, 2)).isEmpty());
    }

    @Test
    @DisplayName("Configured order decides which rule fires first")
    void testAdjustmentOrder() {
        config.getRisk().setAdjustmentOrder(List.of(
                ScannerConfig.AdjustmentRule.TRAIL, ScannerConfig.AdjustmentRule.BREAK_EVEN));

        Optional<SlTpAdjustment> adj = estimator.evaluateAdjustment(
                analytics(buyTrade(90), 125, MarketCondition.CONTINUATION, 2));

        assertEquals(SlTpAdjustment.Action.TRAIL_STOP, adj.orElseThrow().getAction());
    }

    @Test
    @DisplayName("Stale trade without continuation is closed early")
    void testCloseEarly() {
        when(outcomeStore.queryClosedTrades(TestCandles.SYMBOL, Direction.BUY))
                .thenReturn(List.of(outcome(20, 1.0, 10), outcome(20, 2.0, 10), outcome(5, -1.0, 40)));

        Optional<SlTpAdjustment> adj = estimator.evaluateAdjustment(
                analytics(buyTrade(90), 101, MarketCondition.NEUTRAL, 30));

        assertTrue(adj.isPresent());
        assertEquals(SlTpAdjustment.Action.CLOSE_EARLY, adj.get().getAction());
        assertEquals(90.0, adj.get().getNewStopLoss(), 1e-9);
    }

    @Test
    @DisplayName("Continuation structure keeps a stale trade open")
    void testContinuationBlocksCloseEarly() {
        assertTrue(estimator.evaluateAdjustment(
                analytics(buyTrade(90), 101, MarketCondition.CONTINUATION, 30)).isEmpty());
        verifyNoInteractions(outcomeStore);
    }

    @Test
    @DisplayName("Within the median holding window nothing is closed")
    void testNotStaleYet() {
        when(outcomeStore.queryClosedTrades(TestCandles.SYMBOL, Direction.BUY))
                .thenReturn(List.of(outcome(20, 1.0, 10)));

        assertTrue(estimator.evaluateAdjustment(
                analytics(buyTrade(90), 101, MarketCondition.EXHAUSTION, 15)).isEmpty());
    }

    @Test
    @DisplayName("Closed trades get no adjustment")
    void testClosedTrade() {
        Trade closed = buyTrade(90).toBuilder().state(TradeState.CLOSED_BY_TP).build();

        assertTrue(estimator.evaluateAdjustment(analytics(closed, 125, MarketCondition.NEUTRAL, 2)).isEmpty());
    }
}
