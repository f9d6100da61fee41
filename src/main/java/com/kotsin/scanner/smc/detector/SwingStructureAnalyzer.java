package com.kotsin.scanner.smc.detector;

import com.kotsin.scanner.model.CandleSeries;
import com.kotsin.scanner.smc.model.StructureEvent;
import com.kotsin.scanner.smc.model.SwingPoint;

import java.util.List;

/**
 * Finds swing points and structural events (BOS, CHOCH, liquidity sweep) on a single series.
 *
 * Implementations are pure: the same series always yields the same output, and short series
 * yield empty lists rather than errors.
 */
public interface SwingStructureAnalyzer {

    /**
     * Swing highs and lows ordered by bar index.
     */
    List<SwingPoint> findSwings(CandleSeries series);

    /**
     * Structure events ordered by the bar index at which they fired.
     */
    List<StructureEvent> findStructure(CandleSeries series, List<SwingPoint> swings);

    default List<StructureEvent> findStructure(CandleSeries series) {
        return findStructure(series, findSwings(series));
    }

    /**
     * Fewest bars for which swing detection can return anything.
     */
    int minimumBars();
}
