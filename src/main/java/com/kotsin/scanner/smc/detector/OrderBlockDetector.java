package com.kotsin.scanner.smc.detector;

import com.kotsin.scanner.model.CandleSeries;
import com.kotsin.scanner.smc.model.OrderBlock;

import java.util.List;

/**
 * Finds Order Blocks on a single series, ordered by origin index, with superseded and
 * invalidated blocks already pruned.
 */
public interface OrderBlockDetector {

    List<OrderBlock> detect(CandleSeries series);

    /**
     * Fewest bars for which detection can return anything.
     */
    int minimumBars();
}
