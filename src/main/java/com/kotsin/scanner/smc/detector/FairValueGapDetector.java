package com.kotsin.scanner.smc.detector;

import com.kotsin.scanner.model.CandleSeries;
import com.kotsin.scanner.smc.model.FairValueGap;

import java.util.List;

/**
 * Finds Fair Value Gaps on a single series, ordered by origin index.
 * Filled gaps stay in the output with {@link FairValueGap#isFilled()} set.
 */
public interface FairValueGapDetector {

    List<FairValueGap> detect(CandleSeries series);
}
