package com.kotsin.scanner.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DirectionTest {

    @Test
    @DisplayName("BUY: adverse is below, favorable is above")
    void testBuyOffsets() {
        assertEquals(950, Direction.BUY.adverse(1000, 50), 1e-9);
        assertEquals(1100, Direction.BUY.favorable(1000, 100), 1e-9);
        assertTrue(Direction.BUY.isStrictlyAdverse(1000, 950));
        assertFalse(Direction.BUY.isStrictlyAdverse(1000, 1000));
        assertEquals(-50, Direction.BUY.excursion(1000, 950), 1e-9);
    }

    @Test
    @DisplayName("SELL: adverse is above, favorable is below")
    void testSellOffsets() {
        assertEquals(2050, Direction.SELL.adverse(2000, 50), 1e-9);
        assertEquals(1900, Direction.SELL.favorable(2000, 100), 1e-9);
        assertTrue(Direction.SELL.isStrictlyFavorable(2000, 1900));
        assertEquals(100, Direction.SELL.excursion(2000, 1900), 1e-9);
        assertEquals(Direction.BUY, Direction.SELL.opposite());
    }
}
