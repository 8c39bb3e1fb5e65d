package com.flagship.revenue_ledger.baseline;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class DataQualityTest {

    @Test
    @DisplayName("Fewer than 10 samples or under 30 days is LOW")
    void low() {
        assertEquals(DataQuality.LOW, DataQuality.assess(9, 365, null));
        assertEquals(DataQuality.LOW, DataQuality.assess(500, 29, null));
    }

    @Test
    @DisplayName("Fewer than 30 samples, under 90 days or variance above 0.50 is MEDIUM")
    void medium() {
        assertEquals(DataQuality.MEDIUM, DataQuality.assess(10, 30, null));
        assertEquals(DataQuality.MEDIUM, DataQuality.assess(29, 365, null));
        assertEquals(DataQuality.MEDIUM, DataQuality.assess(100, 89, null));
        assertEquals(DataQuality.MEDIUM, DataQuality.assess(100, 365, new BigDecimal("0.51")));
    }

    @Test
    @DisplayName("Enough history with low variance is HIGH")
    void high() {
        assertEquals(DataQuality.HIGH, DataQuality.assess(30, 90, null));
        assertEquals(DataQuality.HIGH, DataQuality.assess(30, 90, new BigDecimal("0.50")));
    }
}
