package com.flagship.revenue_ledger.attribution;

import com.flagship.revenue_ledger.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SignalScoresTest {

    @Test
    @DisplayName("Unreported signals score zero")
    void missingSignalsScoreZero() {
        SignalScores scores = SignalScores.fromWire(Map.of("acquisition", new BigDecimal("0.5")));

        assertEquals(new BigDecimal("0.5000"), scores.get(SignalKind.ACQUISITION));
        assertEquals(new BigDecimal("0.0000"), scores.get(SignalKind.AD_TOUCHPOINT));
        assertTrue(scores.qualifies(SignalKind.ACQUISITION));
        assertFalse(scores.qualifies(SignalKind.AD_TOUCHPOINT));
    }

    @Test
    @DisplayName("Unknown signal names are rejected")
    void rejectsUnknownSignal() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> SignalScores.fromWire(Map.of("weather", new BigDecimal("0.5"))));
        assertTrue(e.getMessage().contains("weather"));
    }

    @Test
    @DisplayName("Scores outside [0, 1] are rejected")
    void rejectsOutOfRange() {
        assertThrows(ValidationException.class,
                () -> SignalScores.fromWire(Map.of("acquisition", new BigDecimal("1.01"))));
        assertThrows(ValidationException.class,
                () -> SignalScores.fromWire(Map.of("acquisition", new BigDecimal("-0.1"))));
    }

    @Test
    @DisplayName("Wire form lists every signal in declaration order")
    void wireForm() {
        SignalScores scores = SignalScores.fromWire(Map.of("nurture_engagement", new BigDecimal("0.75")));

        assertEquals(
                List.of("ad_touchpoint", "acquisition", "product_promotion", "nurture_engagement"),
                List.copyOf(scores.toWire().keySet()));
        assertEquals(scores, SignalScores.fromWire(scores.toWire()));
    }
}
