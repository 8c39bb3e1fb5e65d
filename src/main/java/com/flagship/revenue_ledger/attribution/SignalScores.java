package com.flagship.revenue_ledger.attribution;

import com.flagship.revenue_ledger.exception.ValidationException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-signal evidence scores for one order, each in [0, 1]. Signals that were not
 * reported score zero.
 */
public final class SignalScores {

    public static final int SCORE_SCALE = 4;

    private static final SignalScores NONE = new SignalScores(new EnumMap<>(SignalKind.class));

    private final EnumMap<SignalKind, BigDecimal> scores;

    private SignalScores(EnumMap<SignalKind, BigDecimal> scores) {
        this.scores = scores;
    }

    public static SignalScores none() {
        return NONE;
    }

    public static SignalScores of(Map<SignalKind, BigDecimal> scores) {
        EnumMap<SignalKind, BigDecimal> copy = new EnumMap<>(SignalKind.class);
        scores.forEach((kind, value) -> copy.put(kind, validate(kind.getKey(), value)));
        return new SignalScores(copy);
    }

    /**
     * Parses the wire form ({@code {"ad_touchpoint": 0.8, ...}}). Unknown keys are rejected.
     */
    public static SignalScores fromWire(Map<String, BigDecimal> raw) {
        if (raw == null || raw.isEmpty()) {
            return NONE;
        }
        EnumMap<SignalKind, BigDecimal> parsed = new EnumMap<>(SignalKind.class);
        for (Map.Entry<String, BigDecimal> entry : raw.entrySet()) {
            SignalKind kind = SignalKind.fromKey(entry.getKey())
                    .orElseThrow(() -> new ValidationException("signalScores",
                            "Unknown signal '" + entry.getKey() + "'"));
            parsed.put(kind, validate(entry.getKey(), entry.getValue()));
        }
        return new SignalScores(parsed);
    }

    private static BigDecimal validate(String key, BigDecimal value) {
        if (value == null || value.signum() < 0 || value.compareTo(BigDecimal.ONE) > 0) {
            throw new ValidationException("signalScores",
                    "Signal '" + key + "' must be between 0 and 1, got " + value);
        }
        if (value.stripTrailingZeros().scale() > SCORE_SCALE) {
            throw new ValidationException("signalScores",
                    "Signal '" + key + "' supports at most " + SCORE_SCALE + " decimal places");
        }
        return value.setScale(SCORE_SCALE, RoundingMode.UNNECESSARY);
    }

    public BigDecimal get(SignalKind kind) {
        return scores.getOrDefault(kind, BigDecimal.ZERO.setScale(SCORE_SCALE));
    }

    public boolean qualifies(SignalKind kind) {
        return kind.qualifies(get(kind));
    }

    public Map<String, BigDecimal> toWire() {
        Map<String, BigDecimal> wire = new LinkedHashMap<>();
        for (SignalKind kind : SignalKind.values()) {
            wire.put(kind.getKey(), get(kind));
        }
        return Collections.unmodifiableMap(wire);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SignalScores other)) {
            return false;
        }
        for (SignalKind kind : SignalKind.values()) {
            if (get(kind).compareTo(other.get(kind)) != 0) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        return Objects.hash(toWire().values().stream().map(BigDecimal::stripTrailingZeros).toArray());
    }

    @Override
    public String toString() {
        return toWire().toString();
    }
}
