package com.autotrader.domain.model;

import com.autotrader.domain.enums.SignalDirection;
import java.math.BigDecimal;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Immutable directional opinion produced by one analysis source (or by the aggregator).
 *
 * <p>Confidence is on a 0-100 scale. Signals are created fresh every cycle and never mutated;
 * the aggregated one is archived with the resulting trade as part of its {@link SignalSnapshot}.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class Signal {

    public static final BigDecimal MAX_CONFIDENCE = new BigDecimal("100");

    private final SignalDirection direction;
    private final BigDecimal confidence;
    private final String rationale;

    public Signal(SignalDirection direction, BigDecimal confidence, String rationale) {
        if (direction == null) {
            throw new IllegalArgumentException("Signal direction is required");
        }
        if (confidence == null || confidence.signum() < 0 || confidence.compareTo(MAX_CONFIDENCE) > 0) {
            throw new IllegalArgumentException("Confidence must be between 0 and 100, got " + confidence);
        }
        this.direction = direction;
        this.confidence = confidence;
        this.rationale = rationale != null ? rationale : "";
    }

    public static Signal of(SignalDirection direction, double confidence, String rationale) {
        return new Signal(direction, BigDecimal.valueOf(confidence), rationale);
    }

    public static Signal buy(double confidence, String rationale) {
        return of(SignalDirection.BUY, confidence, rationale);
    }

    public static Signal sell(double confidence, String rationale) {
        return of(SignalDirection.SELL, confidence, rationale);
    }

    public static Signal hold(double confidence, String rationale) {
        return of(SignalDirection.HOLD, confidence, rationale);
    }

    /** True for BUY and SELL. */
    public boolean isActionable() {
        return direction != SignalDirection.HOLD;
    }
}
