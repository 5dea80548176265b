package com.autotrader.signal;

import com.autotrader.domain.enums.SignalDirection;
import com.autotrader.domain.model.Signal;
import com.autotrader.domain.model.WeightedOpinion;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import org.springframework.stereotype.Component;

/**
 * Combines the cycle's weighted opinions into one decision by weighted voting.
 *
 * <p>Each contributing opinion adds {@code confidence * weight} to the bucket of its direction.
 * The bucket with the strictly largest score wins; a tie for the maximum resolves to HOLD. A BUY
 * or SELL winner below the confidence threshold is downgraded to HOLD but keeps its score as the
 * confidence. The result is capped at 100.
 *
 * <p>Stateless.
 */
@Component
public class SignalAggregator {

    static final String NO_ACTIVE_SOURCES = "no active sources";

    public Signal combine(List<WeightedOpinion> opinions, BigDecimal confidenceThreshold) {
        Map<SignalDirection, BigDecimal> scores = new EnumMap<>(SignalDirection.class);
        for (SignalDirection direction : SignalDirection.values()) {
            scores.put(direction, BigDecimal.ZERO);
        }

        StringJoiner sourceRationales = new StringJoiner(" | ");
        int contributing = 0;
        for (WeightedOpinion opinion : opinions) {
            if (!opinion.isContributing()) {
                continue;
            }
            Signal signal = opinion.getSignal();
            scores.merge(signal.getDirection(), signal.getConfidence().multiply(opinion.getWeight()), BigDecimal::add);
            sourceRationales.add(opinion.getSourceName() + ": " + signal.getRationale());
            contributing++;
        }

        if (contributing == 0) {
            return new Signal(SignalDirection.HOLD, BigDecimal.ZERO, NO_ACTIVE_SOURCES);
        }

        BigDecimal maxScore = scores.values().stream().max(BigDecimal::compareTo).orElse(BigDecimal.ZERO);
        List<SignalDirection> leaders = new ArrayList<>();
        for (Map.Entry<SignalDirection, BigDecimal> entry : scores.entrySet()) {
            if (entry.getValue().compareTo(maxScore) == 0) {
                leaders.add(entry.getKey());
            }
        }

        SignalDirection direction;
        String note = null;
        if (leaders.size() > 1) {
            direction = SignalDirection.HOLD;
            note = "tie between " + leaders + " at " + format(maxScore);
        } else {
            direction = leaders.get(0);
            if (direction != SignalDirection.HOLD && maxScore.compareTo(confidenceThreshold) < 0) {
                note = direction + " confidence " + format(maxScore) + " below threshold " + format(confidenceThreshold);
                direction = SignalDirection.HOLD;
            }
        }

        String rationale = note == null ? sourceRationales.toString() : sourceRationales + " | " + note;
        return new Signal(direction, maxScore.min(Signal.MAX_CONFIDENCE), rationale);
    }

    private static String format(BigDecimal value) {
        return value.stripTrailingZeros().toPlainString();
    }
}
