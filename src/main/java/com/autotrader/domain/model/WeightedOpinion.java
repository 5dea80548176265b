package com.autotrader.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * One analysis source's signal for the current cycle, together with the weight and enabled
 * flag read from the source registry at the start of that cycle.
 *
 * <p>A source that is disabled, or whose evaluation failed this cycle, appears with
 * {@code enabled = false} and a null signal so the aggregator can skip it.
 */
@Value
@Builder
public class WeightedOpinion {

    String sourceName;
    BigDecimal weight;
    Signal signal;
    boolean enabled;

    public static WeightedOpinion of(String sourceName, BigDecimal weight, Signal signal) {
        return WeightedOpinion.builder()
                .sourceName(sourceName)
                .weight(weight)
                .signal(signal)
                .enabled(true)
                .build();
    }

    public static WeightedOpinion inactive(String sourceName, BigDecimal weight) {
        return WeightedOpinion.builder()
                .sourceName(sourceName)
                .weight(weight)
                .enabled(false)
                .build();
    }

    /** True when this opinion takes part in aggregation. */
    public boolean isContributing() {
        return enabled && signal != null;
    }
}
