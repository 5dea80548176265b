package com.autotrader.signal;

import com.autotrader.domain.model.MarketSnapshot;
import com.autotrader.domain.model.Signal;
import java.math.BigDecimal;

/**
 * A pluggable producer of directional opinions.
 *
 * <p>Implementations are registered with the {@link AnalysisSourceRegistry} under a unique
 * {@link #name()} and evaluated once per cycle on the engine thread. An implementation may throw;
 * the registry isolates the failure to that source for that cycle.
 */
public interface AnalysisSource {

    /** Unique, stable name. Also the key under {@code autotrader.signal.weights}. */
    String name();

    Signal evaluate(MarketSnapshot snapshot);

    /** Weight used when no weight is configured for this source. */
    default BigDecimal defaultWeight() {
        return BigDecimal.ONE;
    }
}
