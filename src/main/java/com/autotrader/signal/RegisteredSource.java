package com.autotrader.signal;

import java.math.BigDecimal;

/**
 * Registry entry for one analysis source. Weight and enabled flag are written by operators and
 * read by the engine at the start of each cycle.
 */
public final class RegisteredSource {

    private final AnalysisSource source;
    private volatile BigDecimal weight;
    private volatile boolean enabled;

    RegisteredSource(AnalysisSource source, BigDecimal weight) {
        this.source = source;
        this.weight = weight;
        this.enabled = true;
    }

    public String getName() {
        return source.name();
    }

    public AnalysisSource getSource() {
        return source;
    }

    public BigDecimal getWeight() {
        return weight;
    }

    public boolean isEnabled() {
        return enabled;
    }

    void setWeight(BigDecimal weight) {
        this.weight = weight;
    }

    void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }
}
