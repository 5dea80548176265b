package com.autotrader.risk;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Capital-preservation limits enforced by the {@link RiskGovernor}.
 *
 * <p>All percentages are on a 0-100 scale and relative to {@code startingCapital}, except
 * {@code positionSizePercent} which applies to the current account balance. Loaded from
 * {@code autotrader.risk.*} at startup by {@code RiskConfig}.
 */
@Data
@Builder
public class RiskLimits {

    /** Share of the current balance committed to each new position. */
    private BigDecimal positionSizePercent;

    /** Daily realized loss at which new entries are blocked until the UTC day rolls over. */
    private BigDecimal dailyLossLimitPercent;

    /** Cumulative loss at which the kill switch latches. */
    private BigDecimal killSwitchPercent;

    /** Capital baseline that loss percentages are measured against. */
    private BigDecimal startingCapital;

    /** Smallest position notional worth placing. */
    private BigDecimal minPositionUsd;

    /** Distance of the protective stop below the entry price. */
    private BigDecimal stopLossPercent;
}
