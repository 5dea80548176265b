package com.autotrader.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time copy of the RiskGovernor's state machine.
 *
 * <p>The governor is the only writer; this value is what it persists after every mutation and
 * what it hands to readers. {@code locked} is the kill-switch latch and only an explicit reset
 * clears it. Loss percentages are relative to {@code startingCapital} and never negative.
 */
@Value
@Builder(toBuilder = true)
public class RiskState {

    BigDecimal startingCapital;
    BigDecimal dailyRealizedPnl;
    BigDecimal totalRealizedPnl;
    BigDecimal dailyLossPercent;
    BigDecimal totalLossPercent;
    boolean locked;
    String lockReason;
    LocalDateTime lockedAt;
    LocalDate dailyAnchorDate;
}
