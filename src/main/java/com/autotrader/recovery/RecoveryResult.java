package com.autotrader.recovery;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Outcome of the startup recovery sequence, summarized in the RECOVERY_COMPLETED event.
 */
@Data
@Builder
public class RecoveryResult {

    private boolean success;
    private long startedAt;
    private long durationMs;
    private String error;

    // Risk state
    private boolean riskStateRestored;
    private boolean killSwitchWasActive;

    // Ledger
    private int positionsRestored;
    private BigDecimal restoredBalance;

    // Daily stats
    private boolean dailyStatsRestored;

    // Engine
    private boolean engineStarted;
}
