package com.autotrader.domain.model;

import com.autotrader.domain.enums.EngineState;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Read-only snapshot of the engine for operators and dashboards. */
@Value
@Builder
public class EngineStatus {

    String symbol;
    EngineState state;
    boolean paused;
    BigDecimal accountBalance;
    RiskState riskState;
    List<Position> openPositions;
    long cycleCount;
    LocalDateTime lastCycleAt;
    String lastError;
}
