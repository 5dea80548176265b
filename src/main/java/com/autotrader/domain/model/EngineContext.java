package com.autotrader.domain.model;

import com.autotrader.domain.enums.EngineState;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Getter;
import lombok.Setter;

/**
 * Account and loop state owned by the CycleOrchestrator and passed explicitly to each step of a
 * cycle. Written only on the engine thread; readers go through {@code EngineStatus}.
 */
@Getter
@Setter
public class EngineContext {

    private final String symbol;

    /** Free cash: debited by entry notional on buy, credited by exit notional on sell. */
    private volatile BigDecimal accountBalance;

    private volatile EngineState state = EngineState.IDLE;
    private volatile boolean paused;
    private volatile long cycleCount;
    private volatile LocalDateTime lastCycleAt;
    private volatile String lastError;

    public EngineContext(String symbol, BigDecimal accountBalance) {
        this.symbol = symbol;
        this.accountBalance = accountBalance;
    }

    public long nextCycle() {
        return ++cycleCount;
    }

    public void debit(BigDecimal amount) {
        accountBalance = accountBalance.subtract(amount);
    }

    public void credit(BigDecimal amount) {
        accountBalance = accountBalance.add(amount);
    }
}
