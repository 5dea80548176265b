package com.autotrader.observability;

import com.autotrader.event.TradeEvent;
import com.autotrader.ledger.PositionLedger;
import com.autotrader.risk.RiskGovernor;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Registers and updates the engine's Micrometer metrics:
 * <ul>
 *   <li><b>engine.cycles</b> (counter): completed trading cycles</li>
 *   <li><b>engine.cycle.failures</b> (counter): cycles aborted by an exception</li>
 *   <li><b>trades.executed</b> (counter): recorded trades, incremented from TradeEvents</li>
 *   <li><b>trades.rejected</b> (counter): entries rejected by the risk governor</li>
 *   <li><b>positions.open</b> (gauge): open positions in the ledger</li>
 *   <li><b>risk.locked</b> (gauge 0/1): whether the kill switch is latched</li>
 * </ul>
 *
 * <p>Gauges are evaluated lazily by Micrometer on scrape.
 */
@Service
public class EngineMetrics {

    private final Counter cyclesCounter;
    private final Counter cycleFailuresCounter;
    private final Counter tradesExecutedCounter;
    private final Counter tradesRejectedCounter;

    public EngineMetrics(MeterRegistry meterRegistry, PositionLedger positionLedger, RiskGovernor riskGovernor) {
        this.cyclesCounter = Counter.builder("engine.cycles")
                .description("Completed trading cycles")
                .register(meterRegistry);

        this.cycleFailuresCounter = Counter.builder("engine.cycle.failures")
                .description("Trading cycles aborted by an exception")
                .register(meterRegistry);

        this.tradesExecutedCounter = Counter.builder("trades.executed")
                .description("Executed and recorded trades")
                .register(meterRegistry);

        this.tradesRejectedCounter = Counter.builder("trades.rejected")
                .description("Entries rejected by the risk governor")
                .register(meterRegistry);

        Gauge.builder("positions.open", positionLedger, ledger -> ledger.openPositions().size())
                .description("Open positions")
                .register(meterRegistry);

        Gauge.builder("risk.locked", riskGovernor, governor -> governor.isLocked() ? 1.0 : 0.0)
                .description("Kill switch latched (1) or not (0)")
                .register(meterRegistry);
    }

    public void recordCycle() {
        cyclesCounter.increment();
    }

    public void recordCycleFailure() {
        cycleFailuresCounter.increment();
    }

    public void recordRejection() {
        tradesRejectedCounter.increment();
    }

    @EventListener
    @Order(20)
    public void onTradeEvent(TradeEvent event) {
        tradesExecutedCounter.increment();
    }
}
