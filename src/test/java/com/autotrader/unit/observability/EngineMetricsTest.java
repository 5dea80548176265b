package com.autotrader.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.autotrader.domain.model.Trade;
import com.autotrader.event.TradeEvent;
import com.autotrader.ledger.PositionLedger;
import com.autotrader.observability.EngineMetrics;
import com.autotrader.risk.RiskGovernor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for EngineMetrics using a SimpleMeterRegistry.
 */
@ExtendWith(MockitoExtension.class)
class EngineMetricsTest {

    @Mock
    private PositionLedger positionLedger;

    @Mock
    private RiskGovernor riskGovernor;

    private SimpleMeterRegistry meterRegistry;
    private EngineMetrics engineMetrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        engineMetrics = new EngineMetrics(meterRegistry, positionLedger, riskGovernor);
    }

    @Test
    @DisplayName("Counters track cycles, failures, rejections and executed trades")
    void counters() {
        engineMetrics.recordCycle();
        engineMetrics.recordCycle();
        engineMetrics.recordCycleFailure();
        engineMetrics.recordRejection();
        engineMetrics.onTradeEvent(new TradeEvent(this, Trade.builder().id("T-1").build()));

        assertThat(meterRegistry.get("engine.cycles").counter().count()).isEqualTo(2.0);
        assertThat(meterRegistry.get("engine.cycle.failures").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("trades.rejected").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("trades.executed").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Gauges read the ledger and the kill-switch latch on demand")
    void gauges() {
        when(positionLedger.openPositions()).thenReturn(List.of());
        when(riskGovernor.isLocked()).thenReturn(true);

        assertThat(meterRegistry.get("positions.open").gauge().value()).isEqualTo(0.0);
        assertThat(meterRegistry.get("risk.locked").gauge().value()).isEqualTo(1.0);
    }
}
