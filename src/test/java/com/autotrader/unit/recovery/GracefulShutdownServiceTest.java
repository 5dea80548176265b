package com.autotrader.unit.recovery;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.autotrader.core.engine.CycleOrchestrator;
import com.autotrader.domain.model.Position;
import com.autotrader.event.EventPublisherHelper;
import com.autotrader.event.SystemEventType;
import com.autotrader.ledger.PositionLedger;
import com.autotrader.pnl.DailyStatsTracker;
import com.autotrader.recovery.GracefulShutdownService;
import com.autotrader.repository.TradingStore;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class GracefulShutdownServiceTest {

    @Mock
    private CycleOrchestrator cycleOrchestrator;

    @Mock
    private PositionLedger positionLedger;

    @Mock
    private TradingStore tradingStore;

    @Mock
    private DailyStatsTracker dailyStatsTracker;

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    private GracefulShutdownService gracefulShutdownService;

    @BeforeEach
    void setUp() {
        gracefulShutdownService = new GracefulShutdownService(
                cycleOrchestrator, positionLedger, tradingStore, dailyStatsTracker, eventPublisherHelper);
    }

    @Test
    @DisplayName("Stops the engine before persisting positions and flushing stats")
    void shutdownOrder() {
        Position position = Position.builder().id("P-1").symbol("BTC/USDT").build();
        when(positionLedger.snapshot()).thenReturn(List.of(position));
        gracefulShutdownService.start();

        gracefulShutdownService.stop();

        InOrder inOrder = inOrder(eventPublisherHelper, cycleOrchestrator, tradingStore, dailyStatsTracker);
        inOrder.verify(eventPublisherHelper)
                .publishSystem(eq(gracefulShutdownService), eq(SystemEventType.SHUTTING_DOWN), anyString());
        inOrder.verify(cycleOrchestrator).stop();
        inOrder.verify(tradingStore).savePosition(position);
        inOrder.verify(dailyStatsTracker).flush();
        assertThat(gracefulShutdownService.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Errors during shutdown are logged and the service still stops")
    void errorsDoNotPropagate() {
        doThrow(new IllegalStateException("boom")).when(cycleOrchestrator).stop();
        gracefulShutdownService.start();

        gracefulShutdownService.stop();

        assertThat(gracefulShutdownService.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Runs in a late lifecycle phase")
    void phase() {
        assertThat(gracefulShutdownService.getPhase()).isEqualTo(Integer.MAX_VALUE - 1);
    }
}
