package com.autotrader.unit.recovery;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.autotrader.config.TradingProperties;
import com.autotrader.core.engine.CycleOrchestrator;
import com.autotrader.domain.enums.PositionStatus;
import com.autotrader.domain.model.DailyStats;
import com.autotrader.domain.model.Position;
import com.autotrader.domain.model.RiskState;
import com.autotrader.event.EventPublisherHelper;
import com.autotrader.event.SystemEventType;
import com.autotrader.ledger.PositionLedger;
import com.autotrader.pnl.DailyStatsTracker;
import com.autotrader.recovery.RecoveryResult;
import com.autotrader.recovery.StartupRecoveryService;
import com.autotrader.repository.TradingStore;
import com.autotrader.risk.RiskGovernor;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for StartupRecoveryService. The ledger is real so the balance rebuild sees the
 * rehydrated positions; everything else is mocked.
 */
@ExtendWith(MockitoExtension.class)
class StartupRecoveryServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 3, 15);

    @Mock
    private TradingStore tradingStore;

    @Mock
    private RiskGovernor riskGovernor;

    @Mock
    private DailyStatsTracker dailyStatsTracker;

    @Mock
    private CycleOrchestrator cycleOrchestrator;

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    private PositionLedger positionLedger;
    private TradingProperties tradingProperties;
    private StartupRecoveryService startupRecoveryService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-03-15T08:00:00Z"), ZoneOffset.UTC);
        positionLedger = new PositionLedger(clock);
        tradingProperties = new TradingProperties();

        lenient().when(tradingStore.loadRiskState()).thenReturn(Optional.empty());
        lenient().when(tradingStore.loadOpenPositions()).thenReturn(List.of());
        lenient().when(tradingStore.loadDailyStats(TODAY)).thenReturn(Optional.empty());
        lenient().when(riskGovernor.snapshot()).thenReturn(riskState(false, "0"));

        startupRecoveryService = new StartupRecoveryService(
                tradingStore,
                riskGovernor,
                positionLedger,
                dailyStatsTracker,
                cycleOrchestrator,
                tradingProperties,
                eventPublisherHelper,
                clock);
    }

    private static RiskState riskState(boolean locked, String totalRealizedPnl) {
        return RiskState.builder()
                .startingCapital(new BigDecimal("10000"))
                .dailyRealizedPnl(BigDecimal.ZERO)
                .totalRealizedPnl(new BigDecimal(totalRealizedPnl))
                .locked(locked)
                .lockReason(locked ? "total loss 50%" : null)
                .dailyAnchorDate(TODAY)
                .build();
    }

    private static Position persistedOpen() {
        return Position.builder()
                .id("P-9")
                .symbol("BTC/USDT")
                .entryPrice(new BigDecimal("50000"))
                .amount(new BigDecimal("0.01"))
                .stopLossPrice(new BigDecimal("47500"))
                .currentPrice(new BigDecimal("50500"))
                .unrealizedPnl(new BigDecimal("5"))
                .status(PositionStatus.OPEN)
                .build();
    }

    // ==============================
    // STATE RESTORATION
    // ==============================

    @Nested
    @DisplayName("State restoration")
    class StateRestoration {

        @Test
        @DisplayName("Balance is starting capital plus realized P&L minus open cost basis")
        void balanceRebuild() {
            RiskState persisted = riskState(false, "-200");
            when(tradingStore.loadRiskState()).thenReturn(Optional.of(persisted));
            when(riskGovernor.snapshot()).thenReturn(persisted);
            when(tradingStore.loadOpenPositions()).thenReturn(List.of(persistedOpen()));

            RecoveryResult result = startupRecoveryService.recover();

            // 10000 - 200 - 500
            verify(cycleOrchestrator).restoreAccountBalance(argThat(b -> b.compareTo(new BigDecimal("9300")) == 0));
            verify(riskGovernor).restore(persisted);
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.isRiskStateRestored()).isTrue();
            assertThat(result.getPositionsRestored()).isEqualTo(1);
            assertThat(positionLedger.hasOpenPosition("BTC/USDT")).isTrue();
        }

        @Test
        @DisplayName("Today's daily stats are continued when present")
        void dailyStatsRestored() {
            DailyStats stats = DailyStats.empty(TODAY);
            when(tradingStore.loadDailyStats(TODAY)).thenReturn(Optional.of(stats));

            RecoveryResult result = startupRecoveryService.recover();

            verify(dailyStatsTracker).restore(stats);
            assertThat(result.isDailyStatsRestored()).isTrue();
        }

        @Test
        @DisplayName("Stats of the risk state's trading day are continued after a restart past midnight")
        void dailyStatsForAnchorDay() {
            LocalDate yesterday = TODAY.minusDays(1);
            RiskState persisted = riskState(false, "20").toBuilder().dailyAnchorDate(yesterday).build();
            DailyStats stats = DailyStats.empty(yesterday);
            when(tradingStore.loadRiskState()).thenReturn(Optional.of(persisted));
            when(riskGovernor.snapshot()).thenReturn(persisted);
            when(tradingStore.loadDailyStats(yesterday)).thenReturn(Optional.of(stats));

            RecoveryResult result = startupRecoveryService.recover();

            verify(dailyStatsTracker).restore(stats);
            verify(tradingStore, never()).loadDailyStats(TODAY);
            assertThat(result.isDailyStatsRestored()).isTrue();
        }

        @Test
        @DisplayName("Fresh start restores nothing and keeps the starting balance")
        void freshStart() {
            RecoveryResult result = startupRecoveryService.recover();

            verify(riskGovernor, never()).restore(any());
            verify(cycleOrchestrator).restoreAccountBalance(argThat(b -> b.compareTo(new BigDecimal("10000")) == 0));
            assertThat(result.isRiskStateRestored()).isFalse();
            assertThat(result.getPositionsRestored()).isZero();
        }
    }

    // ==============================
    // AUTO-START
    // ==============================

    @Nested
    @DisplayName("Auto-start")
    class AutoStart {

        @Test
        @DisplayName("Engine starts when auto-start is enabled and trading is unlocked")
        void autoStarts() {
            tradingProperties.getEngine().setAutoStart(true);

            RecoveryResult result = startupRecoveryService.recover();

            verify(cycleOrchestrator).start();
            assertThat(result.isEngineStarted()).isTrue();
        }

        @Test
        @DisplayName("Latched kill switch survives restart and blocks auto-start")
        void lockedSkipsStart() {
            tradingProperties.getEngine().setAutoStart(true);
            RiskState locked = riskState(true, "-5000");
            when(tradingStore.loadRiskState()).thenReturn(Optional.of(locked));
            when(riskGovernor.snapshot()).thenReturn(locked);
            when(riskGovernor.isLocked()).thenReturn(true);

            RecoveryResult result = startupRecoveryService.recover();

            verify(cycleOrchestrator, never()).start();
            assertThat(result.isKillSwitchWasActive()).isTrue();
            assertThat(result.isEngineStarted()).isFalse();
        }

        @Test
        @DisplayName("Auto-start disabled leaves the engine idle")
        void autoStartDisabled() {
            startupRecoveryService.recover();

            verify(cycleOrchestrator, never()).start();
        }
    }

    // ==============================
    // REPORTING
    // ==============================

    @Test
    @DisplayName("RECOVERY_COMPLETED is published on success")
    void publishesCompletion() {
        startupRecoveryService.recover();

        verify(eventPublisherHelper)
                .publishSystem(
                        eq(startupRecoveryService), eq(SystemEventType.RECOVERY_COMPLETED), anyString(), anyMap());
    }

    @Test
    @DisplayName("Store failure is reported, not thrown")
    void failureReported() {
        when(tradingStore.loadRiskState()).thenThrow(new IllegalStateException("database unavailable"));

        RecoveryResult result = startupRecoveryService.recover();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isEqualTo("database unavailable");
        verify(eventPublisherHelper)
                .publishSystem(
                        eq(startupRecoveryService),
                        eq(SystemEventType.RECOVERY_COMPLETED),
                        argThat(message -> message.startsWith("Recovery failed")),
                        anyMap());
    }
}
