package com.autotrader.recovery;

import com.autotrader.config.TradingProperties;
import com.autotrader.core.engine.CycleOrchestrator;
import com.autotrader.domain.model.DailyStats;
import com.autotrader.domain.model.Position;
import com.autotrader.domain.model.RiskState;
import com.autotrader.event.EventPublisherHelper;
import com.autotrader.event.SystemEventType;
import com.autotrader.ledger.PositionLedger;
import com.autotrader.pnl.DailyStatsTracker;
import com.autotrader.repository.TradingStore;
import com.autotrader.risk.RiskGovernor;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Restores the engine's state from the store once the application is ready.
 *
 * <p>Sequence:
 * <ol>
 *   <li>Restore the risk state, including a latched kill switch</li>
 *   <li>Load open positions into the ledger</li>
 *   <li>Rebuild the account balance: starting capital plus total realized P&L minus the cost
 *       basis of every open position</li>
 *   <li>Continue the current trading day's statistics if a row exists</li>
 *   <li>Start the engine when {@code autotrader.engine.auto-start} is set and trading is not
 *       locked</li>
 * </ol>
 *
 * <p>Publishes RECOVERY_COMPLETED with a summary when done, successful or not.
 */
@Service
public class StartupRecoveryService {

    private static final Logger log = LoggerFactory.getLogger(StartupRecoveryService.class);

    private final TradingStore tradingStore;
    private final RiskGovernor riskGovernor;
    private final PositionLedger positionLedger;
    private final DailyStatsTracker dailyStatsTracker;
    private final CycleOrchestrator cycleOrchestrator;
    private final TradingProperties tradingProperties;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    public StartupRecoveryService(
            TradingStore tradingStore,
            RiskGovernor riskGovernor,
            PositionLedger positionLedger,
            DailyStatsTracker dailyStatsTracker,
            CycleOrchestrator cycleOrchestrator,
            TradingProperties tradingProperties,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.tradingStore = tradingStore;
        this.riskGovernor = riskGovernor;
        this.positionLedger = positionLedger;
        this.dailyStatsTracker = dailyStatsTracker;
        this.cycleOrchestrator = cycleOrchestrator;
        this.tradingProperties = tradingProperties;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        recover();
    }

    public RecoveryResult recover() {
        log.info("Starting recovery sequence...");

        RecoveryResult recoveryResult =
                RecoveryResult.builder().startedAt(clock.millis()).build();

        try {
            restoreRiskState(recoveryResult);
            restorePositions(recoveryResult);
            restoreDailyStats(recoveryResult);
            startEngine(recoveryResult);

            recoveryResult.setSuccess(true);
            log.info("Recovery sequence completed successfully");
        } catch (RuntimeException e) {
            recoveryResult.setSuccess(false);
            recoveryResult.setError(e.getMessage());
            log.error("Recovery sequence failed", e);
        }

        recoveryResult.setDurationMs(clock.millis() - recoveryResult.getStartedAt());

        eventPublisherHelper.publishSystem(
                this,
                SystemEventType.RECOVERY_COMPLETED,
                String.format(
                        "Recovery %s: positionsRestored=%d, killSwitchActive=%s, engineStarted=%s",
                        recoveryResult.isSuccess() ? "completed" : "failed",
                        recoveryResult.getPositionsRestored(),
                        recoveryResult.isKillSwitchWasActive(),
                        recoveryResult.isEngineStarted()),
                Map.of(
                        "success", recoveryResult.isSuccess(),
                        "durationMs", recoveryResult.getDurationMs(),
                        "positionsRestored", recoveryResult.getPositionsRestored(),
                        "killSwitchActive", recoveryResult.isKillSwitchWasActive()));
        return recoveryResult;
    }

    void restoreRiskState(RecoveryResult recoveryResult) {
        Optional<RiskState> persisted = tradingStore.loadRiskState();
        if (persisted.isEmpty()) {
            log.info("No persisted risk state, starting fresh");
            return;
        }
        riskGovernor.restore(persisted.get());
        recoveryResult.setRiskStateRestored(true);
        if (persisted.get().isLocked()) {
            recoveryResult.setKillSwitchWasActive(true);
            log.error(
                    "Kill switch was active before shutdown ({}); trading stays locked until an operator reset",
                    persisted.get().getLockReason());
        }
    }

    void restorePositions(RecoveryResult recoveryResult) {
        List<Position> open = tradingStore.loadOpenPositions();
        positionLedger.rehydrate(open);
        List<Position> rehydrated = positionLedger.openPositions();
        recoveryResult.setPositionsRestored(rehydrated.size());

        RiskState riskState = riskGovernor.snapshot();
        BigDecimal committed = rehydrated.stream()
                .map(Position::costBasis)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal balance =
                riskState.getStartingCapital().add(riskState.getTotalRealizedPnl()).subtract(committed);
        cycleOrchestrator.restoreAccountBalance(balance);
        recoveryResult.setRestoredBalance(balance);
    }

    /**
     * Continues the risk state's trading day, which is still the previous day after a restart
     * across midnight. The first cycle then rolls that day over with its real figures.
     */
    void restoreDailyStats(RecoveryResult recoveryResult) {
        LocalDate anchor = riskGovernor.snapshot().getDailyAnchorDate();
        LocalDate tradingDate = anchor != null ? anchor : LocalDate.now(clock);
        Optional<DailyStats> persisted = tradingStore.loadDailyStats(tradingDate);
        if (persisted.isPresent()) {
            dailyStatsTracker.restore(persisted.get());
            recoveryResult.setDailyStatsRestored(true);
            log.info("Restored daily stats for {}: {} trade(s)", tradingDate, persisted.get().getTotalTrades());
        }
    }

    void startEngine(RecoveryResult recoveryResult) {
        if (!tradingProperties.getEngine().isAutoStart()) {
            log.info("Auto-start disabled, engine left IDLE");
            return;
        }
        if (riskGovernor.isLocked()) {
            log.error("Auto-start skipped: trading is locked by the kill switch");
            return;
        }
        cycleOrchestrator.start();
        recoveryResult.setEngineStarted(true);
    }
}
