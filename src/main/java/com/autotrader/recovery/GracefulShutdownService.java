package com.autotrader.recovery;

import com.autotrader.core.engine.CycleOrchestrator;
import com.autotrader.domain.model.Position;
import com.autotrader.event.EventPublisherHelper;
import com.autotrader.event.SystemEventType;
import com.autotrader.ledger.PositionLedger;
import com.autotrader.pnl.DailyStatsTracker;
import com.autotrader.repository.TradingStore;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

/**
 * Orderly shutdown: stop the engine, persist positions and flush the day's statistics.
 *
 * <p>Runs in a high {@link SmartLifecycle} phase so it stops before the datasource. Open
 * positions are left open and persisted; {@link StartupRecoveryService} picks them up on the next
 * start.
 */
@Service
public class GracefulShutdownService implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(GracefulShutdownService.class);

    private final CycleOrchestrator cycleOrchestrator;
    private final PositionLedger positionLedger;
    private final TradingStore tradingStore;
    private final DailyStatsTracker dailyStatsTracker;
    private final EventPublisherHelper eventPublisherHelper;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public GracefulShutdownService(
            CycleOrchestrator cycleOrchestrator,
            PositionLedger positionLedger,
            TradingStore tradingStore,
            DailyStatsTracker dailyStatsTracker,
            EventPublisherHelper eventPublisherHelper) {
        this.cycleOrchestrator = cycleOrchestrator;
        this.positionLedger = positionLedger;
        this.tradingStore = tradingStore;
        this.dailyStatsTracker = dailyStatsTracker;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    @Override
    public void start() {
        running.set(true);
    }

    @Override
    public void stop() {
        log.info("Graceful shutdown initiated...");
        eventPublisherHelper.publishSystem(this, SystemEventType.SHUTTING_DOWN, "Trading engine shutting down");

        try {
            cycleOrchestrator.stop();
            persistPositions();
            dailyStatsTracker.flush();
            log.info("Graceful shutdown completed successfully");
        } catch (RuntimeException e) {
            log.error("Error during graceful shutdown", e);
        } finally {
            running.set(false);
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE - 1;
    }

    void persistPositions() {
        List<Position> open = positionLedger.snapshot();
        for (Position position : open) {
            tradingStore.savePosition(position);
        }
        log.info("Persisted {} open position(s)", open.size());
    }
}
