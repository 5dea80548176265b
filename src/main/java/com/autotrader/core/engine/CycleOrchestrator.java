package com.autotrader.core.engine;

import com.autotrader.config.TradingProperties;
import com.autotrader.domain.enums.EngineState;
import com.autotrader.domain.enums.OrderSide;
import com.autotrader.domain.enums.SignalDirection;
import com.autotrader.domain.model.EngineContext;
import com.autotrader.domain.model.EngineStatus;
import com.autotrader.domain.model.MarketSnapshot;
import com.autotrader.domain.model.OrderResult;
import com.autotrader.domain.model.Position;
import com.autotrader.domain.model.RiskState;
import com.autotrader.domain.model.Signal;
import com.autotrader.domain.model.SignalSnapshot;
import com.autotrader.domain.model.Trade;
import com.autotrader.domain.model.WeightedOpinion;
import com.autotrader.event.EventPublisherHelper;
import com.autotrader.event.RiskEventType;
import com.autotrader.event.RiskLevel;
import com.autotrader.event.SystemEventType;
import com.autotrader.execution.ExecutionAdapter;
import com.autotrader.ledger.PositionLedger;
import com.autotrader.marketdata.MarketDataProvider;
import com.autotrader.observability.EngineMetrics;
import com.autotrader.pnl.DailyStatsTracker;
import com.autotrader.repository.TradingStore;
import com.autotrader.risk.RiskGovernor;
import com.autotrader.risk.RiskLimits;
import com.autotrader.risk.RiskValidationResult;
import com.autotrader.risk.RiskViolation;
import com.autotrader.signal.AnalysisSourceRegistry;
import com.autotrader.signal.SignalAggregator;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * The trading engine: a single {@code trading-engine} thread running one decision-and-execution
 * cycle at a time.
 *
 * <p>One cycle, in order:
 * <ol>
 *   <li>Apply pending operator commands (reset, pause, resume, close-all)</li>
 *   <li>Roll the risk day over if the UTC date changed, persisting the finished day's stats</li>
 *   <li>Fetch the market snapshot</li>
 *   <li>Revalue, persist and publish every open position</li>
 *   <li>Close stop-loss breaches unconditionally, then everything if close-all was requested</li>
 *   <li>Check the kill switch against realized plus unrealized loss; on a trip flatten and halt</li>
 *   <li>Stop here while paused</li>
 *   <li>Aggregate the analysis sources, gate through the risk governor and act on the decision</li>
 * </ol>
 * The loop then sleeps for the poll interval, or for the shorter error backoff after a failed
 * cycle. The sleep waits on a stop latch, so {@link #stop()} wakes it immediately; a cycle in
 * progress is never interrupted.
 *
 * <p><b>State machine:</b> IDLE -> RUNNING -> HALTED. Only a kill-switch trip halts the engine;
 * {@link #stop()} returns it to IDLE. Pause is a soft sub-state of RUNNING in which monitoring
 * (revaluation, stop-loss, kill switch) continues but no new entries or signal exits are made.
 *
 * <p><b>Concurrency:</b> account state, the ledger and the risk state are written only by the
 * engine thread while it runs. Operator commands arriving from other threads are flags read at
 * the top of the next cycle.
 */
@Service
public class CycleOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(CycleOrchestrator.class);

    static final String ENGINE_THREAD_NAME = "trading-engine";

    private static final BigDecimal HUNDRED = new BigDecimal("100");
    private static final int AMOUNT_SCALE = 8;
    private static final Duration STOP_JOIN_TIMEOUT = Duration.ofSeconds(30);

    private final TradingProperties tradingProperties;
    private final AnalysisSourceRegistry analysisSourceRegistry;
    private final SignalAggregator signalAggregator;
    private final RiskGovernor riskGovernor;
    private final PositionLedger positionLedger;
    private final ExecutionAdapter executionAdapter;
    private final MarketDataProvider marketDataProvider;
    private final TradingStore tradingStore;
    private final EventPublisherHelper eventPublisherHelper;
    private final DailyStatsTracker dailyStatsTracker;
    private final EngineMetrics engineMetrics;
    private final Clock clock;

    private final EngineContext context;

    private final AtomicBoolean pauseRequested = new AtomicBoolean(false);
    private final AtomicBoolean resumeRequested = new AtomicBoolean(false);
    private final AtomicBoolean closeAllRequested = new AtomicBoolean(false);
    private final AtomicBoolean resetRequested = new AtomicBoolean(false);

    private final Object lifecycleLock = new Object();
    private volatile CountDownLatch stopLatch = new CountDownLatch(0);
    private volatile Thread engineThread;

    public CycleOrchestrator(
            TradingProperties tradingProperties,
            AnalysisSourceRegistry analysisSourceRegistry,
            SignalAggregator signalAggregator,
            RiskGovernor riskGovernor,
            PositionLedger positionLedger,
            ExecutionAdapter executionAdapter,
            MarketDataProvider marketDataProvider,
            TradingStore tradingStore,
            EventPublisherHelper eventPublisherHelper,
            DailyStatsTracker dailyStatsTracker,
            EngineMetrics engineMetrics,
            Clock clock) {
        this.tradingProperties = tradingProperties;
        this.analysisSourceRegistry = analysisSourceRegistry;
        this.signalAggregator = signalAggregator;
        this.riskGovernor = riskGovernor;
        this.positionLedger = positionLedger;
        this.executionAdapter = executionAdapter;
        this.marketDataProvider = marketDataProvider;
        this.tradingStore = tradingStore;
        this.eventPublisherHelper = eventPublisherHelper;
        this.dailyStatsTracker = dailyStatsTracker;
        this.engineMetrics = engineMetrics;
        this.clock = clock;
        this.context = new EngineContext(
                tradingProperties.getSymbol(), riskGovernor.getRiskLimits().getStartingCapital());
    }

    // ========================
    // LIFECYCLE
    // ========================

    /**
     * Starts the engine thread. No-op if already running.
     *
     * @throws IllegalStateException if the engine is HALTED or the kill switch is latched
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (context.getState() == EngineState.RUNNING) {
                log.warn("Trading engine already running");
                return;
            }
            if (context.getState() == EngineState.HALTED || riskGovernor.isLocked()) {
                throw new IllegalStateException("Trading engine halted by kill switch; reset the kill switch first");
            }

            stopLatch = new CountDownLatch(1);
            context.setState(EngineState.RUNNING);
            context.setLastError(null);
            Thread thread = new Thread(this::runLoop, ENGINE_THREAD_NAME);
            engineThread = thread;
            thread.start();

            log.info(
                    "Trading engine started: symbol={} mode={} pollInterval={}",
                    context.getSymbol(),
                    executionAdapter.isSimulated() ? "PAPER" : "LIVE",
                    tradingProperties.getEngine().getPollInterval());
            eventPublisherHelper.publishSystem(this, SystemEventType.ENGINE_STARTED, "Trading engine started");
        }
    }

    /**
     * Stops the loop after the current cycle and waits for the engine thread to finish. A cycle
     * in progress is never interrupted.
     */
    public void stop() {
        Thread thread;
        synchronized (lifecycleLock) {
            thread = engineThread;
            if (thread == null) {
                log.info("Trading engine not running");
                return;
            }
            stopLatch.countDown();
        }

        if (thread != Thread.currentThread()) {
            try {
                thread.join(STOP_JOIN_TIMEOUT.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (thread.isAlive()) {
                log.warn("Trading engine still finishing its cycle after {}", STOP_JOIN_TIMEOUT);
            }
        }
    }

    /** Requests a pause. Applied at the next cycle boundary while running, immediately otherwise. */
    public void pause() {
        if (isRunning()) {
            resumeRequested.set(false);
            pauseRequested.set(true);
            log.info("Pause requested");
        } else {
            context.setPaused(true);
            log.info("Trading engine paused");
        }
    }

    /** Requests a resume. Applied at the next cycle boundary while running, immediately otherwise. */
    public void resume() {
        if (isRunning()) {
            pauseRequested.set(false);
            resumeRequested.set(true);
            log.info("Resume requested");
        } else {
            context.setPaused(false);
            log.info("Trading engine resumed");
        }
    }

    /**
     * Closes every open position. While running this happens at the next cycle boundary at the
     * snapshot price; otherwise it happens now at the adapter's current price.
     */
    public void closeAll() {
        synchronized (lifecycleLock) {
            if (isRunning()) {
                closeAllRequested.set(true);
                log.info("Close-all requested");
                return;
            }
            BigDecimal price = executionAdapter.currentPrice(context.getSymbol());
            for (Position position : positionLedger.openPositions()) {
                closePosition(position, price, "operator close-all", null, false);
            }
        }
    }

    /**
     * Clears the kill switch. While HALTED or IDLE it applies now and HALTED becomes IDLE; while
     * running it applies at the next cycle boundary.
     */
    public void resetKillSwitch() {
        synchronized (lifecycleLock) {
            if (isRunning()) {
                resetRequested.set(true);
                log.info("Kill switch reset requested");
                return;
            }
            applyKillSwitchReset();
            if (context.getState() == EngineState.HALTED) {
                context.setState(EngineState.IDLE);
            }
        }
    }

    public EngineStatus status() {
        return EngineStatus.builder()
                .symbol(context.getSymbol())
                .state(context.getState())
                .paused(context.isPaused())
                .accountBalance(context.getAccountBalance())
                .riskState(riskGovernor.snapshot())
                .openPositions(positionLedger.snapshot())
                .cycleCount(context.getCycleCount())
                .lastCycleAt(context.getLastCycleAt())
                .lastError(context.getLastError())
                .build();
    }

    /** Sets the account balance recovered at startup. Only valid before the engine starts. */
    public void restoreAccountBalance(BigDecimal balance) {
        synchronized (lifecycleLock) {
            if (isRunning()) {
                throw new IllegalStateException("Cannot restore account balance while the engine is running");
            }
            context.setAccountBalance(balance);
            log.info("Account balance restored to {}", balance);
        }
    }

    public boolean isRunning() {
        return context.getState() == EngineState.RUNNING;
    }

    // ========================
    // LOOP
    // ========================

    private void runLoop() {
        try {
            while (true) {
                CycleOutcome outcome = runCycle();
                if (outcome == CycleOutcome.HALTED) {
                    break;
                }
                Duration wait = outcome == CycleOutcome.FAILED
                        ? tradingProperties.getEngine().getErrorBackoff()
                        : tradingProperties.getEngine().getPollInterval();
                if (stopLatch.await(wait.toMillis(), TimeUnit.MILLISECONDS)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Trading engine thread interrupted");
        } finally {
            synchronized (lifecycleLock) {
                engineThread = null;
                if (context.getState() != EngineState.HALTED) {
                    context.setState(EngineState.IDLE);
                    log.info("Trading engine stopped after {} cycle(s)", context.getCycleCount());
                    eventPublisherHelper.publishSystem(this, SystemEventType.ENGINE_STOPPED, "Trading engine stopped");
                }
            }
        }
    }

    /**
     * Runs one cycle. Any exception is caught here, logged at WARN and reported as
     * {@link CycleOutcome#FAILED}.
     */
    public CycleOutcome runCycle() {
        long cycle = context.nextCycle();
        context.setLastCycleAt(LocalDateTime.now(clock));
        try {
            applyCommands();
            boolean closeAll = closeAllRequested.getAndSet(false);

            LocalDate today = LocalDate.now(clock);
            riskGovernor.rolloverIfNewDay(today).ifPresent(finished -> dailyStatsTracker.finishDay(finished, today));

            MarketSnapshot snapshot = marketDataProvider.fetchSnapshot(context.getSymbol());
            BigDecimal price = snapshot.getPrice();
            executionAdapter.observePrice(context.getSymbol(), price);

            revalueOpenPositions(price);
            closeStopLossBreaches(price);
            if (closeAll) {
                for (Position position : positionLedger.openPositions()) {
                    closePosition(position, price, "operator close-all", null, false);
                }
            }

            BigDecimal totalLossPercent = riskGovernor.totalLossPercentIncluding(positionLedger.totalUnrealizedPnl());
            if (riskGovernor.checkKillSwitch(totalLossPercent)) {
                haltOnKillSwitch(totalLossPercent, price);
                engineMetrics.recordCycle();
                return CycleOutcome.HALTED;
            }

            if (context.isPaused()) {
                log.debug("Cycle {}: paused, skipping signal evaluation", cycle);
                engineMetrics.recordCycle();
                return CycleOutcome.COMPLETED;
            }

            decideAndExecute(snapshot);
            context.setLastError(null);
            engineMetrics.recordCycle();
            return CycleOutcome.COMPLETED;
        } catch (RuntimeException e) {
            log.warn("Trading cycle {} failed: {}", cycle, e.getMessage(), e);
            context.setLastError(e.getMessage());
            engineMetrics.recordCycleFailure();
            eventPublisherHelper.publishSystem(
                    this,
                    SystemEventType.CYCLE_FAILED,
                    "Cycle " + cycle + " failed: " + e.getMessage(),
                    Map.of("cycle", cycle, "error", e.getClass().getSimpleName()));
            return CycleOutcome.FAILED;
        }
    }

    // ========================
    // CYCLE STEPS
    // ========================

    private void applyCommands() {
        if (resetRequested.getAndSet(false)) {
            applyKillSwitchReset();
        }
        if (pauseRequested.getAndSet(false)) {
            context.setPaused(true);
            log.info("Trading engine paused: monitoring continues, no new entries or signal exits");
            eventPublisherHelper.publishSystem(this, SystemEventType.ENGINE_PAUSED, "Trading engine paused");
        }
        if (resumeRequested.getAndSet(false)) {
            context.setPaused(false);
            log.info("Trading engine resumed");
            eventPublisherHelper.publishSystem(this, SystemEventType.ENGINE_RESUMED, "Trading engine resumed");
        }
    }

    private void revalueOpenPositions(BigDecimal price) {
        for (Position position : positionLedger.openPositions()) {
            BigDecimal previousPnl = position.getUnrealizedPnl();
            positionLedger.revalue(position, price);
            tradingStore.savePosition(position);
            eventPublisherHelper.publishPositionUpdated(this, position.copy(), previousPnl);
        }
    }

    private void closeStopLossBreaches(BigDecimal price) {
        List<Position> breached = positionLedger.checkStopLossBreaches(Map.of(context.getSymbol(), price));
        for (Position position : breached) {
            log.warn(
                    "Stop-loss triggered for position {}: price {} at or below stop {}",
                    position.getId(),
                    price,
                    position.getStopLossPrice());
            closePosition(
                    position,
                    price,
                    "stop-loss triggered at " + price.toPlainString() + " (stop "
                            + position.getStopLossPrice().toPlainString() + ")",
                    null,
                    true);
            eventPublisherHelper.publishRisk(
                    this,
                    RiskEventType.STOP_LOSS_TRIGGERED,
                    RiskLevel.WARNING,
                    "Stop-loss triggered for " + position.getSymbol() + " at " + price.toPlainString(),
                    Map.of("positionId", position.getId(), "stopLossPrice", position.getStopLossPrice()));
        }
    }

    /**
     * Kill-switch trip: log the full state, raise a CRITICAL event, flatten every position
     * (best effort, failures are logged and do not prevent the halt) and halt.
     */
    private void haltOnKillSwitch(BigDecimal totalLossPercent, BigDecimal price) {
        RiskState riskState = riskGovernor.snapshot();
        List<Position> open = positionLedger.snapshot();
        log.error(
                "KILL SWITCH TRIPPED at total loss {}%: riskState={} balance={} openPositions={}",
                totalLossPercent,
                riskState,
                context.getAccountBalance(),
                open);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("totalLossPercent", totalLossPercent);
        details.put("killSwitchPercent", riskGovernor.getRiskLimits().getKillSwitchPercent());
        details.put("accountBalance", context.getAccountBalance());
        details.put("openPositions", open.size());
        details.put("lockReason", String.valueOf(riskState.getLockReason()));
        eventPublisherHelper.publishRisk(
                this,
                RiskEventType.KILL_SWITCH_TRIGGERED,
                RiskLevel.CRITICAL,
                "Kill switch activated: " + riskState.getLockReason(),
                details);

        List<String> errors = new ArrayList<>();
        for (Position position : positionLedger.openPositions()) {
            try {
                closePosition(position, price, "kill switch", null, false);
            } catch (RuntimeException e) {
                errors.add(position.getId() + ": " + e.getMessage());
                log.error("Kill switch failed to close position {}: {}", position.getId(), e.getMessage(), e);
            }
        }
        if (!errors.isEmpty()) {
            log.error("Kill switch completed with {} error(s), positions may remain open: {}", errors.size(), errors);
        }

        context.setState(EngineState.HALTED);
        eventPublisherHelper.publishSystem(
                this, SystemEventType.ENGINE_HALTED, "Trading engine halted by kill switch", details);
    }

    private void decideAndExecute(MarketSnapshot snapshot) {
        List<WeightedOpinion> opinions = analysisSourceRegistry.collectOpinions(snapshot);
        Signal signal = signalAggregator.combine(
                opinions, tradingProperties.getSignal().getConfidenceThreshold());
        log.info(
                "Signal: {} (confidence {}) - {}",
                signal.getDirection(),
                signal.getConfidence(),
                signal.getRationale());

        RiskValidationResult validation =
                riskGovernor.validate(context.getAccountBalance(), riskGovernor.dailyLossPercent());

        boolean hasPosition = positionLedger.hasOpenPosition(context.getSymbol());
        boolean entry = signal.getDirection() == SignalDirection.BUY && !hasPosition;
        boolean exit = signal.getDirection() == SignalDirection.SELL && hasPosition;

        if (validation.isRejected()) {
            if (entry || exit) {
                engineMetrics.recordRejection();
                publishRejection(signal, validation);
            }
            return;
        }

        if (entry) {
            openPosition(snapshot, signal, SignalSnapshot.of(signal, opinions));
        } else if (exit) {
            Position position = positionLedger.openPosition(context.getSymbol()).orElseThrow();
            closePosition(
                    position, snapshot.getPrice(), signal.getRationale(), SignalSnapshot.of(signal, opinions), false);
        }
    }

    private void publishRejection(Signal signal, RiskValidationResult validation) {
        boolean dailyLimit = validation.hasViolation(RiskViolation.DAILY_LOSS_LIMIT_REACHED);
        eventPublisherHelper.publishRisk(
                this,
                dailyLimit ? RiskEventType.DAILY_LOSS_LIMIT_BREACH : RiskEventType.TRADE_REJECTED,
                dailyLimit ? RiskLevel.WARNING : RiskLevel.INFO,
                signal.getDirection() + " rejected: " + validation.getReason(),
                Map.of("violations", validation.getViolations().toString()));
    }

    // ========================
    // EXECUTION
    // ========================

    private void openPosition(MarketSnapshot snapshot, Signal signal, SignalSnapshot signalSnapshot) {
        String symbol = context.getSymbol();
        BigDecimal price = snapshot.getPrice();
        BigDecimal size = riskGovernor.sizePosition(context.getAccountBalance());
        BigDecimal amount = size.divide(price, AMOUNT_SCALE, RoundingMode.DOWN);
        if (amount.signum() <= 0) {
            log.info("Position size {} at price {} rounds to zero amount, skipping entry", size, price);
            return;
        }

        OrderResult order = executionAdapter.buy(symbol, amount);
        BigDecimal entryPrice = order.getFillPrice() != null ? order.getFillPrice() : price;
        BigDecimal filledAmount = order.getAmount() != null ? order.getAmount() : amount;

        RiskLimits limits = riskGovernor.getRiskLimits();
        BigDecimal stopLossPrice = entryPrice
                .multiply(BigDecimal.ONE.subtract(
                        limits.getStopLossPercent().divide(HUNDRED, AMOUNT_SCALE, RoundingMode.HALF_UP)))
                .setScale(AMOUNT_SCALE, RoundingMode.HALF_UP);
        try {
            executionAdapter.placeStopLoss(symbol, filledAmount, stopLossPrice);
        } catch (RuntimeException e) {
            log.warn(
                    "Failed to place exchange stop-loss at {} for {}, the engine's stop-loss monitor still applies: {}",
                    stopLossPrice,
                    symbol,
                    e.getMessage(),
                    e);
        }

        Position position = positionLedger.open(symbol, entryPrice, filledAmount, stopLossPrice);
        context.debit(entryPrice.multiply(filledAmount));
        tradingStore.savePosition(position);

        Trade trade = Trade.builder()
                .id(UUID.randomUUID().toString())
                .positionId(position.getId())
                .orderId(order.getId())
                .symbol(symbol)
                .side(OrderSide.BUY)
                .amount(filledAmount)
                .entryPrice(entryPrice)
                .signalSnapshot(signalSnapshot)
                .rationale(signal.getRationale())
                .simulated(order.isSimulated())
                .executedAt(LocalDateTime.now(clock))
                .build();
        recordTrade(trade);
        eventPublisherHelper.publishPositionOpened(this, position.copy());

        log.info(
                "BUY {} {} @ {} (size {}), stop-loss {}, balance {}",
                filledAmount,
                symbol,
                entryPrice,
                size,
                stopLossPrice,
                context.getAccountBalance());
    }

    /**
     * Sells the position's full amount and books the result: ledger close, balance credit,
     * governor P&L, persistence, trade record and events.
     */
    private void closePosition(
            Position position,
            BigDecimal marketPrice,
            String rationale,
            SignalSnapshot signalSnapshot,
            boolean stopLoss) {
        OrderResult order = executionAdapter.sell(position.getSymbol(), position.getAmount());
        BigDecimal exitPrice = order.getFillPrice() != null ? order.getFillPrice() : marketPrice;
        BigDecimal previousPnl = position.getUnrealizedPnl();

        BigDecimal realized = positionLedger.close(position, exitPrice);
        context.credit(exitPrice.multiply(position.getAmount()));
        riskGovernor.recordRealizedPnl(realized);
        tradingStore.savePosition(position);

        Trade trade = Trade.builder()
                .id(UUID.randomUUID().toString())
                .positionId(position.getId())
                .orderId(order.getId())
                .symbol(position.getSymbol())
                .side(OrderSide.SELL)
                .amount(position.getAmount())
                .entryPrice(position.getEntryPrice())
                .exitPrice(exitPrice)
                .realizedPnl(realized)
                .signalSnapshot(signalSnapshot)
                .rationale(rationale)
                .simulated(order.isSimulated())
                .executedAt(LocalDateTime.now(clock))
                .build();
        recordTrade(trade);

        if (stopLoss) {
            eventPublisherHelper.publishStopLossTriggered(this, position.copy(), previousPnl);
        } else {
            eventPublisherHelper.publishPositionClosed(this, position.copy(), previousPnl);
        }

        log.info(
                "SELL {} {} @ {} ({}), realized P&L {}, balance {}",
                position.getAmount(),
                position.getSymbol(),
                exitPrice,
                rationale,
                realized,
                context.getAccountBalance());
    }

    private void recordTrade(Trade trade) {
        tradingStore.saveTrade(trade);
        dailyStatsTracker.record(trade);
        eventPublisherHelper.publishTrade(this, trade);
    }

    private void applyKillSwitchReset() {
        boolean wasLocked = riskGovernor.isLocked();
        riskGovernor.resetKillSwitch();
        if (wasLocked) {
            eventPublisherHelper.publishRisk(
                    this, RiskEventType.KILL_SWITCH_RESET, RiskLevel.WARNING, "Kill switch reset by operator");
        }
    }

    EngineContext getContext() {
        return context;
    }
}
