package com.autotrader.risk;

import com.autotrader.domain.model.RiskState;
import com.autotrader.repository.TradingStore;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Stateful capital-preservation gate in front of every new entry.
 *
 * <p>Owns the {@link RiskState} state machine:
 * <ul>
 *   <li><b>Daily loss limit:</b> self-healing. Blocks new entries once the day's realized loss
 *       reaches the limit and clears itself when {@link #rolloverIfNewDay} sees a new UTC date.</li>
 *   <li><b>Kill switch:</b> one-way latch. Set only by {@link #checkKillSwitch} and cleared only by
 *       {@link #resetKillSwitch}. A day rollover never touches it.</li>
 * </ul>
 *
 * <p>Loss percentages count losses only: {@code max(0, -pnl) / startingCapital * 100}. The state is
 * persisted through the {@link TradingStore} after every mutation so a restart cannot silently
 * unlock trading.
 *
 * <p><b>Thread safety:</b> the engine thread is the only writer during a run. The state is an
 * immutable value swapped under the object lock, so {@link #snapshot()} is safe from any thread.
 */
@Service
public class RiskGovernor {

    private static final Logger log = LoggerFactory.getLogger(RiskGovernor.class);

    private static final BigDecimal HUNDRED = new BigDecimal("100");
    private static final int AMOUNT_SCALE = 8;
    private static final int PERCENT_SCALE = 4;

    private final RiskLimits riskLimits;
    private final TradingStore tradingStore;
    private final Clock clock;

    private volatile RiskState state;

    public RiskGovernor(RiskLimits riskLimits, TradingStore tradingStore, Clock clock) {
        this.riskLimits = riskLimits;
        this.tradingStore = tradingStore;
        this.clock = clock;
        this.state = RiskState.builder()
                .startingCapital(riskLimits.getStartingCapital())
                .dailyRealizedPnl(BigDecimal.ZERO)
                .totalRealizedPnl(BigDecimal.ZERO)
                .dailyLossPercent(BigDecimal.ZERO)
                .totalLossPercent(BigDecimal.ZERO)
                .locked(false)
                .dailyAnchorDate(LocalDate.now(clock))
                .build();
    }

    // ========================
    // SIZING & PRE-TRADE VALIDATION
    // ========================

    /** Notional to commit to a new position: {@code balance * positionSizePercent / 100}. */
    public BigDecimal sizePosition(BigDecimal balance) {
        return balance.multiply(riskLimits.getPositionSizePercent())
                .divide(HUNDRED, AMOUNT_SCALE, RoundingMode.DOWN);
    }

    /**
     * Checks whether a new entry may be opened. Rules are evaluated in precedence order and the
     * first failing one is returned:
     * <ol>
     *   <li>kill switch latched</li>
     *   <li>daily loss at or above the daily limit</li>
     *   <li>computed position size below the minimum</li>
     * </ol>
     */
    public RiskValidationResult validate(BigDecimal balance, BigDecimal dailyLossPercent) {
        RiskValidationResult result = evaluate(balance, dailyLossPercent);
        if (result.isRejected()) {
            log.info("Trade rejected by risk governor: {}", result.getReason());
        }
        return result;
    }

    private RiskValidationResult evaluate(BigDecimal balance, BigDecimal dailyLossPercent) {
        if (state.isLocked()) {
            return RiskValidationResult.rejected(
                    RiskViolation.of(RiskViolation.KILL_SWITCH_LOCKED, "trading locked by kill switch"));
        }

        if (dailyLossPercent.compareTo(riskLimits.getDailyLossLimitPercent()) >= 0) {
            return RiskValidationResult.rejected(RiskViolation.of(
                    RiskViolation.DAILY_LOSS_LIMIT_REACHED,
                    "daily loss limit reached (" + dailyLossPercent.stripTrailingZeros().toPlainString() + "%)"));
        }

        if (sizePosition(balance).compareTo(riskLimits.getMinPositionUsd()) < 0) {
            return RiskValidationResult.rejected(RiskViolation.of(
                    RiskViolation.INSUFFICIENT_BALANCE, "insufficient balance for minimum position size"));
        }

        return RiskValidationResult.approved();
    }

    // ========================
    // KILL SWITCH
    // ========================

    /**
     * Latches the kill switch when {@code totalLossPercent} reaches the configured threshold.
     *
     * <p>Idempotent: while locked this returns true regardless of the argument and does not
     * persist again.
     *
     * @return true if trading is (now) locked
     */
    public synchronized boolean checkKillSwitch(BigDecimal totalLossPercent) {
        if (state.isLocked()) {
            return true;
        }
        if (totalLossPercent.compareTo(riskLimits.getKillSwitchPercent()) < 0) {
            return false;
        }

        String reason = "total loss " + totalLossPercent.stripTrailingZeros().toPlainString()
                + "% reached kill switch threshold " + riskLimits.getKillSwitchPercent().toPlainString() + "%";
        update(state.toBuilder()
                .locked(true)
                .lockReason(reason)
                .lockedAt(LocalDateTime.now(clock))
                .build());
        log.error("KILL SWITCH LATCHED: {}", reason);
        return true;
    }

    /** Manual reset. Clears the latch and persists; the only way trading resumes after a trip. */
    public synchronized void resetKillSwitch() {
        if (!state.isLocked()) {
            log.info("Kill switch reset requested but trading is not locked");
            return;
        }
        String previousReason = state.getLockReason();
        update(state.toBuilder().locked(false).lockReason(null).lockedAt(null).build());
        log.warn("Kill switch reset by operator (was: {})", previousReason);
    }

    public boolean isLocked() {
        return state.isLocked();
    }

    // ========================
    // P&L ACCOUNTING
    // ========================

    /**
     * Folds a closed position's realized P&L into the daily and total figures and recomputes both
     * loss percentages.
     */
    public synchronized void recordRealizedPnl(BigDecimal pnl) {
        BigDecimal daily = state.getDailyRealizedPnl().add(pnl);
        BigDecimal total = state.getTotalRealizedPnl().add(pnl);
        update(state.toBuilder()
                .dailyRealizedPnl(daily)
                .totalRealizedPnl(total)
                .dailyLossPercent(lossPercent(daily))
                .totalLossPercent(lossPercent(total))
                .build());
        log.debug("Realized P&L {} recorded: daily={} total={}", pnl, daily, total);
    }

    /**
     * Loss percentage of total realized P&L plus the given unrealized P&L. This is the figure the
     * engine feeds to {@link #checkKillSwitch}.
     */
    public BigDecimal totalLossPercentIncluding(BigDecimal unrealizedPnl) {
        return lossPercent(state.getTotalRealizedPnl().add(unrealizedPnl));
    }

    public BigDecimal dailyLossPercent() {
        return state.getDailyLossPercent();
    }

    /** {@code max(0, -pnl) / startingCapital * 100} at four decimal places. */
    public BigDecimal lossPercent(BigDecimal pnl) {
        if (pnl.signum() >= 0) {
            return BigDecimal.ZERO.setScale(PERCENT_SCALE);
        }
        return pnl.negate().multiply(HUNDRED).divide(state.getStartingCapital(), PERCENT_SCALE, RoundingMode.HALF_UP);
    }

    // ========================
    // DAY ROLLOVER
    // ========================

    /**
     * Resets the daily figures when {@code today} differs from the anchor date. Never touches the
     * kill-switch latch.
     *
     * @return the finished day's anchor date if a rollover happened, empty otherwise
     */
    public synchronized Optional<LocalDate> rolloverIfNewDay(LocalDate today) {
        LocalDate anchor = state.getDailyAnchorDate();
        if (today.equals(anchor)) {
            return Optional.empty();
        }
        update(state.toBuilder()
                .dailyRealizedPnl(BigDecimal.ZERO)
                .dailyLossPercent(BigDecimal.ZERO.setScale(PERCENT_SCALE))
                .dailyAnchorDate(today)
                .build());
        log.info("Trading day rolled over from {} to {}, daily loss reset", anchor, today);
        return Optional.ofNullable(anchor);
    }

    // ========================
    // STATE ACCESS & RECOVERY
    // ========================

    /** Immutable copy of the current state. */
    public RiskState snapshot() {
        return state;
    }

    /**
     * Replaces the in-memory state with one loaded from the store at startup. Does not persist.
     */
    public synchronized void restore(RiskState persisted) {
        if (persisted.getStartingCapital() != null
                && persisted.getStartingCapital().compareTo(riskLimits.getStartingCapital()) != 0) {
            log.warn(
                    "Persisted starting capital {} differs from configured {}; keeping persisted value",
                    persisted.getStartingCapital(),
                    riskLimits.getStartingCapital());
        }
        this.state = persisted.toBuilder()
                .startingCapital(persisted.getStartingCapital() != null
                        ? persisted.getStartingCapital()
                        : riskLimits.getStartingCapital())
                .build();
        if (persisted.isLocked()) {
            log.error("Trading is LOCKED by a persisted kill switch since {}: {}",
                    persisted.getLockedAt(), persisted.getLockReason());
        }
    }

    public RiskLimits getRiskLimits() {
        return riskLimits;
    }

    private void update(RiskState next) {
        this.state = next;
        tradingStore.saveRiskState(next);
    }
}
