package com.autotrader.ledger;

import com.autotrader.domain.enums.PositionStatus;
import com.autotrader.domain.model.Position;
import com.autotrader.exception.PositionStateException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Tracks open positions and computes their P&L.
 *
 * <p>Long-only: {@code pnl = (price - entryPrice) * amount}. At most one position is open per
 * symbol. A position leaves the ledger when it is closed; its final state lives on in the
 * persisted snapshot and the closing trade.
 *
 * <p>The engine thread is the only writer. {@link #openPositions()} returns the live instances for
 * the engine; other readers use {@link #snapshot()}, which returns detached copies.
 */
@Component
public class PositionLedger {

    private static final Logger log = LoggerFactory.getLogger(PositionLedger.class);

    private final Clock clock;

    /** Open positions keyed by symbol. */
    private final Map<String, Position> openBySymbol = new ConcurrentHashMap<>();

    public PositionLedger(Clock clock) {
        this.clock = clock;
    }

    // ========================
    // LIFECYCLE
    // ========================

    /**
     * Opens a position after a confirmed buy.
     *
     * @throws PositionStateException if a position is already open for the symbol
     */
    public Position open(String symbol, BigDecimal entryPrice, BigDecimal amount, BigDecimal stopLossPrice) {
        Position existing = openBySymbol.get(symbol);
        if (existing != null) {
            throw new PositionStateException(
                    "Position " + existing.getId() + " already open for " + symbol, existing.getId());
        }

        LocalDateTime now = LocalDateTime.now(clock);
        Position position = Position.builder()
                .id(UUID.randomUUID().toString())
                .symbol(symbol)
                .entryPrice(entryPrice)
                .amount(amount)
                .stopLossPrice(stopLossPrice)
                .currentPrice(entryPrice)
                .unrealizedPnl(BigDecimal.ZERO)
                .status(PositionStatus.OPEN)
                .openedAt(now)
                .lastUpdated(now)
                .build();
        openBySymbol.put(symbol, position);

        log.info(
                "Opened position {} {}: amount={} entry={} stop={}",
                position.getId(),
                symbol,
                amount,
                entryPrice,
                stopLossPrice);
        return position;
    }

    /**
     * Marks an open position to the given price.
     *
     * @return the new unrealized P&L
     * @throws PositionStateException if the position is closed
     */
    public BigDecimal revalue(Position position, BigDecimal currentPrice) {
        requireOpen(position, "revalue");
        BigDecimal pnl = pnl(position, currentPrice);
        position.markToMarket(currentPrice, pnl, LocalDateTime.now(clock));
        return pnl;
    }

    /**
     * Closes an open position at the exit price and freezes its realized P&L.
     *
     * @return the realized P&L
     * @throws PositionStateException if the position is already closed; nothing is recomputed
     */
    public BigDecimal close(Position position, BigDecimal exitPrice) {
        requireOpen(position, "close");
        BigDecimal realized = pnl(position, exitPrice);
        position.markClosed(exitPrice, realized, LocalDateTime.now(clock));
        openBySymbol.remove(position.getSymbol(), position);

        log.info(
                "Closed position {} {}: entry={} exit={} realizedPnl={}",
                position.getId(),
                position.getSymbol(),
                position.getEntryPrice(),
                exitPrice,
                realized);
        return realized;
    }

    // ========================
    // QUERIES
    // ========================

    /** Live open positions, for the engine thread. */
    public List<Position> openPositions() {
        return List.copyOf(openBySymbol.values());
    }

    /** Detached copies of the open positions, safe to hand to any thread. */
    public List<Position> snapshot() {
        return openBySymbol.values().stream().map(Position::copy).toList();
    }

    public Optional<Position> openPosition(String symbol) {
        return Optional.ofNullable(openBySymbol.get(symbol));
    }

    public boolean hasOpenPosition(String symbol) {
        return openBySymbol.containsKey(symbol);
    }

    /**
     * Open positions whose price in the map is at or below their stop-loss price. Symbols missing
     * from the map are skipped.
     */
    public List<Position> checkStopLossBreaches(Map<String, BigDecimal> priceBySymbol) {
        List<Position> breached = new ArrayList<>();
        for (Position position : openBySymbol.values()) {
            BigDecimal price = priceBySymbol.get(position.getSymbol());
            if (price == null || position.getStopLossPrice() == null) {
                continue;
            }
            if (price.compareTo(position.getStopLossPrice()) <= 0) {
                breached.add(position);
            }
        }
        return breached;
    }

    public BigDecimal totalUnrealizedPnl() {
        return openBySymbol.values().stream()
                .map(p -> p.getUnrealizedPnl() != null ? p.getUnrealizedPnl() : BigDecimal.ZERO)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    // ========================
    // RECOVERY
    // ========================

    /**
     * Replaces the ledger contents with positions loaded from the store. Closed positions are
     * ignored; a second open position for the same symbol is ignored with a warning.
     */
    public void rehydrate(List<Position> positions) {
        openBySymbol.clear();
        for (Position position : positions) {
            if (!position.isOpen()) {
                continue;
            }
            Position previous = openBySymbol.putIfAbsent(position.getSymbol(), position);
            if (previous != null) {
                log.warn(
                        "Ignoring persisted position {}: position {} is already open for {}",
                        position.getId(),
                        previous.getId(),
                        position.getSymbol());
            }
        }
        log.info("Rehydrated {} open position(s)", openBySymbol.size());
    }

    private static BigDecimal pnl(Position position, BigDecimal price) {
        return price.subtract(position.getEntryPrice()).multiply(position.getAmount());
    }

    private static void requireOpen(Position position, String operation) {
        if (!position.isOpen()) {
            throw new PositionStateException(
                    "Cannot " + operation + " position " + position.getId() + ": already " + position.getStatus(),
                    position.getId());
        }
    }
}
