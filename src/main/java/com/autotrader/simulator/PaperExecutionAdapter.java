package com.autotrader.simulator;

import com.autotrader.domain.enums.OrderSide;
import com.autotrader.domain.enums.OrderStatus;
import com.autotrader.domain.enums.OrderType;
import com.autotrader.domain.model.OrderResult;
import com.autotrader.execution.ExecutionAdapter;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Paper trading implementation of {@link ExecutionAdapter}.
 *
 * <p>Every market order fills immediately and in full at the reference price. Stop-loss orders
 * are accepted as OPEN and never trigger on their own; the engine's stop-loss monitor closes
 * breached positions. Order ids are sequential ({@code SIM-000001}, {@code SIM-000002}, ...), so a
 * given sequence of calls always yields the same results.
 *
 * <p>Active when {@code autotrader.trading-mode=PAPER}.
 */
public class PaperExecutionAdapter implements ExecutionAdapter {

    private static final Logger log = LoggerFactory.getLogger(PaperExecutionAdapter.class);

    /** Reference price used when none is configured. */
    public static final BigDecimal DEFAULT_REFERENCE_PRICE = new BigDecimal("50000");

    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();
    private final List<OrderResult> placedOrders = new CopyOnWriteArrayList<>();

    private volatile BigDecimal referencePrice;

    public PaperExecutionAdapter(BigDecimal referencePrice, Clock clock) {
        this.referencePrice = referencePrice != null ? referencePrice : DEFAULT_REFERENCE_PRICE;
        this.clock = clock;
    }

    @Override
    public OrderResult buy(String symbol, BigDecimal amount) {
        return fill(symbol, OrderSide.BUY, amount);
    }

    @Override
    public OrderResult sell(String symbol, BigDecimal amount) {
        return fill(symbol, OrderSide.SELL, amount);
    }

    @Override
    public OrderResult placeStopLoss(String symbol, BigDecimal amount, BigDecimal stopPrice) {
        OrderResult order = OrderResult.builder()
                .id(nextId())
                .symbol(symbol)
                .side(OrderSide.SELL)
                .type(OrderType.STOP_LOSS)
                .amount(amount)
                .stopPrice(stopPrice)
                .status(OrderStatus.OPEN)
                .simulated(true)
                .placedAt(LocalDateTime.now(clock))
                .build();
        placedOrders.add(order);
        log.debug("Paper stop-loss {} {}: amount={} stop={}", order.getId(), symbol, amount, stopPrice);
        return order;
    }

    @Override
    public BigDecimal currentPrice(String symbol) {
        return referencePrice;
    }

    @Override
    public boolean isSimulated() {
        return true;
    }

    @Override
    public void observePrice(String symbol, BigDecimal price) {
        if (price != null && price.compareTo(referencePrice) != 0) {
            log.debug("Paper reference price for {} follows market: {} -> {}", symbol, referencePrice, price);
            this.referencePrice = price;
        }
    }

    /** Moves the synthetic market. Subsequent fills and price queries use the new price. */
    public void setReferencePrice(BigDecimal referencePrice) {
        this.referencePrice = referencePrice;
        log.info("Paper reference price set to {}", referencePrice);
    }

    /** Every order placed so far, oldest first. */
    public List<OrderResult> getPlacedOrders() {
        return List.copyOf(placedOrders);
    }

    private OrderResult fill(String symbol, OrderSide side, BigDecimal amount) {
        OrderResult order = OrderResult.builder()
                .id(nextId())
                .symbol(symbol)
                .side(side)
                .type(OrderType.MARKET)
                .amount(amount)
                .fillPrice(referencePrice)
                .status(OrderStatus.FILLED)
                .simulated(true)
                .placedAt(LocalDateTime.now(clock))
                .build();
        placedOrders.add(order);
        log.debug("Paper {} {} {}: amount={} price={}", side, order.getId(), symbol, amount, referencePrice);
        return order;
    }

    private String nextId() {
        return String.format("SIM-%06d", sequence.incrementAndGet());
    }
}
