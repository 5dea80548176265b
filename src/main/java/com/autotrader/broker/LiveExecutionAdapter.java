package com.autotrader.broker;

import com.autotrader.broker.mapper.StopOrderMapper;
import com.autotrader.broker.mapper.StopOrderRequest;
import com.autotrader.domain.enums.ExchangeVenue;
import com.autotrader.domain.enums.OrderSide;
import com.autotrader.domain.enums.OrderStatus;
import com.autotrader.domain.enums.OrderType;
import com.autotrader.domain.model.OrderResult;
import com.autotrader.exception.ExecutionException;
import com.autotrader.execution.ExecutionAdapter;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Live implementation of {@link ExecutionAdapter} backed by an {@link ExchangeClient}.
 *
 * <p>Returns the exchange's own order ids and fill data. Any client failure is wrapped in an
 * {@link ExecutionException} and rethrown; the engine handles it at the cycle boundary.
 *
 * <p>Active when {@code autotrader.trading-mode=LIVE}.
 */
public class LiveExecutionAdapter implements ExecutionAdapter {

    private static final Logger log = LoggerFactory.getLogger(LiveExecutionAdapter.class);

    private final ExchangeClient exchangeClient;
    private final ExchangeVenue venue;
    private final StopOrderMapper stopOrderMapper;
    private final Clock clock;

    public LiveExecutionAdapter(ExchangeClient exchangeClient, ExchangeVenue venue, Clock clock) {
        this.exchangeClient = exchangeClient;
        this.venue = venue;
        this.stopOrderMapper = StopOrderMapper.forVenue(venue);
        this.clock = clock;
    }

    @Override
    public OrderResult buy(String symbol, BigDecimal amount) {
        return marketOrder(symbol, OrderSide.BUY, amount);
    }

    @Override
    public OrderResult sell(String symbol, BigDecimal amount) {
        return marketOrder(symbol, OrderSide.SELL, amount);
    }

    @Override
    public OrderResult placeStopLoss(String symbol, BigDecimal amount, BigDecimal stopPrice) {
        StopOrderRequest request = stopOrderMapper.toStopOrder(stopPrice);
        ExchangeOrder order;
        try {
            order = exchangeClient.createStopOrder(symbol, OrderSide.SELL, amount, request.getOrderType(), request.getParams());
        } catch (RuntimeException e) {
            throw new ExecutionException(
                    "Failed to place stop-loss on " + venue + " for " + symbol + ": " + e.getMessage(),
                    Map.of("symbol", symbol, "venue", venue.name(), "stopPrice", stopPrice),
                    e);
        }
        log.info("Stop-loss placed on {}: {} {} amount={} stop={}", venue, order.getId(), symbol, amount, stopPrice);
        return OrderResult.builder()
                .id(order.getId())
                .symbol(symbol)
                .side(OrderSide.SELL)
                .type(OrderType.STOP_LOSS)
                .amount(amount)
                .stopPrice(stopPrice)
                .status(OrderStatus.fromExchange(order.getStatus()))
                .simulated(false)
                .placedAt(placedAt(order))
                .build();
    }

    @Override
    public BigDecimal currentPrice(String symbol) {
        try {
            return exchangeClient.fetchTicker(symbol).getLast();
        } catch (RuntimeException e) {
            throw new ExecutionException("Failed to fetch price for " + symbol + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isSimulated() {
        return false;
    }

    public ExchangeVenue getVenue() {
        return venue;
    }

    private OrderResult marketOrder(String symbol, OrderSide side, BigDecimal amount) {
        ExchangeOrder order;
        try {
            order = exchangeClient.createMarketOrder(symbol, side, amount);
        } catch (RuntimeException e) {
            throw new ExecutionException(
                    "Failed to place " + side.wireValue() + " order on " + venue + " for " + symbol + ": "
                            + e.getMessage(),
                    Map.of("symbol", symbol, "venue", venue.name(), "side", side.name()),
                    e);
        }
        log.info("{} order placed on {}: {} {} amount={}", side, venue, order.getId(), symbol, amount);
        return OrderResult.builder()
                .id(order.getId())
                .symbol(symbol)
                .side(side)
                .type(OrderType.MARKET)
                .amount(order.getFilled() != null && order.getFilled().signum() > 0 ? order.getFilled() : amount)
                .fillPrice(order.getAveragePrice() != null ? order.getAveragePrice() : order.getPrice())
                .status(OrderStatus.fromExchange(order.getStatus()))
                .simulated(false)
                .placedAt(placedAt(order))
                .build();
    }

    private LocalDateTime placedAt(ExchangeOrder order) {
        return order.getTimestamp() != null ? order.getTimestamp() : LocalDateTime.now(clock);
    }
}
