package com.autotrader.execution;

import com.autotrader.domain.model.OrderResult;
import java.math.BigDecimal;

/**
 * Order placement abstraction shared by paper and live trading. The engine never talks to an
 * exchange through anything else.
 *
 * <p>Two implementations exist:
 * <ul>
 *   <li>{@code PaperExecutionAdapter}: deterministic synthetic fills, never fails</li>
 *   <li>{@code LiveExecutionAdapter}: delegates to an {@code ExchangeClient}</li>
 * </ul>
 *
 * <p>The active one is selected once at startup from {@code autotrader.trading-mode}.
 */
public interface ExecutionAdapter {

    /**
     * Places a market buy for {@code amount} units of the base asset.
     *
     * @throws com.autotrader.exception.ExecutionException if the order is rejected or the exchange is unavailable
     */
    OrderResult buy(String symbol, BigDecimal amount);

    /**
     * Places a market sell for {@code amount} units of the base asset.
     *
     * @throws com.autotrader.exception.ExecutionException if the order is rejected or the exchange is unavailable
     */
    OrderResult sell(String symbol, BigDecimal amount);

    /**
     * Places a resting sell-side stop order at {@code stopPrice}.
     *
     * @throws com.autotrader.exception.ExecutionException if the order is rejected or the exchange is unavailable
     */
    OrderResult placeStopLoss(String symbol, BigDecimal amount, BigDecimal stopPrice);

    /** Last traded price for the symbol. */
    BigDecimal currentPrice(String symbol);

    boolean isSimulated();

    /** Latest market price seen by the engine. Simulated adapters fill at it; live ones ignore it. */
    default void observePrice(String symbol, BigDecimal price) {}
}
