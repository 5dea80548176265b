package com.autotrader.broker;

import com.autotrader.domain.enums.OrderSide;
import com.autotrader.domain.model.Candle;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Raw exchange connectivity used for live trading and exchange-backed market data.
 *
 * <p>No implementation ships with the engine; a deployment that trades live provides one as a
 * Spring bean. Implementations report failures by throwing; callers wrap them in the engine's
 * exception types.
 */
public interface ExchangeClient {

    ExchangeOrder createMarketOrder(String symbol, OrderSide side, BigDecimal amount);

    /**
     * Places a conditional order with venue-specific type and parameters, as produced by a
     * {@link com.autotrader.broker.mapper.StopOrderMapper}.
     */
    ExchangeOrder createStopOrder(
            String symbol, OrderSide side, BigDecimal amount, String orderType, Map<String, Object> params);

    Ticker fetchTicker(String symbol);

    /**
     * Recent candles, oldest first.
     *
     * @param timeframe exchange timeframe code, e.g. {@code 1h}
     * @param limit     maximum number of candles
     */
    List<Candle> fetchOhlcv(String symbol, String timeframe, int limit);
}
