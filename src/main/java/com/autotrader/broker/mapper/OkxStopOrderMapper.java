package com.autotrader.broker.mapper;

import java.math.BigDecimal;
import java.util.Map;

/**
 * OKX conditional order: type {@code trigger} with {@code triggerPrice}. {@code orderPx=-1} makes
 * the triggered order execute at market.
 */
public class OkxStopOrderMapper implements StopOrderMapper {

    static final String ORDER_TYPE = "trigger";
    static final String MARKET_ORDER_PX = "-1";

    @Override
    public StopOrderRequest toStopOrder(BigDecimal stopPrice) {
        return new StopOrderRequest(ORDER_TYPE, Map.of("triggerPrice", stopPrice, "orderPx", MARKET_ORDER_PX));
    }
}
