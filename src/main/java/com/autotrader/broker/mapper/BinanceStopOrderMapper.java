package com.autotrader.broker.mapper;

import java.math.BigDecimal;
import java.util.Map;

/** Binance and Binance.US: type {@code STOP_LOSS} with {@code stopPrice}. */
public class BinanceStopOrderMapper implements StopOrderMapper {

    static final String ORDER_TYPE = "STOP_LOSS";

    @Override
    public StopOrderRequest toStopOrder(BigDecimal stopPrice) {
        return new StopOrderRequest(ORDER_TYPE, Map.of("stopPrice", stopPrice));
    }
}
