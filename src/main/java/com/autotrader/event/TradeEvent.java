package com.autotrader.event;

import com.autotrader.domain.model.Trade;
import org.springframework.context.ApplicationEvent;

/** Published after an executed order has been recorded as a trade. */
public class TradeEvent extends ApplicationEvent {

    private final Trade trade;

    public TradeEvent(Object source, Trade trade) {
        super(source);
        this.trade = trade;
    }

    public Trade getTrade() {
        return trade;
    }
}
