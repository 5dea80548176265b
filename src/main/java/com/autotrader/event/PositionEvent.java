package com.autotrader.event;

import com.autotrader.domain.model.Position;
import java.math.BigDecimal;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the engine whenever the ledger opens, revalues or closes a position.
 *
 * <p>The carried position is a detached copy; listeners may keep it.
 */
public class PositionEvent extends ApplicationEvent {

    private final Position position;
    private final PositionEventType eventType;
    private final BigDecimal previousPnl;

    /**
     * @param source      the component publishing this event
     * @param position    copy of the position after the change
     * @param eventType   what kind of change occurred
     * @param previousPnl unrealized P&L before this change (null for OPENED)
     */
    public PositionEvent(Object source, Position position, PositionEventType eventType, BigDecimal previousPnl) {
        super(source);
        this.position = position;
        this.eventType = eventType;
        this.previousPnl = previousPnl;
    }

    public PositionEvent(Object source, Position position, PositionEventType eventType) {
        this(source, position, eventType, null);
    }

    public Position getPosition() {
        return position;
    }

    public PositionEventType getEventType() {
        return eventType;
    }

    public BigDecimal getPreviousPnl() {
        return previousPnl;
    }
}
