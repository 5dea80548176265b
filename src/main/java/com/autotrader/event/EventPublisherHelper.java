package com.autotrader.event;

import com.autotrader.domain.model.Position;
import com.autotrader.domain.model.Trade;
import java.math.BigDecimal;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Convenience wrapper around Spring's {@link ApplicationEventPublisher} with typed factory
 * methods for every engine event.
 *
 * <p>Publication is fire-and-forget: a failing synchronous listener is logged here and never
 * reaches the trading cycle. Notification listeners run on the async event executor.
 */
@Component
public class EventPublisherHelper {

    private static final Logger log = LoggerFactory.getLogger(EventPublisherHelper.class);

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Position ----

    public void publishPositionOpened(Object source, Position position) {
        publish(new PositionEvent(source, position, PositionEventType.OPENED));
    }

    public void publishPositionUpdated(Object source, Position position, BigDecimal previousPnl) {
        publish(new PositionEvent(source, position, PositionEventType.UPDATED, previousPnl));
    }

    public void publishPositionClosed(Object source, Position position, BigDecimal previousPnl) {
        publish(new PositionEvent(source, position, PositionEventType.CLOSED, previousPnl));
    }

    public void publishStopLossTriggered(Object source, Position position, BigDecimal previousPnl) {
        publish(new PositionEvent(source, position, PositionEventType.STOP_LOSS_TRIGGERED, previousPnl));
    }

    // ---- Trade ----

    public void publishTrade(Object source, Trade trade) {
        publish(new TradeEvent(source, trade));
    }

    // ---- Risk ----

    public void publishRisk(Object source, RiskEventType type, RiskLevel level, String message) {
        publish(new RiskEvent(source, type, level, message));
    }

    public void publishRisk(
            Object source, RiskEventType type, RiskLevel level, String message, Map<String, Object> details) {
        publish(new RiskEvent(source, type, level, message, details));
    }

    // ---- System ----

    public void publishSystem(Object source, SystemEventType type, String message) {
        publish(new SystemEvent(source, type, message));
    }

    public void publishSystem(Object source, SystemEventType type, String message, Map<String, Object> details) {
        publish(new SystemEvent(source, type, message, details));
    }

    private void publish(ApplicationEvent event) {
        try {
            applicationEventPublisher.publishEvent(event);
        } catch (RuntimeException e) {
            log.warn("Failed to publish {}: {}", event.getClass().getSimpleName(), e.getMessage(), e);
        }
    }
}
