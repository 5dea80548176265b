package com.autotrader.event;

import java.util.HashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Published when the risk governor or engine detects a risk condition.
 *
 * <p>Carries the condition type, its severity, a human-readable message and a details map
 * with condition-specific values (loss percentage, configured limit, state snapshot).
 */
public class RiskEvent extends ApplicationEvent {

    private final RiskEventType eventType;
    private final RiskLevel level;
    private final String message;
    private final Map<String, Object> details;

    public RiskEvent(Object source, RiskEventType eventType, RiskLevel level, String message) {
        this(source, eventType, level, message, null);
    }

    public RiskEvent(
            Object source, RiskEventType eventType, RiskLevel level, String message, Map<String, Object> details) {
        super(source);
        this.eventType = eventType;
        this.level = level;
        this.message = message;
        this.details = details != null ? new HashMap<>(details) : new HashMap<>();
    }

    public RiskEventType getEventType() {
        return eventType;
    }

    public RiskLevel getLevel() {
        return level;
    }

    public String getMessage() {
        return message;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
