package com.autotrader.notification;

import com.autotrader.domain.enums.AlertSeverity;
import com.autotrader.domain.enums.AlertType;
import com.autotrader.domain.model.Position;
import com.autotrader.domain.model.Trade;
import com.autotrader.event.PositionEvent;
import com.autotrader.event.PositionEventType;
import com.autotrader.event.RiskEvent;
import com.autotrader.event.RiskLevel;
import com.autotrader.event.SystemEvent;
import com.autotrader.event.TradeEvent;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Turns engine events into {@link Alert}s and delivers them as severity-routed log lines.
 *
 * <p>All listeners run on the {@code eventExecutor} pool so a slow or failing delivery never
 * delays the trading cycle. The most recent alerts are kept in memory for dashboards.
 */
@Service
public class NotificationService {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    static final int MAX_RECENT_ALERTS = 100;

    private final Clock clock;
    private final Deque<Alert> recentAlerts = new ArrayDeque<>();

    public NotificationService(Clock clock) {
        this.clock = clock;
    }

    /**
     * Delivers an alert: CRITICAL at ERROR level, WARNING at WARN, everything else at INFO.
     */
    public void notify(Alert alert) {
        switch (alert.getSeverity()) {
            case CRITICAL -> log.error("[ALERT][{}] {}: {}", alert.getType(), alert.getTitle(), alert.getMessage());
            case WARNING -> log.warn("[ALERT][{}] {}: {}", alert.getType(), alert.getTitle(), alert.getMessage());
            default -> log.info("[ALERT][{}] {}: {}", alert.getType(), alert.getTitle(), alert.getMessage());
        }
        synchronized (recentAlerts) {
            recentAlerts.addFirst(alert);
            while (recentAlerts.size() > MAX_RECENT_ALERTS) {
                recentAlerts.removeLast();
            }
        }
    }

    /** Most recent alerts, newest first. */
    public List<Alert> getRecentAlerts() {
        synchronized (recentAlerts) {
            return List.copyOf(recentAlerts);
        }
    }

    @Async("eventExecutor")
    @EventListener
    public void onRiskEvent(RiskEvent event) {
        notify(alert(AlertType.RISK, mapRiskLevel(event.getLevel()), event.getEventType().name(), event.getMessage()));
    }

    @Async("eventExecutor")
    @EventListener
    public void onTradeEvent(TradeEvent event) {
        Trade trade = event.getTrade();
        String message = trade.getRealizedPnl() == null
                ? String.format(
                        "%s %s %s @ %s (%s)",
                        trade.getSide(),
                        trade.getAmount(),
                        trade.getSymbol(),
                        trade.getEntryPrice(),
                        trade.getRationale())
                : String.format(
                        "%s %s %s @ %s, realized P&L %s (%s)",
                        trade.getSide(),
                        trade.getAmount(),
                        trade.getSymbol(),
                        trade.getExitPrice(),
                        trade.getRealizedPnl(),
                        trade.getRationale());
        notify(alert(AlertType.TRADE, AlertSeverity.INFO, "Trade Executed", message));
    }

    /** Only closes are worth an alert; per-cycle revaluations are not. */
    @Async("eventExecutor")
    @EventListener
    public void onPositionEvent(PositionEvent event) {
        Position position = event.getPosition();
        if (event.getEventType() == PositionEventType.STOP_LOSS_TRIGGERED) {
            notify(alert(
                    AlertType.POSITION,
                    AlertSeverity.WARNING,
                    "Stop-Loss Triggered",
                    String.format(
                            "Position %s %s hit stop %s at %s",
                            position.getId(),
                            position.getSymbol(),
                            position.getStopLossPrice(),
                            position.getCurrentPrice())));
        } else if (event.getEventType() == PositionEventType.CLOSED) {
            notify(alert(
                    AlertType.POSITION,
                    AlertSeverity.INFO,
                    "Position Closed",
                    String.format(
                            "Position %s %s closed, realized P&L %s",
                            position.getId(),
                            position.getSymbol(),
                            position.getRealizedPnl())));
        }
    }

    @Async("eventExecutor")
    @EventListener
    public void onSystemEvent(SystemEvent event) {
        AlertSeverity severity = switch (event.getEventType()) {
            case ENGINE_HALTED -> AlertSeverity.CRITICAL;
            case CYCLE_FAILED -> AlertSeverity.WARNING;
            default -> AlertSeverity.INFO;
        };
        notify(alert(AlertType.SYSTEM, severity, event.getEventType().name(), event.getMessage()));
    }

    private Alert alert(AlertType type, AlertSeverity severity, String title, String message) {
        return Alert.builder()
                .type(type)
                .severity(severity)
                .title(title)
                .message(message)
                .timestamp(LocalDateTime.now(clock))
                .build();
    }

    private AlertSeverity mapRiskLevel(RiskLevel level) {
        return switch (level) {
            case INFO -> AlertSeverity.INFO;
            case WARNING -> AlertSeverity.WARNING;
            case CRITICAL -> AlertSeverity.CRITICAL;
        };
    }
}
