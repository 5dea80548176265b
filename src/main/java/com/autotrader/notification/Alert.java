package com.autotrader.notification;

import com.autotrader.domain.enums.AlertSeverity;
import com.autotrader.domain.enums.AlertType;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * An operator-facing alert derived from an engine event.
 */
@Data
@Builder
public class Alert {

    private AlertType type;
    private AlertSeverity severity;
    private String title;
    private String message;
    private LocalDateTime timestamp;
}
