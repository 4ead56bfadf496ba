package com.permit.payment.messaging;

import com.permit.payment.domain.AlertSeverity;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Alert for the operations team: permanent webhook failures, breaker trips,
 * payments that need manual capture, high-risk velocity and state conflicts.
 */
@Value
@Builder
@Jacksonized
public class OperationalAlert {

    String alertId;
    String title;
    String message;
    AlertSeverity severity;
    Map<String, Object> details;
    Instant timestamp;

    public static OperationalAlert of(String title, String message, AlertSeverity severity, Map<String, Object> details) {
        return OperationalAlert.builder()
                .alertId(UUID.randomUUID().toString())
                .title(title)
                .message(message)
                .severity(severity)
                .details(details)
                .timestamp(Instant.now())
                .build();
    }
}
