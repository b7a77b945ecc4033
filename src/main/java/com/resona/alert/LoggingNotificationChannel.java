package com.resona.alert;

import lombok.extern.slf4j.Slf4j;

/**
 * Used when no alert topic is configured: alerts only reach the log.
 */
@Slf4j
public class LoggingNotificationChannel implements NotificationChannel {

    @Override
    public String getName() {
        return "log";
    }

    @Override
    public void publish(String subject, String message) {
        log.warn("ALERT {}\n{}", subject, message);
    }
}
