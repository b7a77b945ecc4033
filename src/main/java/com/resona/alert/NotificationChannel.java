package com.resona.alert;

/**
 * Best-effort operator notification sink.
 */
public interface NotificationChannel {

    String getName();

    /**
     * Publish a message. May throw; callers treat failure as non-fatal.
     *
     * @param subject short subject line
     * @param message message body
     */
    void publish(String subject, String message);
}
