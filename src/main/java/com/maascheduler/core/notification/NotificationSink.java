package com.maascheduler.core.notification;

/**
 * Outbound notification channel used for retry alerts, success and failure hooks and keyword matches.
 */
public interface NotificationSink {

    /**
     * Sends a notification.
     *
     * @return true when the channel accepted the message
     */
    boolean notify(String title, String content, String tag);

    default boolean isConfigured() {
        return true;
    }
}
