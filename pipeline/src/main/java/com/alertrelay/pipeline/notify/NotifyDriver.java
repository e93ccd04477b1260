package com.alertrelay.pipeline.notify;

import java.util.Map;

/**
 * Delivers a {@link NotificationMessage} to one kind of destination
 * (a chat webhook, e-mail, a log sink, ...).
 *
 * @since 1.0.0
 */
public interface NotifyDriver {

    /**
     * @return registry name, matched against {@link NotificationChannel#getDriver()}
     */
    String name();

    /**
     * @param config the channel's driver configuration
     * @return whether {@link #send} can work with this configuration
     */
    boolean validateConfig(Map<String, Object> config);

    /**
     * Implementations should report delivery problems through the returned
     * result. A thrown exception is treated as a failed delivery.
     */
    SendResult send(NotificationMessage message, Map<String, Object> config);
}
