package com.alertrelay.pipeline.notify;

import java.util.List;
import java.util.Optional;

/**
 * Persistence boundary for notification channels.
 *
 * @since 1.0.0
 */
public interface ChannelStore {

    /**
     * Insert or replace the channel with the same name.
     */
    NotificationChannel save(NotificationChannel channel);

    Optional<NotificationChannel> findByName(String name);

    /**
     * @return active channels ordered by name
     */
    List<NotificationChannel> findActive();
}
