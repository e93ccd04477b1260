package com.alertrelay.pipeline.notify;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Thread-safe {@link ChannelStore} backed by a sorted map.
 *
 * @since 1.0.0
 */
public class InMemoryChannelStore implements ChannelStore {

    private final Map<String, NotificationChannel> channels = new TreeMap<>();

    @Override
    public synchronized NotificationChannel save(NotificationChannel channel) {
        Objects.requireNonNull(channel, "channel must not be null");
        channels.put(channel.getName(), channel);
        return channel;
    }

    @Override
    public synchronized Optional<NotificationChannel> findByName(String name) {
        return Optional.ofNullable(channels.get(name));
    }

    @Override
    public synchronized List<NotificationChannel> findActive() {
        return channels.values().stream()
                .filter(NotificationChannel::isActive)
                .toList();
    }
}
