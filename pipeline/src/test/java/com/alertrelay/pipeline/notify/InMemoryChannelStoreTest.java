package com.alertrelay.pipeline.notify;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link InMemoryChannelStore}.
 */
class InMemoryChannelStoreTest {

    private InMemoryChannelStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryChannelStore();
    }

    @Test
    @DisplayName("Should list only active channels, ordered by name")
    void shouldListActiveByName() {
        store.save(NotificationChannel.active("zulu", "log", Map.of()));
        store.save(new NotificationChannel("mike", "log", Map.of(), false));
        store.save(NotificationChannel.active("alpha", "slack", Map.of()));

        assertThat(store.findActive())
                .extracting(NotificationChannel::getName)
                .containsExactly("alpha", "zulu");
    }

    @Test
    @DisplayName("Should replace a channel saved under the same name")
    void shouldReplaceByName() {
        store.save(NotificationChannel.active("ops", "log", Map.of()));
        store.save(new NotificationChannel("ops", "slack", Map.of(), false));

        assertThat(store.findByName("ops")).hasValueSatisfying(channel -> {
            assertThat(channel.getDriver()).isEqualTo("slack");
            assertThat(channel.isActive()).isFalse();
        });
        assertThat(store.findActive()).isEmpty();
    }
}
