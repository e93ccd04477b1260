package com.alertrelay.pipeline.notify;

import com.alertrelay.core.registry.UnknownEntryException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link NotifyDriverRegistry}.
 */
class NotifyDriverRegistryTest {

    @Test
    @DisplayName("Should expose the log driver and reject unknown names")
    void shouldResolveLogDriver() {
        NotifyDriverRegistry registry = NotifyDriverRegistry.standard();

        assertThat(registry.names()).containsExactly("log");
        assertThat(registry.create("log")).isInstanceOf(LogNotifyDriver.class);
        assertThatThrownBy(() -> registry.create("slack"))
                .isInstanceOf(UnknownEntryException.class)
                .hasMessage("Unknown notify driver: slack. Available: log");
    }
}
