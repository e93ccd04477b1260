package com.alertrelay.core.driver;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link PayloadView}.
 */
class PayloadViewTest {

    @Test
    @DisplayName("Should key fields by their string form and keep their order")
    void shouldStringifyKeys() {
        Map<Object, Object> source = new LinkedHashMap<>();
        source.put(42, "answer");
        source.put("name", "HighCPU");

        PayloadView view = PayloadView.of(source);

        assertThat(view.string("42")).contains("answer");
        assertThat(view.raw()).containsOnlyKeys("42", "name");
        assertThat(view.raw().keySet()).containsExactly("42", "name");
    }

    @Test
    @DisplayName("Should not reflect later changes to the wrapped map")
    void shouldCopyWrappedMap() {
        Map<String, Object> source = new LinkedHashMap<>();
        source.put("status", "firing");
        PayloadView view = PayloadView.of(source);

        source.put("status", "resolved");

        assertThat(view.string("status")).contains("firing");
    }

    @Test
    @DisplayName("Should wrap nested objects and yield an empty view for non-maps")
    void shouldWrapNestedObjects() {
        PayloadView view = PayloadView.of(Map.of("labels", Map.of("severity", "critical"), "alerts", List.of()));

        assertThat(view.object("labels").string("severity", "")).isEqualTo("critical");
        assertThat(view.object("alerts").isEmpty()).isTrue();
        assertThat(PayloadView.of("text").isEmpty()).isTrue();
    }
}
