package com.alertrelay.core.driver;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link Fingerprints}.
 */
class FingerprintsTest {

    @Test
    @DisplayName("Should be independent of label insertion order")
    void shouldBeOrderIndependent() {
        Map<String, String> forward = new LinkedHashMap<>();
        forward.put("alertname", "HighCPU");
        forward.put("instance", "web-01");
        forward.put("severity", "critical");

        Map<String, String> backward = new LinkedHashMap<>();
        backward.put("severity", "critical");
        backward.put("instance", "web-01");
        backward.put("alertname", "HighCPU");

        assertThat(Fingerprints.generate(forward, "HighCPU"))
                .isEqualTo(Fingerprints.generate(backward, "HighCPU"))
                .isEqualTo(Fingerprints.generate(new HashMap<>(forward), "HighCPU"))
                .isEqualTo(Fingerprints.generate(new TreeMap<>(backward), "HighCPU"));
    }

    @Test
    @DisplayName("Should produce 16 lowercase hex characters")
    void shouldProduceSixteenHexChars() {
        String fp = Fingerprints.generate(Map.of("a", "b"), "name");

        assertThat(fp).hasSize(16).matches("[0-9a-f]{16}");
    }

    @Test
    @DisplayName("Should match fingerprints stored by earlier deployments")
    void shouldMatchKnownValues() {
        assertThat(Fingerprints.generate(Map.of("alertname", "HighCPU", "severity", "critical"), "HighCPU"))
                .isEqualTo("cb8b593651aa775e");
        assertThat(Fingerprints.generate(Map.of(), "X")).isEqualTo("4e411b16b6fb1d7c");
        assertThat(Fingerprints.generate(Map.of("k", "it's"), "n")).isEqualTo("d5b5849d2148d749");
    }

    @Test
    @DisplayName("Should treat null labels like empty labels")
    void shouldTreatNullLabelsAsEmpty() {
        assertThat(Fingerprints.generate(null, "X")).isEqualTo(Fingerprints.generate(Map.of(), "X"));
    }

    @Test
    @DisplayName("Should change when name or a label value changes")
    void shouldChangeWithInput() {
        String base = Fingerprints.generate(Map.of("host", "a"), "Disk");

        assertThat(Fingerprints.generate(Map.of("host", "b"), "Disk")).isNotEqualTo(base);
        assertThat(Fingerprints.generate(Map.of("host", "a"), "Memory")).isNotEqualTo(base);
    }

    @Test
    @DisplayName("Should hash checker and hostname for check alerts")
    void shouldHashRawInput() {
        assertThat(Fingerprints.sha256Prefix("disk:web-01")).isEqualTo("f7c2264dcb1924ee");
    }
}
