package com.alertrelay.core.driver;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Checks the {@link SourceDriver} contract across every bundled driver with
 * odd payload shapes.
 */
class SourceDriverContractTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-08T12:00:00Z"), ZoneOffset.UTC);

    static Stream<Arguments> driversAndPayloads() {
        DriverRegistry registry = DriverRegistry.standard(CLOCK);
        List<Map<String, Object>> payloads = oddPayloads();
        List<Arguments> cases = new ArrayList<>();
        for (String name : registry.names()) {
            for (int i = 0; i < payloads.size(); i++) {
                cases.add(Arguments.of(name, i, payloads.get(i)));
            }
        }
        return cases.stream();
    }

    private static List<Map<String, Object>> oddPayloads() {
        Map<String, Object> nullValues = new HashMap<>();
        nullValues.put("alerts", null);
        nullValues.put("event", null);
        nullValues.put("alert", null);
        nullValues.put("name", null);

        return Arrays.asList(
                Map.of(),
                Map.of("alerts", "nope", "status", 5, "receiver", List.of()),
                Map.of("event", List.of(1, 2), "messages", "x"),
                Map.of("messages", List.of("not-an-object")),
                Map.of("alert", "x", "action", 3),
                Map.of("org", Map.of(), "tags", 42),
                Map.of("alerts", List.of("junk", 7), "status", "firing", "receiver", "r"),
                nullValues);
    }

    @ParameterizedTest(name = "{0} payload #{1}")
    @MethodSource("driversAndPayloads")
    @DisplayName("Should never throw from validate and throw from parse only when invalid")
    void shouldHonourContract(String driverName, int index, Map<String, Object> payload) {
        SourceDriver driver = DriverRegistry.standard(CLOCK).get(driverName);

        assertThatCode(() -> driver.validate(payload)).doesNotThrowAnyException();
        if (driver.validate(payload)) {
            assertThatCode(() -> driver.parse(payload)).doesNotThrowAnyException();
        } else {
            assertThatThrownBy(() -> driver.parse(payload)).isInstanceOf(InvalidPayloadException.class);
        }
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("driverNames")
    @DisplayName("Should reject a null payload")
    void shouldRejectNull(String driverName) {
        SourceDriver driver = DriverRegistry.standard(CLOCK).get(driverName);

        assertThat(driver.validate(null)).isFalse();
        assertThatThrownBy(() -> driver.parse(null)).isInstanceOf(InvalidPayloadException.class);
    }

    static Stream<String> driverNames() {
        return DriverRegistry.standard(CLOCK).names().stream();
    }
}
