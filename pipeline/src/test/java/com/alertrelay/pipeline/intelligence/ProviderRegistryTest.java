package com.alertrelay.pipeline.intelligence;

import com.alertrelay.core.model.Incident;
import com.alertrelay.core.registry.UnknownEntryException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ProviderRegistry}.
 */
class ProviderRegistryTest {

    @Test
    @DisplayName("Should register the local provider by default")
    void shouldRegisterLocalProvider() {
        ProviderRegistry registry = ProviderRegistry.standard(null);

        assertThat(registry.names()).containsExactly(KeywordRecommendationProvider.NAME);
        assertThat(registry.create("local")).isInstanceOf(KeywordRecommendationProvider.class);
    }

    @Test
    @DisplayName("Should reject unknown and duplicate provider names")
    void shouldRejectUnknownAndDuplicateNames() {
        ProviderRegistry registry = ProviderRegistry.of(List.of(new NamedProvider("remote")));

        assertThat(registry.contains("remote")).isTrue();
        assertThatThrownBy(() -> registry.create("local"))
                .isInstanceOf(UnknownEntryException.class)
                .hasMessage("Unknown provider: local. Available: remote");
        assertThatThrownBy(() -> ProviderRegistry.of(List.of(new NamedProvider("x"), new NamedProvider("x"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Duplicate provider name: x");
    }

    private static final class NamedProvider implements AnalysisProvider {

        private final String name;

        NamedProvider(String name) {
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public List<?> run(Incident incident) {
            return List.of();
        }
    }
}
