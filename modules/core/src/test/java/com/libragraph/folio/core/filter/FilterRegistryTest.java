package com.libragraph.folio.core.filter;

import com.libragraph.folio.core.BuiltinFilters;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class FilterRegistryTest {

    @Test
    void shouldRegisterEveryBuiltinFilter() {
        assertThat(BuiltinFilters.registry().names()).containsExactly(
                "structural-repair", "privacy-scrub", "version-upgrade", "metadata-normalize",
                "style-optimize", "markup-optimize", "layout");
    }

    @Test
    void shouldRejectDuplicateRegistration() {
        FilterRegistry registry = BuiltinFilters.registry();

        assertThatThrownBy(() -> registry.register(new SimpleFilterFactory("layout", o -> null)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("layout");
    }

    @Test
    void shouldRejectUnknownNameWhenBuildingChain() {
        FilterRegistry registry = BuiltinFilters.registry();

        assertThatThrownBy(() -> registry.chain(List.of(FilterSpec.of("layout"), FilterSpec.of("sparkle"))))
                .isInstanceOf(UnknownFilterException.class)
                .satisfies(e -> assertThat(((UnknownFilterException) e).filterName()).isEqualTo("sparkle"));
    }

    @Test
    void shouldRejectDuplicateNameInChain() {
        FilterRegistry registry = BuiltinFilters.registry();

        assertThatThrownBy(() -> registry.chain(List.of(FilterSpec.of("layout"), FilterSpec.of("layout"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate");
    }

    @Test
    void shouldRejectInvalidOptionsAtBuildTime() {
        FilterRegistry registry = BuiltinFilters.registry();

        assertThatThrownBy(() -> registry.chain(List.of(
                new FilterSpec("layout", Map.of("platform", "palm-pilot")))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("palm-pilot");
        assertThatThrownBy(() -> registry.chain(List.of(
                new FilterSpec("style-optimize", Map.of("remove-unused", "maybe")))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldKeepRequestedOrder() {
        FilterChain chain = BuiltinFilters.registry().chain(List.of(
                FilterSpec.of("markup-optimize"), FilterSpec.of("structural-repair")));

        assertThat(chain.names()).containsExactly("markup-optimize", "structural-repair");
        assertThat(chain.policy()).isEqualTo(FailurePolicy.FAIL_FAST);
    }
}
