package com.apiprobe.core.scanner;

import com.apiprobe.core.api.ProbeDescriptor;
import com.apiprobe.core.model.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProbeRegistryTest {

    private static ProbeDescriptor d(String name) {
        return ProbeDescriptor.of(name, name + ":2023", Severity.MEDIUM, (t, h, dl) -> List.of());
    }

    private final ProbeRegistry registry = ProbeRegistry.of(d("API1"), d("API2"), d("API5"));

    @Test
    void iteration_follows_registration_order() {
        assertThat(registry.names()).containsExactly("API1", "API2", "API5");
        assertThat(registry.orderOf("API5")).isEqualTo(2);
        assertThat(registry.orderOf("API9")).isEqualTo(-1);
    }

    @Test
    void lookup_ignores_case() {
        assertThat(registry.find("api2")).map(ProbeDescriptor::name).contains("API2");
        assertThat(registry.contains(" Api5 ")).isTrue();
        assertThat(registry.find(null)).isEmpty();
    }

    @Test
    void empty_selection_means_all() {
        assertThat(registry.select(List.of())).hasSize(3);
        assertThat(registry.select(null)).hasSize(3);
    }

    @Test
    void selection_is_in_registry_order_without_duplicates() {
        assertThat(registry.select(List.of("API5", "api1", "API5")))
                .extracting(ProbeDescriptor::name)
                .containsExactly("API1", "API5");
    }

    @Test
    void unknown_names_are_rejected_with_details() {
        assertThatThrownBy(() -> registry.select(List.of("API1", "API42")))
                .isInstanceOfSatisfying(InvalidSelectionException.class, e -> {
                    assertThat(e.getUnknownNames()).containsExactly("API42");
                    assertThat(e.getKnownNames()).containsExactly("API1", "API2", "API5");
                });
    }

    @Test
    void duplicate_registration_fails() {
        assertThatThrownBy(() -> ProbeRegistry.builder().register(d("API1")).register(d("api1")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("already registered");
    }

    @Test
    void all_is_read_only() {
        assertThatThrownBy(() -> registry.all().add(d("X"))).isInstanceOf(UnsupportedOperationException.class);
    }
}
