package com.apiprobe.core.scanner;

import com.apiprobe.core.api.ProbeDescriptor;
import com.apiprobe.core.model.ScanPlan;
import com.apiprobe.core.model.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExecutionOrderTest {

    private static ProbeDescriptor d(String name) {
        return ProbeDescriptor.of(name, name + ":2023", Severity.MEDIUM, (t, h, dl) -> List.of());
    }

    private final ProbeRegistry registry = ProbeRegistry.of(d("API1"), d("API2"), d("API5"), d("API8"));

    private static List<String> names(List<ProbeDescriptor> ds) {
        return ds.stream().map(ProbeDescriptor::name).toList();
    }

    @Test
    void plan_priorities_run_first_and_rest_keep_registry_order() {
        List<ProbeDescriptor> selected = registry.select(List.of("API1", "API2", "API5"));

        List<ProbeDescriptor> order = ExecutionOrder.resolve(selected, ScanPlan.of("API2", "API5"), registry);

        assertThat(names(order)).containsExactly("API2", "API5", "API1");
    }

    @Test
    void without_plan_registry_order_is_used() {
        List<ProbeDescriptor> selected = registry.select(List.of());
        assertThat(names(ExecutionOrder.resolve(selected, null, registry)))
                .containsExactly("API1", "API2", "API5", "API8");
    }

    @Test
    void plan_cannot_add_or_remove_probes() {
        List<ProbeDescriptor> selected = registry.select(List.of("API1", "API8"));

        List<ProbeDescriptor> order = ExecutionOrder.resolve(selected,
                ScanPlan.of("API5", "api8", "UNKNOWN", "API8"), registry);

        assertThat(names(order)).containsExactly("API8", "API1");
    }

    @Test
    void probes_outside_the_registry_go_last() {
        ProbeDescriptor custom = d("CUSTOM");
        List<ProbeDescriptor> selected = List.of(custom, registry.find("API2").orElseThrow(), d("API1"));

        assertThat(names(ExecutionOrder.resolve(selected, null, registry)))
                .containsExactly("API1", "API2", "CUSTOM");
    }

    @Test
    void empty_selection_gives_empty_order() {
        assertThat(ExecutionOrder.resolve(List.of(), ScanPlan.of("API1"), registry)).isEmpty();
    }
}
