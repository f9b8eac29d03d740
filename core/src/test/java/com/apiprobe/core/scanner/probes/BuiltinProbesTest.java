package com.apiprobe.core.scanner.probes;

import com.apiprobe.core.api.ProbeDescriptor;
import com.apiprobe.core.model.Severity;
import com.apiprobe.core.scanner.ProbeRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BuiltinProbesTest {

    @Test
    void builtins_register_in_default_order() {
        ProbeRegistry reg = BuiltinProbes.registry(StubHttp.http(1));

        assertThat(reg.names()).containsExactly("API2", "API4", "API8", "API9");
        assertThat(reg.all()).extracting(ProbeDescriptor::category)
                .containsExactly("API2:2023", "API4:2023", "API8:2023", "API9:2023");
    }

    @Test
    void custom_probes_can_join_the_builtins() {
        ProbeDescriptor custom = ProbeDescriptor.of("API10", "API10:2023", Severity.HIGH, (t, h, d) -> List.of());

        ProbeRegistry reg = BuiltinProbes.register(ProbeRegistry.builder(), StubHttp.http(1))
                .register(custom)
                .build();

        assertThat(reg.names()).endsWith("API10");
        assertThatThrownBy(() -> BuiltinProbes.register(ProbeRegistry.builder().register(
                ProbeDescriptor.of("api2", "x", Severity.LOW, (t, h, d) -> List.of())), StubHttp.http(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
