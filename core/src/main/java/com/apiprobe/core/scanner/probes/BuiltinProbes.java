package com.apiprobe.core.scanner.probes;

import com.apiprobe.core.http.ProbeHttp;
import com.apiprobe.core.scanner.ProbeRegistry;

/** 내장 프로브 등록. 등록 순서 = 기본 실행 순서 (API2 → API4 → API8 → API9) */
public final class BuiltinProbes {
    private BuiltinProbes() {}

    public static ProbeRegistry registry(ProbeHttp http) {
        return register(ProbeRegistry.builder(), http).build();
    }

    /** 외부 프로브와 함께 쓰고 싶을 때: 내장 프로브를 먼저 얹은 빌더 */
    public static ProbeRegistry.Builder register(ProbeRegistry.Builder b, ProbeHttp http) {
        return b.register(new BrokenAuthProbe(http).descriptor())
                .register(new ResourceConsumptionProbe(http).descriptor())
                .register(new SecurityMisconfigurationProbe(http).descriptor())
                .register(new InventoryProbe(http).descriptor());
    }
}
