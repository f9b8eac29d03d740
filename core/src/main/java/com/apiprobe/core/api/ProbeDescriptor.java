package com.apiprobe.core.api;

import com.apiprobe.core.model.Severity;

import java.util.Objects;

/**
 * 프로브 = 정적 메타데이터 + 실행 능력. 상속 계층 없이 데이터로 등록한다.
 *
 * @param name            레지스트리 키이자 플랜이 가리키는 이름 (예: "API2")
 * @param category        분류 코드 (예: "API2:2023")
 * @param title           사람이 읽는 이름
 * @param defaultSeverity 대표 심각도 (표시/플래닝용)
 * @param probe           실행 능력
 */
public record ProbeDescriptor(String name,
                              String category,
                              String title,
                              Severity defaultSeverity,
                              Probe probe) {

    public ProbeDescriptor {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) throw new IllegalArgumentException("probe name must not be blank");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(defaultSeverity, "defaultSeverity");
        Objects.requireNonNull(probe, "probe");
        if (title == null || title.isBlank()) title = name;
    }

    public static ProbeDescriptor of(String name, String category, Severity defaultSeverity, Probe probe) {
        return new ProbeDescriptor(name, category, name, defaultSeverity, probe);
    }

    @Override public String toString() {
        return "ProbeDescriptor{" + name + " [" + category + "] " + title + "}";
    }
}
