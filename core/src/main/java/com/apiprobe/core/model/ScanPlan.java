package com.apiprobe.core.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * 외부 어드바이저가 제안한 실행 우선순위(권고 전용).
 * 선택된 프로브를 추가/제거하지 않으며 순서만 앞당긴다.
 */
public record ScanPlan(List<String> priorityOrder, String rationale) {

    public ScanPlan {
        // 공백/중복 제거, 첫 등장 순서 유지
        LinkedHashSet<String> seen = new LinkedHashSet<>();
        if (priorityOrder != null) {
            for (String n : priorityOrder) {
                if (n != null && !n.isBlank()) seen.add(n.trim());
            }
        }
        priorityOrder = List.copyOf(new ArrayList<>(seen));
        rationale = (rationale == null ? "" : rationale);
    }

    public static ScanPlan of(String... names) {
        return new ScanPlan(List.of(names), "");
    }
}
