package com.apiprobe.core.scanner;

import com.apiprobe.core.api.ProbeDescriptor;
import com.apiprobe.core.model.ScanPlan;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 실행 순서 결정:
 *  1) 플랜 우선순위 목록에 있는 프로브를 그 순서대로
 *  2) 나머지 선택 프로브는 레지스트리 등록 순서로
 * 플랜은 선택 집합을 넓히거나 줄이지 못한다 (모르는 이름은 무시).
 */
public final class ExecutionOrder {
    private ExecutionOrder() {}

    public static List<ProbeDescriptor> resolve(List<ProbeDescriptor> selected, ScanPlan plan, ProbeRegistry registry) {
        if (selected == null || selected.isEmpty()) return List.of();

        // 선택 집합 (이름 → 디스크립터), 선택 순서 유지
        Map<String, ProbeDescriptor> remaining = new LinkedHashMap<>();
        for (ProbeDescriptor d : selected) remaining.putIfAbsent(key(d.name()), d);

        List<ProbeDescriptor> out = new ArrayList<>(remaining.size());
        if (plan != null) {
            for (String n : plan.priorityOrder()) {
                ProbeDescriptor d = remaining.remove(key(n));
                if (d != null) out.add(d);
            }
        }

        List<ProbeDescriptor> rest = new ArrayList<>(remaining.values());
        if (registry != null) {
            // 레지스트리에 없는 커스텀 프로브는 뒤로 (stable sort 라 상대 순서 유지)
            rest.sort(Comparator.comparingInt(d -> {
                int i = registry.orderOf(d.name());
                return i < 0 ? Integer.MAX_VALUE : i;
            }));
        }
        out.addAll(rest);
        return out;
    }

    private static String key(String name) {
        return name == null ? "" : name.trim().toUpperCase(Locale.ROOT);
    }
}
