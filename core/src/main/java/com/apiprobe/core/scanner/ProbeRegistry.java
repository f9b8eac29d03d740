package com.apiprobe.core.scanner;

import com.apiprobe.core.api.ProbeDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 프로브 디스크립터의 읽기 전용 레지스트리.
 * - 등록 순서 = 기본 실행 순서
 * - 이름 조회는 대소문자 무시, O(1)
 * - 생성 후 변경 불가 (Builder 로만 구성)
 */
public final class ProbeRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(ProbeRegistry.class);

    private final Map<String, ProbeDescriptor> byKey;   // 등록 순서 유지
    private final Map<String, Integer> orderByKey;

    private ProbeRegistry(Map<String, ProbeDescriptor> byKey) {
        this.byKey = Collections.unmodifiableMap(new LinkedHashMap<>(byKey));
        Map<String, Integer> order = new LinkedHashMap<>();
        int i = 0;
        for (String k : this.byKey.keySet()) order.put(k, i++);
        this.orderByKey = Collections.unmodifiableMap(order);
    }

    public static Builder builder() { return new Builder(); }

    public static ProbeRegistry of(ProbeDescriptor... descriptors) {
        Builder b = builder();
        for (ProbeDescriptor d : descriptors) b.register(d);
        return b.build();
    }

    public Optional<ProbeDescriptor> find(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(byKey.get(key(name)));
    }

    public boolean contains(String name) { return find(name).isPresent(); }

    /** 등록 순서 인덱스. 없으면 -1 */
    public int orderOf(String name) {
        if (name == null) return -1;
        Integer i = orderByKey.get(key(name));
        return i == null ? -1 : i;
    }

    public List<ProbeDescriptor> all() { return List.copyOf(byKey.values()); }

    public List<String> names() {
        List<String> out = new ArrayList<>(byKey.size());
        for (ProbeDescriptor d : byKey.values()) out.add(d.name());
        return out;
    }

    public int size() { return byKey.size(); }

    /**
     * 이름 목록을 디스크립터로 해석한다. 비어 있으면 전체.
     * 결과는 등록 순서이며 중복은 한 번만 포함된다.
     *
     * @throws InvalidSelectionException 등록되지 않은 이름이 하나라도 있으면
     */
    public List<ProbeDescriptor> select(Collection<String> names) {
        if (names == null || names.isEmpty()) return all();

        Set<String> wanted = new LinkedHashSet<>();
        List<String> unknown = new ArrayList<>();
        for (String n : names) {
            if (n == null || n.isBlank()) continue;
            String k = key(n);
            if (byKey.containsKey(k)) wanted.add(k);
            else unknown.add(n.trim());
        }
        if (!unknown.isEmpty()) throw new InvalidSelectionException(unknown, names());
        if (wanted.isEmpty()) return all();

        List<ProbeDescriptor> out = new ArrayList<>(wanted.size());
        for (Map.Entry<String, ProbeDescriptor> e : byKey.entrySet()) {
            if (wanted.contains(e.getKey())) out.add(e.getValue());
        }
        return out;
    }

    private static String key(String name) {
        return name.trim().toUpperCase(Locale.ROOT);
    }

    public static final class Builder {
        private final Map<String, ProbeDescriptor> byKey = new LinkedHashMap<>();

        /** @throws IllegalArgumentException 같은 이름(대소문자 무시)이 이미 등록된 경우 */
        public Builder register(ProbeDescriptor d) {
            if (d == null) throw new IllegalArgumentException("descriptor must not be null");
            String k = key(d.name());
            if (byKey.containsKey(k)) {
                throw new IllegalArgumentException("Probe '" + d.name() + "' is already registered");
            }
            byKey.put(k, d);
            LOG.debug("Registered probe: {}", d);
            return this;
        }

        public ProbeRegistry build() { return new ProbeRegistry(byKey); }
    }
}
