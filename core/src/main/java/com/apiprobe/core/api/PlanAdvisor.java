package com.apiprobe.core.api;

import com.apiprobe.core.model.ScanPlan;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 외부 플랜 어드바이저 계약 (선택). 실패는 예외가 아니라 {@link Advice#unavailable(String)} 값으로 표현한다.
 * 오케스트레이터는 그래도 예외/지연을 방어한다.
 */
@FunctionalInterface
public interface PlanAdvisor {

    Advice propose(URI target, Map<String, String> headers, List<ProbeDescriptor> selected);

    /** 어드바이저 없음: 항상 unavailable */
    PlanAdvisor NONE = (t, h, s) -> Advice.unavailable("advisor disabled");

    /** 제안 결과: 플랜이 있거나, 없다는 사유가 있다 */
    final class Advice {
        private final ScanPlan plan;
        private final String reason;

        private Advice(ScanPlan plan, String reason) {
            this.plan = plan;
            this.reason = reason;
        }

        public static Advice of(ScanPlan plan) {
            return new Advice(Objects.requireNonNull(plan, "plan"), null);
        }

        public static Advice unavailable(String reason) {
            return new Advice(null, reason == null ? "unavailable" : reason);
        }

        public boolean isAvailable() { return plan != null; }
        public Optional<ScanPlan> plan() { return Optional.ofNullable(plan); }
        public String reason() { return reason; }

        @Override public String toString() {
            return isAvailable() ? "Advice{" + plan.priorityOrder() + "}" : "Advice{unavailable: " + reason + "}";
        }
    }
}
