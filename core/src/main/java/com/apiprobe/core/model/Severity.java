package com.apiprobe.core.model;

/** 취약 판정 심각도. 선언 순서 = 낮음 → 높음 (Comparator 정렬에 그대로 사용) */
public enum Severity {
    INFO,
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
