package com.apiprobe.core.model;

/** 위험 점수 구간 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
