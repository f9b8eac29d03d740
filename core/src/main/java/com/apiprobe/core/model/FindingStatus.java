package com.apiprobe.core.model;

/** 프로브 관측 결과 상태 */
public enum FindingStatus {
    VULNERABLE,
    PASSED,
    INFO,
    /** 프로브 실행 실패(러너가 합성). severity 없음 */
    ERROR
}
