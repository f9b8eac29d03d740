package com.apiprobe.core.model;

/** CREATED → RUNNING → FINALIZED. FINALIZED 에서 나가는 전이는 없다. */
public enum SessionState {
    CREATED,
    RUNNING,
    FINALIZED
}
