package com.apiprobe.core.util;

import java.time.Duration;

/** 재시도 대기 훅 (테스트에서 가짜로 교체) */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;
}
