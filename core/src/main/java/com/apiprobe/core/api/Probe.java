package com.apiprobe.core.api;

import com.apiprobe.core.model.Finding;

import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 프로브 최소 계약: 타깃 + 헤더를 받아 유한한 관측 목록을 돌려주거나 실패한다.
 *
 * 구현체는 반환값 외의 공유 상태를 바꾸지 않는다. deadline 은 러너가 강제하지만
 * 긴 루프를 도는 프로브는 스스로 확인해 일찍 끝내는 편이 좋다.
 */
@FunctionalInterface
public interface Probe {
    List<Finding> execute(URI target, Map<String, String> headers, Instant deadline) throws Exception;
}
