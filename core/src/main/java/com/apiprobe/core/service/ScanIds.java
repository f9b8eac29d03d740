package com.apiprobe.core.service;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * 생성 시각 기반 scan_id: yyyyMMdd_HHmmss.
 * 같은 초(또는 시계 역행) 안에서 다시 만들면 -002, -003 … 접미사로 프로세스 내 유일성을 지킨다.
 * 접미사는 0 으로 채워 문자열 정렬이 생성 순서와 같다.
 */
final class ScanIds {
    private ScanIds() {}

    private static final DateTimeFormatter FMT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private static String lastBase = "";
    private static int seq = 0;

    static synchronized String next(Instant createdAt, ZoneId zone) {
        String base = FMT.withZone(zone).format(createdAt);
        if (base.compareTo(lastBase) > 0) {
            lastBase = base;
            seq = 1;
            return base;
        }
        seq++;
        return String.format(Locale.ROOT, "%s-%03d", lastBase, seq);
    }
}
