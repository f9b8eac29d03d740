package com.apiprobe.core.util;

/** 토큰 버킷. 모든 프로브가 같은 인스턴스를 공유해 타깃 요청률 상한을 지킨다. */
public final class RateLimiter {
    private final long capacity;
    private final long refillPerSecond;
    private double tokens;
    private long lastNs;

    public RateLimiter(long capacity, long refillPerSecond) {
        if (capacity < 1 || refillPerSecond < 1) throw new IllegalArgumentException("capacity/refill must be >= 1");
        this.capacity = capacity;
        this.refillPerSecond = refillPerSecond;
        this.tokens = capacity;
        this.lastNs = System.nanoTime();
    }

    /** rps 하나로 버스트=rps 인 리미터 */
    public static RateLimiter perSecond(int rps) {
        int r = Math.max(1, rps);
        return new RateLimiter(r, r);
    }

    /** 토큰이 생길 때까지 대기 (interrupt 로 빠져나올 수 있음) */
    public synchronized void acquire() throws InterruptedException {
        for (;;) {
            refill();
            if (tokens >= 1.0) { tokens -= 1.0; return; }
            this.wait(5);
        }
    }

    /** 대기 없이 시도 */
    public synchronized boolean tryAcquire() {
        refill();
        if (tokens >= 1.0) { tokens -= 1.0; return true; }
        return false;
    }

    private void refill() {
        long now = System.nanoTime();
        double add = (now - lastNs) / 1_000_000_000.0 * refillPerSecond;
        if (add > 0) {
            tokens = Math.min(capacity, tokens + add);
            lastNs = now;
        }
    }
}
