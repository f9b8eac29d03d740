package com.apiprobe.core.scanner;

/**
 * 프로브 1개 실행 실패. 러너 경계에서 ERROR 관측으로 바뀌며 스캔 밖으로 전파되지 않는다.
 * 메시지는 이미 정제된(sanitized) 요약이다.
 */
public class ProbeExecutionException extends Exception {
    private final String probeName;
    private final boolean timeout;

    public ProbeExecutionException(String probeName, String summary, Throwable cause, boolean timeout) {
        super(summary, cause);
        this.probeName = probeName;
        this.timeout = timeout;
    }

    public String getProbeName() { return probeName; }
    public boolean isTimeout() { return timeout; }
}
