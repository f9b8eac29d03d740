package com.apiprobe.core.service;

/** FINALIZED 세션에 대한 append/finalize 재호출. 호출 단위로만 치명적인 계약 위반. */
public class AlreadyFinalizedException extends IllegalStateException {
    private final String scanId;

    public AlreadyFinalizedException(String scanId, String operation) {
        super("Scan session " + scanId + " is already finalized; rejected " + operation);
        this.scanId = scanId;
    }

    public String getScanId() { return scanId; }
}
