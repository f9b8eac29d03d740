package com.apiprobe.core.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON 라인 기반 구조화 로거 (JUL 위).
 * LoggingConfigurator 로 핸들러를 잡은 뒤 호출하면 한 줄 JSON 으로 찍힌다.
 *
 * 사용: SLOG.info("probe-done", "probe", name, "findings", n);
 */
public final class StructuredLog {
    private final Logger jul;
    private final String comp;

    private StructuredLog(Class<?> cls) {
        this.jul = Logger.getLogger(cls.getName());
        this.comp = cls.getSimpleName();
    }

    public static StructuredLog get(Class<?> cls) {
        return new StructuredLog(cls);
    }

    public void debug(String event, Object... kvs) { log(Level.FINE,   event, null, kvs); }
    public void info (String event, Object... kvs) { log(Level.INFO,   event, null, kvs); }
    public void warn (String event, Object... kvs) { log(Level.WARNING,event, null, kvs); }
    public void error(String event, Throwable t, Object... kvs) { log(Level.SEVERE, event, t, kvs); }

    private void log(Level lvl, String event, Throwable t, Object... kvs) {
        if (!jul.isLoggable(lvl)) return;
        String line = toJson(lvl, event, t, kvs);
        if (t == null) jul.log(lvl, line); else jul.log(lvl, line, t);
    }

    String toJson(Level lvl, String event, Throwable t, Object... kvs) {
        ObjectNode n = JsonMappers.shared().createObjectNode();
        n.put("ts", Instant.now().toString());
        n.put("lvl", lvl.getName());
        n.put("comp", comp);
        n.put("thread", Thread.currentThread().getName());
        n.put("event", event);

        if (kvs != null && kvs.length > 0) {
            for (int i = 0; i + 1 < kvs.length; i += 2) {
                put(n, String.valueOf(kvs[i]), kvs[i + 1]);
            }
            if (kvs.length % 2 == 1) n.put("_kv_mismatch", true);
        }
        if (t != null) {
            n.put("error", t.getClass().getSimpleName());
            n.put("message", t.getMessage());
        }
        try {
            return JsonMappers.shared().writeValueAsString(n);
        } catch (JsonProcessingException e) {
            // ObjectNode 직렬화는 사실상 실패하지 않음. 그래도 이벤트 이름은 남긴다
            return "{\"event\":\"" + event + "\",\"_encode_error\":true}";
        }
    }

    private static void put(ObjectNode n, String k, Object v) {
        if (v == null) n.putNull(k);
        else if (v instanceof Integer i) n.put(k, i);
        else if (v instanceof Long l) n.put(k, l);
        else if (v instanceof Double d) n.put(k, d);
        else if (v instanceof Number num) n.put(k, num.doubleValue());
        else if (v instanceof Boolean b) n.put(k, b);
        else n.put(k, String.valueOf(v));
    }
}
