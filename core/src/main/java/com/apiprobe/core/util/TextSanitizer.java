package com.apiprobe.core.util;

import java.util.regex.Pattern;

/** 실패 요약/증거 문자열을 표시용으로 정리한다. */
public final class TextSanitizer {
    private TextSanitizer() {}

    public static final int MAX_SUMMARY = 200;

    // URL 의 query/fragment 는 토큰 등 민감값을 담을 수 있어 잘라낸다
    private static final Pattern URL_TAIL = Pattern.compile("(https?://[^\\s?#\"'<>]+)[?#][^\\s\"'<>]*");
    private static final Pattern CONTROL = Pattern.compile("\\p{Cntrl}+");

    /** "SimpleName: message" 형태의 정제된 한 줄 요약 */
    public static String summarize(Throwable t) {
        if (t == null) return "Unknown failure";
        String msg = t.getMessage();
        String raw = t.getClass().getSimpleName() + (msg == null || msg.isBlank() ? "" : ": " + msg);
        return sanitize(raw, MAX_SUMMARY);
    }

    public static String sanitize(String s, int maxLength) {
        if (s == null) return "";
        String out = CONTROL.matcher(s).replaceAll(" ");
        out = stripUrlQueries(out);
        return truncate(out.trim(), maxLength);
    }

    /** scheme://host/path 만 남긴다 */
    public static String stripUrlQueries(String s) {
        if (s == null) return null;
        return URL_TAIL.matcher(s).replaceAll("$1");
    }

    public static String truncate(String s, int maxLength) {
        if (s == null) return "";
        if (maxLength < 4 || s.length() <= maxLength) return s;
        return s.substring(0, maxLength - 3) + "...";
    }
}
